package org.csits.kex.server.worker.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.csits.kex.dao.ExportTaskEntity;
import org.csits.kex.dao.ExportTaskStatus;
import org.csits.kex.dao.InMemoryExportTaskRepository;
import org.csits.kex.manager.job.JobIdGenerator;
import org.csits.kex.server.datasource.AbstractPagedDataSource;
import org.csits.kex.server.dto.ExportDataRequest;
import org.csits.kex.server.exception.ExportJobRejectedException;
import org.csits.kex.server.notification.ExportPushNotification;
import org.csits.kex.server.registry.ExportedTypeDefinition;
import org.csits.kex.server.service.ExportJob;
import org.csits.kex.server.service.ExportTaskStateMachine;
import org.csits.kex.server.support.ExportServerFixture;
import org.csits.kex.server.support.Product;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class ExportJobRunnerTest {

    @TempDir
    Path tempDir;

    private ExportServerFixture fixture;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new ExportServerFixture(tempDir);
    }

    @Test
    void enqueue_persistsQueuedTaskAndReturnsSnapshot() {
        fixture.registerProducts(10);

        ExportPushNotification snapshot = fixture.runner.enqueue(request(), notification(), "admin");

        assertThat(snapshot.getJobId()).isNotBlank();
        assertThat(snapshot.getStatus()).isEqualTo(ExportTaskStatus.QUEUED);
        ExportTaskEntity task = fixture.repository.findByJobId(snapshot.getJobId()).orElseThrow(AssertionError::new);
        assertThat(task.getStatus()).isEqualTo(ExportTaskStatus.QUEUED);
        assertThat(task.getCreatedBy()).isEqualTo("admin");
        assertThat(task.getNotificationId()).isEqualTo(snapshot.getId());
        assertThat(fixture.executor.pending()).isEqualTo(1);
        assertThat(fixture.runner.isActive(snapshot.getJobId())).isTrue();
    }

    @Test
    void runningJob_exportsAllPagesAndSendsOneTerminalNotification() throws IOException {
        fixture.registerProducts(250);
        String jobId = fixture.runner.enqueue(request(), notification(), "admin").getJobId();

        fixture.executor.runNext();

        List<ExportTaskStatus> statuses = fixture.notifications.statusesFor(jobId);
        assertThat(statuses.get(0)).isEqualTo(ExportTaskStatus.QUEUED);
        assertThat(statuses.get(1)).isEqualTo(ExportTaskStatus.RUNNING);
        assertThat(statuses.get(statuses.size() - 1)).isEqualTo(ExportTaskStatus.COMPLETED);
        assertThat(statuses.stream().filter(ExportTaskStatus::isTerminal).count()).isEqualTo(1);

        List<ExportPushNotification> sent = fixture.notifications.sentFor(jobId);
        ExportPushNotification last = sent.get(sent.size() - 1);
        assertThat(last.getProcessedCount()).isEqualTo(250);
        assertThat(last.getTotalCount()).isEqualTo(250);
        assertThat(last.getFileName()).isEqualTo("Product_" + jobId + ".json");
        assertThat(last.getDownloadUrl()).isEqualTo("/api/export/download/Product_" + jobId + ".json");
        assertThat(sent).extracting(ExportPushNotification::getDescription)
            .contains("50 of 250 have been exported", "250 of 250 have been exported");

        JsonNode exported = fixture.objectMapper.readTree(tempDir.resolve(last.getFileName()).toFile());
        assertThat(exported.isArray()).isTrue();
        assertThat(exported.size()).isEqualTo(250);
        assertThat(exported.get(0).get("id").asText()).isEqualTo("p-1");

        ExportTaskEntity task = fixture.repository.findByJobId(jobId).orElseThrow(AssertionError::new);
        assertThat(task.getStatus()).isEqualTo(ExportTaskStatus.COMPLETED);
        assertThat(task.getProcessedCount()).isEqualTo(250L);
        assertThat(task.getStartTime()).isNotNull();
        assertThat(task.getEndTime()).isNotNull();
        assertThat(fixture.runner.isActive(jobId)).isFalse();
        assertThat(temporaryFiles()).isEmpty();
    }

    @Test
    void delete_beforePickup_neverStartsJob() {
        fixture.registerProducts(10);
        String jobId = fixture.runner.enqueue(request(), notification(), "admin").getJobId();

        fixture.runner.delete(jobId);
        fixture.executor.runAll();

        assertThat(fixture.notifications.statusesFor(jobId))
            .containsExactly(ExportTaskStatus.QUEUED, ExportTaskStatus.CANCELLED);
        assertThat(fixture.repository.findByJobId(jobId).map(ExportTaskEntity::getStatus))
            .contains(ExportTaskStatus.CANCELLED);
        assertThat(Files.exists(tempDir.resolve("Product_" + jobId + ".json"))).isFalse();
    }

    @Test
    void delete_isIdempotent() {
        fixture.registerProducts(10);
        String jobId = fixture.runner.enqueue(request(), notification(), "admin").getJobId();

        fixture.runner.delete(jobId);
        fixture.runner.delete(jobId);

        assertThat(fixture.notifications.statusesFor(jobId))
            .containsExactly(ExportTaskStatus.QUEUED, ExportTaskStatus.CANCELLED);
    }

    @Test
    void delete_afterCompletion_isNoOp() {
        fixture.registerProducts(10);
        String jobId = fixture.runner.enqueue(request(), notification(), "admin").getJobId();
        fixture.executor.runNext();
        int sentBefore = fixture.notifications.sentCount();

        fixture.runner.delete(jobId);

        assertThat(fixture.notifications.sentCount()).isEqualTo(sentBefore);
        assertThat(fixture.repository.findByJobId(jobId).map(ExportTaskEntity::getStatus))
            .contains(ExportTaskStatus.COMPLETED);
        assertThat(Files.exists(tempDir.resolve("Product_" + jobId + ".json"))).isTrue();
    }

    @Test
    void delete_unknownJob_isIgnored() {
        fixture.runner.delete("missing");
        fixture.runner.delete(null);

        assertThat(fixture.notifications.sentCount()).isZero();
    }

    @Test
    void delete_whileRunning_stopsAtPageBoundaryAndDiscardsPartialFile() throws IOException {
        AtomicReference<String> jobId = new AtomicReference<>();
        List<Product> products = Product.catalog(250);
        fixture.registerProducts(() -> {
            fixture.runner.delete(jobId.get());
            return products;
        });
        jobId.set(fixture.runner.enqueue(request(), notification(), "admin").getJobId());

        fixture.executor.runNext();

        List<ExportTaskStatus> statuses = fixture.notifications.statusesFor(jobId.get());
        assertThat(statuses).contains(ExportTaskStatus.RUNNING);
        assertThat(statuses.get(statuses.size() - 1)).isEqualTo(ExportTaskStatus.CANCELLED);
        assertThat(statuses.stream().filter(ExportTaskStatus::isTerminal).count()).isEqualTo(1);
        assertThat(fixture.repository.findByJobId(jobId.get()).map(ExportTaskEntity::getStatus))
            .contains(ExportTaskStatus.CANCELLED);
        assertThat(Files.exists(tempDir.resolve("Product_" + jobId.get() + ".json"))).isFalse();
        assertThat(temporaryFiles()).isEmpty();
    }

    @Test
    void failingDataSource_marksJobFailedWithError() throws IOException {
        fixture.registerProducts(() -> {
            throw new IllegalStateException("catalog offline");
        });
        String jobId = fixture.runner.enqueue(request(), notification(), "admin").getJobId();

        fixture.executor.runNext();

        List<ExportPushNotification> sent = fixture.notifications.sentFor(jobId);
        ExportPushNotification last = sent.get(sent.size() - 1);
        assertThat(last.getStatus()).isEqualTo(ExportTaskStatus.FAILED);
        assertThat(last.getErrors()).hasSize(1);
        assertThat(last.getErrors().get(0)).contains("catalog offline");
        assertThat(last.getDownloadUrl()).isNull();
        ExportTaskEntity task = fixture.repository.findByJobId(jobId).orElseThrow(AssertionError::new);
        assertThat(task.getStatus()).isEqualTo(ExportTaskStatus.FAILED);
        assertThat(task.getErrorMessage()).contains("catalog offline");
        assertThat(temporaryFiles()).isEmpty();
    }

    @Test
    void enqueue_whenQueueFull_failsTaskAndThrows() {
        fixture.registerProducts(10);
        fixture.executor.setRejecting(true);

        assertThatThrownBy(() -> fixture.runner.enqueue(request(), notification(), "admin"))
            .isInstanceOf(ExportJobRejectedException.class);

        List<ExportTaskEntity> tasks = fixture.repository.findAll();
        assertThat(tasks).hasSize(1);
        assertThat(tasks.get(0).getStatus()).isEqualTo(ExportTaskStatus.FAILED);
        assertThat(fixture.runner.isActive(tasks.get(0).getJobId())).isFalse();
    }

    @Test
    void delete_afterFirstPage_writesNothingMoreAndDiscardsPartialFile() throws IOException {
        AtomicReference<String> jobId = new AtomicReference<>();
        AtomicInteger fetches = new AtomicInteger();
        List<Product> products = Product.catalog(250);
        fixture.registry.register(ExportedTypeDefinition.builder()
            .name(ExportServerFixture.PRODUCT_TYPE)
            .requiredPermission(ExportServerFixture.PRODUCT_PERMISSION)
            .dataSourceFactory(query -> new AbstractPagedDataSource(query) {
                @Override
                protected List<?> fetchPage(int skip, int take) {
                    if (fetches.incrementAndGet() == 2) {
                        fixture.runner.delete(jobId.get());
                    }
                    return products.subList(Math.min(skip, products.size()), Math.min(products.size(), skip + take));
                }

                @Override
                protected long countTotal() {
                    return products.size();
                }
            })
            .build());
        jobId.set(fixture.runner.enqueue(request(), notification(), "admin").getJobId());

        fixture.executor.runNext();

        assertThat(fetches.get()).isEqualTo(2);
        List<ExportPushNotification> sent = fixture.notifications.sentFor(jobId.get());
        assertThat(sent).extracting(ExportPushNotification::getDescription)
            .contains("50 of 250 have been exported")
            .doesNotContain("100 of 250 have been exported");
        ExportPushNotification last = sent.get(sent.size() - 1);
        assertThat(last.getStatus()).isEqualTo(ExportTaskStatus.CANCELLED);
        assertThat(last.getProcessedCount()).isEqualTo(50);
        assertThat(last.getDownloadUrl()).isNull();
        ExportTaskEntity task = fixture.repository.findByJobId(jobId.get()).orElseThrow(AssertionError::new);
        assertThat(task.getStatus()).isEqualTo(ExportTaskStatus.CANCELLED);
        assertThat(task.getProcessedCount()).isEqualTo(50L);
        assertThat(Files.exists(tempDir.resolve("Product_" + jobId.get() + ".json"))).isFalse();
        assertThat(temporaryFiles()).isEmpty();
    }

    @Test
    void delete_queuedJob_releasesPoolQueueCapacity() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<Product> products = Product.catalog(10);
        fixture.registerProducts(() -> {
            started.countDown();
            awaitLatch(release);
            return products;
        });
        ThreadPoolTaskExecutor pool = pool(1, 1);
        try {
            ExportJobRunner runner = new ExportJobRunner(pool, fixture.exportJob, fixture.stateMachine,
                fixture.notifications, new JobIdGenerator());
            ExportPushNotification blocking = runner.enqueue(request(), notification(), "admin");
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            ExportPushNotification cancelled = runner.enqueue(request(), notification(), "admin");

            runner.delete(cancelled.getJobId());

            assertThat(pool.getThreadPoolExecutor().getQueue()).isEmpty();
            ExportPushNotification next = runner.enqueue(request(), notification(), "admin");
            release.countDown();

            assertThat(awaitTerminal(blocking)).isEqualTo(ExportTaskStatus.COMPLETED);
            assertThat(awaitTerminal(next)).isEqualTo(ExportTaskStatus.COMPLETED);
            assertThat(fixture.notifications.statusesFor(cancelled.getJobId()))
                .containsExactly(ExportTaskStatus.QUEUED, ExportTaskStatus.CANCELLED);
            assertThat(fixture.repository.findByJobId(next.getJobId()).map(ExportTaskEntity::getStatus))
                .contains(ExportTaskStatus.COMPLETED);
        } finally {
            release.countDown();
            pool.shutdown();
        }
    }

    @Test
    void deleteRacingPickup_endsEveryJobInExactlyOneTerminalState() throws Exception {
        fixture.registerProducts(120);
        ThreadPoolTaskExecutor pool = pool(4, 100);
        try {
            ExportJobRunner runner = new ExportJobRunner(pool, fixture.exportJob, fixture.stateMachine,
                fixture.notifications, new JobIdGenerator());
            List<ExportPushNotification> submitted = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                ExportPushNotification snapshot = runner.enqueue(request(), notification(), "admin");
                submitted.add(snapshot);
                runner.delete(snapshot.getJobId());
            }

            for (ExportPushNotification snapshot : submitted) {
                ExportTaskStatus terminal = awaitTerminal(snapshot);
                String jobId = snapshot.getJobId();
                List<ExportTaskStatus> statuses = fixture.notifications.statusesFor(jobId);
                assertThat(statuses.stream().filter(ExportTaskStatus::isTerminal).count()).isEqualTo(1);
                assertThat(statuses.get(statuses.size() - 1)).isEqualTo(terminal);
                assertThat(terminal).isIn(ExportTaskStatus.CANCELLED, ExportTaskStatus.COMPLETED);
                assertThat(fixture.repository.findByJobId(jobId).map(ExportTaskEntity::getStatus))
                    .contains(terminal);
                assertThat(Files.exists(tempDir.resolve("Product_" + jobId + ".json")))
                    .isEqualTo(terminal == ExportTaskStatus.COMPLETED);
            }
            assertThat(temporaryFiles()).isEmpty();
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void repositoryOutageBeforeStart_stillSendsSingleFailedNotification() {
        fixture.registerProducts(10);
        FlakyRepository repository = new FlakyRepository();
        ExportJobRunner runner = runnerOver(repository);
        String jobId = runner.enqueue(request(), notification(), "admin").getJobId();
        repository.failWhen = task -> true;

        fixture.executor.runNext();

        assertThat(fixture.notifications.statusesFor(jobId))
            .containsExactly(ExportTaskStatus.QUEUED, ExportTaskStatus.FAILED);
        List<ExportPushNotification> sent = fixture.notifications.sentFor(jobId);
        assertThat(sent.get(sent.size() - 1).getErrors()).containsExactly("database unavailable");
        assertThat(runner.isActive(jobId)).isFalse();
    }

    @Test
    void repositoryOutageOnCompletion_stillSendsCompletedNotification() {
        fixture.registerProducts(10);
        FlakyRepository repository = new FlakyRepository();
        repository.failWhen = task -> task.getStatus() == ExportTaskStatus.COMPLETED;
        ExportJobRunner runner = runnerOver(repository);
        String jobId = runner.enqueue(request(), notification(), "admin").getJobId();

        fixture.executor.runNext();

        List<ExportTaskStatus> statuses = fixture.notifications.statusesFor(jobId);
        assertThat(statuses.get(statuses.size() - 1)).isEqualTo(ExportTaskStatus.COMPLETED);
        assertThat(statuses.stream().filter(ExportTaskStatus::isTerminal).count()).isEqualTo(1);
        assertThat(Files.exists(tempDir.resolve("Product_" + jobId + ".json"))).isTrue();
    }

    @Test
    void interruptWhileWaitingToRetry_failsJobAndKeepsInterruptFlag() throws Exception {
        fixture.config.getRetry().setMaxRetries(3);
        fixture.config.getRetry().setRetryIntervalMs(60_000L);
        CountDownLatch firstAttempt = new CountDownLatch(1);
        fixture.registerProducts(() -> {
            firstAttempt.countDown();
            throw new IllegalStateException("catalog offline");
        });
        String jobId = fixture.runner.enqueue(request(), notification(), "admin").getJobId();
        AtomicBoolean interruptedAfter = new AtomicBoolean();

        Thread worker = new Thread(() -> {
            fixture.executor.runNext();
            interruptedAfter.set(Thread.currentThread().isInterrupted());
        });
        worker.start();
        assertThat(firstAttempt.await(5, TimeUnit.SECONDS)).isTrue();
        worker.interrupt();
        worker.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(worker.isAlive()).isFalse();
        assertThat(interruptedAfter.get()).isTrue();
        List<ExportPushNotification> sent = fixture.notifications.sentFor(jobId);
        ExportPushNotification last = sent.get(sent.size() - 1);
        assertThat(last.getStatus()).isEqualTo(ExportTaskStatus.FAILED);
        assertThat(last.getErrors()).containsExactly("重试被中断");
        assertThat(fixture.repository.findByJobId(jobId).map(ExportTaskEntity::getStatus))
            .contains(ExportTaskStatus.FAILED);
    }

    private List<Path> temporaryFiles() throws IOException {
        try (Stream<Path> files = Files.list(tempDir.resolve(".tmp"))) {
            return files.collect(Collectors.toList());
        }
    }

    private ExportJobRunner runnerOver(InMemoryExportTaskRepository repository) {
        ExportTaskStateMachine stateMachine = new ExportTaskStateMachine(repository);
        ExportJob job = new ExportJob(fixture.registry, fixture.providers, fixture.namingService, fixture.storage,
            fixture.dataExporter, stateMachine, fixture.notifications, fixture.config);
        return new ExportJobRunner(fixture.executor, job, stateMachine, fixture.notifications, new JobIdGenerator());
    }

    private ExportTaskStatus awaitTerminal(ExportPushNotification snapshot) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(10);
        while (System.currentTimeMillis() < deadline) {
            ExportPushNotification current = fixture.notifications.findById(snapshot.getId())
                .orElseThrow(AssertionError::new);
            if (current.isTerminal()) {
                return current.getStatus();
            }
            Thread.sleep(10);
        }
        throw new AssertionError("job did not finish: " + snapshot.getJobId());
    }

    private static ThreadPoolTaskExecutor pool(int threads, int capacity) {
        ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(threads);
        pool.setMaxPoolSize(threads);
        pool.setQueueCapacity(capacity);
        pool.setThreadNamePrefix("kex-export-test-");
        pool.initialize();
        return pool;
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            if (!latch.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch timed out");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static ExportDataRequest request() {
        ExportDataRequest request = new ExportDataRequest();
        request.setExportTypeName(ExportServerFixture.PRODUCT_TYPE);
        request.setProviderName("Json");
        return request;
    }

    private static ExportPushNotification notification() {
        ExportPushNotification notification = new ExportPushNotification("admin");
        notification.setTitle("Product export");
        return notification;
    }

    private static class FlakyRepository extends InMemoryExportTaskRepository {

        private volatile Predicate<ExportTaskEntity> failWhen = task -> false;

        @Override
        public ExportTaskEntity save(ExportTaskEntity entity) {
            if (failWhen.test(entity)) {
                throw new DataAccessResourceFailureException("database unavailable");
            }
            return super.save(entity);
        }
    }
}

package org.csits.kex.server.worker.core;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.csits.kex.dao.ExportTaskStatus;
import org.csits.kex.manager.job.JobIdGenerator;
import org.csits.kex.server.config.ExportServerConfiguration;
import org.csits.kex.server.dto.ExportDataRequest;
import org.csits.kex.server.exception.ExportJobRejectedException;
import org.csits.kex.server.notification.ExportPushNotification;
import org.csits.kex.server.notification.PushNotificationManager;
import org.csits.kex.server.service.ExportJob;
import org.csits.kex.server.service.ExportTaskStateMachine;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * 导出任务队列：提交、执行与取消。
 *
 * 每个任务在工作线程池中执行一次。排队中的任务取消后立即移出线程池队列，释放队列容量；
 * 运行中的任务通过取消信号在页边界停止。排队/运行/取消之间的竞争由条目状态的 CAS 决定。
 */
@Slf4j
@Component
public class ExportJobRunner {

    private enum EntryState {
        QUEUED, RUNNING, CANCELLED
    }

    private final AsyncTaskExecutor executor;

    private final ExportJob exportJob;

    private final ExportTaskStateMachine stateMachine;

    private final PushNotificationManager notificationManager;

    private final JobIdGenerator jobIdGenerator;

    private final Map<String, JobEntry> jobs = new ConcurrentHashMap<>();

    public ExportJobRunner(@Qualifier(ExportServerConfiguration.EXPORT_JOB_EXECUTOR) AsyncTaskExecutor executor,
                           ExportJob exportJob, ExportTaskStateMachine stateMachine,
                           PushNotificationManager notificationManager, JobIdGenerator jobIdGenerator) {
        this.executor = executor;
        this.exportJob = exportJob;
        this.stateMachine = stateMachine;
        this.notificationManager = notificationManager;
        this.jobIdGenerator = jobIdGenerator;
    }

    /**
     * 登记并提交导出任务，立即返回。
     *
     * @param notification 任务通知，由执行线程独占更新
     * @return 提交时刻的通知快照，已带 jobId
     * @throws ExportJobRejectedException 队列已满
     */
    public ExportPushNotification enqueue(ExportDataRequest request, ExportPushNotification notification,
                                          String createdBy) {
        String jobId = jobIdGenerator.nextJobId();
        notification.setJobId(jobId);
        notification.setStatus(ExportTaskStatus.QUEUED);
        stateMachine.createQueued(jobId, request.getExportTypeName(), request.getProviderName(),
            notification.getId(), createdBy);

        JobEntry entry = new JobEntry(jobId, request, notification, this);
        jobs.put(jobId, entry);
        notificationManager.send(notification);
        ExportPushNotification snapshot = notification.copy();

        try {
            executor.execute(entry.task);
        } catch (TaskRejectedException e) {
            jobs.remove(jobId);
            log.error("导出任务提交被拒绝: jobId={}", jobId, e);
            stateMachine.tryMarkTerminal(jobId, ExportTaskStatus.FAILED, null, "导出任务队列已满");
            notification.setStatus(ExportTaskStatus.FAILED);
            notification.getErrors().add("Export queue is full");
            notification.setFinished(LocalDateTime.now());
            notificationManager.send(notification);
            throw new ExportJobRejectedException("导出任务队列已满，请稍后重试", e);
        }
        // 提交前已被取消的任务同样不能占用队列
        if (entry.state.get() == EntryState.CANCELLED) {
            releaseQueueSlot(entry.task);
        }
        return snapshot;
    }

    /**
     * 取消任务。可重复调用；已结束或不存在的任务忽略。
     */
    public void delete(String jobId) {
        if (jobId == null) {
            return;
        }
        JobEntry entry = jobs.get(jobId);
        if (entry == null) {
            log.debug("取消请求忽略，任务不存在或已结束: jobId={}", jobId);
            return;
        }
        if (entry.state.compareAndSet(EntryState.QUEUED, EntryState.CANCELLED)) {
            jobs.remove(jobId, entry);
            entry.task.cancel(false);
            releaseQueueSlot(entry.task);
            stateMachine.tryMarkTerminal(jobId, ExportTaskStatus.CANCELLED, null, null);
            ExportPushNotification notification = entry.notification;
            notification.setStatus(ExportTaskStatus.CANCELLED);
            notification.setDescription("Export was cancelled by the user");
            notification.setFinished(LocalDateTime.now());
            notificationManager.send(notification);
            log.info("排队中的导出任务已取消: jobId={}", jobId);
        } else if (entry.state.get() == EntryState.RUNNING) {
            entry.token.cancel();
            log.info("已向运行中的导出任务发送取消信号: jobId={}", jobId);
        }
    }

    /**
     * 任务是否仍在队列或执行中。
     */
    public boolean isActive(String jobId) {
        return jobId != null && jobs.containsKey(jobId);
    }

    private void releaseQueueSlot(FutureTask<Void> task) {
        if (executor instanceof ThreadPoolTaskExecutor) {
            ThreadPoolExecutor pool = ((ThreadPoolTaskExecutor) executor).getThreadPoolExecutor();
            if (pool.remove(task)) {
                log.debug("已从线程池队列移除取消的导出任务, queued={}", pool.getQueue().size());
            }
        }
    }

    private void runJob(String jobId, JobEntry entry) {
        if (!entry.state.compareAndSet(EntryState.QUEUED, EntryState.RUNNING)) {
            log.debug("导出任务已在排队时取消，跳过执行: jobId={}", jobId);
            return;
        }
        try {
            exportJob.execute(jobId, entry.request, entry.notification, entry.token);
        } catch (RuntimeException e) {
            log.error("导出任务执行异常: jobId={}", jobId, e);
        } finally {
            jobs.remove(jobId, entry);
        }
    }

    private static class JobEntry {

        private final AtomicReference<EntryState> state = new AtomicReference<>(EntryState.QUEUED);

        private final ExportCancellationToken token = new ExportCancellationToken();

        private final ExportDataRequest request;

        private final ExportPushNotification notification;

        private final FutureTask<Void> task;

        JobEntry(String jobId, ExportDataRequest request, ExportPushNotification notification,
                 ExportJobRunner runner) {
            this.request = request;
            this.notification = notification;
            this.task = new FutureTask<>(() -> runner.runJob(jobId, this), null);
        }
    }
}

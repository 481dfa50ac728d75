package org.csits.kex.server.service;

import java.io.OutputStream;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.kex.dao.ExportTaskStatus;
import org.csits.kex.manager.plugin.ExportProvider;
import org.csits.kex.manager.plugin.ExportRecordWriter;
import org.csits.kex.manager.storage.ExportFileStorage;
import org.csits.kex.server.config.ExportConfig;
import org.csits.kex.server.datasource.PagedDataSource;
import org.csits.kex.server.dto.ExportDataQuery;
import org.csits.kex.server.dto.ExportDataRequest;
import org.csits.kex.server.dto.ExportProgressInfo;
import org.csits.kex.server.exception.ExportCancelledException;
import org.csits.kex.server.notification.ExportPushNotification;
import org.csits.kex.server.notification.PushNotificationManager;
import org.csits.kex.server.registry.ExportedTypeDefinition;
import org.csits.kex.server.registry.KnownExportTypesResolver;
import org.csits.kex.server.worker.core.ExportCancellationToken;
import org.csits.kex.server.worker.core.ExportProviderRegistry;
import org.springframework.stereotype.Component;

/**
 * 导出任务执行体，在工作线程中运行。
 *
 * 数据先写入临时文件，完成后原子发布；失败或取消时删除临时文件。
 * 每个任务只发送一次终态通知，异常不会抛出到调用方；任务记录落库失败也不影响终态通知。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExportJob {

    public static final String DOWNLOAD_URL_PREFIX = "/api/export/download/";

    private final KnownExportTypesResolver typesResolver;

    private final ExportProviderRegistry providerRegistry;

    private final ExportFileNamingService fileNamingService;

    private final ExportFileStorage fileStorage;

    private final DataExporter dataExporter;

    private final ExportTaskStateMachine stateMachine;

    private final PushNotificationManager notificationManager;

    private final ExportConfig exportConfig;

    public void execute(String jobId, ExportDataRequest request, ExportPushNotification notification,
                        ExportCancellationToken token) {
        String fileName = null;
        try {
            stateMachine.markRunning(jobId);
            notification.setStatus(ExportTaskStatus.RUNNING);
            notification.setDescription("Export task started");
            notificationManager.send(notification);
            log.info("开始导出: jobId={}, type={}, provider={}",
                jobId, request.getExportTypeName(), request.getProviderName());

            ExportedTypeDefinition definition = typesResolver.resolveExportedTypeDefinition(
                request.getExportTypeName());
            ExportProvider provider = providerRegistry.create(request.getProviderName(),
                request.getProviderConfig());
            fileName = fileNamingService.generateFileName(definition.getName(), jobId,
                provider.getExportedFileExtension());
            ExportDataQuery query = (request.getDataQuery() != null ? request.getDataQuery() : new ExportDataQuery())
                .normalized(exportConfig.resolveDefaultPageSize(), exportConfig.resolveMaxPageSize());
            PagedDataSource dataSource = definition.getDataSourceFactory().create(query);

            long exported;
            try (OutputStream out = fileStorage.openTemporary(fileName);
                 ExportRecordWriter writer = provider.openWriter(out)) {
                exported = dataExporter.export(jobId, dataSource, writer, query.getIncludedProperties(), token,
                    info -> onProgress(jobId, notification, info));
            }
            token.throwIfCancellationRequested();
            fileStorage.publish(fileName);

            stateMachine.tryMarkTerminal(jobId, ExportTaskStatus.COMPLETED, fileName, null);
            notification.setStatus(ExportTaskStatus.COMPLETED);
            notification.setDescription("Export finished");
            notification.setFileName(fileName);
            notification.setDownloadUrl(DOWNLOAD_URL_PREFIX + fileName);
            notification.setFinished(LocalDateTime.now());
            notificationManager.send(notification);
            log.info("导出完成: jobId={}, file={}, count={}", jobId, fileName, exported);
        } catch (ExportCancelledException e) {
            discardPartial(jobId, fileName);
            stateMachine.tryMarkTerminal(jobId, ExportTaskStatus.CANCELLED, null, null);
            notification.setStatus(ExportTaskStatus.CANCELLED);
            notification.setDescription("Export was cancelled by the user");
            notification.setFinished(LocalDateTime.now());
            notificationManager.send(notification);
            log.info("导出已取消: jobId={}", jobId);
        } catch (Exception e) {
            discardPartial(jobId, fileName);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("导出失败: jobId={}, type={}", jobId, request.getExportTypeName(), e);
            stateMachine.tryMarkTerminal(jobId, ExportTaskStatus.FAILED, null, message);
            notification.setStatus(ExportTaskStatus.FAILED);
            notification.setDescription("Export failed");
            notification.getErrors().add(message);
            notification.setFinished(LocalDateTime.now());
            notificationManager.send(notification);
        }
    }

    private void onProgress(String jobId, ExportPushNotification notification, ExportProgressInfo info) {
        notification.setProcessedCount(info.getProcessedCount());
        notification.setTotalCount(info.getTotalCount());
        notification.setDescription(info.getDescription());
        notificationManager.send(notification);
        stateMachine.updateProgress(jobId, info.getProcessedCount(), info.getTotalCount());
    }

    private void discardPartial(String jobId, String fileName) {
        if (fileName != null) {
            fileStorage.discard(fileName);
            log.debug("已删除未完成的导出文件: jobId={}, file={}", jobId, fileName);
        }
    }
}

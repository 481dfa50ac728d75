package org.csits.kex.server.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.kex.manager.storage.ExportFileStorage;
import org.csits.kex.manager.storage.FileNameValidator;
import org.csits.kex.manager.storage.MimeTypeResolver;
import org.csits.kex.server.config.ExportConfig;
import org.csits.kex.server.datasource.PagedDataSource;
import org.csits.kex.server.dto.ExportDataQuery;
import org.csits.kex.server.dto.ExportDataRequest;
import org.csits.kex.server.dto.ExportDownload;
import org.csits.kex.server.dto.ExportProviderDescriptor;
import org.csits.kex.server.dto.ExportableSearchResult;
import org.csits.kex.server.notification.ExportPushNotification;
import org.csits.kex.server.notification.PushNotificationManager;
import org.csits.kex.server.registry.ExportedTypeDefinition;
import org.csits.kex.server.registry.KnownExportTypesRegistrar;
import org.csits.kex.server.registry.KnownExportTypesResolver;
import org.csits.kex.server.security.ExportAuthorizationService;
import org.csits.kex.server.security.ExportPrincipal;
import org.csits.kex.server.worker.core.ExportJobRunner;
import org.csits.kex.server.worker.core.ExportProviderRegistry;
import org.springframework.stereotype.Service;

/**
 * 导出服务入口，供 REST 层调用。
 *
 * 授权在创建数据源、登记任务之前完成，未通过时没有任何副作用。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportService {

    private final KnownExportTypesRegistrar typesRegistrar;

    private final KnownExportTypesResolver typesResolver;

    private final ExportAuthorizationService authorizationService;

    private final ExportProviderRegistry providerRegistry;

    private final ExportJobRunner jobRunner;

    private final PushNotificationManager notificationManager;

    private final ExportFileNamingService fileNamingService;

    private final ExportFileStorage fileStorage;

    private final DataExporter dataExporter;

    private final ExportConfig exportConfig;

    public List<ExportedTypeDefinition> getKnownTypes() {
        return typesRegistrar.getRegisteredTypes();
    }

    public List<ExportProviderDescriptor> getProviders() {
        return providerRegistry.describeAll();
    }

    /**
     * 预览一页数据。
     *
     * @throws org.csits.kex.server.exception.UnknownExportTypeException 类型未注册
     * @throws org.csits.kex.server.exception.ExportAuthorizationDeniedException 授权未通过
     * @throws org.csits.kex.server.exception.DataSourceException 查询失败
     */
    public ExportableSearchResult getData(ExportDataRequest request, ExportPrincipal principal) {
        ExportedTypeDefinition definition = typesResolver.resolveExportedTypeDefinition(request.getExportTypeName());
        ExportDataQuery query = normalize(request.getDataQuery());
        authorizationService.authorize(principal, definition, query);

        PagedDataSource dataSource = definition.getDataSourceFactory().create(query);
        long totalCount = dataSource.getTotalCount();
        List<Object> results = new ArrayList<>();
        if (dataSource.fetch()) {
            for (Object item : dataSource.getItems()) {
                results.add(dataExporter.project(item, query.getIncludedProperties()));
            }
        }
        log.debug("数据预览: type={}, user={}, totalCount={}, returned={}",
            definition.getName(), principal.getUserName(), totalCount, results.size());
        return new ExportableSearchResult(totalCount, results);
    }

    /**
     * 登记导出任务并立即返回初始通知。
     *
     * @throws org.csits.kex.server.exception.UnknownExportTypeException 类型未注册
     * @throws org.csits.kex.server.exception.UnknownExportProviderException 插件不存在
     * @throws org.csits.kex.server.exception.ExportAuthorizationDeniedException 授权未通过
     */
    public ExportPushNotification runExport(ExportDataRequest request, ExportPrincipal principal) {
        ExportedTypeDefinition definition = typesResolver.resolveExportedTypeDefinition(request.getExportTypeName());
        authorizationService.authorize(principal, definition, normalize(request.getDataQuery()));
        providerRegistry.validate(request.getProviderName());

        ExportPushNotification notification = new ExportPushNotification(principal.getUserName());
        notification.setTitle(fileNamingService.resolveTypeTitle(definition.getName()) + " export");
        notification.setDescription("Starting export task...");
        ExportPushNotification accepted = jobRunner.enqueue(request, notification, principal.getUserName());
        log.info("导出任务已提交: jobId={}, type={}, user={}",
            accepted.getJobId(), definition.getName(), principal.getUserName());
        return accepted;
    }

    public void cancel(String jobId) {
        jobRunner.delete(jobId);
    }

    /**
     * 查询当前用户发起的任务通知。
     */
    public Optional<ExportPushNotification> getNotification(String id, ExportPrincipal principal) {
        return notificationManager.findById(id)
            .filter(n -> principal != null && principal.getUserName() != null
                && principal.getUserName().equals(n.getCreator()));
    }

    public List<ExportPushNotification> getNotifications(ExportPrincipal principal) {
        return notificationManager.findByCreator(principal.getUserName());
    }

    /**
     * @throws org.csits.kex.manager.exception.InvalidFileNameException 文件名非法
     * @throws org.csits.kex.manager.exception.ExportFileNotFoundException 文件不存在
     */
    public ExportDownload loadDownload(String fileName) {
        FileNameValidator.validate(fileName);
        return new ExportDownload(fileName, MimeTypeResolver.resolveContentType(fileName),
            fileStorage.loadAsResource(fileName));
    }

    private ExportDataQuery normalize(ExportDataQuery query) {
        return (query != null ? query : new ExportDataQuery())
            .normalized(exportConfig.resolveDefaultPageSize(), exportConfig.resolveMaxPageSize());
    }
}

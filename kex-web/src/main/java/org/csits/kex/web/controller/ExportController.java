package org.csits.kex.web.controller;

import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.kex.server.dto.ExportCancellationRequest;
import org.csits.kex.server.dto.ExportDataRequest;
import org.csits.kex.server.dto.ExportDownload;
import org.csits.kex.server.dto.ExportProviderDescriptor;
import org.csits.kex.server.dto.ExportableSearchResult;
import org.csits.kex.server.notification.ExportPushNotification;
import org.csits.kex.server.registry.ExportedTypeDefinition;
import org.csits.kex.server.security.ExportPermissions;
import org.csits.kex.server.security.ExportPrincipal;
import org.csits.kex.server.service.ExportService;
import org.csits.kex.web.security.PermissionInterceptor;
import org.csits.kex.web.security.RequiresPermission;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 通用导出API接口
 */
@Slf4j
@RestController
@RequestMapping("/api/export")
@RequiredArgsConstructor
@RequiresPermission(anyOf = ExportPermissions.ACCESS)
public class ExportController {

    private final ExportService exportService;

    /**
     * 查询已注册的导出类型
     */
    @GetMapping("/knowntypes")
    public ResponseEntity<List<ExportedTypeDefinition>> getKnownTypes() {
        return ResponseEntity.ok(exportService.getKnownTypes());
    }

    /**
     * 查询可用的导出格式
     */
    @GetMapping("/providers")
    public ResponseEntity<List<ExportProviderDescriptor>> getProviders() {
        return ResponseEntity.ok(exportService.getProviders());
    }

    /**
     * 预览一页待导出数据
     */
    @PostMapping("/data")
    public ResponseEntity<ExportableSearchResult> getData(
        @RequestBody ExportDataRequest request,
        @RequestAttribute(PermissionInterceptor.PRINCIPAL_ATTRIBUTE) ExportPrincipal principal) {
        return ResponseEntity.ok(exportService.getData(request, principal));
    }

    /**
     * 提交导出任务，立即返回任务通知
     */
    @PostMapping("/run")
    public ResponseEntity<ExportPushNotification> runExport(
        @RequestBody ExportDataRequest request,
        @RequestAttribute(PermissionInterceptor.PRINCIPAL_ATTRIBUTE) ExportPrincipal principal) {
        return ResponseEntity.ok(exportService.runExport(request, principal));
    }

    /**
     * 取消导出任务，任务不存在或已结束时同样返回成功
     */
    @PostMapping("/task/cancel")
    public ResponseEntity<Void> cancelExport(@RequestBody ExportCancellationRequest cancellationRequest) {
        exportService.cancel(cancellationRequest.getJobId());
        return ResponseEntity.ok().build();
    }

    /**
     * 当前用户的任务通知列表
     */
    @GetMapping("/notifications")
    public ResponseEntity<List<ExportPushNotification>> getNotifications(
        @RequestAttribute(PermissionInterceptor.PRINCIPAL_ATTRIBUTE) ExportPrincipal principal) {
        return ResponseEntity.ok(exportService.getNotifications(principal));
    }

    /**
     * 查询任务通知的最新状态
     */
    @GetMapping("/notifications/{id}")
    public ResponseEntity<ExportPushNotification> getNotification(
        @PathVariable String id,
        @RequestAttribute(PermissionInterceptor.PRINCIPAL_ATTRIBUTE) ExportPrincipal principal) {
        return exportService.getNotification(id, principal)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * 下载导出文件，支持 Range 分段请求
     */
    @GetMapping("/download/{fileName}")
    @RequiresPermission(anyOf = {ExportPermissions.PLATFORM_EXPORT, ExportPermissions.DOWNLOAD})
    public ResponseEntity<Resource> download(@PathVariable String fileName) {
        ExportDownload download = exportService.loadDownload(fileName);
        log.debug("下载导出文件: {}", fileName);
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(download.getContentType()))
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.attachment().filename(download.getFileName()).build().toString())
            .body(download.getResource());
    }
}

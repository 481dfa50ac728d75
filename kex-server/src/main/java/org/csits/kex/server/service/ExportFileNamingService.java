package org.csits.kex.server.service;

import org.springframework.stereotype.Service;

/**
 * 导出文件命名：{类型标题}_{任务编号}.{扩展名}
 */
@Service
public class ExportFileNamingService {

    /**
     * 类型标题取类型名最后一个点之后的部分，如 Catalog.Product -> Product。
     */
    public String resolveTypeTitle(String exportTypeName) {
        if (exportTypeName == null) {
            return "";
        }
        int index = exportTypeName.lastIndexOf('.');
        return index > 0 ? exportTypeName.substring(index + 1) : exportTypeName;
    }

    public String generateFileName(String exportTypeName, String jobId, String extension) {
        String title = resolveTypeTitle(exportTypeName).replaceAll("[^A-Za-z0-9_-]", "_");
        if (title.isEmpty()) {
            title = "Export";
        }
        StringBuilder name = new StringBuilder(title).append('_').append(jobId);
        if (extension != null && !extension.isEmpty()) {
            name.append('.').append(extension);
        }
        return name.toString();
    }
}

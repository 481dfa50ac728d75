package org.csits.kex.server.exception;

import org.csits.kex.manager.exception.ExportException;

/**
 * 请求的导出格式插件不存在。
 */
public class UnknownExportProviderException extends ExportException {

    public UnknownExportProviderException(String providerName) {
        super("未找到导出插件: " + providerName);
    }
}

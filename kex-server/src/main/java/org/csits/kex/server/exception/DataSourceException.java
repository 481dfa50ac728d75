package org.csits.kex.server.exception;

import org.csits.kex.manager.exception.ExportException;

/**
 * 数据源查询失败。
 */
public class DataSourceException extends ExportException {

    public DataSourceException(String message) {
        super(message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}

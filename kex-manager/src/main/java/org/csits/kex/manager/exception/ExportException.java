package org.csits.kex.manager.exception;

/**
 * 导出模块异常基类。
 */
public class ExportException extends RuntimeException {

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}

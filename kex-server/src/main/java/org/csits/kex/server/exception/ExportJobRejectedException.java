package org.csits.kex.server.exception;

import org.csits.kex.manager.exception.ExportException;

/**
 * 任务队列已满，导出任务未被接受。
 */
public class ExportJobRejectedException extends ExportException {

    public ExportJobRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}

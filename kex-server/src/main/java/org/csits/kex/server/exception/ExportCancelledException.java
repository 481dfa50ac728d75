package org.csits.kex.server.exception;

import org.csits.kex.manager.exception.ExportException;

/**
 * 任务执行中观察到取消信号。只在任务内部传递，不作为错误结果对外暴露。
 */
public class ExportCancelledException extends ExportException {

    public ExportCancelledException() {
        super("导出任务已取消");
    }
}

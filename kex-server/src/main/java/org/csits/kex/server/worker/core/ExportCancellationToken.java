package org.csits.kex.server.worker.core;

import org.csits.kex.server.exception.ExportCancelledException;

/**
 * 协作式取消信号，执行线程在页边界检查。
 */
public class ExportCancellationToken {

    private volatile boolean cancellationRequested;

    public void cancel() {
        cancellationRequested = true;
    }

    public boolean isCancellationRequested() {
        return cancellationRequested;
    }

    /**
     * @throws ExportCancelledException 已请求取消
     */
    public void throwIfCancellationRequested() {
        if (cancellationRequested) {
            throw new ExportCancelledException();
        }
    }
}

package org.csits.kex.dao;

/**
 * 导出任务状态。COMPLETED、FAILED、CANCELLED 为终态。
 */
public enum ExportTaskStatus {

    QUEUED,

    RUNNING,

    COMPLETED,

    FAILED,

    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}

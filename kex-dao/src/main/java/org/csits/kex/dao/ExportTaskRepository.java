package org.csits.kex.dao;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 导出任务仓储接口，支持内存和数据库两种实现。
 */
public interface ExportTaskRepository {

    /**
     * 保存导出任务记录（新增或更新）
     */
    ExportTaskEntity save(ExportTaskEntity entity);

    /**
     * 根据任务编号查询
     */
    Optional<ExportTaskEntity> findByJobId(String jobId);

    /**
     * 查询处于给定状态之一的任务，按创建时间倒序
     */
    List<ExportTaskEntity> findByStatusIn(Collection<ExportTaskStatus> statuses);

    /**
     * 查询所有任务记录，按创建时间倒序
     */
    List<ExportTaskEntity> findAll();
}

package org.csits.kex.server.service;

import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.kex.dao.ExportTaskEntity;
import org.csits.kex.dao.ExportTaskRepository;
import org.csits.kex.dao.ExportTaskStatus;
import org.springframework.stereotype.Service;

/**
 * 导出任务状态机服务
 * 管理任务状态转换和验证，并持久化到任务记录
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportTaskStateMachine {

    private final ExportTaskRepository exportTaskRepository;

    /**
     * 状态转换定义
     */
    private enum StateTransition {
        // 排队 -> 运行中
        QUEUED_TO_RUNNING(ExportTaskStatus.QUEUED, ExportTaskStatus.RUNNING),
        // 排队 -> 取消（尚未开始执行）
        QUEUED_TO_CANCELLED(ExportTaskStatus.QUEUED, ExportTaskStatus.CANCELLED),
        // 排队 -> 失败（提交被拒绝或进程重启）
        QUEUED_TO_FAILED(ExportTaskStatus.QUEUED, ExportTaskStatus.FAILED),
        // 运行中 -> 完成
        RUNNING_TO_COMPLETED(ExportTaskStatus.RUNNING, ExportTaskStatus.COMPLETED),
        // 运行中 -> 失败
        RUNNING_TO_FAILED(ExportTaskStatus.RUNNING, ExportTaskStatus.FAILED),
        // 运行中 -> 取消
        RUNNING_TO_CANCELLED(ExportTaskStatus.RUNNING, ExportTaskStatus.CANCELLED);

        private final ExportTaskStatus from;
        private final ExportTaskStatus to;

        StateTransition(ExportTaskStatus from, ExportTaskStatus to) {
            this.from = from;
            this.to = to;
        }

        public boolean matches(ExportTaskStatus current, ExportTaskStatus target) {
            return this.from == current && this.to == target;
        }
    }

    /**
     * 创建排队中的任务记录
     */
    public ExportTaskEntity createQueued(String jobId, String exportTypeName, String providerName,
                                         String notificationId, String createdBy) {
        ExportTaskEntity entity = new ExportTaskEntity();
        entity.setJobId(jobId);
        entity.setExportTypeName(exportTypeName);
        entity.setProviderName(providerName);
        entity.setNotificationId(notificationId);
        entity.setCreatedBy(createdBy);
        entity.setStatus(ExportTaskStatus.QUEUED);
        entity.setProcessedCount(0L);
        entity.setTotalCount(0L);
        entity.setCreatedAt(LocalDateTime.now());
        ExportTaskEntity saved = exportTaskRepository.save(entity);
        log.info("导出任务入队: jobId={}, type={}, provider={}, user={}",
            jobId, exportTypeName, providerName, createdBy);
        return saved;
    }

    /**
     * 转换任务状态
     *
     * @param jobId 任务编号
     * @param targetStatus 目标状态
     * @return 是否转换成功
     */
    private synchronized boolean transitionTo(String jobId, ExportTaskStatus targetStatus,
                                              String fileName, String errorMessage) {
        ExportTaskEntity entity = exportTaskRepository.findByJobId(jobId).orElse(null);
        if (entity == null) {
            log.error("导出任务不存在: jobId={}", jobId);
            return false;
        }

        ExportTaskStatus currentStatus = entity.getStatus();

        // 幂等：当前已是目标状态则直接成功
        if (currentStatus == targetStatus) {
            log.debug("任务已是目标状态，跳过转换: jobId={}, status={}", jobId, currentStatus);
            return true;
        }

        if (!isValidTransition(currentStatus, targetStatus)) {
            log.error("非法的状态转换: jobId={}, from={}, to={}", jobId, currentStatus, targetStatus);
            return false;
        }

        entity.setStatus(targetStatus);
        if (fileName != null) {
            entity.setFileName(fileName);
        }
        if (errorMessage != null) {
            entity.setErrorMessage(errorMessage);
        }
        if (targetStatus == ExportTaskStatus.RUNNING && entity.getStartTime() == null) {
            entity.setStartTime(LocalDateTime.now());
        } else if (targetStatus.isTerminal()) {
            entity.setEndTime(LocalDateTime.now());
        }

        exportTaskRepository.save(entity);
        log.info("导出任务状态转换: jobId={}, {} -> {}", jobId, currentStatus, targetStatus);
        return true;
    }

    private boolean isValidTransition(ExportTaskStatus currentStatus, ExportTaskStatus targetStatus) {
        for (StateTransition transition : StateTransition.values()) {
            if (transition.matches(currentStatus, targetStatus)) {
                return true;
            }
        }
        return false;
    }

    public boolean markRunning(String jobId) {
        return transitionTo(jobId, ExportTaskStatus.RUNNING, null, null);
    }

    public boolean markFailed(String jobId, String errorMessage) {
        return transitionTo(jobId, ExportTaskStatus.FAILED, null, errorMessage);
    }

    /**
     * 记录任务终态，完成时同时记录发布的文件名。仓储异常只记录日志并返回 false，调用方照常发送终态通知；
     * 未能落库的任务在下次启动时由恢复流程标记为失败。
     */
    public boolean tryMarkTerminal(String jobId, ExportTaskStatus status, String fileName, String errorMessage) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("不是终态: " + status);
        }
        try {
            return transitionTo(jobId, status, fileName, errorMessage);
        } catch (RuntimeException e) {
            log.error("导出任务终态持久化失败: jobId={}, status={}", jobId, status, e);
            return false;
        }
    }

    /**
     * 更新处理进度，只对运行中的任务生效
     */
    public synchronized void updateProgress(String jobId, long processedCount, long totalCount) {
        exportTaskRepository.findByJobId(jobId)
            .filter(e -> e.getStatus() == ExportTaskStatus.RUNNING)
            .ifPresent(e -> {
                e.setProcessedCount(processedCount);
                e.setTotalCount(totalCount);
                exportTaskRepository.save(e);
            });
    }
}

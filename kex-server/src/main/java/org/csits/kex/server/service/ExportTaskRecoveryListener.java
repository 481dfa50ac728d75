package org.csits.kex.server.service;

import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.kex.dao.ExportTaskEntity;
import org.csits.kex.dao.ExportTaskRepository;
import org.csits.kex.dao.ExportTaskStatus;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 启动时将上次进程遗留的排队中、运行中任务标记为失败。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExportTaskRecoveryListener {

    static final String INTERRUPTED_MESSAGE = "interrupted by restart";

    private final ExportTaskRepository exportTaskRepository;

    private final ExportTaskStateMachine stateMachine;

    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterruptedTasks() {
        List<ExportTaskEntity> leftovers = exportTaskRepository.findByStatusIn(
            Arrays.asList(ExportTaskStatus.QUEUED, ExportTaskStatus.RUNNING));
        for (ExportTaskEntity task : leftovers) {
            stateMachine.markFailed(task.getJobId(), INTERRUPTED_MESSAGE);
        }
        if (!leftovers.isEmpty()) {
            log.warn("已将 {} 个中断的导出任务标记为失败", leftovers.size());
        }
    }
}

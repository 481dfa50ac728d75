package org.csits.kex.dao;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * 导出任务记录实体，对应 kex.export_task。
 */
@Data
public class ExportTaskEntity {

    private Long id;

    /**
     * 作业运行器分配的任务编号，创建后不变。
     */
    private String jobId;

    private String exportTypeName;

    private String providerName;

    /**
     * 对应推送通知的 ID。
     */
    private String notificationId;

    private ExportTaskStatus status;

    /**
     * 发布后的导出文件名，仅在 COMPLETED 时有值。
     */
    private String fileName;

    private Long processedCount;

    private Long totalCount;

    private String errorMessage;

    private String createdBy;

    private LocalDateTime createdAt;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private LocalDateTime updatedAt;
}

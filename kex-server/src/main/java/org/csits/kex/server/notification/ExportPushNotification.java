package org.csits.kex.server.notification;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.Data;
import org.csits.kex.dao.ExportTaskStatus;

/**
 * 导出任务推送通知。同一任务的所有状态更新共用一个 id。
 */
@Data
public class ExportPushNotification {

    public static final String NOTIFY_TYPE = "PlatformExportPushNotification";

    private String id;

    private String jobId;

    private String creator;

    private String notifyType = NOTIFY_TYPE;

    private String title;

    private String description;

    private ExportTaskStatus status;

    private long processedCount;

    private long totalCount;

    /**
     * 发布后的文件名。
     */
    private String fileName;

    private String downloadUrl;

    private List<String> errors = new ArrayList<>();

    private LocalDateTime created;

    private LocalDateTime finished;

    public ExportPushNotification() {
    }

    public ExportPushNotification(String creator) {
        this.id = UUID.randomUUID().toString();
        this.creator = creator;
        this.created = LocalDateTime.now();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /**
     * 当前状态的快照，推送和返回给调用方时使用，避免与执行线程共享可变对象。
     */
    public ExportPushNotification copy() {
        ExportPushNotification copy = new ExportPushNotification();
        copy.setId(id);
        copy.setJobId(jobId);
        copy.setCreator(creator);
        copy.setNotifyType(notifyType);
        copy.setTitle(title);
        copy.setDescription(description);
        copy.setStatus(status);
        copy.setProcessedCount(processedCount);
        copy.setTotalCount(totalCount);
        copy.setFileName(fileName);
        copy.setDownloadUrl(downloadUrl);
        copy.setErrors(errors != null ? new ArrayList<>(errors) : new ArrayList<>());
        copy.setCreated(created);
        copy.setFinished(finished);
        return copy;
    }
}

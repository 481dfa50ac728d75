package org.csits.kex.server.notification;

import java.util.List;
import java.util.Optional;

/**
 * 推送通知通道。实现需线程安全，且终态通知之后不再接受同一 id 的更新。
 */
public interface PushNotificationManager {

    /**
     * 发送（新增或更新）通知。
     *
     * @return 被接受时返回 true；该通知已处于终态时忽略并返回 false
     */
    boolean send(ExportPushNotification notification);

    Optional<ExportPushNotification> findById(String id);

    List<ExportPushNotification> findByCreator(String creator);
}

package org.csits.kex.server.notification;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.csits.kex.server.config.ExportConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 内存通知通道，保存每个通知的最新状态，客户端轮询获取。
 * 终态通知保留一段时间供客户端读取，之后由定时清理移除。
 */
@Slf4j
@Component
public class InMemoryPushNotificationManager implements PushNotificationManager {

    private final Map<String, ExportPushNotification> notifications = new ConcurrentHashMap<>();

    private final Duration retention;

    public InMemoryPushNotificationManager() {
        this(Duration.ofMinutes(ExportConfig.DEFAULT_NOTIFICATION_RETENTION_MINUTES));
    }

    @Autowired
    public InMemoryPushNotificationManager(ExportConfig exportConfig) {
        this(exportConfig.resolveNotificationRetention());
    }

    public InMemoryPushNotificationManager(Duration retention) {
        this.retention = retention;
    }

    @Override
    public boolean send(ExportPushNotification notification) {
        if (notification == null || notification.getId() == null) {
            throw new IllegalArgumentException("通知 id 不能为空");
        }
        AtomicBoolean accepted = new AtomicBoolean(false);
        notifications.compute(notification.getId(), (id, existing) -> {
            if (existing != null && existing.isTerminal()) {
                return existing;
            }
            accepted.set(true);
            return notification.copy();
        });
        if (accepted.get()) {
            log.debug("推送通知: id={}, jobId={}, status={}, description={}",
                notification.getId(), notification.getJobId(), notification.getStatus(),
                notification.getDescription());
        } else {
            log.warn("通知已处于终态，忽略更新: id={}, jobId={}, status={}",
                notification.getId(), notification.getJobId(), notification.getStatus());
        }
        return accepted.get();
    }

    @Override
    public Optional<ExportPushNotification> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        ExportPushNotification notification = notifications.get(id);
        return notification != null ? Optional.of(notification.copy()) : Optional.empty();
    }

    @Override
    public List<ExportPushNotification> findByCreator(String creator) {
        return notifications.values().stream()
            .filter(n -> creator != null && creator.equals(n.getCreator()))
            .sorted(Comparator.comparing(ExportPushNotification::getCreated,
                Comparator.nullsLast(Comparator.reverseOrder())))
            .map(ExportPushNotification::copy)
            .collect(Collectors.toList());
    }

    @Scheduled(fixedDelayString = "${kex.notification.sweep-interval-ms:60000}")
    public void evictExpired() {
        evictExpired(LocalDateTime.now());
    }

    /**
     * 移除在 now - retention 之前结束的终态通知，未结束的通知一律保留。
     *
     * @return 移除的条数
     */
    public int evictExpired(LocalDateTime now) {
        LocalDateTime cutoff = now.minus(retention);
        int evicted = 0;
        for (Map.Entry<String, ExportPushNotification> entry : notifications.entrySet()) {
            ExportPushNotification notification = entry.getValue();
            LocalDateTime finished = notification.getFinished() != null
                ? notification.getFinished() : notification.getCreated();
            if (notification.isTerminal() && finished != null && finished.isBefore(cutoff)
                && notifications.remove(entry.getKey(), notification)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("已清理过期的终态通知: count={}, remaining={}", evicted, notifications.size());
        }
        return evicted;
    }
}

package org.csits.kex.dao;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * 基于内存的导出任务仓储实现，用于单机运行和测试。
 */
@Repository
@ConditionalOnProperty(name = "kex.persistence.type", havingValue = "memory")
public class InMemoryExportTaskRepository implements ExportTaskRepository {

    private static final Comparator<ExportTaskEntity> NEWEST_FIRST =
        Comparator.comparing(ExportTaskEntity::getCreatedAt).reversed()
            .thenComparing(ExportTaskEntity::getId, Comparator.reverseOrder());

    private final AtomicLong idGenerator = new AtomicLong(0);

    private final Map<Long, ExportTaskEntity> store = new ConcurrentHashMap<>();

    @Override
    public ExportTaskEntity save(ExportTaskEntity entity) {
        if (entity.getId() == null) {
            entity.setId(idGenerator.incrementAndGet());
            if (entity.getCreatedAt() == null) {
                entity.setCreatedAt(LocalDateTime.now());
            }
        }
        entity.setUpdatedAt(LocalDateTime.now());
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public Optional<ExportTaskEntity> findByJobId(String jobId) {
        return store.values().stream()
            .filter(e -> jobId.equals(e.getJobId()))
            .findFirst();
    }

    @Override
    public List<ExportTaskEntity> findByStatusIn(Collection<ExportTaskStatus> statuses) {
        return store.values().stream()
            .filter(e -> statuses.contains(e.getStatus()))
            .sorted(NEWEST_FIRST)
            .collect(Collectors.toList());
    }

    @Override
    public List<ExportTaskEntity> findAll() {
        return store.values().stream()
            .sorted(NEWEST_FIRST)
            .collect(Collectors.toList());
    }
}

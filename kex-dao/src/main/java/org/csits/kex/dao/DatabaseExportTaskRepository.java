package org.csits.kex.dao;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

/**
 * 基于数据库的导出任务仓储实现
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "kex.persistence.type", havingValue = "database", matchIfMissing = true)
@RequiredArgsConstructor
public class DatabaseExportTaskRepository implements ExportTaskRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL =
        "INSERT INTO export_task (job_id, export_type_name, provider_name, notification_id, status, " +
        "file_name, processed_count, total_count, error_message, created_by, start_time, end_time, " +
        "created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_SQL =
        "UPDATE export_task SET notification_id = ?, status = ?, file_name = ?, processed_count = ?, " +
        "total_count = ?, error_message = ?, start_time = ?, end_time = ?, updated_at = ? WHERE id = ?";

    private static final String SELECT_BY_JOB_ID_SQL =
        "SELECT * FROM export_task WHERE job_id = ?";

    private static final String SELECT_BY_STATUS_SQL =
        "SELECT * FROM export_task WHERE status IN (%s) ORDER BY created_at DESC, id DESC";

    private static final String SELECT_ALL_SQL =
        "SELECT * FROM export_task ORDER BY created_at DESC, id DESC";

    @Override
    public ExportTaskEntity save(ExportTaskEntity entity) {
        if (entity.getId() == null) {
            return insert(entity);
        } else {
            return update(entity);
        }
    }

    private ExportTaskEntity insert(ExportTaskEntity entity) {
        LocalDateTime now = LocalDateTime.now();
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(now);
        }
        entity.setUpdatedAt(now);
        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(INSERT_SQL, new String[]{"id"});
            ps.setString(1, entity.getJobId());
            ps.setString(2, entity.getExportTypeName());
            ps.setString(3, entity.getProviderName());
            ps.setString(4, entity.getNotificationId());
            ps.setString(5, statusName(entity.getStatus()));
            ps.setString(6, entity.getFileName());
            ps.setObject(7, entity.getProcessedCount());
            ps.setObject(8, entity.getTotalCount());
            ps.setString(9, entity.getErrorMessage());
            ps.setString(10, entity.getCreatedBy());
            ps.setTimestamp(11, toTimestamp(entity.getStartTime()));
            ps.setTimestamp(12, toTimestamp(entity.getEndTime()));
            ps.setTimestamp(13, toTimestamp(entity.getCreatedAt()));
            ps.setTimestamp(14, toTimestamp(entity.getUpdatedAt()));
            return ps;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("插入导出任务记录未返回主键: jobId=" + entity.getJobId());
        }
        entity.setId(key.longValue());
        log.debug("插入导出任务记录: id={}, jobId={}, type={}",
            entity.getId(), entity.getJobId(), entity.getExportTypeName());
        return entity;
    }

    private ExportTaskEntity update(ExportTaskEntity entity) {
        entity.setUpdatedAt(LocalDateTime.now());
        int rows = jdbcTemplate.update(UPDATE_SQL,
            entity.getNotificationId(),
            statusName(entity.getStatus()),
            entity.getFileName(),
            entity.getProcessedCount(),
            entity.getTotalCount(),
            entity.getErrorMessage(),
            toTimestamp(entity.getStartTime()),
            toTimestamp(entity.getEndTime()),
            toTimestamp(entity.getUpdatedAt()),
            entity.getId()
        );

        if (rows == 0) {
            log.warn("更新导出任务记录失败，记录不存在: id={}", entity.getId());
        } else {
            log.debug("更新导出任务记录: id={}, status={}", entity.getId(), entity.getStatus());
        }
        return entity;
    }

    @Override
    public Optional<ExportTaskEntity> findByJobId(String jobId) {
        List<ExportTaskEntity> results = jdbcTemplate.query(SELECT_BY_JOB_ID_SQL, new ExportTaskRowMapper(), jobId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<ExportTaskEntity> findByStatusIn(Collection<ExportTaskStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return Collections.emptyList();
        }
        String placeholders = statuses.stream().map(s -> "?").collect(Collectors.joining(", "));
        Object[] args = statuses.stream().map(Enum::name).toArray();
        return jdbcTemplate.query(String.format(SELECT_BY_STATUS_SQL, placeholders),
            new ExportTaskRowMapper(), args);
    }

    @Override
    public List<ExportTaskEntity> findAll() {
        return jdbcTemplate.query(SELECT_ALL_SQL, new ExportTaskRowMapper());
    }

    /**
     * RowMapper实现
     */
    private static class ExportTaskRowMapper implements RowMapper<ExportTaskEntity> {
        @Override
        public ExportTaskEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            ExportTaskEntity entity = new ExportTaskEntity();
            entity.setId(rs.getLong("id"));
            entity.setJobId(rs.getString("job_id"));
            entity.setExportTypeName(rs.getString("export_type_name"));
            entity.setProviderName(rs.getString("provider_name"));
            entity.setNotificationId(rs.getString("notification_id"));
            String status = rs.getString("status");
            entity.setStatus(status != null ? ExportTaskStatus.valueOf(status) : null);
            entity.setFileName(rs.getString("file_name"));
            entity.setProcessedCount(rs.getObject("processed_count", Long.class));
            entity.setTotalCount(rs.getObject("total_count", Long.class));
            entity.setErrorMessage(rs.getString("error_message"));
            entity.setCreatedBy(rs.getString("created_by"));
            entity.setStartTime(toLocalDateTime(rs.getTimestamp("start_time")));
            entity.setEndTime(toLocalDateTime(rs.getTimestamp("end_time")));
            entity.setCreatedAt(toLocalDateTime(rs.getTimestamp("created_at")));
            entity.setUpdatedAt(toLocalDateTime(rs.getTimestamp("updated_at")));
            return entity;
        }
    }

    private static String statusName(ExportTaskStatus status) {
        return status != null ? status.name() : null;
    }

    private static Timestamp toTimestamp(LocalDateTime dateTime) {
        return dateTime != null ? Timestamp.valueOf(dateTime) : null;
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }
}

package org.csits.kex.server.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.List;
import lombok.Data;

/**
 * 导出服务配置，对应 config/export.yaml。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportConfig {

    public static final int DEFAULT_PAGE_SIZE = 50;

    public static final int DEFAULT_MAX_PAGE_SIZE = 1000;

    public static final long DEFAULT_NOTIFICATION_RETENTION_MINUTES = 60L;

    private StorageConfig storage;

    /**
     * 导出工作线程数。
     */
    @JsonProperty("worker_threads")
    private Integer workerThreads;

    /**
     * 等待执行的任务队列容量。
     */
    @JsonProperty("queue_capacity")
    private Integer queueCapacity;

    @JsonProperty("default_page_size")
    private Integer defaultPageSize;

    @JsonProperty("max_page_size")
    private Integer maxPageSize;

    private RetryConfig retry;

    /**
     * 终态通知的保留时间（分钟），超时后从内存中清除。
     */
    @JsonProperty("notification_retention_minutes")
    private Long notificationRetentionMinutes;

    /**
     * 通过配置声明的数据库表导出类型。
     */
    @JsonProperty("jdbc_types")
    private List<JdbcTypeConfig> jdbcTypes;

    public int resolveDefaultPageSize() {
        return defaultPageSize != null && defaultPageSize > 0 ? defaultPageSize : DEFAULT_PAGE_SIZE;
    }

    public int resolveMaxPageSize() {
        return maxPageSize != null && maxPageSize > 0 ? maxPageSize : DEFAULT_MAX_PAGE_SIZE;
    }

    public Duration resolveNotificationRetention() {
        return Duration.ofMinutes(notificationRetentionMinutes != null && notificationRetentionMinutes >= 0
            ? notificationRetentionMinutes : DEFAULT_NOTIFICATION_RETENTION_MINUTES);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {

        /**
         * 导出文件根目录。
         */
        @JsonProperty("root_dir")
        private String rootDir;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {

        /**
         * 分页读取失败后的最大重试次数，0 表示不重试。
         */
        @JsonProperty("max_retries")
        private Integer maxRetries;

        @JsonProperty("retry_interval_ms")
        private Long retryIntervalMs;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JdbcTypeConfig {

        /**
         * 导出类型名，如 Kex.ExportTask。
         */
        private String name;

        private String table;

        /**
         * 导出列，为空时导出全部列。
         */
        private List<String> columns;

        @JsonProperty("id_column")
        private String idColumn;

        @JsonProperty("order_by")
        private String orderBy;

        private String permission;
    }
}

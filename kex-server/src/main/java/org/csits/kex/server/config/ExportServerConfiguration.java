package org.csits.kex.server.config;

import java.io.IOException;
import java.nio.file.Paths;
import org.csits.kex.manager.storage.ExportFileStorage;
import org.csits.kex.manager.storage.LocalExportFileStorage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 导出服务基础组件装配。
 */
@Configuration
@EnableScheduling
public class ExportServerConfiguration {

    public static final String EXPORT_JOB_EXECUTOR = "exportJobExecutor";

    @Bean
    public ExportConfig exportConfig(ExportConfigLoader loader,
                                     @Value("${kex.config.export:classpath:config/export.yaml}") String location)
        throws IOException {
        return loader.load(location);
    }

    @Bean
    public ExportFileStorage exportFileStorage(ExportConfig exportConfig) throws IOException {
        String rootDir = exportConfig.getStorage() != null && exportConfig.getStorage().getRootDir() != null
            ? exportConfig.getStorage().getRootDir()
            : "data/export";
        return new LocalExportFileStorage(Paths.get(rootDir));
    }

    @Bean(name = EXPORT_JOB_EXECUTOR)
    public ThreadPoolTaskExecutor exportJobExecutor(ExportConfig exportConfig) {
        int threads = exportConfig.getWorkerThreads() != null && exportConfig.getWorkerThreads() > 0
            ? exportConfig.getWorkerThreads() : 2;
        int capacity = exportConfig.getQueueCapacity() != null && exportConfig.getQueueCapacity() >= 0
            ? exportConfig.getQueueCapacity() : 100;
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(capacity);
        executor.setThreadNamePrefix("kex-export-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}

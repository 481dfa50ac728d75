package org.csits.kex.server.registry;

import org.csits.kex.dao.ExportTaskEntity;
import org.csits.kex.dao.ExportTaskRepository;
import org.csits.kex.server.datasource.InMemoryPagedDataSource;
import org.csits.kex.server.security.ExportPermissions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 内置导出类型。
 */
@Configuration
public class BuiltInExportTypes {

    public static final String EXPORT_TASK_TYPE = "Kex.ExportTask";

    /**
     * 导出任务历史，按任务编号过滤，关键字匹配导出类型名。
     */
    @Bean
    public ExportedTypeDefinition exportTaskTypeDefinition(ExportTaskRepository exportTaskRepository) {
        return ExportedTypeDefinition.builder()
            .name(EXPORT_TASK_TYPE)
            .requiredPermission(ExportPermissions.TASK_HISTORY)
            .dataSourceFactory(query -> new InMemoryPagedDataSource<ExportTaskEntity>(query,
                exportTaskRepository::findAll,
                ExportTaskEntity::getJobId,
                (task, keyword) -> task.getExportTypeName() != null
                    && task.getExportTypeName().toLowerCase().contains(keyword.toLowerCase())))
            .build();
    }
}

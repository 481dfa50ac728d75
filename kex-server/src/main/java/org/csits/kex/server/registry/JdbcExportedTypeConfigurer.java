package org.csits.kex.server.registry;

import java.util.List;
import javax.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.kex.server.config.ExportConfig;
import org.csits.kex.server.datasource.JdbcTablePagedDataSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * 注册 export.yaml 中 jdbc_types 声明的数据库表导出类型。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcExportedTypeConfigurer {

    private final ExportConfig exportConfig;

    private final KnownExportTypesRegistrar registrar;

    private final ObjectProvider<JdbcTemplate> jdbcTemplateProvider;

    @PostConstruct
    public void registerConfiguredTypes() {
        List<ExportConfig.JdbcTypeConfig> types = exportConfig.getJdbcTypes();
        if (types == null || types.isEmpty()) {
            return;
        }
        JdbcTemplate jdbcTemplate = jdbcTemplateProvider.getIfAvailable();
        if (jdbcTemplate == null) {
            log.warn("未配置数据源，跳过 {} 个数据库表导出类型", types.size());
            return;
        }
        for (ExportConfig.JdbcTypeConfig type : types) {
            validate(type);
            registrar.register(ExportedTypeDefinition.builder()
                .name(type.getName())
                .requiredPermission(type.getPermission())
                .dataSourceFactory(query -> new JdbcTablePagedDataSource(query, jdbcTemplate, type.getTable(),
                    type.getColumns(), type.getIdColumn(), type.getOrderBy()))
                .build());
        }
    }

    private void validate(ExportConfig.JdbcTypeConfig type) {
        if (type.getName() == null || type.getName().trim().isEmpty()) {
            throw new IllegalStateException("jdbc_types 配置缺少 name");
        }
        if (!JdbcTablePagedDataSource.isIdentifier(type.getTable())) {
            throw new IllegalStateException("jdbc_types 表名非法: " + type.getName() + " -> " + type.getTable());
        }
        if (type.getColumns() != null) {
            for (String column : type.getColumns()) {
                if (!JdbcTablePagedDataSource.isIdentifier(column)) {
                    throw new IllegalStateException("jdbc_types 列名非法: " + type.getName() + " -> " + column);
                }
            }
        }
        for (String column : new String[] {type.getIdColumn(), type.getOrderBy()}) {
            if (column != null && !JdbcTablePagedDataSource.isIdentifier(column)) {
                throw new IllegalStateException("jdbc_types 列名非法: " + type.getName() + " -> " + column);
            }
        }
    }
}

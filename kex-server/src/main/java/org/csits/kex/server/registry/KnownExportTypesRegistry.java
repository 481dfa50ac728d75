package org.csits.kex.server.registry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.csits.kex.server.exception.UnknownExportTypeException;
import org.springframework.stereotype.Component;

/**
 * 导出类型注册表。启动时收集容器中的 {@link ExportedTypeDefinition}，运行期也可继续注册。
 */
@Slf4j
@Component
public class KnownExportTypesRegistry implements KnownExportTypesRegistrar, KnownExportTypesResolver {

    private final Map<String, ExportedTypeDefinition> definitions = new LinkedHashMap<>();

    public KnownExportTypesRegistry(List<ExportedTypeDefinition> definitions) {
        definitions.forEach(this::register);
    }

    @Override
    public synchronized void register(ExportedTypeDefinition definition) {
        if (definition == null || definition.getName() == null || definition.getName().trim().isEmpty()) {
            throw new IllegalArgumentException("导出类型名不能为空");
        }
        if (definition.getDataSourceFactory() == null) {
            throw new IllegalArgumentException("导出类型未配置数据源工厂: " + definition.getName());
        }
        ExportedTypeDefinition previous = definitions.put(definition.getName(), definition);
        if (previous != null) {
            log.info("覆盖导出类型: {}", definition.getName());
        } else {
            log.info("注册导出类型: {}, permission={}", definition.getName(), definition.getRequiredPermission());
        }
    }

    @Override
    public synchronized List<ExportedTypeDefinition> getRegisteredTypes() {
        return new ArrayList<>(definitions.values());
    }

    @Override
    public synchronized ExportedTypeDefinition resolveExportedTypeDefinition(String exportTypeName) {
        ExportedTypeDefinition definition = exportTypeName != null ? definitions.get(exportTypeName) : null;
        if (definition == null) {
            throw new UnknownExportTypeException(exportTypeName);
        }
        return definition;
    }
}

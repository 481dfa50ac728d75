package org.csits.kex.server.registry;

import java.util.List;

/**
 * 导出类型注册。
 */
public interface KnownExportTypesRegistrar {

    /**
     * 注册导出类型，同名覆盖。
     */
    void register(ExportedTypeDefinition definition);

    /**
     * 按注册顺序返回全部导出类型。
     */
    List<ExportedTypeDefinition> getRegisteredTypes();
}

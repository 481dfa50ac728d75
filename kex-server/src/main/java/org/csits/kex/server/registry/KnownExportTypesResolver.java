package org.csits.kex.server.registry;

/**
 * 按类型名查找导出类型。
 */
public interface KnownExportTypesResolver {

    /**
     * @throws org.csits.kex.server.exception.UnknownExportTypeException 类型未注册
     */
    ExportedTypeDefinition resolveExportedTypeDefinition(String exportTypeName);
}

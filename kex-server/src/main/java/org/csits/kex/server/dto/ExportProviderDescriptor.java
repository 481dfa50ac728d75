package org.csits.kex.server.dto;

import lombok.Value;
import org.csits.kex.manager.plugin.ExportProvider;

/**
 * 导出插件描述，供 providers 接口返回。
 */
@Value
public class ExportProviderDescriptor {

    String typeName;

    String exportedFileExtension;

    boolean tabular;

    public static ExportProviderDescriptor of(ExportProvider provider) {
        return new ExportProviderDescriptor(provider.getTypeName(), provider.getExportedFileExtension(),
            provider.isTabular());
    }
}

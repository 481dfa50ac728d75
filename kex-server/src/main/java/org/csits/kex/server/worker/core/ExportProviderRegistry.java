package org.csits.kex.server.worker.core;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.csits.kex.manager.plugin.ExportProvider;
import org.csits.kex.manager.plugin.ExportProviderFactory;
import org.csits.kex.server.dto.ExportProviderDescriptor;
import org.csits.kex.server.exception.UnknownExportProviderException;
import org.csits.kex.server.provider.JsonExportProvider;
import org.springframework.stereotype.Component;

/**
 * 导出格式插件注册与选择器。
 */
@Component
@RequiredArgsConstructor
public class ExportProviderRegistry {

    private final List<ExportProviderFactory> factories;

    /**
     * 用空配置探测每个插件，返回其描述。
     */
    public List<ExportProviderDescriptor> describeAll() {
        return factories.stream()
            .map(f -> ExportProviderDescriptor.of(f.create(Collections.emptyMap())))
            .collect(Collectors.toList());
    }

    /**
     * 按名称（忽略大小写）选择插件；名称为空时优先 Json，否则取第一个。
     *
     * @throws UnknownExportProviderException 插件不存在
     */
    public ExportProvider create(String providerName, Map<String, String> configuration) {
        return selectFactory(providerName).create(
            configuration != null ? configuration : Collections.emptyMap());
    }

    /**
     * 只校验插件是否存在，不创建实例。
     */
    public void validate(String providerName) {
        selectFactory(providerName);
    }

    private ExportProviderFactory selectFactory(String providerName) {
        if (providerName == null || providerName.trim().isEmpty()) {
            return factories.stream()
                .filter(f -> JsonExportProvider.TYPE_NAME.equalsIgnoreCase(f.getTypeName()))
                .findFirst()
                .orElseGet(() -> factories.stream()
                    .findFirst()
                    .orElseThrow(() -> new UnknownExportProviderException(providerName)));
        }
        String name = providerName.trim();
        return factories.stream()
            .filter(f -> name.equalsIgnoreCase(f.getTypeName()))
            .findFirst()
            .orElseThrow(() -> new UnknownExportProviderException(providerName));
    }
}

package org.csits.kex.manager.plugin;

import java.util.Map;

/**
 * 按请求配置创建导出插件实例。
 */
public interface ExportProviderFactory {

    String getTypeName();

    /**
     * @param configuration 请求携带的插件配置，可为空 Map
     */
    ExportProvider create(Map<String, String> configuration);
}

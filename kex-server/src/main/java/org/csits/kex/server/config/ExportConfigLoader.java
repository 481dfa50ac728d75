package org.csits.kex.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * 使用 Jackson YAML 将 export.yaml 映射为 {@link ExportConfig}。
 */
@Slf4j
@Component
public class ExportConfigLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private final ResourceLoader resourceLoader;

    public ExportConfigLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * 加载配置，文件不存在时使用默认配置。
     */
    public ExportConfig load(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("导出配置文件不存在，使用默认配置: {}", location);
            return new ExportConfig();
        }
        try (InputStream in = resource.getInputStream()) {
            ExportConfig config = yamlMapper.readValue(in, ExportConfig.class);
            log.info("已加载导出配置: {}", location);
            return config != null ? config : new ExportConfig();
        }
    }

    public ExportConfig loadFromString(String yaml) throws IOException {
        return yamlMapper.readValue(new StringReader(yaml), ExportConfig.class);
    }
}

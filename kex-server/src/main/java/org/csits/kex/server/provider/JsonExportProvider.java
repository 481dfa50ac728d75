package org.csits.kex.server.provider;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.csits.kex.manager.plugin.ExportProvider;
import org.csits.kex.manager.plugin.ExportRecordWriter;

/**
 * JSON 导出：输出一个 JSON 数组，逐条流式写入。
 * 配置项 indent=true 时缩进输出。
 */
public class JsonExportProvider implements ExportProvider {

    public static final String TYPE_NAME = "Json";

    private final ObjectMapper objectMapper;

    private final Map<String, String> configuration;

    public JsonExportProvider(ObjectMapper objectMapper, Map<String, String> configuration) {
        this.objectMapper = objectMapper;
        this.configuration = configuration != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(configuration)) : Collections.emptyMap();
    }

    @Override
    public String getTypeName() {
        return TYPE_NAME;
    }

    @Override
    public String getExportedFileExtension() {
        return "json";
    }

    @Override
    public boolean isTabular() {
        return false;
    }

    @Override
    public Map<String, String> getConfiguration() {
        return configuration;
    }

    @Override
    public ExportRecordWriter openWriter(OutputStream out) throws IOException {
        JsonGenerator generator = objectMapper.getFactory().createGenerator(out);
        if (Boolean.parseBoolean(configuration.get("indent"))) {
            generator.useDefaultPrettyPrinter();
        }
        generator.writeStartArray();
        return new JsonRecordWriter(generator);
    }

    private class JsonRecordWriter implements ExportRecordWriter {

        private final JsonGenerator generator;

        JsonRecordWriter(JsonGenerator generator) {
            this.generator = generator;
        }

        @Override
        public void write(Object record) throws IOException {
            objectMapper.writeValue(generator, record);
        }

        @Override
        public void flush() throws IOException {
            generator.flush();
        }

        @Override
        public void close() throws IOException {
            if (!generator.isClosed()) {
                generator.writeEndArray();
                generator.close();
            }
        }
    }
}

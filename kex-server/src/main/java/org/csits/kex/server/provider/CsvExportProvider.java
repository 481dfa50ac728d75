package org.csits.kex.server.provider;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.csits.kex.manager.plugin.ExportProvider;
import org.csits.kex.manager.plugin.ExportRecordWriter;

/**
 * CSV 导出：表头取自配置项 columns（逗号分隔），未配置时取第一条记录的属性名。
 * 嵌套对象与集合以 JSON 字符串写入单元格。配置项 separator 指定分隔符，默认逗号。
 */
public class CsvExportProvider implements ExportProvider {

    public static final String TYPE_NAME = "Csv";

    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE =
        new TypeReference<LinkedHashMap<String, Object>>() {};

    private final ObjectMapper objectMapper;

    private final CsvMapper csvMapper;

    private final Map<String, String> configuration;

    public CsvExportProvider(ObjectMapper objectMapper, Map<String, String> configuration) {
        this.objectMapper = objectMapper;
        this.csvMapper = new CsvMapper();
        this.csvMapper.configure(JsonGenerator.Feature.IGNORE_UNKNOWN, true);
        this.configuration = configuration != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(configuration)) : Collections.emptyMap();
    }

    @Override
    public String getTypeName() {
        return TYPE_NAME;
    }

    @Override
    public String getExportedFileExtension() {
        return "csv";
    }

    @Override
    public boolean isTabular() {
        return true;
    }

    @Override
    public Map<String, String> getConfiguration() {
        return configuration;
    }

    @Override
    public ExportRecordWriter openWriter(OutputStream out) {
        return new CsvRecordWriter(out);
    }

    private List<String> configuredColumns() {
        String columns = configuration.get("columns");
        List<String> result = new ArrayList<>();
        if (columns != null) {
            for (String column : columns.split(",")) {
                if (!column.trim().isEmpty()) {
                    result.add(column.trim());
                }
            }
        }
        return result;
    }

    private char separator() {
        String separator = configuration.get("separator");
        return separator != null && separator.length() == 1 ? separator.charAt(0) : ',';
    }

    private Map<String, Object> toRow(Object record) throws IOException {
        Map<String, Object> source = objectMapper.convertValue(record, ROW_TYPE);
        Map<String, Object> row = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map || value instanceof Collection) {
                value = objectMapper.writeValueAsString(value);
            }
            row.put(entry.getKey(), value);
        }
        return row;
    }

    private class CsvRecordWriter implements ExportRecordWriter {

        private final OutputStream out;

        private SequenceWriter sequenceWriter;

        private boolean closed;

        CsvRecordWriter(OutputStream out) {
            this.out = out;
        }

        @Override
        public void write(Object record) throws IOException {
            Map<String, Object> row = toRow(record);
            if (sequenceWriter == null) {
                List<String> columns = configuredColumns();
                if (columns.isEmpty()) {
                    columns = new ArrayList<>(row.keySet());
                }
                CsvSchema.Builder schema = CsvSchema.builder()
                    .setUseHeader(true)
                    .setColumnSeparator(separator());
                columns.forEach(schema::addColumn);
                sequenceWriter = csvMapper.writer(schema.build()).writeValues(out);
            }
            sequenceWriter.write(row);
        }

        @Override
        public void flush() throws IOException {
            if (sequenceWriter != null) {
                sequenceWriter.flush();
            } else {
                out.flush();
            }
        }

        @Override
        public void close() throws IOException {
            if (closed) {
                return;
            }
            closed = true;
            if (sequenceWriter != null) {
                sequenceWriter.close();
            } else {
                out.close();
            }
        }
    }
}

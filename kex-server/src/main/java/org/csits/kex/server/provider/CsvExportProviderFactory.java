package org.csits.kex.server.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.csits.kex.manager.plugin.ExportProvider;
import org.csits.kex.manager.plugin.ExportProviderFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Order(1)
@Component
@RequiredArgsConstructor
public class CsvExportProviderFactory implements ExportProviderFactory {

    private final ObjectMapper objectMapper;

    @Override
    public String getTypeName() {
        return CsvExportProvider.TYPE_NAME;
    }

    @Override
    public ExportProvider create(Map<String, String> configuration) {
        return new CsvExportProvider(objectMapper, configuration);
    }
}

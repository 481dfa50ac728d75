package org.csits.kex.server.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.csits.kex.manager.plugin.ExportProvider;
import org.csits.kex.manager.plugin.ExportProviderFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Order(0)
@Component
@RequiredArgsConstructor
public class JsonExportProviderFactory implements ExportProviderFactory {

    private final ObjectMapper objectMapper;

    @Override
    public String getTypeName() {
        return JsonExportProvider.TYPE_NAME;
    }

    @Override
    public ExportProvider create(Map<String, String> configuration) {
        return new JsonExportProvider(objectMapper, configuration);
    }
}

package org.csits.kex.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * 导出请求：导出类型、查询条件与输出格式。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportDataRequest {

    private String exportTypeName;

    private ExportDataQuery dataQuery = new ExportDataQuery();

    /**
     * 导出插件类型名，为空时使用默认插件。
     */
    private String providerName;

    private Map<String, String> providerConfig = new LinkedHashMap<>();
}

package org.csits.kex.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * 导出数据查询条件。核心流程不解析其含义，由各导出类型的数据源解释。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportDataQuery {

    /**
     * 指定导出的对象 ID，为空时按其余条件导出。
     */
    private List<String> objectIds = new ArrayList<>();

    private String keyword;

    private String sort;

    private Integer skip;

    /**
     * 每页条数。
     */
    private Integer take;

    /**
     * 只导出这些属性，为空时导出全部属性。
     */
    private List<String> includedProperties = new ArrayList<>();

    /**
     * 返回补齐默认值后的副本：skip 默认 0，take 默认 defaultPageSize 且不超过 maxPageSize。
     */
    public ExportDataQuery normalized(int defaultPageSize, int maxPageSize) {
        ExportDataQuery copy = new ExportDataQuery();
        copy.setObjectIds(objectIds != null ? new ArrayList<>(objectIds) : new ArrayList<>());
        copy.setKeyword(keyword);
        copy.setSort(sort);
        copy.setSkip(skip != null && skip > 0 ? skip : 0);
        int pageSize = take != null && take > 0 ? take : defaultPageSize;
        copy.setTake(Math.min(pageSize, maxPageSize));
        copy.setIncludedProperties(includedProperties != null
            ? new ArrayList<>(includedProperties) : new ArrayList<>());
        return copy;
    }
}

package org.csits.kex.server.dto;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 数据预览结果：总数与当前页数据。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExportableSearchResult {

    private long totalCount;

    private List<Object> results = new ArrayList<>();
}

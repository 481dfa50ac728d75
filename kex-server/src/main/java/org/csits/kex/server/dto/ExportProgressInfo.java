package org.csits.kex.server.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 导出进度。
 */
@Data
@AllArgsConstructor
public class ExportProgressInfo {

    private long processedCount;

    private long totalCount;

    private String description;
}

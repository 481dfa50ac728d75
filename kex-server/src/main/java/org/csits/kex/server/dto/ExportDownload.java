package org.csits.kex.server.dto;

import lombok.Value;
import org.springframework.core.io.Resource;

/**
 * 待下载的导出文件。
 */
@Value
public class ExportDownload {

    String fileName;

    String contentType;

    Resource resource;
}

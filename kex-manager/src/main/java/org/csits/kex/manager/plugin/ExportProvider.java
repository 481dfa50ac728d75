package org.csits.kex.manager.plugin;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;

/**
 * 导出格式插件接口，不同输出格式（JSON、CSV 等）实现自己的写出逻辑。
 */
public interface ExportProvider {

    /**
     * 插件类型名，导出请求中的 providerName 与之匹配（忽略大小写）。
     */
    String getTypeName();

    /**
     * 生成文件的扩展名，不含点。
     */
    String getExportedFileExtension();

    /**
     * 是否为表格型格式（要求记录扁平化）。
     */
    boolean isTabular();

    /**
     * 插件配置，来自导出请求。
     */
    Map<String, String> getConfiguration();

    /**
     * 打开写出器。
     *
     * @param out 目标输出流，由写出器负责关闭
     */
    ExportRecordWriter openWriter(OutputStream out) throws IOException;
}

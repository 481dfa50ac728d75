package org.csits.kex.manager.plugin;

import java.io.Closeable;
import java.io.IOException;

/**
 * 单次导出的记录写出器，由 {@link ExportProvider#openWriter} 创建，不可跨任务复用。
 * close 时写出格式收尾内容并关闭底层流。
 */
public interface ExportRecordWriter extends Closeable {

    void write(Object record) throws IOException;

    void flush() throws IOException;
}

package org.csits.kex.manager.storage;

import java.io.IOException;
import java.io.OutputStream;
import org.springframework.core.io.Resource;

/**
 * 导出文件存储抽象。
 *
 * 写入分两步：先通过 {@link #openTemporary(String)} 写入临时文件，成功后 {@link #publish(String)} 原子发布；
 * 失败或取消时 {@link #discard(String)}。未发布的文件对读取不可见。
 */
public interface ExportFileStorage {

    /**
     * 以 Resource 形式返回已发布文件，供按 Range 分段读取。
     *
     * @throws org.csits.kex.manager.exception.ExportFileNotFoundException 文件不存在
     */
    Resource loadAsResource(String fileName);

    /**
     * 为即将发布的文件打开临时写入流。
     */
    OutputStream openTemporary(String fileName) throws IOException;

    /**
     * 将临时文件发布为正式文件。
     */
    void publish(String fileName) throws IOException;

    /**
     * 丢弃临时文件，不存在时忽略。
     */
    void discard(String fileName);
}

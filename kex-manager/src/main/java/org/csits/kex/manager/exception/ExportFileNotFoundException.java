package org.csits.kex.manager.exception;

import lombok.Getter;

/**
 * 导出文件不存在或尚未发布。
 */
@Getter
public class ExportFileNotFoundException extends ExportException {

    private final String fileName;

    public ExportFileNotFoundException(String fileName) {
        super("导出文件不存在: " + fileName);
        this.fileName = fileName;
    }
}

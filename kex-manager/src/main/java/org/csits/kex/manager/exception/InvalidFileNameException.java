package org.csits.kex.manager.exception;

/**
 * 文件名非法（含路径分隔符、".." 或越出存储根目录）。
 */
public class InvalidFileNameException extends ExportException {

    public InvalidFileNameException(String fileName) {
        super("非法的文件名: " + fileName);
    }
}

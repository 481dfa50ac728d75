package org.csits.kex.manager.storage;

import org.apache.commons.io.FilenameUtils;
import org.csits.kex.manager.exception.InvalidFileNameException;

/**
 * 导出文件名校验。所有存储操作之前都必须先校验，文件名只能是存储根目录下的单层名称。
 */
public final class FileNameValidator {

    private FileNameValidator() {
    }

    public static boolean isValid(String fileName) {
        if (fileName == null || fileName.trim().isEmpty()) {
            return false;
        }
        if (fileName.indexOf('/') >= 0 || fileName.indexOf('\\') >= 0 || fileName.indexOf('\0') >= 0) {
            return false;
        }
        if (fileName.contains("..") || fileName.startsWith(".")) {
            return false;
        }
        // Windows 盘符形式，如 "C:foo"
        if (FilenameUtils.getPrefixLength(fileName) != 0) {
            return false;
        }
        return fileName.equals(FilenameUtils.getName(fileName));
    }

    public static String validate(String fileName) {
        if (!isValid(fileName)) {
            throw new InvalidFileNameException(fileName);
        }
        return fileName;
    }
}

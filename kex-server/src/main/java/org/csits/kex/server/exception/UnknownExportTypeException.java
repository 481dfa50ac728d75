package org.csits.kex.server.exception;

import lombok.Getter;
import org.csits.kex.manager.exception.ExportException;

/**
 * 导出类型未注册。
 */
@Getter
public class UnknownExportTypeException extends ExportException {

    private final String exportTypeName;

    public UnknownExportTypeException(String exportTypeName) {
        super("未注册的导出类型: " + exportTypeName);
        this.exportTypeName = exportTypeName;
    }
}

package org.csits.kex.server.exception;

import org.csits.kex.manager.exception.ExportException;

/**
 * 导出授权未通过。对外只返回 401，不携带策略或原因。
 */
public class ExportAuthorizationDeniedException extends ExportException {

    public ExportAuthorizationDeniedException() {
        super("Unauthorized");
    }
}

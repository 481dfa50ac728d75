package org.csits.kex.server.security;

import org.csits.kex.server.dto.ExportDataQuery;

/**
 * 导出类型的授权策略，与导出类型一起注册。
 */
@FunctionalInterface
public interface ExportDataPolicy {

    /**
     * @param principal 当前用户，非 null
     * @param query     请求的查询条件
     * @return 是否允许
     */
    boolean evaluate(ExportPrincipal principal, ExportDataQuery query);
}

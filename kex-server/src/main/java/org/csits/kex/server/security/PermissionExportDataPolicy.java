package org.csits.kex.server.security;

import org.csits.kex.server.dto.ExportDataQuery;

/**
 * 默认策略：用户持有导出类型声明的权限即允许；未声明权限时对所有已登录用户开放。
 */
public class PermissionExportDataPolicy implements ExportDataPolicy {

    private final String requiredPermission;

    public PermissionExportDataPolicy(String requiredPermission) {
        this.requiredPermission = requiredPermission;
    }

    @Override
    public boolean evaluate(ExportPrincipal principal, ExportDataQuery query) {
        if (requiredPermission == null || requiredPermission.trim().isEmpty()) {
            return true;
        }
        return principal.hasPermission(requiredPermission);
    }
}

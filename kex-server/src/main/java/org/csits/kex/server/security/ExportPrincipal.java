package org.csits.kex.server.security;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Value;

/**
 * 当前请求用户及其权限。
 */
@Value
public class ExportPrincipal {

    String userName;

    Set<String> permissions;

    public ExportPrincipal(String userName, Set<String> permissions) {
        this.userName = userName;
        this.permissions = permissions != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(permissions))
            : Collections.emptySet();
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }

    public boolean hasAnyPermission(String... candidates) {
        for (String candidate : candidates) {
            if (permissions.contains(candidate)) {
                return true;
            }
        }
        return false;
    }
}

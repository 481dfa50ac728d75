package org.csits.kex.web.security;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;
import javax.servlet.http.HttpServletRequest;
import org.csits.kex.server.security.ExportPrincipal;
import org.springframework.stereotype.Component;

/**
 * 从网关写入的请求头解析当前用户：X-User-Name 为用户名，X-User-Permissions 为逗号分隔的权限。
 */
@Component
public class CurrentPrincipalResolver {

    public static final String USER_NAME_HEADER = "X-User-Name";

    public static final String PERMISSIONS_HEADER = "X-User-Permissions";

    /**
     * @return 未携带用户名时返回 null
     */
    public ExportPrincipal resolve(HttpServletRequest request) {
        String userName = request.getHeader(USER_NAME_HEADER);
        if (userName == null || userName.trim().isEmpty()) {
            return null;
        }
        String header = request.getHeader(PERMISSIONS_HEADER);
        Set<String> permissions = header == null ? new LinkedHashSet<>() : Arrays.stream(header.split(","))
            .map(String::trim)
            .filter(p -> !p.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
        return new ExportPrincipal(userName.trim(), permissions);
    }
}

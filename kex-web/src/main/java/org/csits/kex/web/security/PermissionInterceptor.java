package org.csits.kex.web.security;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.kex.server.security.ExportPrincipal;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpStatus;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 校验 {@link RequiresPermission}：无用户返回 401，缺少权限返回 403，均不带响应体。
 * 通过后将当前用户放入请求属性 {@link #PRINCIPAL_ATTRIBUTE}。
 */
@Slf4j
@RequiredArgsConstructor
public class PermissionInterceptor implements HandlerInterceptor {

    public static final String PRINCIPAL_ATTRIBUTE = "kex.principal";

    private final CurrentPrincipalResolver principalResolver;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        HandlerMethod method = (HandlerMethod) handler;
        RequiresPermission required = AnnotatedElementUtils.findMergedAnnotation(method.getMethod(),
            RequiresPermission.class);
        if (required == null) {
            required = AnnotatedElementUtils.findMergedAnnotation(method.getBeanType(), RequiresPermission.class);
        }

        ExportPrincipal principal = principalResolver.resolve(request);
        if (principal != null) {
            request.setAttribute(PRINCIPAL_ATTRIBUTE, principal);
        }
        if (required == null) {
            return true;
        }
        if (principal == null) {
            response.setStatus(HttpStatus.UNAUTHORIZED.value());
            return false;
        }
        if (!principal.hasAnyPermission(required.anyOf())) {
            log.warn("缺少接口权限: user={}, uri={}", principal.getUserName(), request.getRequestURI());
            response.setStatus(HttpStatus.FORBIDDEN.value());
            return false;
        }
        return true;
    }
}

package org.csits.kex.server.security;

import lombok.extern.slf4j.Slf4j;
import org.csits.kex.server.dto.ExportDataQuery;
import org.csits.kex.server.exception.ExportAuthorizationDeniedException;
import org.csits.kex.server.registry.ExportedTypeDefinition;
import org.springframework.stereotype.Service;

/**
 * 按导出类型的策略校验请求。必须在创建数据源、提交任务之前调用。
 */
@Slf4j
@Service
public class ExportAuthorizationService {

    public boolean isAuthorized(ExportPrincipal principal, ExportedTypeDefinition definition,
                                ExportDataQuery query) {
        if (principal == null) {
            return false;
        }
        ExportDataPolicy policy = definition.getPolicy();
        try {
            return policy.evaluate(principal, query);
        } catch (RuntimeException e) {
            log.error("授权策略执行异常，按拒绝处理: policy={}", definition.getPolicyName(), e);
            return false;
        }
    }

    /**
     * @throws ExportAuthorizationDeniedException 未通过
     */
    public void authorize(ExportPrincipal principal, ExportedTypeDefinition definition, ExportDataQuery query) {
        if (!isAuthorized(principal, definition, query)) {
            log.warn("导出授权拒绝: user={}, policy={}",
                principal != null ? principal.getUserName() : null, definition.getPolicyName());
            throw new ExportAuthorizationDeniedException();
        }
    }
}

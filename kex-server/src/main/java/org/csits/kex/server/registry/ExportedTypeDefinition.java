package org.csits.kex.server.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;
import org.csits.kex.server.datasource.PagedDataSourceFactory;
import org.csits.kex.server.security.ExportDataPolicy;
import org.csits.kex.server.security.PermissionExportDataPolicy;

/**
 * 可导出类型的元数据。注册后不可变。
 */
@Getter
@Builder
public class ExportedTypeDefinition {

    /**
     * 类型名，全局唯一，如 Catalog.Product。
     */
    private final String name;

    private final String requiredPermission;

    @JsonIgnore
    private final PagedDataSourceFactory dataSourceFactory;

    /**
     * 授权策略，未指定时按 requiredPermission 校验。
     */
    @JsonIgnore
    private final ExportDataPolicy policy;

    @JsonIgnore
    public ExportDataPolicy getPolicy() {
        return policy != null ? policy : new PermissionExportDataPolicy(requiredPermission);
    }

    /**
     * 策略名，仅用于日志。
     */
    @JsonIgnore
    public String getPolicyName() {
        return name + "ExportDataPolicy";
    }
}

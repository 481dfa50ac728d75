package org.csits.kex.server.security;

/**
 * 导出模块权限常量。
 */
public final class ExportPermissions {

    /**
     * 导出模块基础访问权限。
     */
    public static final String ACCESS = "export:access";

    /**
     * 下载导出文件。
     */
    public static final String DOWNLOAD = "export:download";

    /**
     * 平台级导出权限，同样允许下载。
     */
    public static final String PLATFORM_EXPORT = "platform:export";

    /**
     * 导出任务历史。
     */
    public static final String TASK_HISTORY = "export:task:read";

    private ExportPermissions() {
    }
}

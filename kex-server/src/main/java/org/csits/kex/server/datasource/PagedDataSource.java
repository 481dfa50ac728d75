package org.csits.kex.server.datasource;

import java.util.List;

/**
 * 分页数据源。每次请求或导出任务各自创建，内部维护翻页状态，不可并发调用或跨任务复用。
 */
public interface PagedDataSource {

    int getPageSize();

    /**
     * 已读取的页数。
     */
    int getCurrentPageNumber();

    /**
     * 最近一次 {@link #fetch()} 读到的数据。
     */
    List<Object> getItems();

    /**
     * 读取下一页。
     *
     * @return 读到非空页时返回 true
     * @throws org.csits.kex.server.exception.DataSourceException 查询失败
     */
    boolean fetch();

    /**
     * 符合条件的总条数。
     *
     * @throws org.csits.kex.server.exception.DataSourceException 查询失败
     */
    long getTotalCount();
}

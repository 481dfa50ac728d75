package org.csits.kex.server.datasource;

import org.csits.kex.server.dto.ExportDataQuery;

/**
 * 按查询条件创建数据源，每个导出类型一个工厂。
 */
@FunctionalInterface
public interface PagedDataSourceFactory {

    PagedDataSource create(ExportDataQuery query);
}

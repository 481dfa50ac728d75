package org.csits.kex.server.datasource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.csits.kex.server.config.ExportConfig;
import org.csits.kex.server.dto.ExportDataQuery;
import org.csits.kex.server.exception.DataSourceException;

/**
 * 分页数据源基类：第一页从 query.skip 开始，每页 query.take 条，读取成功后才前进页码，失败可重读同一页。
 */
public abstract class AbstractPagedDataSource implements PagedDataSource {

    protected final ExportDataQuery query;

    private final int pageSize;

    private final int startOffset;

    private int currentPageNumber;

    private List<Object> items = Collections.emptyList();

    private Long totalCount;

    protected AbstractPagedDataSource(ExportDataQuery query) {
        this.query = query != null ? query : new ExportDataQuery();
        this.pageSize = this.query.getTake() != null && this.query.getTake() > 0
            ? this.query.getTake() : ExportConfig.DEFAULT_PAGE_SIZE;
        this.startOffset = this.query.getSkip() != null && this.query.getSkip() > 0 ? this.query.getSkip() : 0;
    }

    @Override
    public int getPageSize() {
        return pageSize;
    }

    @Override
    public int getCurrentPageNumber() {
        return currentPageNumber;
    }

    @Override
    public List<Object> getItems() {
        return items;
    }

    @Override
    public boolean fetch() {
        int skip = startOffset + currentPageNumber * pageSize;
        List<?> page;
        try {
            page = fetchPage(skip, pageSize);
        } catch (DataSourceException e) {
            throw e;
        } catch (Exception e) {
            throw new DataSourceException("读取数据失败: " + e.getMessage(), e);
        }
        items = page != null ? new ArrayList<>(page) : Collections.emptyList();
        currentPageNumber++;
        return !items.isEmpty();
    }

    @Override
    public long getTotalCount() {
        if (totalCount == null) {
            try {
                totalCount = countTotal();
            } catch (DataSourceException e) {
                throw e;
            } catch (Exception e) {
                throw new DataSourceException("统计数据总数失败: " + e.getMessage(), e);
            }
        }
        return totalCount;
    }

    protected abstract List<?> fetchPage(int skip, int take) throws Exception;

    protected abstract long countTotal() throws Exception;
}

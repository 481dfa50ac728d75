package org.csits.kex.server.datasource;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.csits.kex.server.dto.ExportDataQuery;

/**
 * 基于内存集合的数据源。首次读取时取一次快照，之后按快照翻页。
 *
 * @param <T> 记录类型
 */
public class InMemoryPagedDataSource<T> extends AbstractPagedDataSource {

    private final Supplier<? extends List<T>> loader;

    private final Function<T, String> idExtractor;

    private final BiPredicate<T, String> keywordMatcher;

    private List<T> snapshot;

    public InMemoryPagedDataSource(ExportDataQuery query, Supplier<? extends List<T>> loader) {
        this(query, loader, null, null);
    }

    /**
     * @param idExtractor    按 query.objectIds 过滤时取记录 ID，为 null 时忽略 objectIds
     * @param keywordMatcher 按 query.keyword 过滤，为 null 时忽略 keyword
     */
    public InMemoryPagedDataSource(ExportDataQuery query, Supplier<? extends List<T>> loader,
                                   Function<T, String> idExtractor, BiPredicate<T, String> keywordMatcher) {
        super(query);
        this.loader = loader;
        this.idExtractor = idExtractor;
        this.keywordMatcher = keywordMatcher;
    }

    @Override
    protected List<?> fetchPage(int skip, int take) {
        List<T> all = snapshot();
        if (skip >= all.size()) {
            return Collections.emptyList();
        }
        return all.subList(skip, Math.min(all.size(), skip + take));
    }

    @Override
    protected long countTotal() {
        return snapshot().size();
    }

    private List<T> snapshot() {
        if (snapshot == null) {
            List<T> source = loader.get();
            snapshot = source == null ? Collections.emptyList() : filter(source);
        }
        return snapshot;
    }

    private List<T> filter(List<T> source) {
        List<String> objectIds = query.getObjectIds();
        Set<String> ids = idExtractor != null && objectIds != null && !objectIds.isEmpty()
            ? new HashSet<>(objectIds) : null;
        String keyword = keywordMatcher != null && query.getKeyword() != null && !query.getKeyword().trim().isEmpty()
            ? query.getKeyword().trim() : null;
        if (ids == null && keyword == null) {
            return source;
        }
        return source.stream()
            .filter(item -> ids == null || ids.contains(idExtractor.apply(item)))
            .filter(item -> keyword == null || keywordMatcher.test(item, keyword))
            .collect(Collectors.toList());
    }
}

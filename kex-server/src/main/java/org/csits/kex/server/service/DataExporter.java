package org.csits.kex.server.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.kex.manager.plugin.ExportRecordWriter;
import org.csits.kex.server.config.ExportConfig;
import org.csits.kex.server.datasource.PagedDataSource;
import org.csits.kex.server.dto.ExportProgressInfo;
import org.csits.kex.server.worker.core.ExportCancellationToken;
import org.springframework.stereotype.Component;

/**
 * 逐页读取数据源并写入导出插件，页与页之间检查取消并上报进度。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataExporter {

    private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE =
        new TypeReference<LinkedHashMap<String, Object>>() {};

    private final ObjectMapper objectMapper;

    private final RetryService retryService;

    private final ExportConfig exportConfig;

    /**
     * @param includedProperties 只导出的属性，为空时原样写出
     * @param progress           进度回调，在每页写出后调用
     * @return 写出的记录数
     * @throws org.csits.kex.server.exception.ExportCancelledException 收到取消
     */
    public long export(String jobId, PagedDataSource dataSource, ExportRecordWriter writer,
                       List<String> includedProperties, ExportCancellationToken token,
                       Consumer<ExportProgressInfo> progress) throws Exception {
        ExportConfig.RetryConfig retry = exportConfig.getRetry();
        long totalCount = retryService.executeWithRetry(dataSource::getTotalCount, retry,
            "统计导出总数 jobId=" + jobId, token);
        long processed = 0;
        progress.accept(progressInfo(processed, totalCount));

        while (true) {
            token.throwIfCancellationRequested();
            int pageNumber = dataSource.getCurrentPageNumber() + 1;
            boolean hasItems = retryService.executeWithRetry(dataSource::fetch, retry,
                "读取第 " + pageNumber + " 页 jobId=" + jobId, token);
            if (!hasItems) {
                break;
            }
            // 读取期间收到的取消，本页不再写出
            token.throwIfCancellationRequested();
            List<Object> items = dataSource.getItems();
            for (Object item : items) {
                writer.write(project(item, includedProperties));
            }
            writer.flush();
            processed += items.size();
            log.debug("导出进度 jobId={}, page={}, processed={}, total={}", jobId, pageNumber, processed, totalCount);
            progress.accept(progressInfo(processed, Math.max(totalCount, processed)));
            if (items.size() < dataSource.getPageSize()) {
                break;
            }
        }
        token.throwIfCancellationRequested();
        return processed;
    }

    Object project(Object item, List<String> includedProperties) {
        if (includedProperties == null || includedProperties.isEmpty() || item == null) {
            return item;
        }
        Map<String, Object> all = objectMapper.convertValue(item, RECORD_TYPE);
        Map<String, Object> projected = new LinkedHashMap<>();
        for (String property : includedProperties) {
            if (all.containsKey(property)) {
                projected.put(property, all.get(property));
            }
        }
        return projected;
    }

    private static ExportProgressInfo progressInfo(long processed, long total) {
        return new ExportProgressInfo(processed, total, processed + " of " + total + " have been exported");
    }
}

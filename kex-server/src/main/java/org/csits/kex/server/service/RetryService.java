package org.csits.kex.server.service;

import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import org.csits.kex.server.config.ExportConfig;
import org.csits.kex.server.exception.ExportCancelledException;
import org.csits.kex.server.worker.core.ExportCancellationToken;
import org.springframework.stereotype.Service;

/**
 * 重试服务
 * 实现基于配置的自动重试机制，等待期间响应取消
 */
@Slf4j
@Service
public class RetryService {

    private static final long CANCEL_POLL_INTERVAL_MS = 100L;

    /**
     * 执行带重试的操作
     *
     * @param operation 要执行的操作
     * @param retryConfig 重试配置，为空时不重试
     * @param operationName 操作名称（用于日志）
     * @param token 取消信号，可为空
     * @param <T> 返回类型
     * @return 操作结果
     * @throws ExportCancelledException 重试等待期间收到取消
     * @throws Exception 重试等待期间线程被中断，中断标记保留
     * @throws Exception 所有重试失败后抛出最后一次异常
     */
    public <T> T executeWithRetry(Callable<T> operation, ExportConfig.RetryConfig retryConfig,
                                  String operationName, ExportCancellationToken token) throws Exception {
        int maxRetries = retryConfig != null && retryConfig.getMaxRetries() != null
            ? Math.max(0, retryConfig.getMaxRetries()) : 0;
        long retryInterval = retryConfig != null && retryConfig.getRetryIntervalMs() != null
            ? Math.max(0L, retryConfig.getRetryIntervalMs()) : 1000L;

        Exception lastException = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                if (attempt > 0) {
                    log.info("重试 {} (第 {}/{} 次)", operationName, attempt, maxRetries);
                }
                return operation.call();
            } catch (ExportCancelledException e) {
                throw e;
            } catch (Exception e) {
                lastException = e;
                log.warn("{} 失败 (第 {}/{} 次): {}", operationName, attempt + 1, maxRetries + 1, e.getMessage());
                if (attempt < maxRetries) {
                    log.info("等待 {} 毫秒后重试...", retryInterval);
                    sleep(retryInterval, token);
                }
            }
        }

        if (maxRetries > 0) {
            log.error("{} 失败，已达到最大重试次数 {}", operationName, maxRetries);
        }
        throw lastException;
    }

    private void sleep(long millis, ExportCancellationToken token) throws Exception {
        long deadline = System.currentTimeMillis() + millis;
        long remaining = millis;
        while (remaining > 0) {
            if (token != null) {
                token.throwIfCancellationRequested();
            }
            try {
                Thread.sleep(Math.min(remaining, CANCEL_POLL_INTERVAL_MS));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new Exception("重试被中断", ie);
            }
            remaining = deadline - System.currentTimeMillis();
        }
        if (token != null) {
            token.throwIfCancellationRequested();
        }
    }
}

package org.csits.kex.manager.job;

import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

/**
 * 导出任务编号生成：yyyyMMddHHmmss_秒内序号_随机后缀。
 * 随机后缀保证多节点或重启后编号不重复。
 */
@Component
public class JobIdGenerator {

    private final AtomicInteger sequence = new AtomicInteger(0);

    private String currentPrefix = currentTimePrefix();

    public synchronized String nextJobId() {
        String now = currentTimePrefix();
        if (!now.equals(currentPrefix)) {
            currentPrefix = now;
            sequence.set(0);
        }
        int seq = sequence.incrementAndGet();
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return now + "_" + String.format("%03d", seq) + "_" + suffix;
    }

    private String currentTimePrefix() {
        return new SimpleDateFormat("yyyyMMddHHmmss").format(new Date());
    }
}

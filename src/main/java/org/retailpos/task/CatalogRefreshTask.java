package org.retailpos.task;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.cache.CatalogCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 目录缓存定时刷新任务
 * - 周期刷新共享目录缓存，同样受最小刷新间隔限流
 * - pos.catalog.scheduled-refresh-enabled=false 时不启用
 */
@Slf4j
@Component
@EnableScheduling
@ConditionalOnProperty(name = "pos.catalog.scheduled-refresh-enabled", havingValue = "true", matchIfMissing = true)
public class CatalogRefreshTask {

    private final CatalogCache catalogCache;

    public CatalogRefreshTask(CatalogCache catalogCache) {
        this.catalogCache = catalogCache;
    }

    @Scheduled(fixedDelayString = "${pos.catalog.refresh-period-ms:60000}", initialDelay = 5000)
    public void refreshCatalog() {
        try {
            log.debug("[目录刷新任务] 开始执行");
            boolean refreshed = catalogCache.refresh();
            log.debug("[目录刷新任务] 执行完成, refreshed={}, productCount={}",
                    refreshed, catalogCache.snapshot().size());
        } catch (Exception e) {
            log.error("[目录刷新任务异常] errorMsg={}", e.getMessage(), e);
        }
    }
}

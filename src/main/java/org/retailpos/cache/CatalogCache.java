package org.retailpos.cache;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.config.PosProperties;
import org.retailpos.domain.Product;
import org.retailpos.service.ICatalogStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * 商品目录缓存
 * <p>
 * - 所有终端共享同一份快照，整体替换，不做局部合并
 * - 快照按商品ID升序排列（决定重复条码时的取舍顺序）
 * - refresh() 受最小刷新间隔限流；forceRefresh() 不受限流，用于结账后的刷新
 * - 刷新失败时保留旧快照
 * <p>
 * 读取方必须把快照视为可能已过期的副本
 */
@Slf4j
@Component
public class CatalogCache {

    private static final Comparator<Product> BY_ID =
            Comparator.comparing(Product::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ICatalogStore catalogStore;
    private final long minRefreshIntervalMillis;
    private final LongSupplier clock;

    private volatile List<Product> snapshot = List.of();
    private long lastAttemptAt;
    private boolean attempted;
    private volatile boolean loaded;

    @Autowired
    public CatalogCache(ICatalogStore catalogStore, PosProperties properties) {
        this(catalogStore, properties.getCatalog().getMinRefreshInterval().toMillis(), System::currentTimeMillis);
    }

    public CatalogCache(ICatalogStore catalogStore, long minRefreshIntervalMillis, LongSupplier clock) {
        this.catalogStore = catalogStore;
        this.minRefreshIntervalMillis = minRefreshIntervalMillis;
        this.clock = clock;
    }

    /**
     * 当前快照（不可变）
     */
    public List<Product> snapshot() {
        return snapshot;
    }

    /**
     * 限流刷新
     *
     * @return true 表示本次实际拉取并替换了快照
     */
    public boolean refresh() {
        synchronized (this) {
            long now = clock.getAsLong();
            if (attempted && now - lastAttemptAt < minRefreshIntervalMillis) {
                log.debug("[目录刷新跳过] 距上次刷新 {}ms，小于最小间隔 {}ms",
                        now - lastAttemptAt, minRefreshIntervalMillis);
                return false;
            }
            return reload(now);
        }
    }

    /**
     * 强制刷新，不受限流约束
     */
    public boolean forceRefresh() {
        synchronized (this) {
            return reload(clock.getAsLong());
        }
    }

    /**
     * 是否至少成功加载过一次
     */
    public boolean isLoaded() {
        return loaded;
    }

    private boolean reload(long now) {
        // 拉取失败同样计入刷新时间
        lastAttemptAt = now;
        attempted = true;
        try {
            List<Product> products = catalogStore.listProducts();
            snapshot = products.stream().sorted(BY_ID).toList();
            loaded = true;
            log.info("[目录缓存已刷新] productCount={}", snapshot.size());
            return true;
        } catch (RuntimeException e) {
            log.error("[目录缓存刷新失败] 保留旧快照, productCount={}, errorMsg={}",
                    snapshot.size(), e.getMessage(), e);
            return false;
        }
    }
}

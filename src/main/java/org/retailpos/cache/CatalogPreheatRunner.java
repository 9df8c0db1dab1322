package org.retailpos.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时预热目录缓存
 * 预热失败不阻止启动，首次扫码时会再次尝试加载
 */
@Slf4j
@Component
public class CatalogPreheatRunner implements CommandLineRunner {

    private final CatalogCache catalogCache;

    public CatalogPreheatRunner(CatalogCache catalogCache) {
        this.catalogCache = catalogCache;
    }

    @Override
    public void run(String... args) {
        log.info("[目录缓存预热] 开始");
        boolean loaded = catalogCache.forceRefresh();
        log.info("[目录缓存预热] 结束, success={}, productCount={}", loaded, catalogCache.snapshot().size());
    }
}

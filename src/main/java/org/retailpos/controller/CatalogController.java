package org.retailpos.controller;

import org.retailpos.cache.CatalogCache;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 目录缓存
 */
@RestController
@RequestMapping("/api/catalog")
public class CatalogController {

    private final CatalogCache catalogCache;

    public CatalogController(CatalogCache catalogCache) {
        this.catalogCache = catalogCache;
    }

    /**
     * 当前缓存快照（可能已过期）
     */
    @GetMapping("/products")
    public ResponseEntity<Map<String, Object>> products() {
        return ApiResponses.execute("catalogProducts", catalogCache::snapshot);
    }

    /**
     * 按需刷新，受最小刷新间隔限流
     */
    @PostMapping("/refresh")
    public ResponseEntity<Map<String, Object>> refresh() {
        return ApiResponses.execute("catalogRefresh", () -> {
            Map<String, Object> data = new HashMap<>();
            data.put("refreshed", catalogCache.refresh());
            data.put("productCount", catalogCache.snapshot().size());
            return data;
        });
    }
}

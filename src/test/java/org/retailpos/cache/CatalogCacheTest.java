package org.retailpos.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.retailpos.domain.Product;
import org.retailpos.support.FakeCatalog;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogCacheTest {

    private FakeCatalog catalog;
    private AtomicLong clock;
    private CatalogCache cache;

    @BeforeEach
    void setUp() {
        catalog = new FakeCatalog()
                .with("P-003", "Last Battery", "50.00", 1, "0000000000017")
                .with("P-001", "Instant Noodles", "15.00", 50, "8991234567890")
                .with("P-002", "Bottled Water", "100.00", 20, "4800016644290");
        clock = new AtomicLong(10_000);
        cache = new CatalogCache(catalog.store(), 2000, clock::get);
    }

    @Test
    void snapshotIsSortedById() {
        cache.refresh();

        assertThat(cache.snapshot()).extracting(Product::getId).containsExactly("P-001", "P-002", "P-003");
    }

    @Test
    void refreshWithoutWritesLeavesContentUnchanged() {
        cache.forceRefresh();
        List<Product> first = cache.snapshot();
        cache.forceRefresh();

        assertThat(cache.snapshot()).isEqualTo(first);
    }

    @Test
    void refreshIsRateLimited() {
        assertThat(cache.refresh()).isTrue();
        clock.addAndGet(1999);
        assertThat(cache.refresh()).isFalse();
        clock.addAndGet(1);
        assertThat(cache.refresh()).isTrue();

        assertThat(catalog.listCalls()).isEqualTo(2);
    }

    @Test
    void forcedRefreshIgnoresRateLimit() {
        cache.refresh();
        catalog.setQuantity("P-001", 49);
        assertThat(cache.forceRefresh()).isTrue();

        assertThat(cache.snapshot().get(0).getQuantity()).isEqualTo(49);
    }

    @Test
    void failedRefreshKeepsPreviousSnapshot() {
        cache.refresh();
        catalog.setListFailing(true);
        clock.addAndGet(5000);

        assertThat(cache.refresh()).isFalse();
        assertThat(cache.snapshot()).hasSize(3);
        assertThat(cache.isLoaded()).isTrue();
    }

    @Test
    void neverLoadedCacheReportsNotLoaded() {
        catalog.setListFailing(true);

        assertThat(cache.refresh()).isFalse();
        assertThat(cache.isLoaded()).isFalse();
        assertThat(cache.snapshot()).isEmpty();
    }
}

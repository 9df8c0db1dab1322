package org.retailpos.support;

import org.retailpos.domain.Product;
import org.retailpos.exception.ProductNotFoundException;
import org.retailpos.service.ICatalogStore;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * 内存商品库：ICatalogStore 的 Mockito 替身，读写落在一个 Map 上
 */
public final class FakeCatalog {

    private final Map<String, Product> products = new ConcurrentHashMap<>();
    private final Set<String> failingUpdates = ConcurrentHashMap.newKeySet();
    private final AtomicInteger listCalls = new AtomicInteger();
    private final ICatalogStore store = mock(ICatalogStore.class);
    private volatile boolean listFailing;

    public FakeCatalog() {
        when(store.listProducts()).thenAnswer(invocation -> {
            listCalls.incrementAndGet();
            if (listFailing) {
                throw new DataAccessResourceFailureException("catalog store unreachable");
            }
            List<Product> copies = new ArrayList<>();
            for (Product product : products.values()) {
                copies.add(product.toBuilder().build());
            }
            return copies;
        });
        when(store.getProduct(anyString())).thenAnswer(invocation -> {
            String id = invocation.getArgument(0);
            Product product = products.get(id);
            if (product == null) {
                throw new ProductNotFoundException(id);
            }
            return product.toBuilder().build();
        });
        when(store.updateProduct(anyString(), any(Product.class))).thenAnswer(invocation -> {
            String id = invocation.getArgument(0);
            Product patch = invocation.getArgument(1);
            if (failingUpdates.contains(id)) {
                throw new DataAccessResourceFailureException("update failed for " + id);
            }
            Product current = products.get(id);
            if (current == null) {
                throw new ProductNotFoundException(id);
            }
            Product updated = current.toBuilder()
                    .quantity(patch.getQuantity() != null ? patch.getQuantity() : current.getQuantity())
                    .build();
            products.put(id, updated);
            return updated.toBuilder().build();
        });
    }

    public FakeCatalog with(String id, String name, String price, int quantity, String barcode) {
        products.put(id, Product.builder()
                .id(id)
                .name(name)
                .category("General")
                .price(new BigDecimal(price))
                .quantity(quantity)
                .barcode(barcode)
                .build());
        return this;
    }

    public ICatalogStore store() {
        return store;
    }

    public int quantityOf(String id) {
        return products.get(id).getQuantity();
    }

    public void setQuantity(String id, int quantity) {
        products.put(id, products.get(id).toBuilder().quantity(quantity).build());
    }

    public void failUpdatesFor(String id) {
        failingUpdates.add(id);
    }

    public void setListFailing(boolean listFailing) {
        this.listFailing = listFailing;
    }

    public int listCalls() {
        return listCalls.get();
    }
}

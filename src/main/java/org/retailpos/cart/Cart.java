package org.retailpos.cart;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.domain.Product;
import org.retailpos.exception.InsufficientStockException;
import org.retailpos.service.ICatalogStore;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 购物车
 * <p>
 * - 每次增加数量前重新读取权威库存（目录缓存可能已过期）
 * - 读取权威库存只能缩小、不能消除与其他终端之间的竞争窗口
 * - 结账期间冻结，任何变更都会被拒绝
 * <p>
 * 归属单个终端，非线程安全
 */
@Slf4j
public class Cart {

    private final ICatalogStore catalogStore;
    private final BigDecimal taxRate;
    private final Map<String, CartLine> lines = new LinkedHashMap<>();
    private boolean frozen;

    public Cart(ICatalogStore catalogStore, BigDecimal taxRate) {
        this.catalogStore = catalogStore;
        this.taxRate = taxRate;
    }

    /**
     * 加入购物车（数量 +1）
     *
     * @param productId 商品ID
     * @return 变更后的行
     * @throws InsufficientStockException 权威库存 <= 购物车中已有数量
     */
    public CartLine addToCart(String productId) {
        ensureMutable();

        // ==================== 1. 重新读取权威库存 ====================
        Product authoritative = catalogStore.getProduct(productId);
        int inCart = quantityOf(productId);

        // ==================== 2. 校验 ====================
        if (authoritative.availableQuantity() <= inCart) {
            log.warn("[加购被拒] 库存不足, productId={}, available={}, inCart={}",
                    productId, authoritative.availableQuantity(), inCart);
            throw new InsufficientStockException(productId, authoritative.availableQuantity(), inCart + 1);
        }

        // ==================== 3. 新增或累加 ====================
        CartLine existing = lines.get(productId);
        CartLine line = existing == null ? CartLine.of(authoritative, 1) : existing.withQuantity(inCart + 1);
        lines.put(productId, line);
        log.info("[加购成功] productId={}, quantity={}", productId, line.getQuantity());
        return line;
    }

    /**
     * 修改数量；小于 1 时删除该行，购物车中没有该商品时不做任何事
     *
     * @throws InsufficientStockException 新数量超过权威库存
     */
    public void updateQuantity(String productId, int newQuantity) {
        ensureMutable();
        if (newQuantity < 1) {
            removeLine(productId);
            return;
        }
        CartLine existing = lines.get(productId);
        if (existing == null) {
            return;
        }
        Product authoritative = catalogStore.getProduct(productId);
        if (newQuantity > authoritative.availableQuantity()) {
            log.warn("[改数量被拒] 库存不足, productId={}, available={}, requested={}",
                    productId, authoritative.availableQuantity(), newQuantity);
            throw new InsufficientStockException(productId, authoritative.availableQuantity(), newQuantity);
        }
        lines.put(productId, existing.withQuantity(newQuantity));
    }

    public void removeLine(String productId) {
        ensureMutable();
        lines.remove(productId);
    }

    public void clear() {
        ensureMutable();
        lines.clear();
    }

    public int quantityOf(String productId) {
        CartLine line = lines.get(productId);
        return line == null ? 0 : line.getQuantity();
    }

    /**
     * 按加入顺序返回各行的副本
     */
    public List<CartLine> lines() {
        return new ArrayList<>(lines.values());
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public CartTotals totals() {
        return CartTotals.of(lines.values(), taxRate);
    }

    public void freeze() {
        frozen = true;
    }

    public void unfreeze() {
        frozen = false;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("Cart is locked while checkout is in progress");
        }
    }
}

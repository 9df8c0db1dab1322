package org.retailpos.routing;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.domain.Product;

import java.util.Optional;

/**
 * 跨页面一次性转交信箱（单槽位）
 * <p>
 * - offer 覆盖槽位中尚未消费的商品
 * - consume 取出后立即清空槽位，页面重新进入不会再次触发
 * - 同一商品ID在宽限窗口内只会被消费一次，用于吸收重复投递
 */
@Slf4j
public class HandoffMailbox {

    private final long graceMillis;

    private Product pending;
    private String lastConsumedId;
    private long lastConsumedAt;

    public HandoffMailbox(long graceMillis) {
        this.graceMillis = graceMillis;
    }

    public void offer(Product product) {
        this.pending = product;
    }

    public boolean hasPending() {
        return pending != null;
    }

    public Optional<Product> consume(long now) {
        if (pending == null) {
            return Optional.empty();
        }
        Product product = pending;
        pending = null;

        if (product.getId().equals(lastConsumedId) && now - lastConsumedAt < graceMillis) {
            log.debug("[转交忽略] 宽限窗口内重复投递, productId={}", product.getId());
            return Optional.empty();
        }
        lastConsumedId = product.getId();
        lastConsumedAt = now;
        return Optional.of(product);
    }
}

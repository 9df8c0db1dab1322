package org.retailpos.exception;

/**
 * 购物车变更被拒绝：超过最近一次读取到的权威库存
 */
public class InsufficientStockException extends PosException {

    private final String productId;
    private final int available;
    private final int requested;

    public InsufficientStockException(String productId, int available, int requested) {
        super("INSUFFICIENT_STOCK", "Insufficient stock. Only " + available + " available.");
        this.productId = productId;
        this.available = available;
        this.requested = requested;
    }

    public String getProductId() {
        return productId;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequested() {
        return requested;
    }
}

package org.retailpos.exception;

public class OutOfStockException extends PosException {

    private final String productId;

    public OutOfStockException(String productId, String productName) {
        super("OUT_OF_STOCK", productName + " is out of stock");
        this.productId = productId;
    }

    public String getProductId() {
        return productId;
    }
}

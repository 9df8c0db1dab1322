package org.retailpos.exception;

public class ProductNotFoundException extends PosException {

    public ProductNotFoundException(String productId) {
        super("PRODUCT_NOT_FOUND", "Product not found: " + productId);
    }
}

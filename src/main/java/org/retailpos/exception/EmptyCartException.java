package org.retailpos.exception;

public class EmptyCartException extends PosException {

    public EmptyCartException() {
        super("EMPTY_CART", "Cart is empty");
    }
}

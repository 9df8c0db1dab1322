package org.retailpos.exception;

public class AccessDeniedException extends PosException {

    public AccessDeniedException(String message) {
        super("INSUFFICIENT_PERMISSIONS", message);
    }
}

package org.retailpos.exception;

public class TransactionNotFoundException extends PosException {

    public TransactionNotFoundException(String transactionId) {
        super("TRANSACTION_NOT_FOUND", "Transaction not found: " + transactionId);
    }
}

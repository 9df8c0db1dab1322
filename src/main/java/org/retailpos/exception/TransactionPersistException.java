package org.retailpos.exception;

/**
 * 交易落库失败
 * <p>
 * 对本次结账是致命的，但完全可恢复：购物车原样保留，库存未动
 */
public class TransactionPersistException extends PosException {

    public enum Kind {
        /**
         * 无法连接交易存储
         */
        STORE_UNREACHABLE("Cannot connect to the transaction store. Please check the server connection."),
        /**
         * 数据库错误
         */
        DATABASE_ERROR("Database error. Failed to save transaction."),
        UNKNOWN("Transaction failed: unknown error");

        private final String message;

        Kind(String message) {
            this.message = message;
        }
    }

    private final Kind kind;
    private final String transactionId;

    public TransactionPersistException(Kind kind, String transactionId, Throwable cause) {
        super("TRANSACTION_PERSIST_FAILURE", kind.message, cause);
        this.kind = kind;
        this.transactionId = transactionId;
    }

    public Kind getKind() {
        return kind;
    }

    public String getTransactionId() {
        return transactionId;
    }
}

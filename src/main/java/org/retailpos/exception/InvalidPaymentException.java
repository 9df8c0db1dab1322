package org.retailpos.exception;

/**
 * 支付校验失败，购物车保持不变
 */
public class InvalidPaymentException extends PosException {

    public enum Reason {
        /**
         * 现金不足
         */
        INSUFFICIENT_AMOUNT("Insufficient payment amount"),
        /**
         * 现金金额无法解析或为负数
         */
        UNPARSEABLE_AMOUNT("Received amount must be a non-negative number"),
        /**
         * card / gcash 缺少流水号
         */
        MISSING_REFERENCE("Please enter the reference number"),
        /**
         * 不支持的支付方式
         */
        UNSUPPORTED_METHOD("Unsupported payment method");

        private final String message;

        Reason(String message) {
            this.message = message;
        }
    }

    private final Reason reason;

    public InvalidPaymentException(Reason reason) {
        super("INVALID_PAYMENT", reason.message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}

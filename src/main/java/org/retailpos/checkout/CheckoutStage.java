package org.retailpos.checkout;

/**
 * 结账状态机
 * <pre>
 * COLLECTING -> VALIDATING -> PERSISTING_TX -> APPLYING_INVENTORY -> SETTLED
 * VALIDATING 失败、PERSISTING_TX 失败都回到 COLLECTING（购物车保持不变）
 * </pre>
 */
public enum CheckoutStage {
    COLLECTING,
    VALIDATING,
    PERSISTING_TX,
    APPLYING_INVENTORY,
    SETTLED
}

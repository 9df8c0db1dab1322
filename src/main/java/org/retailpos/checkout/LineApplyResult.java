package org.retailpos.checkout;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 单行库存扣减结果
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LineApplyResult {
    String productId;
    String productName;
    int requestedQuantity;
    boolean applied;
    Integer stockBefore;
    Integer stockAfter;
    String errorMessage;

    public static LineApplyResult applied(String productId, String productName, int requested,
                                          int stockBefore, int stockAfter) {
        return new LineApplyResult(productId, productName, requested, true, stockBefore, stockAfter, null);
    }

    /**
     * 幂等凭证已存在：该行此前已经扣减过
     */
    public static LineApplyResult alreadyApplied(String productId, String productName, int requested) {
        return new LineApplyResult(productId, productName, requested, true, null, null, "already applied");
    }

    public static LineApplyResult failed(String productId, String productName, int requested,
                                         String errorMessage) {
        return new LineApplyResult(productId, productName, requested, false, null, null, errorMessage);
    }
}

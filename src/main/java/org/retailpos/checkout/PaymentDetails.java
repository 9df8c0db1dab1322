package org.retailpos.checkout;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 收银员录入的支付信息（原始输入，未经校验）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentDetails {
    /**
     * cash / card / gcash
     */
    private String paymentMethod;
    /**
     * 实收金额（现金时必填，文本形式）
     */
    private String receivedAmount;
    /**
     * 支付流水号（card / gcash 必填）
     */
    private String referenceNumber;
}

package org.retailpos.checkout;

import lombok.Value;
import org.retailpos.domain.PaymentMethod;

import java.math.BigDecimal;

/**
 * 校验通过的支付结果
 */
@Value
public class PaymentOutcome {
    PaymentMethod method;
    BigDecimal receivedAmount;
    BigDecimal change;
    String referenceNumber;
}

package org.retailpos.checkout;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.domain.PaymentMethod;
import org.retailpos.exception.InvalidPaymentException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 支付校验
 * - cash: 实收金额必须是非负数、最多两位小数且不小于应付金额，找零 = 实收 - 应付
 * - card / gcash: 流水号必填，实收金额强制等于应付金额，找零为 0
 */
@Slf4j
@Component
public class PaymentValidator {

    public PaymentOutcome validate(PaymentDetails details, BigDecimal total) {
        PaymentMethod method = PaymentMethod.fromCode(details == null ? null : details.getPaymentMethod());
        if (method == null) {
            throw new InvalidPaymentException(InvalidPaymentException.Reason.UNSUPPORTED_METHOD);
        }

        if (method.isReferenceRequired()) {
            String reference = details.getReferenceNumber() == null ? "" : details.getReferenceNumber().trim();
            if (reference.isEmpty()) {
                log.warn("[支付校验失败] 缺少流水号, paymentMethod={}", method.getCode());
                throw new InvalidPaymentException(InvalidPaymentException.Reason.MISSING_REFERENCE);
            }
            return new PaymentOutcome(method, total, BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP), reference);
        }

        BigDecimal received = parseAmount(details.getReceivedAmount());
        if (received.compareTo(total) < 0) {
            log.warn("[支付校验失败] 现金不足, received={}, total={}", received, total);
            throw new InvalidPaymentException(InvalidPaymentException.Reason.INSUFFICIENT_AMOUNT);
        }
        return new PaymentOutcome(method, received, received.subtract(total), null);
    }

    private BigDecimal parseAmount(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidPaymentException(InvalidPaymentException.Reason.INSUFFICIENT_AMOUNT);
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("[支付校验失败] 金额无法解析, receivedAmount={}", raw);
            throw new InvalidPaymentException(InvalidPaymentException.Reason.UNPARSEABLE_AMOUNT);
        }
        if (amount.signum() < 0) {
            throw new InvalidPaymentException(InvalidPaymentException.Reason.UNPARSEABLE_AMOUNT);
        }
        // 金额最多两位小数，不做舍入，按实收原值比较和记录
        if (amount.stripTrailingZeros().scale() > 2) {
            log.warn("[支付校验失败] 金额超过两位小数, receivedAmount={}", raw);
            throw new InvalidPaymentException(InvalidPaymentException.Reason.UNPARSEABLE_AMOUNT);
        }
        return amount.setScale(2, RoundingMode.UNNECESSARY);
    }
}

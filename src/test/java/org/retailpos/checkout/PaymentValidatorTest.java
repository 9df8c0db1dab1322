package org.retailpos.checkout;

import org.junit.jupiter.api.Test;
import org.retailpos.domain.PaymentMethod;
import org.retailpos.exception.InvalidPaymentException;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaymentValidatorTest {

    private final PaymentValidator validator = new PaymentValidator();
    private final BigDecimal total = new BigDecimal("224.00");

    private static PaymentDetails payment(String method, String received, String reference) {
        return PaymentDetails.builder()
                .paymentMethod(method)
                .receivedAmount(received)
                .referenceNumber(reference)
                .build();
    }

    @Test
    void cashComputesChange() {
        PaymentOutcome outcome = validator.validate(payment("cash", "300", null), total);

        assertThat(outcome.getMethod()).isEqualTo(PaymentMethod.CASH);
        assertThat(outcome.getReceivedAmount()).isEqualByComparingTo("300.00");
        assertThat(outcome.getChange()).isEqualByComparingTo("76.00");
    }

    @Test
    void exactCashIsAccepted() {
        assertThat(validator.validate(payment("cash", "224", null), total).getChange()).isEqualByComparingTo("0");
    }

    @Test
    void cashBelowTotalIsRejected() {
        assertThatThrownBy(() -> validator.validate(payment("cash", "223.99", null), total))
                .isInstanceOfSatisfying(InvalidPaymentException.class, e ->
                        assertThat(e.getReason()).isEqualTo(InvalidPaymentException.Reason.INSUFFICIENT_AMOUNT));
        assertThatThrownBy(() -> validator.validate(payment("cash", "", null), total))
                .isInstanceOf(InvalidPaymentException.class);
    }

    @Test
    void unparseableOrNegativeCashIsRejected() {
        assertThatThrownBy(() -> validator.validate(payment("cash", "abc", null), total))
                .isInstanceOfSatisfying(InvalidPaymentException.class, e ->
                        assertThat(e.getReason()).isEqualTo(InvalidPaymentException.Reason.UNPARSEABLE_AMOUNT));
        assertThatThrownBy(() -> validator.validate(payment("cash", "-500", null), total))
                .isInstanceOfSatisfying(InvalidPaymentException.class, e ->
                        assertThat(e.getReason()).isEqualTo(InvalidPaymentException.Reason.UNPARSEABLE_AMOUNT));
    }

    @Test
    void cashWithMoreThanTwoDecimalsIsRejectedNotRounded() {
        assertThatThrownBy(() -> validator.validate(payment("cash", "223.995", null), total))
                .isInstanceOfSatisfying(InvalidPaymentException.class, e ->
                        assertThat(e.getReason()).isEqualTo(InvalidPaymentException.Reason.UNPARSEABLE_AMOUNT));
        assertThatThrownBy(() -> validator.validate(payment("cash", "300.001", null), total))
                .isInstanceOf(InvalidPaymentException.class);

        // 末尾的 0 不算多余小数
        PaymentOutcome outcome = validator.validate(payment("cash", "224.0000", null), total);
        assertThat(outcome.getReceivedAmount()).isEqualTo(new BigDecimal("224.00"));
        assertThat(outcome.getChange()).isEqualByComparingTo("0");
    }

    @Test
    void cardRequiresReferenceAndForcesReceivedToTotal() {
        assertThatThrownBy(() -> validator.validate(payment("card", null, "  "), total))
                .isInstanceOfSatisfying(InvalidPaymentException.class, e ->
                        assertThat(e.getReason()).isEqualTo(InvalidPaymentException.Reason.MISSING_REFERENCE));

        PaymentOutcome outcome = validator.validate(payment("gcash", "1", "GC-778899"), total);
        assertThat(outcome.getReceivedAmount()).isEqualByComparingTo(total);
        assertThat(outcome.getChange()).isEqualByComparingTo("0");
        assertThat(outcome.getReferenceNumber()).isEqualTo("GC-778899");
    }

    @Test
    void unknownMethodIsRejected() {
        assertThatThrownBy(() -> validator.validate(payment("bitcoin", "1000", null), total))
                .isInstanceOfSatisfying(InvalidPaymentException.class, e ->
                        assertThat(e.getReason()).isEqualTo(InvalidPaymentException.Reason.UNSUPPORTED_METHOD));
    }
}

package org.retailpos.cart;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * 购物车金额（派生值，不落地）
 * <p>
 * tax 四舍五入到分，total = subtotal + tax 精确成立
 */
@Value
public class CartTotals {
    BigDecimal subtotal;
    BigDecimal tax;
    BigDecimal total;

    public static CartTotals of(Collection<CartLine> lines, BigDecimal taxRate) {
        BigDecimal subtotal = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        for (CartLine line : lines) {
            subtotal = subtotal.add(line.subtotal());
        }
        BigDecimal tax = subtotal.multiply(taxRate).setScale(2, RoundingMode.HALF_UP);
        return new CartTotals(subtotal, tax, subtotal.add(tax));
    }
}

package org.retailpos.cart;

import lombok.Builder;
import lombok.Value;
import org.retailpos.domain.Product;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 购物车行
 * <p>
 * 名称、分类、单价取自首次加入时读取到的权威商品记录
 */
@Value
@Builder(toBuilder = true)
public class CartLine {
    String productId;
    String name;
    String category;
    BigDecimal price;
    int quantity;

    public static CartLine of(Product product, int quantity) {
        return CartLine.builder()
                .productId(product.getId())
                .name(product.getName())
                .category(product.getCategory())
                .price(product.getPrice() == null ? BigDecimal.ZERO : product.getPrice())
                .quantity(quantity)
                .build();
    }

    public CartLine withQuantity(int newQuantity) {
        return toBuilder().quantity(newQuantity).build();
    }

    /**
     * 行小计 = 单价 × 数量
     */
    public BigDecimal subtotal() {
        return price.multiply(BigDecimal.valueOf(quantity)).setScale(2, RoundingMode.HALF_UP);
    }
}

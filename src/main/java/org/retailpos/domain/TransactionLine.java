package org.retailpos.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * 交易行快照（下单时刻的商品名称、分类、单价）
 */
@Value
@Builder
@Jacksonized
public class TransactionLine {
    String productId;
    String name;
    String category;
    /**
     * 单价
     */
    BigDecimal price;
    Integer quantity;
    /**
     * 行小计 = price * quantity
     */
    BigDecimal subtotal;
}

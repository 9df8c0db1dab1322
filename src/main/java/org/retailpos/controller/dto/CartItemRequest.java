package org.retailpos.controller.dto;

import lombok.Data;

@Data
public class CartItemRequest {
    private String productId;
    /**
     * 仅修改数量时使用
     */
    private Integer quantity;
}

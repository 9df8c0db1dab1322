package org.retailpos.routing;

public enum ActionType {
    /**
     * 收银页：直接加入购物车
     */
    ADD_TO_CART,
    /**
     * 其他页面：带着商品一次性跳转到收银页
     */
    HANDOFF_TO_SALE,
    /**
     * 目录管理页：条码未登记，打开新建商品表单并预填条码
     */
    OPEN_PRODUCT_FORM,
    /**
     * 新建商品表单：填入条码字段
     */
    PREFILL_BARCODE,
    DUPLICATE_BARCODE,
    UNKNOWN_BARCODE,
    OUT_OF_STOCK
}

package org.retailpos.controller.dto;

import lombok.Data;

@Data
public class ScreenRequest {
    /**
     * 页面标识，如 SALE、CATALOG、PRODUCT_FORM
     */
    private String screen;
}

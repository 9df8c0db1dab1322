package org.retailpos.controller.dto;

import lombok.Data;

/**
 * 手动输入的条码
 */
@Data
public class ScanRequest {
    private String barcode;
}

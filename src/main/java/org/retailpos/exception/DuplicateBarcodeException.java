package org.retailpos.exception;

/**
 * 目录管理页扫描到已登记的条码
 */
public class DuplicateBarcodeException extends PosException {

    private final String barcode;
    private final String existingProductId;

    public DuplicateBarcodeException(String barcode, String existingProductId, String existingProductName) {
        super("DUPLICATE_BARCODE",
                "Product \"" + existingProductName + "\" already exists with this barcode");
        this.barcode = barcode;
        this.existingProductId = existingProductId;
    }

    public String getBarcode() {
        return barcode;
    }

    public String getExistingProductId() {
        return existingProductId;
    }
}

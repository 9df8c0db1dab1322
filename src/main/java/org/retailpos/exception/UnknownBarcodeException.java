package org.retailpos.exception;

public class UnknownBarcodeException extends PosException {

    private final String barcode;

    public UnknownBarcodeException(String barcode) {
        super("UNKNOWN_BARCODE", "Product with barcode \"" + barcode + "\" not found");
        this.barcode = barcode;
    }

    public String getBarcode() {
        return barcode;
    }
}

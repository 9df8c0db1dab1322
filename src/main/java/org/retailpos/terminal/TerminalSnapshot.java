package org.retailpos.terminal;

import lombok.Builder;
import lombok.Value;
import org.retailpos.cart.CartLine;
import org.retailpos.cart.CartTotals;
import org.retailpos.checkout.CheckoutStage;
import org.retailpos.scanner.ScreenId;

import java.util.List;

/**
 * 终端状态快照（只读）
 */
@Value
@Builder
public class TerminalSnapshot {
    String terminalId;
    ScreenId screen;
    CheckoutStage stage;
    List<CartLine> cartLines;
    CartTotals totals;
    /**
     * 新建商品表单中预填的条码
     */
    String productDraftBarcode;
    int suspensionDepth;
    String lastTransactionId;
}

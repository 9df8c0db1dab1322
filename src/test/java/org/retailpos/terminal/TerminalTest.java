package org.retailpos.terminal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.retailpos.business.SaleCheckoutService;
import org.retailpos.cache.CatalogCache;
import org.retailpos.checkout.CheckoutStage;
import org.retailpos.checkout.InventoryApplier;
import org.retailpos.checkout.PaymentDetails;
import org.retailpos.checkout.PaymentValidator;
import org.retailpos.config.PosProperties;
import org.retailpos.domain.SaleTransaction;
import org.retailpos.exception.InventoryApplyException;
import org.retailpos.mq.ReconciliationEventPublisher;
import org.retailpos.routing.BarcodeResolver;
import org.retailpos.routing.BarcodeRouter;
import org.retailpos.routing.CatalogScreenRoute;
import org.retailpos.routing.DedupPolicy;
import org.retailpos.routing.HandoffRoute;
import org.retailpos.routing.ProductFormRoute;
import org.retailpos.routing.SaleScreenRoute;
import org.retailpos.scanner.KeyStroke;
import org.retailpos.scanner.ManualScanScheduler;
import org.retailpos.scanner.ScreenId;
import org.retailpos.service.IInventoryApplyLogService;
import org.retailpos.service.ITransactionStore;
import org.retailpos.support.FakeCatalog;
import org.retailpos.util.IdempotentUtil;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * 终端端到端测试：按键 -> 解码 -> 路由 -> 购物车 -> 结账
 */
class TerminalTest {

    private static final String NOODLES = "8991234567890";

    private FakeCatalog catalog;
    private ManualScanScheduler scheduler;
    private Terminal terminal;

    @BeforeEach
    void setUp() {
        catalog = new FakeCatalog()
                .with("P-001", "Instant Noodles", "15.00", 50, NOODLES)
                .with("P-003", "Last Battery", "50.00", 1, "0000000000017")
                .with("P-004", "Discontinued Soap", "25.00", 0, "4801234000004");
        PosProperties properties = new PosProperties();
        CatalogCache cache = new CatalogCache(catalog.store(), 2000, () -> 0L);
        cache.forceRefresh();

        BarcodeRouter router = new BarcodeRouter(cache, new BarcodeResolver(), new DedupPolicy(properties),
                List.of(new SaleScreenRoute(), new CatalogScreenRoute(), new ProductFormRoute(), new HandoffRoute()));

        ITransactionStore transactionStore = mock(ITransactionStore.class);
        when(transactionStore.createTransaction(any(SaleTransaction.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        InventoryApplier applier = new InventoryApplier(catalog.store(), new IdempotentUtil(null, 60), Runnable::run, 1000);
        SaleCheckoutService checkoutService = new SaleCheckoutService(transactionStore,
                mock(IInventoryApplyLogService.class), applier, new PaymentValidator(), cache,
                mock(ReconciliationEventPublisher.class));

        scheduler = new ManualScanScheduler();
        terminal = new Terminal("T1", scheduler, router, catalog.store(), checkoutService, properties);
    }

    private void scanWithScanner(String barcode) {
        for (char c : barcode.toCharArray()) {
            terminal.onKey(KeyStroke.of(String.valueOf(c)));
        }
        terminal.onKey(KeyStroke.enter());
    }

    @Test
    void doubleFiredScanAddsOneUnit() {
        scanWithScanner(NOODLES);
        scheduler.advance(40);
        scanWithScanner(NOODLES);

        assertThat(terminal.snapshot().getCartLines()).hasSize(1);
        assertThat(terminal.snapshot().getCartLines().get(0).getQuantity()).isEqualTo(1);
    }

    @Test
    void scannerBurstWithoutEnterCommitsAfterInactivity() {
        for (char c : NOODLES.toCharArray()) {
            terminal.onKey(KeyStroke.of(String.valueOf(c)));
        }
        assertThat(terminal.snapshot().getCartLines()).isEmpty();

        scheduler.advance(150);
        assertThat(terminal.snapshot().getCartLines()).hasSize(1);
    }

    @Test
    void unknownAndOutOfStockBecomeNotifications() {
        terminal.manualScan("00000000");
        terminal.manualScan("4801234000004");

        List<Notification> notifications = terminal.drainNotifications();
        assertThat(notifications).extracting(Notification::getCode)
                .containsExactly("UNKNOWN_BARCODE", "OUT_OF_STOCK");
        assertThat(terminal.drainNotifications()).isEmpty();
    }

    @Test
    void lastUnitCannotBeAddedTwice() {
        terminal.manualScan("0000000000017");
        scheduler.advance(600);
        terminal.manualScan("0000000000017");

        assertThat(terminal.snapshot().getCartLines().get(0).getQuantity()).isEqualTo(1);
        assertThat(terminal.drainNotifications()).extracting(Notification::getCode).contains("INSUFFICIENT_STOCK");
    }

    @Test
    void scanOnOtherScreenHandsOffToSale() {
        terminal.navigate(ScreenId.DASHBOARD);
        terminal.manualScan(NOODLES);

        assertThat(terminal.getScreen()).isEqualTo(ScreenId.SALE);
        assertThat(terminal.snapshot().getCartLines()).hasSize(1);

        // 重新进入收银页不会再次加购
        terminal.navigate(ScreenId.REPORTS);
        terminal.navigate(ScreenId.SALE);
        assertThat(terminal.snapshot().getCartLines().get(0).getQuantity()).isEqualTo(1);
    }

    @Test
    void catalogScreenOpensProductFormForNewBarcode() {
        terminal.navigate(ScreenId.CATALOG);
        terminal.manualScan("7770001112223");

        assertThat(terminal.getScreen()).isEqualTo(ScreenId.PRODUCT_FORM);
        assertThat(terminal.getProductDraftBarcode()).isEqualTo("7770001112223");

        terminal.navigate(ScreenId.CATALOG);
        terminal.manualScan(NOODLES);
        assertThat(terminal.getScreen()).isEqualTo(ScreenId.CATALOG);
        assertThat(terminal.drainNotifications()).extracting(Notification::getCode).contains("DUPLICATE_BARCODE");
    }

    @Test
    void productFormUsesItsOwnDecoder() {
        terminal.navigate(ScreenId.PRODUCT_FORM);
        for (char c : "123456".toCharArray()) {
            terminal.onKey(KeyStroke.of(String.valueOf(c)));
        }
        scheduler.advance(100);
        assertThat(terminal.getProductDraftBarcode()).isNull();

        for (char c : "1234567".toCharArray()) {
            terminal.onKey(KeyStroke.of(String.valueOf(c)));
        }
        scheduler.advance(100);
        assertThat(terminal.getProductDraftBarcode()).isEqualTo("1234567");
    }

    @Test
    void scanIntoProductFormBarcodeFieldFillsDraft() {
        terminal.navigate(ScreenId.PRODUCT_FORM);
        for (char c : "7770001112223".toCharArray()) {
            terminal.onKey(new KeyStroke(String.valueOf(c), true, true));
        }
        terminal.onKey(new KeyStroke(KeyStroke.ENTER, true, true));
        assertThat(terminal.getProductDraftBarcode()).isEqualTo("7770001112223");

        // 表单其他输入框的按键不进入解码器
        for (char c : "9990001112223".toCharArray()) {
            terminal.onKey(new KeyStroke(String.valueOf(c), true, false));
        }
        terminal.onKey(new KeyStroke(KeyStroke.ENTER, true, false));
        assertThat(terminal.getProductDraftBarcode()).isEqualTo("7770001112223");
    }

    @Test
    void suspendedTerminalIgnoresScannerUntilResumed() {
        terminal.suspend();
        terminal.suspend();
        scanWithScanner(NOODLES);
        terminal.resume();
        scanWithScanner(NOODLES);
        assertThat(terminal.snapshot().getCartLines()).isEmpty();

        terminal.resume();
        terminal.resume();
        scanWithScanner(NOODLES);
        assertThat(terminal.snapshot().getCartLines()).hasSize(1);
        assertThat(terminal.snapshot().getSuspensionDepth()).isZero();
    }

    @Test
    void navigationDropsPartialScan() {
        for (char c : "89912".toCharArray()) {
            terminal.onKey(KeyStroke.of(String.valueOf(c)));
        }
        terminal.navigate(ScreenId.SALES_HISTORY);
        scheduler.advance(500);

        assertThat(terminal.getScreen()).isEqualTo(ScreenId.SALES_HISTORY);
        assertThat(terminal.drainNotifications()).isEmpty();
    }

    @Test
    void checkoutSettlesAndClearsCart() {
        terminal.manualScan(NOODLES);
        SaleTransaction transaction = terminal.checkout(PaymentDetails.builder()
                .paymentMethod("cash").receivedAmount("20").build());

        assertThat(transaction.getTotal()).isEqualByComparingTo("16.80");
        assertThat(terminal.getStage()).isEqualTo(CheckoutStage.SETTLED);
        assertThat(terminal.snapshot().getCartLines()).isEmpty();
        assertThat(terminal.snapshot().getLastTransactionId()).isEqualTo(transaction.getId());

        terminal.addToCart("P-001");
        assertThat(terminal.getStage()).isEqualTo(CheckoutStage.COLLECTING);
    }

    @Test
    void inventoryFailureIsSurfacedAfterSettlement() {
        terminal.manualScan(NOODLES);
        catalog.failUpdatesFor("P-001");

        assertThatThrownBy(() -> terminal.checkout(PaymentDetails.builder()
                .paymentMethod("card").referenceNumber("CARD-1").build()))
                .isInstanceOf(InventoryApplyException.class);

        assertThat(terminal.getStage()).isEqualTo(CheckoutStage.SETTLED);
        assertThat(terminal.snapshot().getCartLines()).isEmpty();
        assertThat(terminal.drainNotifications()).extracting(Notification::getCode)
                .contains("INVENTORY_APPLY_FAILURE");
    }
}

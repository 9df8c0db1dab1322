package org.retailpos.terminal;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.business.SaleCheckoutService;
import org.retailpos.cart.Cart;
import org.retailpos.cart.CartLine;
import org.retailpos.checkout.CheckoutStage;
import org.retailpos.checkout.PaymentDetails;
import org.retailpos.config.PosProperties;
import org.retailpos.domain.Product;
import org.retailpos.domain.SaleTransaction;
import org.retailpos.exception.DuplicateBarcodeException;
import org.retailpos.exception.InventoryApplyException;
import org.retailpos.exception.OutOfStockException;
import org.retailpos.exception.PosException;
import org.retailpos.exception.UnknownBarcodeException;
import org.retailpos.routing.BarcodeRouter;
import org.retailpos.routing.HandoffMailbox;
import org.retailpos.routing.RoutedAction;
import org.retailpos.routing.RoutingContext;
import org.retailpos.scanner.KeyStroke;
import org.retailpos.scanner.ScanScheduler;
import org.retailpos.scanner.ScannerInputDecoder;
import org.retailpos.scanner.ScreenId;
import org.retailpos.service.ICatalogStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * 收银终端会话
 * <p>
 * 持有一个终端的全部可变状态：两个扫码解码器、路由上下文、购物车、转交信箱、
 * 当前页面、新建商品表单的条码草稿、结账状态和通知队列。
 * <p>
 * 非线程安全：所有方法都必须在该终端的事件循环线程上调用（见 TerminalRegistry）
 */
@Slf4j
public class Terminal {

    private final String terminalId;
    private final ScanScheduler scheduler;
    private final BarcodeRouter router;
    private final SaleCheckoutService checkoutService;

    private final RoutingContext routingContext = new RoutingContext();
    private final ScannerInputDecoder globalDecoder;
    private final ScannerInputDecoder productFormDecoder;
    private final Cart cart;
    private final HandoffMailbox mailbox;
    private final Deque<Notification> notifications = new ArrayDeque<>();
    private final int notificationCapacity;

    private ScreenId screen = ScreenId.SALE;
    private CheckoutStage stage = CheckoutStage.COLLECTING;
    private String productDraftBarcode;
    private String lastTransactionId;

    public Terminal(String terminalId,
                    ScanScheduler scheduler,
                    BarcodeRouter router,
                    ICatalogStore catalogStore,
                    SaleCheckoutService checkoutService,
                    PosProperties properties) {
        this.terminalId = terminalId;
        this.scheduler = scheduler;
        this.router = router;
        this.checkoutService = checkoutService;
        this.cart = new Cart(catalogStore, properties.getTax().getRate());
        this.mailbox = new HandoffMailbox(properties.getHandoff().getGraceWindow().toMillis());
        this.notificationCapacity = properties.getTerminal().getNotificationCapacity();

        PosProperties.DecoderSettings global = properties.getScanner().getGlobal();
        this.globalDecoder = new ScannerInputDecoder(terminalId + "/global",
                global.getInactivityTimeout().toMillis(), global.getMinTokenLength(),
                scheduler, routingContext::getSuspensionDepth, this::onToken);

        // 表单内的条码字段由表单自己管理，不受页面级挂起影响，且接受落在该字段上的按键
        PosProperties.DecoderSettings productForm = properties.getScanner().getProductForm();
        this.productFormDecoder = new ScannerInputDecoder(terminalId + "/product-form",
                productForm.getInactivityTimeout().toMillis(), productForm.getMinTokenLength(),
                scheduler, () -> 0, this::onToken, true);
    }

    // ==================== 扫码输入 ====================

    /**
     * 按键事件，交给当前页面的解码器
     */
    public void onKey(KeyStroke keyStroke) {
        activeDecoder().onKey(keyStroke);
    }

    /**
     * 手动输入条码：跳过解码器直接进入路由（仍然去重）
     */
    public void manualScan(String barcode) {
        if (barcode == null || barcode.trim().isEmpty()) {
            return;
        }
        onToken(barcode.trim());
    }

    public void suspend() {
        routingContext.suspend();
    }

    public void resume() {
        routingContext.resume();
    }

    private ScannerInputDecoder activeDecoder() {
        return screen == ScreenId.PRODUCT_FORM ? productFormDecoder : globalDecoder;
    }

    private void onToken(String token) {
        try {
            router.route(token, screen, routingContext, scheduler.currentTimeMillis(), this::applyAction);
        } catch (PosException e) {
            notify(Notification.Level.WARNING, e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[条码处理异常] terminalId={}, token={}, errorMsg={}", terminalId, token, e.getMessage(), e);
            notify(Notification.Level.ERROR, "ERROR", "Error processing barcode");
        }
    }

    private void applyAction(RoutedAction action) {
        Product product = action.getProduct();
        switch (action.getType()) {
            case ADD_TO_CART:
                addToCart(product.getId());
                break;
            case HANDOFF_TO_SALE:
                mailbox.offer(product);
                navigate(ScreenId.SALE);
                break;
            case OPEN_PRODUCT_FORM:
                navigate(ScreenId.PRODUCT_FORM);
                productDraftBarcode = action.getToken();
                notify(Notification.Level.INFO, null, "New barcode: " + action.getToken());
                break;
            case PREFILL_BARCODE:
                productDraftBarcode = action.getToken();
                notify(Notification.Level.INFO, null, "Barcode scanned: " + action.getToken());
                break;
            case DUPLICATE_BARCODE:
                throw new DuplicateBarcodeException(action.getToken(), product.getId(), product.getName());
            case UNKNOWN_BARCODE:
                throw new UnknownBarcodeException(action.getToken());
            case OUT_OF_STOCK:
                throw new OutOfStockException(product.getId(), product.getName());
            default:
                throw new IllegalStateException("Unhandled action " + action.getType());
        }
    }

    // ==================== 页面切换 ====================

    /**
     * 切换页面：清空两个解码器；进入收银页时消费转交信箱
     */
    public void navigate(ScreenId target) {
        globalDecoder.reset();
        productFormDecoder.reset();
        if (screen == ScreenId.PRODUCT_FORM && target != ScreenId.PRODUCT_FORM) {
            productDraftBarcode = null;
        }
        log.debug("[页面切换] terminalId={}, from={}, to={}", terminalId, screen, target);
        screen = target;

        if (target == ScreenId.SALE) {
            Optional<Product> handedOff = mailbox.consume(scheduler.currentTimeMillis());
            handedOff.ifPresent(this::addHandedOffProduct);
        }
    }

    private void addHandedOffProduct(Product product) {
        try {
            addToCart(product.getId());
        } catch (PosException e) {
            notify(Notification.Level.WARNING, e.getCode(), e.getMessage());
        }
    }

    // ==================== 购物车 ====================

    public CartLine addToCart(String productId) {
        resetStageAfterSettlement();
        CartLine line = cart.addToCart(productId);
        notify(Notification.Level.SUCCESS, null, line.getName() + " added to cart");
        return line;
    }

    public void updateQuantity(String productId, int quantity) {
        resetStageAfterSettlement();
        cart.updateQuantity(productId, quantity);
    }

    public void removeLine(String productId) {
        resetStageAfterSettlement();
        cart.removeLine(productId);
    }

    public void clearCart() {
        resetStageAfterSettlement();
        cart.clear();
    }

    private void resetStageAfterSettlement() {
        if (stage == CheckoutStage.SETTLED) {
            stage = CheckoutStage.COLLECTING;
        }
    }

    // ==================== 结账 ====================

    /**
     * 结账
     *
     * @throws InventoryApplyException 交易已完成但库存未完全更新（终端已进入 SETTLED）
     */
    public SaleTransaction checkout(PaymentDetails payment) {
        resetStageAfterSettlement();
        try {
            SaleTransaction transaction = checkoutService.checkout(terminalId, cart, payment, this::onStage);
            lastTransactionId = transaction.getId();
            notify(Notification.Level.SUCCESS, null,
                    "Transaction completed! Change: " + transaction.getChange());
            return transaction;
        } catch (InventoryApplyException e) {
            lastTransactionId = e.getTransaction().getId();
            notify(Notification.Level.ERROR, e.getCode(), e.getMessage());
            throw e;
        } catch (PosException e) {
            notify(Notification.Level.ERROR, e.getCode(), e.getMessage());
            throw e;
        }
    }

    private void onStage(CheckoutStage next) {
        log.debug("[结账状态] terminalId={}, {} -> {}", terminalId, stage, next);
        stage = next;
    }

    // ==================== 通知与快照 ====================

    private void notify(Notification.Level level, String code, String message) {
        if (level == Notification.Level.ERROR || level == Notification.Level.WARNING) {
            log.warn("[终端通知] terminalId={}, level={}, code={}, message={}", terminalId, level, code, message);
        } else {
            log.info("[终端通知] terminalId={}, level={}, message={}", terminalId, level, message);
        }
        if (notifications.size() >= notificationCapacity) {
            notifications.pollFirst();
        }
        notifications.addLast(new Notification(level, code, message, scheduler.currentTimeMillis()));
    }

    /**
     * 取出并清空通知队列
     */
    public List<Notification> drainNotifications() {
        List<Notification> drained = new ArrayList<>(notifications);
        notifications.clear();
        return drained;
    }

    public TerminalSnapshot snapshot() {
        return TerminalSnapshot.builder()
                .terminalId(terminalId)
                .screen(screen)
                .stage(stage)
                .cartLines(cart.lines())
                .totals(cart.totals())
                .productDraftBarcode(productDraftBarcode)
                .suspensionDepth(routingContext.getSuspensionDepth())
                .lastTransactionId(lastTransactionId)
                .build();
    }

    public ScreenId getScreen() {
        return screen;
    }

    public CheckoutStage getStage() {
        return stage;
    }

    public String getProductDraftBarcode() {
        return productDraftBarcode;
    }

    Cart getCart() {
        return cart;
    }
}

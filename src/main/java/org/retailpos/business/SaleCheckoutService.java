package org.retailpos.business;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.cache.CatalogCache;
import org.retailpos.cart.Cart;
import org.retailpos.cart.CartLine;
import org.retailpos.cart.CartTotals;
import org.retailpos.checkout.CheckoutStage;
import org.retailpos.checkout.InventoryApplier;
import org.retailpos.checkout.LineApplyResult;
import org.retailpos.checkout.PaymentDetails;
import org.retailpos.checkout.PaymentOutcome;
import org.retailpos.checkout.PaymentValidator;
import org.retailpos.domain.SaleTransaction;
import org.retailpos.domain.TransactionLine;
import org.retailpos.event.InventoryApplyFailedEvent;
import org.retailpos.exception.EmptyCartException;
import org.retailpos.exception.InventoryApplyException;
import org.retailpos.exception.TransactionPersistException;
import org.retailpos.mq.ReconciliationEventPublisher;
import org.retailpos.service.IInventoryApplyLogService;
import org.retailpos.service.ITransactionStore;
import org.retailpos.util.TraceIdUtil;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;

import java.net.ConnectException;
import java.sql.SQLTransientConnectionException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

/**
 * 销售结账流程
 * <p>
 * 完整流程：
 * 1. 购物车非空、未在结账中
 * 2. 支付校验（失败回到 COLLECTING）
 * 3. 冻结购物车，生成不可变的交易快照
 * 4. 交易落库（失败回到 COLLECTING，购物车原样保留，库存不动）
 * 5. 逐行并发扣减库存，结果写入对账日志
 * 6. 无论扣减结果如何，强制刷新目录缓存
 * 7. 清空购物车，进入 SETTLED；有扣减失败时发送对账事件并抛出 InventoryApplyException
 * <p>
 * 第 4 步与第 5 步之间没有事务：交易一旦落库就不会回滚，库存差异由人工对账处理
 */
@Slf4j
@Service
public class SaleCheckoutService {

    private final ITransactionStore transactionStore;
    private final IInventoryApplyLogService applyLogService;
    private final InventoryApplier inventoryApplier;
    private final PaymentValidator paymentValidator;
    private final CatalogCache catalogCache;
    private final ReconciliationEventPublisher eventPublisher;

    public SaleCheckoutService(ITransactionStore transactionStore,
                               IInventoryApplyLogService applyLogService,
                               InventoryApplier inventoryApplier,
                               PaymentValidator paymentValidator,
                               CatalogCache catalogCache,
                               ReconciliationEventPublisher eventPublisher) {
        this.transactionStore = transactionStore;
        this.applyLogService = applyLogService;
        this.inventoryApplier = inventoryApplier;
        this.paymentValidator = paymentValidator;
        this.catalogCache = catalogCache;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 结账
     *
     * @param terminalId 收银终端
     * @param cart 终端购物车
     * @param payment 支付信息
     * @param stageListener 状态变更回调
     * @return 已落库的交易
     * @throws IllegalStateException 购物车正处于结账中
     * @throws EmptyCartException 购物车为空
     * @throws org.retailpos.exception.InvalidPaymentException 支付校验失败
     * @throws TransactionPersistException 交易落库失败
     * @throws InventoryApplyException 交易已落库，但部分库存扣减未生效
     */
    public SaleTransaction checkout(String terminalId,
                                    Cart cart,
                                    PaymentDetails payment,
                                    Consumer<CheckoutStage> stageListener) {
        String traceId = TraceIdUtil.getTraceId();

        // ==================== 1. 购物车非空且未在结账中 ====================
        if (cart.isFrozen()) {
            throw new IllegalStateException("Checkout already in progress for terminal " + terminalId);
        }
        if (cart.isEmpty()) {
            throw new EmptyCartException();
        }

        // ==================== 2. 支付校验 ====================
        stageListener.accept(CheckoutStage.VALIDATING);
        CartTotals totals = cart.totals();
        PaymentOutcome outcome;
        try {
            outcome = paymentValidator.validate(payment, totals.getTotal());
        } catch (RuntimeException e) {
            stageListener.accept(CheckoutStage.COLLECTING);
            throw e;
        }

        // ==================== 3. 冻结购物车，生成交易快照 ====================
        cart.freeze();
        SaleTransaction transaction = buildTransaction(terminalId, cart.lines(), totals, outcome);

        // ==================== 4. 交易落库 ====================
        stageListener.accept(CheckoutStage.PERSISTING_TX);
        try {
            transactionStore.createTransaction(transaction);
        } catch (RuntimeException e) {
            TransactionPersistException.Kind kind = classify(e);
            log.error("[交易落库失败] transactionId={}, terminalId={}, kind={}, total={}, errorMsg={}, traceId={}",
                    transaction.getId(), terminalId, kind, transaction.getTotal(), e.getMessage(), traceId, e);
            cart.unfreeze();
            stageListener.accept(CheckoutStage.COLLECTING);
            throw new TransactionPersistException(kind, transaction.getId(), e);
        }

        // 交易已落库：之后无论发生什么，都要进入 SETTLED 并释放购物车
        List<LineApplyResult> results;
        try {
            // ==================== 5. 并发扣减库存 ====================
            stageListener.accept(CheckoutStage.APPLYING_INVENTORY);
            results = applyInventory(transaction);
            for (LineApplyResult result : results) {
                recordOutcome(transaction.getId(), result, traceId);
            }

            // ==================== 6. 强制刷新目录缓存 ====================
            catalogCache.forceRefresh();
        } finally {
            // ==================== 7. 清空购物车，SETTLED ====================
            cart.unfreeze();
            cart.clear();
            stageListener.accept(CheckoutStage.SETTLED);
        }

        List<LineApplyResult> failed = results.stream().filter(r -> !r.isApplied()).toList();
        if (!failed.isEmpty()) {
            log.error("[库存扣减未完全生效] transactionId={}, terminalId={}, failed={}/{}, failedProductIds={}, traceId={}",
                    transaction.getId(), terminalId, failed.size(), results.size(),
                    failed.stream().map(LineApplyResult::getProductId).toList(), traceId);
            eventPublisher.publishInventoryApplyFailed(InventoryApplyFailedEvent.builder()
                    .transactionId(transaction.getId())
                    .terminalId(terminalId)
                    .failedProductIds(failed.stream().map(LineApplyResult::getProductId).toList())
                    .failedCount(failed.size())
                    .totalCount(results.size())
                    .traceId(traceId)
                    .build());
            throw new InventoryApplyException(transaction, results);
        }

        log.info("[结账成功] transactionId={}, terminalId={}, total={}, paymentMethod={}, change={}, traceId={}",
                transaction.getId(), terminalId, transaction.getTotal(),
                transaction.getPaymentMethod().getCode(), transaction.getChange(), traceId);
        return transaction;
    }

    private SaleTransaction buildTransaction(String terminalId,
                                             List<CartLine> lines,
                                             CartTotals totals,
                                             PaymentOutcome outcome) {
        List<TransactionLine> items = lines.stream()
                .map(line -> TransactionLine.builder()
                        .productId(line.getProductId())
                        .name(line.getName())
                        .category(line.getCategory())
                        .price(line.getPrice())
                        .quantity(line.getQuantity())
                        .subtotal(line.subtotal())
                        .build())
                .toList();

        return SaleTransaction.builder()
                .id(generateTransactionId())
                .timestamp(LocalDateTime.now())
                .items(items)
                .subtotal(totals.getSubtotal())
                .tax(totals.getTax())
                .total(totals.getTotal())
                .paymentMethod(outcome.getMethod())
                .receivedAmount(outcome.getReceivedAmount())
                .change(outcome.getChange())
                .referenceNumber(outcome.getReferenceNumber())
                .terminalId(terminalId)
                .build();
    }

    private List<LineApplyResult> applyInventory(SaleTransaction transaction) {
        try {
            return inventoryApplier.applyAll(transaction.getId(), transaction.getItems());
        } catch (RuntimeException e) {
            log.error("[库存扣减执行异常] 全部行按失败记录, transactionId={}, errorMsg={}",
                    transaction.getId(), e.getMessage(), e);
            return transaction.getItems().stream()
                    .map(line -> LineApplyResult.failed(line.getProductId(), line.getName(),
                            line.getQuantity(), e.getMessage()))
                    .toList();
        }
    }

    private void recordOutcome(String transactionId, LineApplyResult result, String traceId) {
        try {
            applyLogService.recordOutcome(transactionId, result, traceId);
        } catch (RuntimeException e) {
            // 日志表写入失败时，ERROR 日志是唯一的对账线索
            log.error("[对账日志写入失败] transactionId={}, productId={}, applied={}, requested={}, errorMsg={}",
                    transactionId, result.getProductId(), result.isApplied(),
                    result.getRequestedQuantity(), e.getMessage(), e);
        }
    }

    /**
     * 交易ID：TXN-{毫秒时间戳}-{6位十六进制随机数}
     */
    static String generateTransactionId() {
        return String.format("TXN-%d-%06x",
                System.currentTimeMillis(), ThreadLocalRandom.current().nextInt(0x1000000));
    }

    static TransactionPersistException.Kind classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof DataAccessResourceFailureException
                    || t instanceof ConnectException
                    || t instanceof SQLTransientConnectionException) {
                return TransactionPersistException.Kind.STORE_UNREACHABLE;
            }
        }
        if (error instanceof DataAccessException) {
            return TransactionPersistException.Kind.DATABASE_ERROR;
        }
        return TransactionPersistException.Kind.UNKNOWN;
    }
}

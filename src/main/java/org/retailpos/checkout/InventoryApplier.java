package org.retailpos.checkout;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.config.PosProperties;
import org.retailpos.domain.Product;
import org.retailpos.domain.TransactionLine;
import org.retailpos.service.ICatalogStore;
import org.retailpos.util.IdempotentUtil;
import org.retailpos.util.TraceIdUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 库存扣减执行器
 * <p>
 * 每一行独立执行"读-改-写"：
 * 1. 抢占幂等凭证（交易ID:商品ID）
 * 2. 读取当前库存
 * 3. 写回 max(0, 当前库存 - 需扣减数量)
 * <p>
 * 各行并发执行，相互之间、与其他终端之间都没有顺序保证，也没有隔离；
 * 单行失败不影响其他行，也不回滚已落库的交易
 */
@Slf4j
@Component
public class InventoryApplier {

    private static final String OPERATION_TYPE = "INVENTORY_APPLY";

    private final ICatalogStore catalogStore;
    private final IdempotentUtil idempotentUtil;
    private final Executor executor;
    private final long timeoutMillis;

    @Autowired
    public InventoryApplier(ICatalogStore catalogStore,
                            IdempotentUtil idempotentUtil,
                            @Qualifier("inventoryApplyExecutor") Executor executor,
                            PosProperties properties) {
        this(catalogStore, idempotentUtil, executor, properties.getCheckout().getInventoryApplyTimeout().toMillis());
    }

    public InventoryApplier(ICatalogStore catalogStore,
                            IdempotentUtil idempotentUtil,
                            Executor executor,
                            long timeoutMillis) {
        this.catalogStore = catalogStore;
        this.idempotentUtil = idempotentUtil;
        this.executor = executor;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * 并发扣减全部交易行并等待结果
     *
     * @return 与 lines 顺序一致的扣减结果
     */
    public List<LineApplyResult> applyAll(String transactionId, List<TransactionLine> lines) {
        List<CompletableFuture<LineApplyResult>> futures = new ArrayList<>(lines.size());
        String traceId = TraceIdUtil.getTraceId();
        for (TransactionLine line : lines) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    TraceIdUtil.setTraceId(traceId);
                    try {
                        return applyLine(transactionId, line.getProductId(), line.getName(), line.getQuantity());
                    } finally {
                        TraceIdUtil.clearTraceId();
                    }
                }, executor));
            } catch (RejectedExecutionException e) {
                // 线程池拒绝时该行未执行，不抢占幂等凭证，按失败处理
                log.error("[库存扣减提交被拒绝] transactionId={}, productId={}, errorMsg={}",
                        transactionId, line.getProductId(), e.getMessage());
                futures.add(CompletableFuture.completedFuture(LineApplyResult.failed(line.getProductId(),
                        line.getName(), line.getQuantity(), "inventory update was rejected: " + e.getMessage())));
            }
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("[库存扣减超时] transactionId={}, timeoutMillis={}", transactionId, timeoutMillis);
        } catch (ExecutionException e) {
            // applyLine 自行捕获异常，这里只会是意外情况，逐行处理
            log.error("[库存扣减异常] transactionId={}, errorMsg={}", transactionId, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[库存扣减等待被中断] transactionId={}", transactionId);
        }

        List<LineApplyResult> results = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            results.add(collect(futures.get(i), lines.get(i)));
        }
        return results;
    }

    /**
     * 扣减单行库存（对账重试同样走这里）
     */
    public LineApplyResult applyLine(String transactionId, String productId, String productName, int requested) {
        String businessId = transactionId + ":" + productId;
        boolean claimed = false;
        try {
            // ==================== 1. 抢占幂等凭证 ====================
            claimed = idempotentUtil.markAsOperated(businessId, OPERATION_TYPE);
            if (!claimed) {
                log.warn("[库存扣减跳过] 该行已扣减过, transactionId={}, productId={}, operatedAt={}",
                        transactionId, productId, idempotentUtil.getOperatedTime(businessId, OPERATION_TYPE));
                return LineApplyResult.alreadyApplied(productId, productName, requested);
            }

            // ==================== 2. 读取当前库存 ====================
            Product current = catalogStore.getProduct(productId);
            int stockBefore = current.availableQuantity();
            int stockAfter = Math.max(0, stockBefore - requested);

            // ==================== 3. 写回 ====================
            catalogStore.updateProduct(productId, Product.builder().quantity(stockAfter).build());
            log.info("[库存扣减成功] transactionId={}, productId={}, requested={}, stockBefore={}, stockAfter={}",
                    transactionId, productId, requested, stockBefore, stockAfter);
            return LineApplyResult.applied(productId, productName, requested, stockBefore, stockAfter);
        } catch (RuntimeException e) {
            log.error("[库存扣减失败] transactionId={}, productId={}, requested={}, errorMsg={}",
                    transactionId, productId, requested, e.getMessage(), e);
            if (claimed) {
                releaseClaim(businessId);
            }
            return LineApplyResult.failed(productId, productName, requested, e.getMessage());
        }
    }

    private LineApplyResult collect(CompletableFuture<LineApplyResult> future, TransactionLine line) {
        if (future.isDone() && !future.isCompletedExceptionally()) {
            return future.join();
        }
        String reason = future.isDone() ? "inventory update was not executed" : "inventory update timed out";
        return LineApplyResult.failed(line.getProductId(), line.getName(), line.getQuantity(), reason);
    }

    private void releaseClaim(String businessId) {
        try {
            idempotentUtil.clearOperated(businessId, OPERATION_TYPE);
        } catch (RuntimeException e) {
            log.error("[幂等凭证清除失败] businessId={}, errorMsg={}", businessId, e.getMessage(), e);
        }
    }
}

package org.retailpos.business;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.cache.CatalogCache;
import org.retailpos.checkout.InventoryApplier;
import org.retailpos.checkout.LineApplyResult;
import org.retailpos.domain.InventoryApplyLog;
import org.retailpos.service.IInventoryApplyLogService;
import org.retailpos.service.ITransactionStore;
import org.retailpos.util.TraceIdUtil;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 库存对账服务
 * <p>
 * 只提供查询和人工触发的重试，不做任何自动重试。
 * 重试只处理 FAILED 状态的行，沿用结账时的"读-改-写"与幂等凭证。
 */
@Slf4j
@Service
public class ReconciliationService {

    private final IInventoryApplyLogService applyLogService;
    private final ITransactionStore transactionStore;
    private final InventoryApplier inventoryApplier;
    private final CatalogCache catalogCache;

    public ReconciliationService(IInventoryApplyLogService applyLogService,
                                 ITransactionStore transactionStore,
                                 InventoryApplier inventoryApplier,
                                 CatalogCache catalogCache) {
        this.applyLogService = applyLogService;
        this.transactionStore = transactionStore;
        this.inventoryApplier = inventoryApplier;
        this.catalogCache = catalogCache;
    }

    public List<InventoryApplyLog> listFailed() {
        return applyLogService.listFailed();
    }

    /**
     * 人工重试一笔交易中扣减失败的行
     *
     * @param transactionId 交易ID
     * @return 本次重试的逐行结果；没有待处理行时为空列表
     * @throws org.retailpos.exception.TransactionNotFoundException 交易不存在
     */
    public List<LineApplyResult> retry(String transactionId) {
        String traceId = TraceIdUtil.getTraceId();

        // ==================== 1. 校验交易存在 ====================
        transactionStore.getTransaction(transactionId);

        // ==================== 2. 查询待处理行 ====================
        List<InventoryApplyLog> failedLogs = applyLogService.listFailed(transactionId);
        if (failedLogs.isEmpty()) {
            log.info("[对账重试] 没有待处理的行, transactionId={}, traceId={}", transactionId, traceId);
            return List.of();
        }

        // ==================== 3. 逐行重试 ====================
        List<LineApplyResult> results = new ArrayList<>(failedLogs.size());
        for (InventoryApplyLog failedLog : failedLogs) {
            LineApplyResult result = inventoryApplier.applyLine(
                    transactionId,
                    failedLog.getProductId(),
                    failedLog.getProductName(),
                    failedLog.getRequestedQuantity());
            applyLogService.recordRetry(failedLog.getId(), result);
            results.add(result);
            log.info("[对账重试] transactionId={}, productId={}, applied={}, attempt={}, traceId={}",
                    transactionId, failedLog.getProductId(), result.isApplied(),
                    failedLog.getAttemptCount() + 1, traceId);
        }

        // ==================== 4. 刷新目录缓存 ====================
        if (results.stream().anyMatch(LineApplyResult::isApplied)) {
            catalogCache.forceRefresh();
        }
        return results;
    }
}

package org.retailpos.exception;

import org.retailpos.checkout.LineApplyResult;
import org.retailpos.domain.SaleTransaction;

import java.util.List;

/**
 * 交易已落库，但部分（或全部）库存扣减未生效
 * <p>
 * 交易保持 SETTLED，不回滚；失败行已写入对账日志，等待人工重试
 */
public class InventoryApplyException extends PosException {

    private final transient SaleTransaction transaction;
    private final transient List<LineApplyResult> results;

    public InventoryApplyException(SaleTransaction transaction, List<LineApplyResult> results) {
        super("INVENTORY_APPLY_FAILURE", buildMessage(transaction, results));
        this.transaction = transaction;
        this.results = List.copyOf(results);
    }

    public SaleTransaction getTransaction() {
        return transaction;
    }

    public List<LineApplyResult> getResults() {
        return results;
    }

    public List<LineApplyResult> getFailedLines() {
        return results.stream().filter(r -> !r.isApplied()).toList();
    }

    private static String buildMessage(SaleTransaction transaction, List<LineApplyResult> results) {
        long failed = results.stream().filter(r -> !r.isApplied()).count();
        return "Transaction " + transaction.getId() + " was saved but inventory was not updated for "
                + failed + " of " + results.size() + " item(s). Reconciliation required.";
    }
}

package org.retailpos.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.retailpos.checkout.LineApplyResult;
import org.retailpos.domain.InventoryApplyLog;

import java.util.List;

/**
 * 库存扣减应用日志服务接口
 */
public interface IInventoryApplyLogService extends IService<InventoryApplyLog> {

    /**
     * 记录一行库存扣减的首次结果
     */
    void recordOutcome(String transactionId, LineApplyResult result, String traceId);

    /**
     * 所有待对账（FAILED）的记录
     */
    List<InventoryApplyLog> listFailed();

    /**
     * 某笔交易下待对账的记录
     */
    List<InventoryApplyLog> listFailed(String transactionId);

    /**
     * 记录一次人工重试的结果
     */
    void recordRetry(Long logId, LineApplyResult result);
}

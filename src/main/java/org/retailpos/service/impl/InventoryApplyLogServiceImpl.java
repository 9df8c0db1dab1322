package org.retailpos.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.retailpos.checkout.LineApplyResult;
import org.retailpos.domain.InventoryApplyLog;
import org.retailpos.mapper.InventoryApplyLogMapper;
import org.retailpos.service.IInventoryApplyLogService;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 库存扣减应用日志服务实现
 * <p>
 * 状态机：APPLIED（终态） / FAILED -> 人工重试 -> APPLIED | FAILED
 */
@Slf4j
@Service
public class InventoryApplyLogServiceImpl extends ServiceImpl<InventoryApplyLogMapper, InventoryApplyLog>
        implements IInventoryApplyLogService {

    @Override
    public void recordOutcome(String transactionId, LineApplyResult result, String traceId) {
        InventoryApplyLog applyLog = InventoryApplyLog.builder()
                .transactionId(transactionId)
                .productId(result.getProductId())
                .productName(result.getProductName())
                .requestedQuantity(result.getRequestedQuantity())
                .stockBefore(result.getStockBefore())
                .stockAfter(result.getStockAfter())
                .status(result.isApplied() ? InventoryApplyLog.STATUS_APPLIED : InventoryApplyLog.STATUS_FAILED)
                .errorMessage(result.getErrorMessage())
                .attemptCount(1)
                .traceId(traceId)
                .createTime(LocalDateTime.now())
                .updateTime(LocalDateTime.now())
                .build();
        this.save(applyLog);
    }

    @Override
    public List<InventoryApplyLog> listFailed() {
        LambdaQueryWrapper<InventoryApplyLog> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(InventoryApplyLog::getStatus, InventoryApplyLog.STATUS_FAILED)
                .orderByAsc(InventoryApplyLog::getCreateTime);
        return this.list(queryWrapper);
    }

    @Override
    public List<InventoryApplyLog> listFailed(String transactionId) {
        LambdaQueryWrapper<InventoryApplyLog> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(InventoryApplyLog::getTransactionId, transactionId)
                .eq(InventoryApplyLog::getStatus, InventoryApplyLog.STATUS_FAILED)
                .orderByAsc(InventoryApplyLog::getId);
        return this.list(queryWrapper);
    }

    @Override
    public void recordRetry(Long logId, LineApplyResult result) {
        int updatedRows = baseMapper.updateAttempt(
                logId,
                result.isApplied() ? InventoryApplyLog.STATUS_APPLIED : InventoryApplyLog.STATUS_FAILED,
                result.getStockBefore(),
                result.getStockAfter(),
                result.getErrorMessage()
        );
        if (updatedRows == 0) {
            log.warn("[对账日志更新失败] logId={} 不存在", logId);
        }
    }
}

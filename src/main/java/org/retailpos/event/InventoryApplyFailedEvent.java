package org.retailpos.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 库存扣减未完全生效事件
 * 交易已落库但部分行扣减失败时发送，供对账方处理
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InventoryApplyFailedEvent {
    /**
     * 消息ID（唯一）
     */
    private String messageId;

    /**
     * 交易ID
     */
    private String transactionId;

    /**
     * 收银终端
     */
    private String terminalId;

    /**
     * 扣减失败的商品ID
     */
    private List<String> failedProductIds;

    private Integer failedCount;

    private Integer totalCount;

    /**
     * 追踪ID
     */
    private String traceId;

    /**
     * 事件时间戳
     */
    private Long timestamp;
}

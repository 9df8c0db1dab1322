package org.retailpos.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 库存扣减应用日志
 * - 每笔已落库交易的每一行记录一条
 * - 记录扣减是否生效，用于对账与人工重试
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("inventory_apply_log")
public class InventoryApplyLog {

    public static final String STATUS_APPLIED = "APPLIED";
    public static final String STATUS_FAILED = "FAILED";

    @TableId(type = IdType.AUTO)
    private Long id;

    /**
     * 交易ID
     */
    private String transactionId;

    /**
     * 商品ID
     */
    private String productId;

    private String productName;

    /**
     * 需扣减数量
     */
    private Integer requestedQuantity;

    /**
     * 扣减前库存（失败时可能为空）
     */
    private Integer stockBefore;

    /**
     * 扣减后库存（失败时可能为空）
     */
    private Integer stockAfter;

    /**
     * 状态：APPLIED(已生效)、FAILED(未生效，待对账)
     */
    private String status;

    private String errorMessage;

    /**
     * 尝试次数（首次扣减计 1）
     */
    private Integer attemptCount;

    /**
     * 追踪ID
     */
    private String traceId;

    private LocalDateTime createTime;

    private LocalDateTime updateTime;
}

package org.retailpos.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.retailpos.mapper.TransactionLinesTypeHandler;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 销售交易记录
 * <p>
 * 创建后不可变（仅管理员删除除外）：
 * - subtotal = Σ 行小计
 * - tax = subtotal × 税率
 * - total = subtotal + tax
 */
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@TableName(value = "transactions", autoResultMap = true)
public class SaleTransaction {
    /**
     * 交易ID，格式 TXN-{timestamp}-{hex}
     */
    @TableId(type = IdType.INPUT)
    private String id;
    /**
     * 交易时间
     */
    private LocalDateTime timestamp;
    /**
     * 交易行快照（JSON 列）
     */
    @TableField(typeHandler = TransactionLinesTypeHandler.class)
    private List<TransactionLine> items;
    private BigDecimal subtotal;
    private BigDecimal tax;
    private BigDecimal total;
    private PaymentMethod paymentMethod;
    /**
     * 实收金额（非现金支付时等于 total）
     */
    private BigDecimal receivedAmount;
    /**
     * 找零（非现金支付时为 0）
     */
    @TableField("change_amount")
    private BigDecimal change;
    /**
     * 支付流水号（仅 card / gcash）
     */
    private String referenceNumber;
    /**
     * 收银终端
     */
    private String terminalId;
}

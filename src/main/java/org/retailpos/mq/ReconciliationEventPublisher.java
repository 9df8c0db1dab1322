package org.retailpos.mq;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.config.RabbitMQConfig;
import org.retailpos.event.InventoryApplyFailedEvent;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 对账事件发布器
 * - 交易已落库但库存扣减未完全生效时，通知外部对账方
 * - 失败行已写入 inventory_apply_log，发送失败不影响对账（日志表是权威记录）
 * - RabbitMQ 未启用时只记日志
 */
@Slf4j
@Component
public class ReconciliationEventPublisher {

    private final RabbitTemplate rabbitTemplate;

    public ReconciliationEventPublisher(@Autowired(required = false) RabbitTemplate rabbitTemplate) {
        this.rabbitTemplate = rabbitTemplate;
    }

    /**
     * 发布库存扣减失败事件
     *
     * @param event 事件
     * @return true 表示已交给 MQ
     */
    public boolean publishInventoryApplyFailed(InventoryApplyFailedEvent event) {
        try {
            // ==================== 1. 生成消息ID ====================
            String messageId = UUID.randomUUID().toString();
            event.setMessageId(messageId);
            event.setTimestamp(System.currentTimeMillis());

            // ==================== 2. 发送消息到MQ（如果 RabbitMQ 可用） ====================
            if (rabbitTemplate == null) {
                log.warn("[RabbitMQ 未启用] 对账事件未发送，请查询对账日志, transactionId={}, failedProductIds={}",
                        event.getTransactionId(), event.getFailedProductIds());
                return false;
            }
            rabbitTemplate.convertAndSend(
                    RabbitMQConfig.RECONCILIATION_EXCHANGE,
                    RabbitMQConfig.RECONCILIATION_ROUTING_KEY,
                    event,
                    message -> {
                        message.getMessageProperties().setHeader("messageId", messageId);
                        return message;
                    }
            );
            log.info("[对账事件已发送] messageId={}, transactionId={}, traceId={}",
                    messageId, event.getTransactionId(), event.getTraceId());
            return true;
        } catch (Exception e) {
            log.error("[对账事件发布失败] transactionId={}, errorMsg={}",
                    event.getTransactionId(), e.getMessage(), e);
            return false;
        }
    }
}

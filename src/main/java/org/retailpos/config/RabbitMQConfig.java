package org.retailpos.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ 配置类
 * - 库存对账事件的 Exchange、Queue、Binding
 * - 消息体使用 JSON
 * - 仅在 spring.rabbitmq.listener.simple.enabled=true 时启用
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "spring.rabbitmq.listener.simple.enabled", havingValue = "true", matchIfMissing = false)
public class RabbitMQConfig {

    // 库存对账交换机
    public static final String RECONCILIATION_EXCHANGE = "pos.inventory.reconciliation.exchange";
    // 库存对账队列
    public static final String RECONCILIATION_QUEUE = "pos.inventory.reconciliation.queue";
    // 库存对账routing key
    public static final String RECONCILIATION_ROUTING_KEY = "pos.inventory.reconciliation";

    @Bean
    public DirectExchange reconciliationExchange() {
        return new DirectExchange(RECONCILIATION_EXCHANGE, true, false);
    }

    @Bean
    public Queue reconciliationQueue() {
        // 对账消息不设置超时，需要人工处理
        return QueueBuilder.durable(RECONCILIATION_QUEUE).build();
    }

    @Bean
    public Binding reconciliationBinding(Queue reconciliationQueue, DirectExchange reconciliationExchange) {
        return BindingBuilder.bind(reconciliationQueue)
                .to(reconciliationExchange)
                .with(RECONCILIATION_ROUTING_KEY);
    }

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    /**
     * 配置RabbitTemplate以支持消息确认回调
     */
    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, MessageConverter jsonMessageConverter) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(jsonMessageConverter);
        rabbitTemplate.setConfirmCallback((correlationData, ack, cause) -> {
            if (!ack) {
                log.error("[对账消息未被确认] cause={}", cause);
            }
        });
        return rabbitTemplate;
    }
}

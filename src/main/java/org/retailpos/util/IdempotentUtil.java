package org.retailpos.util;

import lombok.extern.slf4j.Slf4j;
import org.retailpos.config.PosProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 幂等性工具类
 * - 使用 Redis 记录库存扣减的幂等凭证，key = 交易ID:商品ID
 * - 凭证在扣减前抢占，扣减失败时清除，保证同一行最多生效一次
 * - 未启用 Redis 时退化为"总是首次执行"
 */
@Slf4j
@Component
public class IdempotentUtil {

    private static final String IDEMPOTENT_KEY_PREFIX = "pos:idempotent:";

    private final RedisTemplate<String, Object> redisTemplate;
    private final long expireSeconds;

    @Autowired
    public IdempotentUtil(@Autowired(required = false) RedisTemplate<String, Object> redisTemplate,
                          PosProperties properties) {
        this(properties.getIdempotency().isRedisEnabled() ? redisTemplate : null,
                properties.getIdempotency().getExpire().getSeconds());
    }

    public IdempotentUtil(RedisTemplate<String, Object> redisTemplate, long expireSeconds) {
        this.redisTemplate = redisTemplate;
        this.expireSeconds = expireSeconds;
        if (redisTemplate == null) {
            log.warn("[幂等凭证未启用] 未配置 Redis，对账重试无法防止重复扣减");
        }
    }

    /**
     * 抢占幂等凭证
     *
     * @return true: 抢占成功（首次执行）；false: 凭证已存在
     */
    public boolean markAsOperated(String businessId, String operationType) {
        if (redisTemplate == null) {
            return true;
        }
        // setIfAbsent 保证原子性：只有当 key 不存在时才设置
        Boolean success = redisTemplate.opsForValue().setIfAbsent(
                buildKey(businessId, operationType),
                System.currentTimeMillis(),
                expireSeconds,
                TimeUnit.SECONDS
        );
        return Boolean.TRUE.equals(success);
    }

    /**
     * 清除幂等凭证（操作失败时调用）
     */
    public void clearOperated(String businessId, String operationType) {
        if (redisTemplate == null) {
            return;
        }
        redisTemplate.delete(buildKey(businessId, operationType));
    }

    /**
     * @return 执行时间戳（毫秒），不存在时为 null
     */
    public Long getOperatedTime(String businessId, String operationType) {
        if (redisTemplate == null) {
            return null;
        }
        Object value = redisTemplate.opsForValue().get(buildKey(businessId, operationType));
        return value != null ? Long.parseLong(value.toString()) : null;
    }

    private String buildKey(String businessId, String operationType) {
        return IDEMPOTENT_KEY_PREFIX + operationType + ":" + businessId;
    }
}

package org.retailpos.config;

import lombok.Data;
import org.retailpos.scanner.ScreenId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * 收银核心配置（前缀 pos）
 */
@Data
@Component
@ConfigurationProperties(prefix = "pos")
public class PosProperties {

    private Tax tax = new Tax();
    private Scanner scanner = new Scanner();
    private Routing routing = new Routing();
    private Handoff handoff = new Handoff();
    private Catalog catalog = new Catalog();
    private Checkout checkout = new Checkout();
    private Terminal terminal = new Terminal();
    private Idempotency idempotency = new Idempotency();

    @Data
    public static class Tax {
        /**
         * 税率，固定策略常量
         */
        private BigDecimal rate = new BigDecimal("0.12");
    }

    @Data
    public static class Scanner {
        /**
         * 全局扫描：150ms 无输入自动提交，至少 4 个字符
         */
        private DecoderSettings global = new DecoderSettings(Duration.ofMillis(150), 4);
        /**
         * 新建商品表单内的条码字段：100ms，超过 6 个字符
         */
        private DecoderSettings productForm = new DecoderSettings(Duration.ofMillis(100), 7);
    }

    @Data
    public static class DecoderSettings {
        private Duration inactivityTimeout;
        private int minTokenLength;

        public DecoderSettings() {
        }

        public DecoderSettings(Duration inactivityTimeout, int minTokenLength) {
            this.inactivityTimeout = inactivityTimeout;
            this.minTokenLength = minTokenLength;
        }
    }

    @Data
    public static class Routing {
        /**
         * 未在表中配置的页面使用的去重窗口
         */
        private Duration defaultDedupWindow = Duration.ofMillis(2000);
        /**
         * 按页面配置的去重窗口，0 表示不去重
         */
        private Map<ScreenId, Duration> dedupWindows = defaultWindows();

        private static Map<ScreenId, Duration> defaultWindows() {
            Map<ScreenId, Duration> windows = new EnumMap<>(ScreenId.class);
            windows.put(ScreenId.SALE, Duration.ofMillis(500));
            windows.put(ScreenId.PRODUCT_FORM, Duration.ZERO);
            return windows;
        }
    }

    @Data
    public static class Handoff {
        /**
         * 跨页转交的商品在该窗口内按ID只消费一次
         */
        private Duration graceWindow = Duration.ofMillis(1000);
    }

    @Data
    public static class Catalog {
        /**
         * 两次刷新之间的最小间隔（限流）
         */
        private Duration minRefreshInterval = Duration.ofMillis(2000);
        /**
         * 是否开启定时刷新
         */
        private boolean scheduledRefreshEnabled = true;
        /**
         * 定时刷新周期（毫秒）
         */
        private long refreshPeriodMs = 60000;
    }

    @Data
    public static class Checkout {
        /**
         * 库存扣减并发线程数
         */
        private int inventoryApplyThreads = 4;
        /**
         * 等待全部库存扣减完成的超时时间
         */
        private Duration inventoryApplyTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Terminal {
        /**
         * 每个终端保留的通知条数
         */
        private int notificationCapacity = 100;
        /**
         * 等待终端事件循环执行结果的超时时间
         */
        private Duration callTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Idempotency {
        /**
         * 是否使用 Redis 记录对账重试的幂等凭证
         */
        private boolean redisEnabled = true;
        /**
         * 幂等凭证过期时间
         */
        private Duration expire = Duration.ofDays(7);
    }
}

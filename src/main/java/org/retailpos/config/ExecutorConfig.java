package org.retailpos.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 库存扣减工作线程池
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "inventoryApplyExecutor")
    public ThreadPoolTaskExecutor inventoryApplyExecutor(PosProperties properties) {
        int threads = properties.getCheckout().getInventoryApplyThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("pos-inventory-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}

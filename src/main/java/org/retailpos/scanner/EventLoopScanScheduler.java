package org.retailpos.scanner;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 基于单线程 ScheduledExecutorService 的调度器，定时任务与按键在同一线程上按序执行
 */
public class EventLoopScanScheduler implements ScanScheduler {

    private final ScheduledExecutorService loop;

    public EventLoopScanScheduler(ScheduledExecutorService loop) {
        this.loop = loop;
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public Cancellable schedule(Runnable task, long delayMillis) {
        ScheduledFuture<?> future = loop.schedule(task, delayMillis, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }
}

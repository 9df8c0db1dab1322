package org.retailpos.scanner;

/**
 * 终端事件循环上的时钟与定时器
 * <p>
 * 解码器的无输入定时器是终端内唯一可取消的工作单元
 */
public interface ScanScheduler {

    long currentTimeMillis();

    /**
     * 在事件循环上延迟执行任务
     *
     * @param task 任务
     * @param delayMillis 延迟毫秒数
     * @return 可取消句柄
     */
    Cancellable schedule(Runnable task, long delayMillis);

    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}

package org.retailpos.scanner;

import java.util.PriorityQueue;

/**
 * 手动推进的时钟与定时器，测试中替代终端事件循环
 */
public class ManualScanScheduler implements ScanScheduler {

    private final PriorityQueue<Task> tasks = new PriorityQueue<>();
    private long now;
    private long sequence;

    @Override
    public long currentTimeMillis() {
        return now;
    }

    @Override
    public Cancellable schedule(Runnable runnable, long delayMillis) {
        Task task = new Task(now + delayMillis, sequence++, runnable);
        tasks.add(task);
        return () -> task.cancelled = true;
    }

    /**
     * 推进时间并按到期顺序执行定时任务
     */
    public void advance(long millis) {
        long target = now + millis;
        while (!tasks.isEmpty() && tasks.peek().dueAt <= target) {
            Task task = tasks.poll();
            if (task.cancelled) {
                continue;
            }
            now = task.dueAt;
            task.runnable.run();
        }
        now = target;
    }

    public int pendingCount() {
        int count = 0;
        for (Task task : tasks) {
            if (!task.cancelled) {
                count++;
            }
        }
        return count;
    }

    private static final class Task implements Comparable<Task> {
        private final long dueAt;
        private final long sequence;
        private final Runnable runnable;
        private boolean cancelled;

        private Task(long dueAt, long sequence, Runnable runnable) {
            this.dueAt = dueAt;
            this.sequence = sequence;
            this.runnable = runnable;
        }

        @Override
        public int compareTo(Task other) {
            int byTime = Long.compare(dueAt, other.dueAt);
            return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
        }
    }
}

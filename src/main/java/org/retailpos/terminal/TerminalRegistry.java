package org.retailpos.terminal;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.retailpos.config.PosProperties;
import org.retailpos.exception.TerminalBusyException;
import org.retailpos.scanner.EventLoopScanScheduler;
import org.retailpos.util.TraceIdUtil;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * 终端注册表
 * <p>
 * 每个终端一个单线程事件循环：按键、解码器定时器、路由、购物车和结账都在这个线程上按到达顺序执行。
 * 调用方线程的 traceId 会带到事件循环线程上。
 */
@Slf4j
@Component
public class TerminalRegistry {

    private final TerminalFactory terminalFactory;
    private final long callTimeoutMillis;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public TerminalRegistry(TerminalFactory terminalFactory, PosProperties properties) {
        this.terminalFactory = terminalFactory;
        this.callTimeoutMillis = properties.getTerminal().getCallTimeout().toMillis();
    }

    /**
     * 在终端事件循环上执行并等待结果；终端不存在时自动创建
     *
     * @throws TerminalBusyException 等待超时
     */
    public <T> T call(String terminalId, Function<Terminal, T> action) {
        Session session = sessions.computeIfAbsent(terminalId, this::open);
        String traceId = TraceIdUtil.getTraceId();
        Future<T> future = session.loop.submit(() -> {
            TraceIdUtil.setTraceId(traceId);
            try {
                return action.apply(session.terminal);
            } finally {
                TraceIdUtil.clearTraceId();
            }
        });

        try {
            return future.get(callTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause);
        } catch (TimeoutException e) {
            log.error("[终端响应超时] terminalId={}, timeoutMillis={}", terminalId, callTimeoutMillis);
            throw new TerminalBusyException(terminalId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TerminalBusyException(terminalId, e);
        }
    }

    private Session open(String terminalId) {
        ScheduledExecutorService loop = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pos-terminal-" + terminalId);
            thread.setDaemon(true);
            return thread;
        });
        Terminal terminal = terminalFactory.create(terminalId, new EventLoopScanScheduler(loop));
        log.info("[终端已创建] terminalId={}", terminalId);
        return new Session(loop, terminal);
    }

    @PreDestroy
    public void shutdown() {
        sessions.forEach((terminalId, session) -> session.loop.shutdownNow());
        log.info("[终端已全部关闭] count={}", sessions.size());
        sessions.clear();
    }

    private static final class Session {
        private final ScheduledExecutorService loop;
        private final Terminal terminal;

        private Session(ScheduledExecutorService loop, Terminal terminal) {
            this.loop = loop;
            this.terminal = terminal;
        }
    }
}

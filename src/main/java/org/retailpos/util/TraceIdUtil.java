package org.retailpos.util;

import java.util.UUID;

/**
 * 链路追踪工具类
 * - 生成追踪ID
 * - ThreadLocal 保存当前线程的追踪ID（请求线程、终端事件循环线程、库存扣减工作线程）
 */
public final class TraceIdUtil {

    private static final ThreadLocal<String> TRACE_ID_HOLDER = new ThreadLocal<>();

    private TraceIdUtil() {
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static void setTraceId(String traceId) {
        TRACE_ID_HOLDER.set(traceId);
    }

    /**
     * 获取当前追踪ID，未设置时返回 null
     */
    public static String getTraceId() {
        return TRACE_ID_HOLDER.get();
    }

    public static void clearTraceId() {
        TRACE_ID_HOLDER.remove();
    }
}

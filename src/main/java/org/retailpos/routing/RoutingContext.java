package org.retailpos.routing;

/**
 * 终端路由上下文
 * - 可重入的扫描挂起计数（例如弹窗获得焦点时挂起，嵌套弹窗再次挂起）
 * - 最近一次提交的条码及时间，用于重复投递抑制
 * - 是否有条码正在解析
 * <p>
 * 归属单个终端，只在该终端的事件循环线程上访问
 */
public class RoutingContext {

    private int suspensionDepth;
    private String lastToken;
    private long lastTokenAt;
    private boolean inFlight;

    public void suspend() {
        suspensionDepth++;
    }

    /**
     * 恢复扫描，计数最低为 0
     */
    public void resume() {
        suspensionDepth = Math.max(0, suspensionDepth - 1);
    }

    public int getSuspensionDepth() {
        return suspensionDepth;
    }

    /**
     * 尝试开始一次解析
     *
     * @param token 条码
     * @param now 当前时间
     * @param dedupWindowMillis 去重窗口，0 表示不去重
     * @return false 表示重复投递或已有解析在进行中，调用方应静默丢弃
     */
    public boolean tryBegin(String token, long now, long dedupWindowMillis) {
        if (inFlight) {
            return false;
        }
        if (dedupWindowMillis > 0
                && token.equals(lastToken)
                && now - lastTokenAt < dedupWindowMillis) {
            return false;
        }
        lastToken = token;
        lastTokenAt = now;
        inFlight = true;
        return true;
    }

    public void complete() {
        inFlight = false;
    }

    public boolean isInFlight() {
        return inFlight;
    }
}

package org.retailpos.scanner;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;
import java.util.function.IntSupplier;
import java.util.regex.Pattern;

/**
 * 扫码枪输入解码器
 * <p>
 * 扫码枪模拟键盘输入，本类根据按键节奏把连续按键还原为条码：
 * <pre>
 * IDLE -> ACCUMULATING -> (提交 | 丢弃) -> IDLE
 * </pre>
 * 执行流程：
 * 1. 焦点在可编辑输入框、或页面处于挂起状态时，按键被完全忽略（缓冲区不变）；
 *    表单解码器例外地接受落在表单条码字段上的按键
 * 2. 接受字母、数字以及 - _ . 字符，追加到缓冲区并重置无输入定时器
 * 3. 回车或定时器到期时提交：长度达到下限则交给下游，否则静默丢弃；两种情况都清空缓冲区
 * <p>
 * 非线程安全，必须只在所属终端的事件循环线程上调用。
 */
@Slf4j
public class ScannerInputDecoder {

    private static final Pattern ACCEPTED_CHAR = Pattern.compile("[a-zA-Z0-9\\-_.]");

    public enum State {
        IDLE,
        ACCUMULATING
    }

    private final String name;
    private final long inactivityMillis;
    private final int minTokenLength;
    private final ScanScheduler scheduler;
    private final IntSupplier suspensionDepth;
    private final Consumer<String> sink;
    private final boolean acceptBarcodeField;

    private final StringBuilder buffer = new StringBuilder();
    private ScanScheduler.Cancellable pendingTimer;
    private long timerGeneration;
    private State state = State.IDLE;

    /**
     * @param name 解码器名称（日志用）
     * @param inactivityMillis 无输入自动提交的等待时间
     * @param minTokenLength 条码最小长度
     * @param scheduler 终端事件循环调度器
     * @param suspensionDepth 当前页面的挂起计数
     * @param sink 条码接收方
     */
    public ScannerInputDecoder(String name,
                               long inactivityMillis,
                               int minTokenLength,
                               ScanScheduler scheduler,
                               IntSupplier suspensionDepth,
                               Consumer<String> sink) {
        this(name, inactivityMillis, minTokenLength, scheduler, suspensionDepth, sink, false);
    }

    /**
     * @param acceptBarcodeField true 时接受焦点在表单条码字段上的按键
     */
    public ScannerInputDecoder(String name,
                               long inactivityMillis,
                               int minTokenLength,
                               ScanScheduler scheduler,
                               IntSupplier suspensionDepth,
                               Consumer<String> sink,
                               boolean acceptBarcodeField) {
        this.name = name;
        this.inactivityMillis = inactivityMillis;
        this.minTokenLength = minTokenLength;
        this.scheduler = scheduler;
        this.suspensionDepth = suspensionDepth;
        this.sink = sink;
        this.acceptBarcodeField = acceptBarcodeField;
    }

    /**
     * 处理一次按键
     *
     * @param keyStroke 按键事件
     */
    public void onKey(KeyStroke keyStroke) {
        // ==================== 1. 过滤：输入框内或挂起状态 ====================
        if (keyStroke == null || keyStroke.getKey() == null) {
            return;
        }
        boolean ownField = acceptBarcodeField && keyStroke.isBarcodeField();
        if ((keyStroke.isEditableTarget() && !ownField) || suspensionDepth.getAsInt() > 0) {
            log.debug("[按键忽略] decoder={}, key={}, editable={}, suspended={}",
                    name, keyStroke.getKey(), keyStroke.isEditableTarget(), suspensionDepth.getAsInt());
            return;
        }

        // ==================== 2. 回车：立即提交 ====================
        if (keyStroke.isEnter()) {
            commit();
            return;
        }

        // ==================== 3. 普通字符：追加并重置定时器 ====================
        String key = keyStroke.getKey();
        if (!ACCEPTED_CHAR.matcher(key).matches()) {
            // 其他按键不影响缓冲区
            return;
        }
        buffer.append(key);
        state = State.ACCUMULATING;
        armTimer();
    }

    /**
     * 丢弃缓冲区与待执行的定时器（页面切换时调用）
     */
    public void reset() {
        cancelTimer();
        buffer.setLength(0);
        state = State.IDLE;
    }

    public State getState() {
        return state;
    }

    public String getBufferedText() {
        return buffer.toString();
    }

    public int getMinTokenLength() {
        return minTokenLength;
    }

    private void armTimer() {
        cancelTimer();
        long generation = ++timerGeneration;
        pendingTimer = scheduler.schedule(() -> onInactivity(generation), inactivityMillis);
    }

    private void onInactivity(long generation) {
        if (generation != timerGeneration) {
            return;
        }
        pendingTimer = null;
        commit();
    }

    private void cancelTimer() {
        if (pendingTimer != null) {
            pendingTimer.cancel();
            pendingTimer = null;
        }
        timerGeneration++;
    }

    private void commit() {
        cancelTimer();
        String token = buffer.toString().trim();
        buffer.setLength(0);
        state = State.IDLE;

        if (token.length() < minTokenLength) {
            if (!token.isEmpty()) {
                log.debug("[丢弃短输入] decoder={}, length={}, minLength={}", name, token.length(), minTokenLength);
            }
            return;
        }
        log.debug("[条码提交] decoder={}, token={}", name, token);
        sink.accept(token);
    }
}

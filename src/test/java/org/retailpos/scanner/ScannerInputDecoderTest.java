package org.retailpos.scanner;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 扫码输入解码器测试
 * - 最小长度
 * - 字符过滤
 * - 无输入定时器（防抖）
 * - 输入框焦点与挂起
 */
@Slf4j
class ScannerInputDecoderTest {

    private ManualScanScheduler scheduler;
    private AtomicInteger suspension;
    private List<String> emitted;
    private ScannerInputDecoder decoder;

    @BeforeEach
    void setUp() {
        scheduler = new ManualScanScheduler();
        suspension = new AtomicInteger();
        emitted = new ArrayList<>();
        decoder = new ScannerInputDecoder("test", 150, 4, scheduler, suspension::get, emitted::add);
    }

    private void type(String text) {
        for (char c : text.toCharArray()) {
            decoder.onKey(KeyStroke.of(String.valueOf(c)));
        }
    }

    @Test
    void enterCommitsTokenImmediately() {
        type("8991234567890");
        decoder.onKey(KeyStroke.enter());

        assertThat(emitted).containsExactly("8991234567890");
        assertThat(decoder.getState()).isEqualTo(ScannerInputDecoder.State.IDLE);
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void inactivityTimerCommitsToken() {
        type("ABC-123");
        scheduler.advance(149);
        assertThat(emitted).isEmpty();

        scheduler.advance(1);
        assertThat(emitted).containsExactly("ABC-123");
        assertThat(decoder.getBufferedText()).isEmpty();
    }

    @Test
    void tokensShorterThanMinimumAreNeverEmitted() {
        for (String shortToken : List.of("1", "12", "123")) {
            type(shortToken);
            decoder.onKey(KeyStroke.enter());
            type(shortToken);
            scheduler.advance(200);
        }
        assertThat(emitted).isEmpty();

        type("1234");
        decoder.onKey(KeyStroke.enter());
        assertThat(emitted).containsExactly("1234");
    }

    @Test
    void nextKeystrokeRestartsInactivityTimer() {
        for (char c : "SKU_0042".toCharArray()) {
            decoder.onKey(KeyStroke.of(String.valueOf(c)));
            scheduler.advance(100);
        }
        // 每次间隔 100ms，定时器一直被重置
        assertThat(emitted).isEmpty();

        scheduler.advance(50);
        assertThat(emitted).containsExactly("SKU_0042");
    }

    @Test
    void slowTypingSplitsIntoDiscardedFragments() {
        type("12");
        scheduler.advance(200);
        type("34");
        scheduler.advance(200);

        assertThat(emitted).isEmpty();
    }

    @Test
    void unsupportedKeysAreIgnoredWithoutClearingBuffer() {
        type("AB");
        decoder.onKey(KeyStroke.of("Shift"));
        decoder.onKey(KeyStroke.of("#"));
        type("CD");
        decoder.onKey(KeyStroke.enter());

        assertThat(emitted).containsExactly("AB" + "CD");
    }

    @Test
    void keysInEditableFieldAreIgnored() {
        type("12");
        decoder.onKey(new KeyStroke("3", true));
        decoder.onKey(new KeyStroke(KeyStroke.ENTER, true));
        assertThat(decoder.getBufferedText()).isEqualTo("12");

        type("34");
        decoder.onKey(KeyStroke.enter());
        assertThat(emitted).containsExactly("1234");
    }

    @Test
    void suspendedPageIgnoresAllKeys() {
        suspension.set(2);
        type("8991234567890");
        decoder.onKey(KeyStroke.enter());
        scheduler.advance(500);
        assertThat(emitted).isEmpty();
        assertThat(decoder.getBufferedText()).isEmpty();

        suspension.set(0);
        type("8991234567890");
        decoder.onKey(KeyStroke.enter());
        assertThat(emitted).containsExactly("8991234567890");
    }

    @Test
    void resetDropsBufferAndPendingTimer() {
        type("ABCDEF");
        decoder.reset();
        scheduler.advance(500);

        assertThat(emitted).isEmpty();
        assertThat(decoder.getState()).isEqualTo(ScannerInputDecoder.State.IDLE);
    }

    @Test
    void productFormDecoderRequiresMoreThanSixCharacters() {
        List<String> formTokens = new ArrayList<>();
        ScannerInputDecoder formDecoder =
                new ScannerInputDecoder("form", 100, 7, scheduler, () -> 0, formTokens::add);

        for (char c : "123456".toCharArray()) {
            formDecoder.onKey(KeyStroke.of(String.valueOf(c)));
        }
        scheduler.advance(100);
        for (char c : "1234567".toCharArray()) {
            formDecoder.onKey(KeyStroke.of(String.valueOf(c)));
        }
        scheduler.advance(100);

        log.info("====== 表单解码结果: {} ======", formTokens);
        assertThat(formTokens).containsExactly("1234567");
    }

    @Test
    void formDecoderAcceptsKeysInItsOwnBarcodeField() {
        List<String> formTokens = new ArrayList<>();
        ScannerInputDecoder formDecoder =
                new ScannerInputDecoder("form", 100, 7, scheduler, () -> 0, formTokens::add, true);

        // 表单其他输入框（如商品名称）仍然忽略
        formDecoder.onKey(new KeyStroke("X", true, false));
        for (char c : "4801234000004".toCharArray()) {
            formDecoder.onKey(new KeyStroke(String.valueOf(c), true, true));
        }
        formDecoder.onKey(new KeyStroke(KeyStroke.ENTER, true, true));

        assertThat(formTokens).containsExactly("4801234000004");

        // 页面级解码器不认条码字段
        decoder.onKey(new KeyStroke("1", true, true));
        assertThat(decoder.getBufferedText()).isEmpty();
    }
}

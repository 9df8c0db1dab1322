package org.retailpos.scanner;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * 一次按键事件
 * <p>
 * key 采用浏览器 KeyboardEvent.key 的取值：单字符、"Enter"、"Shift" 等；
 * editableTarget 表示焦点位于可编辑输入框内；barcodeField 表示该输入框是商品表单的条码字段
 */
@Value
public class KeyStroke {

    public static final String ENTER = "Enter";

    String key;
    boolean editableTarget;
    /**
     * 焦点位于新建商品表单自己的条码输入框（此时 editableTarget 也为 true）
     */
    boolean barcodeField;

    public KeyStroke(String key, boolean editableTarget) {
        this(key, editableTarget, false);
    }

    @JsonCreator
    public KeyStroke(@JsonProperty("key") String key,
                     @JsonProperty("editableTarget") boolean editableTarget,
                     @JsonProperty("barcodeField") boolean barcodeField) {
        this.key = key;
        this.editableTarget = editableTarget;
        this.barcodeField = barcodeField;
    }

    public static KeyStroke of(String key) {
        return new KeyStroke(key, false);
    }

    public static KeyStroke enter() {
        return new KeyStroke(ENTER, false);
    }

    public boolean isEnter() {
        return ENTER.equals(key);
    }
}

package org.retailpos.terminal;

import lombok.Value;

/**
 * 终端通知（提示条）
 */
@Value
public class Notification {

    public enum Level {
        INFO,
        SUCCESS,
        WARNING,
        ERROR
    }

    Level level;
    /**
     * 错误码，普通提示为 null
     */
    String code;
    String message;
    long timestamp;
}

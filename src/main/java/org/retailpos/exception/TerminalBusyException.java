package org.retailpos.exception;

/**
 * 终端事件循环未能在超时时间内处理请求
 */
public class TerminalBusyException extends PosException {

    public TerminalBusyException(String terminalId, Throwable cause) {
        super("TERMINAL_BUSY", "Terminal " + terminalId + " did not respond in time", cause);
    }
}

package org.retailpos.exception;

/**
 * 收银核心业务异常基类
 * <p>
 * 继承 RuntimeException，携带稳定的错误码，由控制器统一转换为响应
 */
public abstract class PosException extends RuntimeException {

    private final String code;

    protected PosException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected PosException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

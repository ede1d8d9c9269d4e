package com.asiainfo.pivot.core.exception;

/**
 * 透视查询相关异常基类
 */
public class PivotException extends RuntimeException {

    public PivotException(String message) {
        super(message);
    }

    public PivotException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getUserFriendlyMessage() {
        return getMessage();
    }
}

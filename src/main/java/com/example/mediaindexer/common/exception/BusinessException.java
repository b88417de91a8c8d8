package com.example.mediaindexer.common.exception;

public class BusinessException extends RuntimeException {

    private final String code;
    private final String userAction;

    public BusinessException(String code, String message) {
        this(code, message, (String) null);
    }

    public BusinessException(String code, String message, String userAction) {
        super(message);
        this.code = code;
        this.userAction = userAction;
    }

    public BusinessException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.userAction = null;
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }
}

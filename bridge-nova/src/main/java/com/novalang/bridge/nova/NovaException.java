package com.novalang.bridge.nova;

/**
 * NovaLang 基础运行时异常
 */
public class NovaException extends RuntimeException {

    public NovaException(String message) {
        super(message);
    }

    public NovaException(String message, Throwable cause) {
        super(message, cause);
    }
}

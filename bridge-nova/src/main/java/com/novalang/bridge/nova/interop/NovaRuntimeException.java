package com.novalang.bridge.nova.interop;

import com.novalang.bridge.ErrorKind;
import com.novalang.bridge.nova.NovaException;

/**
 * 绑定调用期异常，脚本可以按 {@link ErrorKind} 区分处理。
 */
public class NovaRuntimeException extends NovaException {

    private final ErrorKind kind;

    public NovaRuntimeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public NovaRuntimeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** 返回不含错误类别前缀的消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return kind + ": " + super.getMessage();
    }
}

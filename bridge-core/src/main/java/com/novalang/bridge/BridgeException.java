package com.novalang.bridge;

/**
 * NovaBridge 基础异常（非受检）。
 *
 * <p>绑定生成阶段抛出 {@link BindingBuildException}；调用阶段的错误由具体运行时
 * 通过 {@link com.novalang.bridge.runtime.ForeignRuntime#raiseError} 转换为自身的异常类型。</p>
 */
public class BridgeException extends RuntimeException {

    public BridgeException(String message) {
        super(message);
    }

    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}

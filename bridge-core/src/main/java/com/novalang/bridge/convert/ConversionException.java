package com.novalang.bridge.convert;

/**
 * 值转换失败。
 *
 * <p>只在转换层内部流动：调用桩捕获后按上下文映射为 {@code CONVERSION}
 * 或 {@code CONSTRUCTOR_RESOLUTION} 错误。</p>
 */
public class ConversionException extends Exception {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }

    /** 在消息前追加位置上下文（如 "element [2]"、"field 'zip'"） */
    public ConversionException at(String location) {
        return new ConversionException(location + ": " + getMessage(), getCause() != null ? getCause() : this);
    }
}

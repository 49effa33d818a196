package com.novalang.bridge.nova;

/**
 * Nova null 值和 Unit 值
 *
 * <p>Unit 是无返回值函数的结果；两者都视为空。</p>
 */
public final class NovaNull extends NovaValue {

    /** 唯一的 null 实例 */
    public static final NovaNull NULL = new NovaNull(true);

    /** 唯一的 Unit 实例 */
    public static final NovaNull UNIT = new NovaNull(false);

    private final boolean isNullValue;

    private NovaNull(boolean isNullValue) {
        this.isNullValue = isNullValue;
    }

    @Override
    public String getTypeName() {
        return isNullValue ? "Null" : "Unit";
    }

    @Override
    public Object toJavaValue() {
        return null;
    }

    @Override
    public boolean isNull() {
        return true;
    }

    public boolean isUnit() {
        return !isNullValue;
    }

    @Override
    public String toString() {
        return isNullValue ? "null" : "Unit";
    }

    @Override
    public boolean equals(NovaValue other) {
        return other == this;
    }

    @Override
    public int hashCode() {
        return isNullValue ? 0 : 1;
    }
}

package com.novalang.bridge.nova;

/**
 * Nova Int 值（32位整数）
 */
public final class NovaInt extends NovaValue {

    private static final int CACHE_LOW = -128;
    private static final int CACHE_HIGH = 1024;
    private static final NovaInt[] CACHE = new NovaInt[CACHE_HIGH - CACHE_LOW + 1];
    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new NovaInt(CACHE_LOW + i);
        }
    }

    /** 获取 NovaInt 实例，优先从缓存取 */
    public static NovaInt of(int value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[value - CACHE_LOW];
        }
        return new NovaInt(value);
    }

    private final int value;

    private NovaInt(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Int";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isNumber() {
        return true;
    }

    @Override
    public boolean isInteger() {
        return true;
    }

    @Override
    public long asLong() {
        return value;
    }

    @Override
    public double asDouble() {
        return value;
    }

    @Override
    public boolean equals(NovaValue other) {
        if (other instanceof NovaInt) return ((NovaInt) other).value == value;
        if (other instanceof NovaLong) return ((NovaLong) other).getValue() == value;
        return false;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}

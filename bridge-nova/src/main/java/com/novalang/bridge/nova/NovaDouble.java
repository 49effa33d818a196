package com.novalang.bridge.nova;

/**
 * Nova Double 值
 */
public final class NovaDouble extends NovaValue {

    private final double value;

    private NovaDouble(double value) {
        this.value = value;
    }

    public static NovaDouble of(double value) {
        return new NovaDouble(value);
    }

    public double getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Double";
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
    public double asDouble() {
        return value;
    }

    @Override
    public long asLong() {
        return (long) value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}

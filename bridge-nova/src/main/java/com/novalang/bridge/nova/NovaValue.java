package com.novalang.bridge.nova;

/**
 * Nova 运行时值的基类
 */
public abstract class NovaValue {

    /**
     * 获取值的类型名称
     */
    public abstract String getTypeName();

    /**
     * 获取底层 Java 值
     */
    public abstract Object toJavaValue();

    public boolean isNull() {
        return false;
    }

    public boolean isNumber() {
        return false;
    }

    public boolean isInteger() {
        return false;
    }

    public boolean isString() {
        return false;
    }

    public boolean isBoolean() {
        return false;
    }

    public boolean isCallable() {
        return false;
    }

    public boolean isList() {
        return false;
    }

    public boolean isMap() {
        return false;
    }

    public long asLong() {
        throw new NovaException("Cannot convert " + getTypeName() + " to Long");
    }

    public double asDouble() {
        throw new NovaException("Cannot convert " + getTypeName() + " to Double");
    }

    public String asString() {
        return toString();
    }

    public boolean asBoolean() {
        throw new NovaException("Cannot convert " + getTypeName() + " to Boolean");
    }

    /**
     * 相等性比较
     */
    public boolean equals(NovaValue other) {
        if (other == null) return false;
        if (other == this) return true;
        Object thisVal = toJavaValue();
        Object otherVal = other.toJavaValue();
        if (thisVal == null) return otherVal == null;
        if (thisVal == this || otherVal == other) return thisVal == otherVal;
        return thisVal.equals(otherVal);
    }

    @Override
    public int hashCode() {
        Object val = toJavaValue();
        return val != null && val != this ? val.hashCode() : System.identityHashCode(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof NovaValue) {
            return equals((NovaValue) obj);
        }
        return false;
    }
}

package com.novalang.bridge.registry;

/**
 * 注册表条目：类名、结构签名、签名摘要与脚本类型句柄。
 */
public final class ClassMetadata {

    private final String name;
    private String signature;
    private String hash;
    private Object foreignHandle;

    ClassMetadata(String name, String signature, String hash, Object foreignHandle) {
        this.name = name;
        this.signature = signature;
        this.hash = hash;
        this.foreignHandle = foreignHandle;
    }

    void update(String signature, String hash, Object foreignHandle) {
        this.signature = signature;
        this.hash = hash;
        this.foreignHandle = foreignHandle;
    }

    public String getName() {
        return name;
    }

    public String getSignature() {
        return signature;
    }

    /** 签名的 SHA-256 十六进制摘要 */
    public String getHash() {
        return hash;
    }

    /** 脚本类型句柄；从清单恢复的条目为 null */
    public Object getForeignHandle() {
        return foreignHandle;
    }

    @Override
    public String toString() {
        return name + " [" + hash.substring(0, Math.min(12, hash.length())) + "]";
    }
}

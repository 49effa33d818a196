package com.novalang.bridge.registry;

import com.novalang.bridge.introspect.ClassBytes;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 摘要。
 *
 * <p>结构签名看不到方法体的变化，对类文件字节取摘要并拼入签名可以覆盖这类改动。</p>
 */
public final class ContentHasher {

    private ContentHasher() {}

    public static String sha256(String text) {
        return sha256(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256(byte[] bytes) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
        byte[] hash = digest.digest(bytes);
        StringBuilder sb = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }

    /**
     * 类文件字节的摘要；类文件不可用时返回 null。
     */
    public static String sha256Of(Class<?> type) {
        byte[] bytes = ClassBytes.read(type);
        return bytes != null ? sha256(bytes) : null;
    }
}

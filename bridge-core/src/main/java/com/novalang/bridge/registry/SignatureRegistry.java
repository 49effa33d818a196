package com.novalang.bridge.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 已绑定类的签名目录，用于变更检测。
 *
 * <p>由嵌入方创建并传给 {@link com.novalang.bridge.bind.BindingGenerator}，生命周期跟随嵌入方。
 * 只在单线程的模块初始化期间写入，调用桩从不访问，因此不加锁。</p>
 */
public final class SignatureRegistry {

    private static final Logger LOG = Logger.getLogger(SignatureRegistry.class.getName());

    private final Map<String, ClassMetadata> entries = new LinkedHashMap<>();

    /**
     * 新增或更新条目。签名变化时记录 INFO 日志；已创建的脚本对象不受影响。
     */
    public ClassMetadata register(String name, String signature, Object foreignHandle) {
        String hash = ContentHasher.sha256(signature);
        ClassMetadata existing = entries.get(name);
        if (existing == null) {
            ClassMetadata created = new ClassMetadata(name, signature, hash, foreignHandle);
            entries.put(name, created);
            return created;
        }
        if (!existing.getSignature().equals(signature)) {
            LOG.info("Signature of " + name + " changed: " + existing.getHash() + " -> " + hash);
        }
        existing.update(signature, hash, foreignHandle);
        return existing;
    }

    /**
     * 未登记，或已登记的签名与给定签名不同。
     */
    public boolean needsRegeneration(String name, String signature) {
        ClassMetadata existing = entries.get(name);
        return existing == null || !existing.getSignature().equals(signature);
    }

    public ClassMetadata get(String name) {
        return entries.get(name);
    }

    public boolean isRegistered(String name) {
        return entries.containsKey(name);
    }

    public Collection<ClassMetadata> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public int size() {
        return entries.size();
    }

    /** 从持久化清单恢复条目，不带脚本句柄 */
    void restore(String name, String signature, String hash) {
        entries.put(name, new ClassMetadata(name, signature, hash, null));
    }
}

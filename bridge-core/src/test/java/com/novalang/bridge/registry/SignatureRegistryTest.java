package com.novalang.bridge.registry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 签名注册表测试
 */
class SignatureRegistryTest {

    private static final String SIG = "class:Point|members:x:double,y:double|methods:distanceFromOrigin";

    @Test
    @DisplayName("未登记的类需要重新生成")
    void absentNeedsRegeneration() {
        SignatureRegistry registry = new SignatureRegistry();
        assertTrue(registry.needsRegeneration("Point", SIG));
        assertFalse(registry.isRegistered("Point"));
    }

    @Test
    @DisplayName("签名不变时不需要重新生成")
    void unchangedSignature() {
        SignatureRegistry registry = new SignatureRegistry();
        Object handle = new Object();
        ClassMetadata meta = registry.register("Point", SIG, handle);
        assertFalse(registry.needsRegeneration("Point", SIG));
        assertSame(handle, meta.getForeignHandle());
        assertEquals(ContentHasher.sha256(SIG), meta.getHash());
        assertEquals(64, meta.getHash().length());
    }

    @Test
    @DisplayName("签名变化时更新条目")
    void changedSignature() {
        SignatureRegistry registry = new SignatureRegistry();
        ClassMetadata first = registry.register("Point", SIG, "h1");
        String changed = SIG + ",length";
        assertTrue(registry.needsRegeneration("Point", changed));

        ClassMetadata second = registry.register("Point", changed, "h2");
        assertSame(first, second);
        assertEquals(changed, second.getSignature());
        assertEquals("h2", second.getForeignHandle());
        assertFalse(registry.needsRegeneration("Point", changed));
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("条目保持登记顺序")
    void entriesKeepOrder() {
        SignatureRegistry registry = new SignatureRegistry();
        registry.register("B", "class:B|members:|methods:", null);
        registry.register("A", "class:A|members:|methods:", null);
        assertThat(registry.entries()).extracting(ClassMetadata::getName).containsExactly("B", "A");
    }

    @Test
    @DisplayName("摘要是稳定的十六进制串")
    void stableHash() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", ContentHasher.sha256(""));
    }
}

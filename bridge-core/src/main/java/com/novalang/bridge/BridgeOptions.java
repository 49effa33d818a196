package com.novalang.bridge;

import com.novalang.bridge.bind.OverloadNaming;
import com.novalang.bridge.bind.TypeSuffixNaming;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * 绑定生成选项
 *
 * <p>控制哪些成员被暴露、是否允许突破访问控制以及签名的计算方式。</p>
 *
 * <pre>
 * BindingGenerator&lt;NovaValue&gt; gen = new BindingGenerator&lt;&gt;(runtime, BridgeOptions.strict());
 *
 * BridgeOptions options = BridgeOptions.custom()
 *     .includeNonPublicFields(true)
 *     .excludeMember("com.example.Account", "password")
 *     .contentHashing(true)
 *     .build();
 * </pre>
 */
public final class BridgeOptions {

    /** 预设级别 */
    public enum Level { DEFAULT, STRICT, PERMISSIVE, CUSTOM }

    private final Level level;

    // --- 成员选择 ---
    private final boolean includeNonPublicFields;
    private final boolean includeInheritedMembers;
    private final boolean bindStaticMethods;
    private final Set<String> excludedMembers;   // "className.memberName" 格式

    // --- 访问控制 ---
    private final boolean allowSetAccessible;
    private final boolean requireDefaultConstructor;

    // --- 签名 ---
    private final boolean contentHashing;
    private final boolean typedMethodSignatures;

    private final OverloadNaming overloadNaming;

    private BridgeOptions(Builder builder) {
        this.level = builder.level;
        this.includeNonPublicFields = builder.includeNonPublicFields;
        this.includeInheritedMembers = builder.includeInheritedMembers;
        this.bindStaticMethods = builder.bindStaticMethods;
        this.excludedMembers = Collections.unmodifiableSet(new HashSet<>(builder.excludedMembers));
        this.allowSetAccessible = builder.allowSetAccessible;
        this.requireDefaultConstructor = builder.requireDefaultConstructor;
        this.contentHashing = builder.contentHashing;
        this.typedMethodSignatures = builder.typedMethodSignatures;
        this.overloadNaming = builder.overloadNaming;
    }

    // ============ 预定义工厂方法 ============

    /** 默认：公开成员、继承成员与静态方法，允许 final 字段在记录重建时写入 */
    public static BridgeOptions defaults() {
        return new Builder(Level.DEFAULT).build();
    }

    /** 严格：不突破访问控制，要求默认构造器，签名附带类文件摘要 */
    public static BridgeOptions strict() {
        return new Builder(Level.STRICT)
                .allowSetAccessible(false)
                .requireDefaultConstructor(true)
                .contentHashing(true)
                .typedMethodSignatures(true)
                .build();
    }

    /** 宽松：暴露非公开字段 */
    public static BridgeOptions permissive() {
        return new Builder(Level.PERMISSIVE)
                .includeNonPublicFields(true)
                .allowSetAccessible(true)
                .build();
    }

    public static Builder custom() {
        return new Builder(Level.CUSTOM);
    }

    // ============ 查询方法 ============

    public boolean isMemberExcluded(Class<?> owner, String memberName) {
        return !excludedMembers.isEmpty() && excludedMembers.contains(owner.getName() + "." + memberName);
    }

    public Level getLevel() { return level; }
    public boolean isIncludeNonPublicFields() { return includeNonPublicFields; }
    public boolean isIncludeInheritedMembers() { return includeInheritedMembers; }
    public boolean isBindStaticMethods() { return bindStaticMethods; }
    public Set<String> getExcludedMembers() { return excludedMembers; }
    public boolean isAllowSetAccessible() { return allowSetAccessible; }
    public boolean isRequireDefaultConstructor() { return requireDefaultConstructor; }
    public boolean isContentHashing() { return contentHashing; }
    public boolean isTypedMethodSignatures() { return typedMethodSignatures; }
    public OverloadNaming getOverloadNaming() { return overloadNaming; }

    // ============ Builder ============

    public static final class Builder {
        private final Level level;
        private boolean includeNonPublicFields = false;
        private boolean includeInheritedMembers = true;
        private boolean bindStaticMethods = true;
        private final Set<String> excludedMembers = new HashSet<>();
        private boolean allowSetAccessible = true;
        private boolean requireDefaultConstructor = false;
        private boolean contentHashing = false;
        private boolean typedMethodSignatures = false;
        private OverloadNaming overloadNaming = TypeSuffixNaming.INSTANCE;

        Builder(Level level) {
            this.level = level;
        }

        public Builder includeNonPublicFields(boolean include) {
            this.includeNonPublicFields = include;
            return this;
        }

        public Builder includeInheritedMembers(boolean include) {
            this.includeInheritedMembers = include;
            return this;
        }

        public Builder bindStaticMethods(boolean bind) {
            this.bindStaticMethods = bind;
            return this;
        }

        public Builder excludeMember(String className, String memberName) {
            excludedMembers.add(className + "." + memberName);
            return this;
        }

        public Builder allowSetAccessible(boolean allow) {
            this.allowSetAccessible = allow;
            return this;
        }

        public Builder requireDefaultConstructor(boolean require) {
            this.requireDefaultConstructor = require;
            return this;
        }

        public Builder contentHashing(boolean enabled) {
            this.contentHashing = enabled;
            return this;
        }

        public Builder typedMethodSignatures(boolean enabled) {
            this.typedMethodSignatures = enabled;
            return this;
        }

        public Builder overloadNaming(OverloadNaming naming) {
            if (naming == null) {
                throw new IllegalArgumentException("overloadNaming must not be null");
            }
            this.overloadNaming = naming;
            return this;
        }

        public BridgeOptions build() {
            return new BridgeOptions(this);
        }
    }
}

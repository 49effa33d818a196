package com.novalang.bridge;

/**
 * 绑定生成失败（构建期错误）。
 *
 * <p>类型无法分类、重载名冲突、要求默认构造器但缺失等情况下抛出。
 * 该异常在模块初始化时出现，永远不会到达脚本调用方。</p>
 */
public class BindingBuildException extends BridgeException {

    private final Class<?> nativeType;
    private final String member;

    public BindingBuildException(String message) {
        this(message, null, null, null);
    }

    public BindingBuildException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public BindingBuildException(String message, Class<?> nativeType, String member, Throwable cause) {
        super(message, cause);
        this.nativeType = nativeType;
        this.member = member;
    }

    /** 出错的原生类型，未知时为 null */
    public Class<?> getNativeType() {
        return nativeType;
    }

    /** 出错的成员名（字段/方法/构造器），未知时为 null */
    public String getMember() {
        return member;
    }

    /**
     * 为已有异常补充所属类与成员信息，保持最内层的原始消息。
     */
    public static BindingBuildException inMember(Class<?> owner, String member, BindingBuildException e) {
        if (e.nativeType != null) {
            return e;
        }
        return new BindingBuildException(owner.getName() + "." + member + ": " + e.getMessage(),
                owner, member, e);
    }
}

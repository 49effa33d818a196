package com.novalang.bridge.nova.interop;

import com.novalang.bridge.BridgeOptions;
import com.novalang.bridge.bind.BindingGenerator;
import com.novalang.bridge.bind.BridgeModule;
import com.novalang.bridge.nova.NovaValue;
import com.novalang.bridge.registry.SignatureRegistry;

/**
 * Nova 绑定入口
 *
 * <pre>
 * NovaBridge bridge = new NovaBridge();
 * NovaLibrary geometry = bridge.defineLibrary(BridgeModule.builder("geometry")
 *     .bind(Point.class)
 *     .build());
 * NovaBridgeObject p = (NovaBridgeObject) geometry.member("Point").call();
 * </pre>
 */
public final class NovaBridge {

    private final BindingGenerator<NovaValue> generator;

    public NovaBridge() {
        this(BridgeOptions.defaults());
    }

    public NovaBridge(BridgeOptions options) {
        this(new SignatureRegistry(), options);
    }

    public NovaBridge(SignatureRegistry registry, BridgeOptions options) {
        this.generator = new BindingGenerator<>(new NovaForeignRuntime(), registry, options);
    }

    /** 绑定模块中的全部类并导出到同名的库 */
    public NovaLibrary defineLibrary(BridgeModule module) {
        NovaLibrary library = new NovaLibrary(module.getName());
        module.registerInto(generator, library);
        return library;
    }

    public NovaBridgeClass bind(Class<?> type) {
        generator.bind(type);
        return classOf(type);
    }

    public NovaBridgeClass bind(String name, Class<?> type) {
        generator.bind(name, type);
        return classOf(type);
    }

    public NovaBridgeClass classOf(Class<?> type) {
        return (NovaBridgeClass) generator.typeOf(type);
    }

    /** 把宿主对象暴露给脚本，不转移所有权 */
    public NovaBridgeObject wrap(Object instance) {
        return (NovaBridgeObject) generator.wrap(instance);
    }

    /**
     * 立即结束对象句柄的包装，不等待 GC；之后对该句柄的访问报告 INVALID_OBJECT。
     */
    public void collect(NovaBridgeObject handle) {
        generator.getLifetimeManager().collectNow(handle.getWrapper());
    }

    public BindingGenerator<NovaValue> getGenerator() {
        return generator;
    }

    public SignatureRegistry getRegistry() {
        return generator.getRegistry();
    }
}

package com.novalang.bridge.bind;

import java.lang.ref.Cleaner;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 原生对象包装
 *
 * <p>把一个 Java 对象与所有权标记绑在一起，由脚本对象句柄持有。
 * 包装对象不能反向引用脚本句柄，否则句柄永远不会变为不可达，回收回调也就不会触发。</p>
 *
 * <pre>
 * ALLOCATED --construct--> CONSTRUCTED --finalize--> COLLECTED
 * </pre>
 */
public final class NativeWrapper {

    public enum State { ALLOCATED, CONSTRUCTED, COLLECTED }

    private final AtomicReference<State> state = new AtomicReference<>(State.ALLOCATED);
    private volatile Object instance;
    private volatile boolean owns;
    private volatile Cleaner.Cleanable cleanable;

    NativeWrapper() {
    }

    /**
     * 填入原生对象。只能从 ALLOCATED 状态调用一次。
     *
     * @param owns 为 true 时结束包装会关闭原生对象
     */
    public void construct(Object instance, boolean owns) {
        if (instance == null) {
            throw new IllegalArgumentException("Native instance must not be null");
        }
        if (state.get() != State.ALLOCATED) {
            throw new IllegalStateException("Wrapper is already " + state.get());
        }
        this.instance = instance;
        this.owns = owns;
        state.set(State.CONSTRUCTED);
    }

    /** 原生对象；未构造或已回收时为 null */
    public Object get() {
        return instance;
    }

    public boolean isValid() {
        return instance != null;
    }

    public boolean owns() {
        return owns;
    }

    public State getState() {
        return state.get();
    }

    void attachCleanable(Cleaner.Cleanable cleanable) {
        if (this.cleanable != null) {
            throw new IllegalStateException("Wrapper is already attached to a foreign handle");
        }
        this.cleanable = cleanable;
    }

    Cleaner.Cleanable cleanable() {
        return cleanable;
    }

    /**
     * 切换到 COLLECTED 并交出原生对象。
     *
     * @return 原生对象；已经回收过时返回 null
     */
    Object release() {
        State previous = state.getAndSet(State.COLLECTED);
        if (previous == State.COLLECTED) {
            return null;
        }
        Object released = instance;
        instance = null;
        return released;
    }

    @Override
    public String toString() {
        Object current = instance;
        return "NativeWrapper[" + state.get() + (current != null ? ", " + current.getClass().getSimpleName() : "")
                + (owns ? ", owned" : "") + "]";
    }
}

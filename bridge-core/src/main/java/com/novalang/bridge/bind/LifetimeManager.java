package com.novalang.bridge.bind;

import java.lang.ref.Cleaner;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 包装对象生命周期管理
 *
 * <p>脚本对象句柄被 GC 回收时，通过 {@link Cleaner} 回调结束对应的包装对象：
 * 拥有所有权时关闭实现了 {@link AutoCloseable} 的原生对象，然后释放引用。
 * 每个包装对象只会被结束一次。</p>
 */
public final class LifetimeManager {

    private static final Logger LOG = Logger.getLogger(LifetimeManager.class.getName());

    private static final Cleaner CLEANER = Cleaner.create();

    private final AtomicLong constructed = new AtomicLong();
    private final AtomicLong finalized = new AtomicLong();

    /** 空包装，原生构造器成功返回后才分配，随即填入原生对象 */
    public NativeWrapper allocate() {
        return new NativeWrapper();
    }

    /** 包装宿主已有的对象，不获取所有权 */
    public NativeWrapper adopt(Object instance) {
        NativeWrapper wrapper = new NativeWrapper();
        wrapper.construct(instance, false);
        return wrapper;
    }

    /**
     * 在脚本句柄上登记回收回调。
     */
    public void attach(Object foreignHandle, NativeWrapper wrapper) {
        wrapper.attachCleanable(CLEANER.register(foreignHandle, new Finalizer(this, wrapper)));
        constructed.incrementAndGet();
    }

    /**
     * 结束包装对象。重复调用不做任何事。
     */
    public void finalizeWrapper(NativeWrapper wrapper) {
        boolean owned = wrapper.owns();
        Object instance = wrapper.release();
        if (instance == null) {
            LOG.fine("Wrapper already finalized: " + wrapper);
            return;
        }
        finalized.incrementAndGet();
        if (owned && instance instanceof AutoCloseable) {
            try {
                ((AutoCloseable) instance).close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Failed to close native object " + instance.getClass().getName(), e);
            }
        }
    }

    /**
     * 立即结束包装对象，不等待 GC。已登记的回收回调随之失效。
     */
    public void collectNow(NativeWrapper wrapper) {
        Cleaner.Cleanable cleanable = wrapper.cleanable();
        if (cleanable != null) {
            cleanable.clean();
        } else {
            finalizeWrapper(wrapper);
        }
    }

    /** 已登记到脚本句柄的包装数 */
    public long constructedCount() {
        return constructed.get();
    }

    public long finalizedCount() {
        return finalized.get();
    }

    private static final class Finalizer implements Runnable {
        private final LifetimeManager manager;
        private final NativeWrapper wrapper;

        private Finalizer(LifetimeManager manager, NativeWrapper wrapper) {
            this.manager = manager;
            this.wrapper = wrapper;
        }

        @Override
        public void run() {
            try {
                manager.finalizeWrapper(wrapper);
            } catch (RuntimeException e) {
                // 回收线程上不能抛出
                LOG.log(Level.WARNING, "Finalizer failed for " + wrapper, e);
            }
        }
    }
}

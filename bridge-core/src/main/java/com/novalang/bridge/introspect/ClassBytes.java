package com.novalang.bridge.introspect;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Logger;

/**
 * 定位并读取已加载类的类文件字节。
 */
public final class ClassBytes {

    private static final Logger LOG = Logger.getLogger(ClassBytes.class.getName());

    private ClassBytes() {}

    /**
     * 通过类自身的类加载器读取类文件；无法读取（动态生成的类、隐藏类等）时返回 null。
     */
    public static byte[] read(Class<?> type) {
        String resourcePath = type.getName().replace('.', '/') + ".class";
        ClassLoader loader = type.getClassLoader();
        try (InputStream is = loader != null
                ? loader.getResourceAsStream(resourcePath)
                : ClassLoader.getSystemResourceAsStream(resourcePath)) {
            if (is == null) {
                return null;
            }
            return is.readAllBytes();
        } catch (IOException e) {
            LOG.fine("Failed to read class file: " + resourcePath + " (" + e.getMessage() + ")");
            return null;
        }
    }
}

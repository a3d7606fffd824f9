package com.edge.equipment.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责在创建任何 Mat 之前加载 OpenCV 的 JNI 库
 * <p>
 * JAR 模式下使用 openpnp 打包的 native 库；失败时回退到系统库路径
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static final String SYSTEM_LIBRARY_NAME = "opencv_java470";

    private static boolean loaded = false;

    /**
     * 预加载 OpenCV native 库
     * 可重复调用，只有第一次生效
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }

        try {
            // openpnp 会把与平台匹配的库解压到临时目录再加载
            nu.pattern.OpenCV.loadLocally();
            logger.info("OpenCV loaded successfully via openpnp");
            loaded = true;
            return;
        } catch (Throwable e) {
            logger.warn("Failed to load OpenCV via openpnp: {}", e.getMessage());
        }

        // 回退到系统库路径
        try {
            System.loadLibrary(SYSTEM_LIBRARY_NAME);
            logger.info("OpenCV loaded from system library path");
            loaded = true;
        } catch (UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV library. Please ensure {} is on java.library.path", SYSTEM_LIBRARY_NAME);
            throw new IllegalStateException("OpenCV native library not found: " + SYSTEM_LIBRARY_NAME, e);
        }
    }

    public static synchronized boolean isLoaded() {
        return loaded;
    }
}

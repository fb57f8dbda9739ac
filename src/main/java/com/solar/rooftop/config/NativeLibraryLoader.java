package com.solar.rooftop.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责加载 OpenCV JNI 库（openpnp 自带的 native 库）
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean loaded = false;

    /**
     * 预加载 OpenCV native 库
     * 必须在任何使用 Mat/Imgproc 的代码之前调用，可重复调用
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }

        logger.info("Loading OpenCV via openpnp...");
        try {
            nu.pattern.OpenCV.loadLocally();
            logger.info("OpenCV loaded successfully via openpnp");
        } catch (UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV library", e);
            throw new IllegalStateException("Failed to load OpenCV library", e);
        }
        loaded = true;
    }

    public static synchronized boolean isLoaded() {
        return loaded;
    }
}

package com.ttennebkram.intensity.util;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact, once per process.
 */
public final class OpenCVLoader {

    private static volatile boolean loaded = false;

    private OpenCVLoader() {
    }

    /**
     * Load the native library if it has not been loaded yet.
     * Failures propagate as the linkage errors OpenCV raises.
     */
    public static void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (OpenCVLoader.class) {
            if (!loaded) {
                nu.pattern.OpenCV.loadLocally();
                loaded = true;
                System.out.println("[OpenCVLoader] Loaded OpenCV " + org.opencv.core.Core.VERSION);
            }
        }
    }

    /**
     * Try to load the native library.
     *
     * @return false if the library cannot be loaded on this platform
     */
    public static boolean tryLoad() {
        try {
            ensureLoaded();
            return true;
        } catch (LinkageError | RuntimeException e) {
            System.err.println("[OpenCVLoader] OpenCV native library unavailable: " + e.getMessage());
            return false;
        }
    }

    public static boolean isLoaded() {
        return loaded;
    }
}

package com.edge.equipment.core.model;

import org.opencv.core.Mat;

import java.nio.file.Path;

/**
 * 待识别的截图图标，只在一次匹配中存活
 */
public class ProbeIcon {
    private final String id;
    private final Mat pixels;
    private final Path sourcePath;

    public ProbeIcon(String id, Mat pixels, Path sourcePath) {
        this.id = id;
        this.pixels = pixels;
        this.sourcePath = sourcePath;
    }

    public ProbeIcon(String id, Mat pixels) {
        this(id, pixels, null);
    }

    public String getId() { return id; }

    public Mat getPixels() { return pixels; }

    public Path getSourcePath() { return sourcePath; }

    public void release() {
        if (pixels != null) {
            pixels.release();
        }
    }
}

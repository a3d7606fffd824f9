package com.edge.equipment.core.model;

import com.edge.equipment.core.cache.PerceptualHistogram;
import org.opencv.core.Mat;

import java.nio.file.Path;
import java.time.Instant;

/**
 * 基准装备模板
 * <p>
 * 像素在构建后只读，匹配器只借用，不修改也不释放；
 * 缓存字段（哈希、直方图、描述子）由 TemplateCache 负责
 */
public class ReferenceTemplate {
    private final String id;
    private final Mat pixels;
    private final String contentHash;
    private final PerceptualHistogram perceptualHistogram;
    private final Instant cachedAt;
    private final Path sourcePath;

    public ReferenceTemplate(String id, Mat pixels, String contentHash,
                             PerceptualHistogram perceptualHistogram, Instant cachedAt, Path sourcePath) {
        this.id = id;
        this.pixels = pixels;
        this.contentHash = contentHash;
        this.perceptualHistogram = perceptualHistogram;
        this.cachedAt = cachedAt;
        this.sourcePath = sourcePath;
    }

    public String getId() { return id; }

    public Mat getPixels() { return pixels; }

    public String getContentHash() { return contentHash; }

    public PerceptualHistogram getPerceptualHistogram() { return perceptualHistogram; }

    public Instant getCachedAt() { return cachedAt; }

    public Path getSourcePath() { return sourcePath; }

    /**
     * 批次结束后由持有者调用
     */
    public void release() {
        if (pixels != null) {
            pixels.release();
        }
    }

    @Override
    public String toString() {
        return "ReferenceTemplate{" + id + ", " + pixels.cols() + "x" + pixels.rows() + ", hash=" + contentHash + "}";
    }
}

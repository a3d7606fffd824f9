package com.edge.equipment.core.cache;

import com.edge.equipment.core.feature.DescriptorSet;

import java.time.Instant;

/**
 * 单个模板的缓存内容，对应磁盘上的一个 blob 文件
 */
public class FeatureCacheEntry {
    private final String contentHash;
    private final Instant cachedAt;
    private final PerceptualHistogram histogram;
    private final DescriptorSet descriptorSet;

    public FeatureCacheEntry(String contentHash, Instant cachedAt, PerceptualHistogram histogram,
                             DescriptorSet descriptorSet) {
        this.contentHash = contentHash;
        this.cachedAt = cachedAt;
        this.histogram = histogram;
        this.descriptorSet = descriptorSet;
    }

    public FeatureCacheEntry withDescriptors(DescriptorSet descriptors) {
        return new FeatureCacheEntry(contentHash, Instant.now(), histogram, descriptors);
    }

    public boolean hasDescriptors() {
        return descriptorSet != null;
    }

    public String getContentHash() { return contentHash; }

    public Instant getCachedAt() { return cachedAt; }

    public PerceptualHistogram getHistogram() { return histogram; }

    public DescriptorSet getDescriptorSet() { return descriptorSet; }
}

package com.edge.equipment.core.cache;

import java.time.Instant;

/**
 * getOrCompute 的返回值
 * <p>
 * fresh=true 表示直接命中缓存；false 表示本次重新计算（首次、内容变化、blob 丢失或损坏）
 */
public class CacheLookup {
    private final PerceptualHistogram histogram;
    private final boolean fresh;
    private final String contentHash;
    private final Instant cachedAt;

    CacheLookup(FeatureCacheEntry entry, boolean fresh) {
        this.histogram = entry.getHistogram();
        this.fresh = fresh;
        this.contentHash = entry.getContentHash();
        this.cachedAt = entry.getCachedAt();
    }

    public PerceptualHistogram getHistogram() { return histogram; }

    public boolean isFresh() { return fresh; }

    public String getContentHash() { return contentHash; }

    public Instant getCachedAt() { return cachedAt; }
}

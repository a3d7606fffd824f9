package com.edge.equipment.core.cache;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * cache_index.json 的内容：templateId -> 索引项
 * <p>
 * 判断新鲜度的唯一依据：索引项的 contentHash 必须等于当前文件内容的哈希
 */
@Data
@NoArgsConstructor
public class CacheIndex {
    private int version = 1;
    private Instant updatedAt;
    private Map<String, Entry> entries = new TreeMap<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        private String contentHash;
        private String blobFile;
        private Instant cachedAt;
        private boolean hasDescriptors;
    }
}

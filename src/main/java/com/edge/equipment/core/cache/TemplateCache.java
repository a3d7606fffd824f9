package com.edge.equipment.core.cache;

import com.edge.equipment.core.feature.DescriptorExtractor;
import com.edge.equipment.core.feature.DescriptorSet;
import com.edge.equipment.core.model.ReferenceTemplate;
import com.edge.equipment.util.ImageDecodeException;
import com.edge.equipment.util.ImageLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 模板特征缓存
 * <p>
 * 磁盘布局：
 * - cache_index.json：templateId -> {contentHash, blobFile, cachedAt, hasDescriptors}
 * - &lt;md5(templateId)&gt;.bin：直方图 + 可选的 ORB 描述子
 * <p>
 * 只有当前文件内容的 MD5 与索引中的 contentHash 一致时才命中；
 * 否则同步重算，先写 blob 再写索引，然后返回。
 * 同一模板的重算由模板级锁串行化，索引写入由 indexLock 串行化。
 * 缓存 I/O 失败只记 WARN，不影响本次返回值。
 */
public class TemplateCache {
    private static final Logger logger = LoggerFactory.getLogger(TemplateCache.class);

    public static final String INDEX_FILE = "cache_index.json";
    private static final String BLOB_SUFFIX = ".bin";

    private final Path directory;
    private final HistogramExtractor histogramExtractor;
    private final DescriptorExtractor descriptorExtractor;
    private final ObjectMapper objectMapper;

    private final Map<String, CacheIndex.Entry> indexEntries = new ConcurrentHashMap<>();
    private final Map<String, FeatureCacheEntry> memory = new ConcurrentHashMap<>();
    private final Map<String, Object> templateLocks = new ConcurrentHashMap<>();
    private final Object indexLock = new Object();
    private volatile Instant lastIndexUpdate;

    /**
     * 打开（必要时创建）缓存目录并读取索引
     *
     * @throws CacheConfigurationException 目录无法创建或不可写
     */
    public TemplateCache(Path directory, HistogramExtractor histogramExtractor,
                         DescriptorExtractor descriptorExtractor) {
        this.directory = directory.toAbsolutePath().normalize();
        this.histogramExtractor = histogramExtractor;
        this.descriptorExtractor = descriptorExtractor;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);

        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new CacheConfigurationException("Cannot create cache directory: " + this.directory, e);
        }
        if (!Files.isDirectory(this.directory) || !Files.isWritable(this.directory)) {
            throw new CacheConfigurationException("Cache directory is not a writable directory: " + this.directory);
        }

        loadIndex();
    }

    /**
     * 文件内容哈希（MD5 十六进制）
     */
    public static String contentHash(byte[] imageBytes) {
        return DigestUtils.md5DigestAsHex(imageBytes);
    }

    /**
     * 读取或计算模板的感知直方图，只在未命中时才解码图片
     */
    public CacheLookup getOrCompute(String templateId, byte[] imageBytes) throws ImageDecodeException {
        return lookup(templateId, contentHash(imageBytes), () -> ImageLoader.decode(imageBytes, templateId), true);
    }

    /**
     * 调用方已解码好图片时使用，避免重复解码
     */
    public CacheLookup getOrCompute(String templateId, byte[] imageBytes, Mat decoded) {
        try {
            return lookup(templateId, contentHash(imageBytes), () -> decoded, false);
        } catch (ImageDecodeException e) {
            // 图片已经给出，不会走到解码
            throw new IllegalStateException(e);
        }
    }

    private CacheLookup lookup(String templateId, String hash, ImageSource source, boolean releaseImage)
            throws ImageDecodeException {
        synchronized (lockFor(templateId)) {
            CacheIndex.Entry indexed = indexEntries.get(templateId);
            if (indexed != null && hash.equals(indexed.getContentHash())) {
                FeatureCacheEntry entry = loadEntry(templateId, hash);
                if (entry != null) {
                    logger.debug("Cache hit for {}", templateId);
                    return new CacheLookup(entry, true);
                }
                logger.warn("Cache blob for {} missing or corrupt, recomputing", templateId);
            } else if (indexed != null) {
                logger.info("Content of {} changed ({} -> {}), recomputing", templateId, indexed.getContentHash(), hash);
            }

            Mat image = source.get();
            try {
                FeatureCacheEntry entry = new FeatureCacheEntry(hash, Instant.now(), histogramExtractor.extract(image), null);
                persist(templateId, entry);
                return new CacheLookup(entry, false);
            } finally {
                if (releaseImage && image != null) {
                    image.release();
                }
            }
        }
    }

    /**
     * 已缓存的描述子，不校验新鲜度；不存在时返回 empty
     */
    public Optional<DescriptorSet> getCachedFeatures(String templateId) {
        CacheIndex.Entry indexed = indexEntries.get(templateId);
        if (indexed == null || !indexed.isHasDescriptors()) {
            return Optional.empty();
        }
        FeatureCacheEntry entry = loadEntry(templateId, indexed.getContentHash());
        if (entry == null || !entry.hasDescriptors()) {
            return Optional.empty();
        }
        return Optional.of(entry.getDescriptorSet());
    }

    /**
     * 哈希一致且已有描述子时直接返回，否则提取后持久化
     */
    public DescriptorSet getOrComputeFeatures(ReferenceTemplate template) {
        String templateId = template.getId();
        synchronized (lockFor(templateId)) {
            FeatureCacheEntry entry = loadEntry(templateId, template.getContentHash());
            if (entry != null && entry.hasDescriptors()) {
                return entry.getDescriptorSet();
            }

            DescriptorSet descriptors = descriptorExtractor.extract(template.getPixels());
            logger.debug("Extracted {} keypoints for template {}", descriptors.keyPointCount(), templateId);

            FeatureCacheEntry base = entry;
            if (base == null) {
                PerceptualHistogram histogram = template.getPerceptualHistogram() != null
                    ? template.getPerceptualHistogram()
                    : histogramExtractor.extract(template.getPixels());
                base = new FeatureCacheEntry(template.getContentHash(), Instant.now(), histogram, null);
            }
            persist(templateId, base.withDescriptors(descriptors));
            return descriptors;
        }
    }

    /**
     * 删除索引项和 blob
     *
     * @return 原先是否存在
     */
    public boolean invalidate(String templateId) {
        synchronized (lockFor(templateId)) {
            memory.remove(templateId);
            CacheIndex.Entry removed = indexEntries.remove(templateId);
            deleteBlob(templateId);
            if (removed != null) {
                writeIndex();
                logger.info("Invalidated cache entry {}", templateId);
            }
            return removed != null;
        }
    }

    /**
     * 移除不在 liveIds 中的缓存项（模板文件已从目录删除）
     *
     * @return 被移除的模板 ID
     */
    public List<String> retainOnly(Collection<String> liveIds) {
        Set<String> live = new HashSet<>(liveIds);
        List<String> removed = new ArrayList<>();
        for (String templateId : new TreeMap<>(indexEntries).keySet()) {
            if (!live.contains(templateId) && invalidate(templateId)) {
                removed.add(templateId);
            }
        }
        return removed;
    }

    public Optional<String> indexedHash(String templateId) {
        CacheIndex.Entry entry = indexEntries.get(templateId);
        return entry == null ? Optional.empty() : Optional.of(entry.getContentHash());
    }

    public Set<String> indexedIds() {
        return Set.copyOf(indexEntries.keySet());
    }

    public CacheStats stats() {
        int withDescriptors = (int) indexEntries.values().stream().filter(CacheIndex.Entry::isHasDescriptors).count();
        return new CacheStats(indexEntries.size(), withDescriptors, directory.toString(), lastIndexUpdate);
    }

    public Path getDirectory() {
        return directory;
    }

    // =========================================================
    // 磁盘读写
    // =========================================================

    private FeatureCacheEntry loadEntry(String templateId, String expectedHash) {
        CacheIndex.Entry indexed = indexEntries.get(templateId);
        if (indexed == null || !expectedHash.equals(indexed.getContentHash())) {
            return null;
        }

        FeatureCacheEntry cached = memory.get(templateId);
        if (cached != null && expectedHash.equals(cached.getContentHash())) {
            return cached;
        }

        // blob 文件名总是由模板 ID 推导，索引里的 blobFile 只做校验
        String blobFile = blobFileName(templateId);
        if (!blobFile.equals(indexed.getBlobFile())) {
            logger.warn("Index entry for {} names blob {}, expected {}; treating as miss",
                templateId, indexed.getBlobFile(), blobFile);
            return null;
        }
        Path blob = directory.resolve(blobFile);
        try {
            FeatureCacheEntry entry = FeatureBlobCodec.decode(Files.readAllBytes(blob));
            if (!expectedHash.equals(entry.getContentHash())) {
                logger.warn("Cache blob {} belongs to a different content hash, ignoring", blob.getFileName());
                return null;
            }
            memory.put(templateId, entry);
            return entry;
        } catch (IOException e) {
            logger.warn("Cannot read cache blob {} for {}: {}", blob.getFileName(), templateId, e.getMessage());
            return null;
        } catch (RuntimeException e) {
            logger.warn("Corrupt cache blob {} for {}: {}", blob.getFileName(), templateId, e.toString());
            return null;
        }
    }

    private void persist(String templateId, FeatureCacheEntry entry) {
        String blobFile = blobFileName(templateId);
        Path blob = directory.resolve(blobFile);
        Path tmp = directory.resolve(blobFile + ".tmp");
        try {
            Files.write(tmp, FeatureBlobCodec.encode(entry));
            Files.move(tmp, blob, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            // 下次调用会重新计算
            logger.warn("Failed to write cache blob for {}: {}", templateId, e.getMessage());
            memory.remove(templateId);
            indexEntries.remove(templateId);
            return;
        }

        memory.put(templateId, entry);
        indexEntries.put(templateId,
            new CacheIndex.Entry(entry.getContentHash(), blobFile, entry.getCachedAt(), entry.hasDescriptors()));
        writeIndex();
    }

    private void deleteBlob(String templateId) {
        Path blob = directory.resolve(blobFileName(templateId));
        try {
            Files.deleteIfExists(blob);
        } catch (IOException e) {
            logger.warn("Failed to delete cache blob {}: {}", blob.getFileName(), e.getMessage());
        }
    }

    private void loadIndex() {
        Path indexPath = directory.resolve(INDEX_FILE);
        if (!Files.exists(indexPath)) {
            logger.info("No cache index at {}, starting empty", indexPath);
            return;
        }
        try {
            CacheIndex index = objectMapper.readValue(indexPath.toFile(), CacheIndex.class);
            if (index.getEntries() != null) {
                index.getEntries().forEach((id, entry) -> {
                    if (entry != null && entry.getContentHash() != null && entry.getBlobFile() != null) {
                        indexEntries.put(id, entry);
                    }
                });
            }
            lastIndexUpdate = index.getUpdatedAt();
            logger.info("Loaded cache index with {} entries from {}", indexEntries.size(), indexPath);
        } catch (IOException e) {
            logger.warn("Unreadable cache index {}, starting empty: {}", indexPath, e.getMessage());
        }
    }

    private void writeIndex() {
        synchronized (indexLock) {
            CacheIndex index = new CacheIndex();
            index.setUpdatedAt(Instant.now());
            index.setEntries(new TreeMap<>(indexEntries));

            Path indexPath = directory.resolve(INDEX_FILE);
            Path tmp = directory.resolve(INDEX_FILE + ".tmp");
            try {
                objectMapper.writeValue(tmp.toFile(), index);
                Files.move(tmp, indexPath, StandardCopyOption.REPLACE_EXISTING);
                lastIndexUpdate = index.getUpdatedAt();
            } catch (IOException e) {
                logger.warn("Failed to write cache index {}: {}", indexPath, e.getMessage());
            }
        }
    }

    private Object lockFor(String templateId) {
        return templateLocks.computeIfAbsent(templateId, k -> new Object());
    }

    static String blobFileName(String templateId) {
        return DigestUtils.md5DigestAsHex(templateId.getBytes(StandardCharsets.UTF_8)) + BLOB_SUFFIX;
    }

    /**
     * 未命中时才取图片
     */
    @FunctionalInterface
    private interface ImageSource {
        Mat get() throws ImageDecodeException;
    }
}

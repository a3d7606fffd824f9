package com.edge.equipment.core.cache;

import com.edge.equipment.SyntheticImages;
import com.edge.equipment.config.NativeLibraryLoader;
import com.edge.equipment.core.feature.DescriptorExtractor;
import com.edge.equipment.core.feature.DescriptorSet;
import com.edge.equipment.core.model.ReferenceTemplate;
import com.edge.equipment.util.ImageLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Mat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateCacheTest {

    @TempDir
    Path tempDir;

    private Path cacheDir;
    private HistogramExtractor histogramExtractor;
    private DescriptorExtractor descriptorExtractor;
    private byte[] grayIconBytes;
    private byte[] redIconBytes;

    @BeforeAll
    static void loadOpenCv() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @BeforeEach
    void setUp() {
        cacheDir = tempDir.resolve("cache");
        histogramExtractor = new HistogramExtractor();
        descriptorExtractor = new DescriptorExtractor(1000, 116);
        grayIconBytes = SyntheticImages.encodePng(SyntheticImages.grayIconOnPurple());
        redIconBytes = SyntheticImages.encodePng(SyntheticImages.squareOnPurple(SyntheticImages.RED));
    }

    private TemplateCache newCache() {
        return new TemplateCache(cacheDir, histogramExtractor, descriptorExtractor);
    }

    @Test
    @DisplayName("First lookup computes, second lookup of the same bytes is served from cache")
    void secondLookupIsFresh() throws Exception {
        TemplateCache cache = newCache();

        CacheLookup first = cache.getOrCompute("sword", grayIconBytes);
        CacheLookup second = cache.getOrCompute("sword", grayIconBytes);

        assertThat(first.isFresh()).isFalse();
        assertThat(second.isFresh()).isTrue();
        assertThat(second.getHistogram()).isEqualTo(first.getHistogram());
        assertThat(second.getContentHash()).isEqualTo(TemplateCache.contentHash(grayIconBytes));
        assertThat(cacheDir.resolve(TemplateCache.INDEX_FILE)).exists();
        assertThat(cacheDir.resolve(TemplateCache.blobFileName("sword"))).exists();
    }

    @Test
    @DisplayName("Cached histogram equals a direct computation on the decoded image")
    void cachedHistogramEqualsDirectComputation() throws Exception {
        TemplateCache cache = newCache();
        cache.getOrCompute("sword", grayIconBytes);

        CacheLookup reloaded = newCache().getOrCompute("sword", grayIconBytes);
        PerceptualHistogram direct = histogramExtractor.extract(ImageLoader.decode(grayIconBytes, "direct"));

        assertThat(reloaded.isFresh()).isTrue();
        assertThat(reloaded.getHistogram()).isEqualTo(direct);
    }

    @Test
    @DisplayName("Changed bytes under the same id invalidate the stored hash")
    void staleHashTriggersRecompute() throws Exception {
        TemplateCache cache = newCache();
        CacheLookup original = cache.getOrCompute("shield", grayIconBytes);

        CacheLookup changed = newCache().getOrCompute("shield", redIconBytes);

        assertThat(changed.isFresh()).isFalse();
        assertThat(changed.getHistogram()).isNotEqualTo(original.getHistogram());
        assertThat(newCache().indexedHash("shield")).contains(TemplateCache.contentHash(redIconBytes));
    }

    @Test
    @DisplayName("Corrupt blob is treated as a miss and recomputed")
    void corruptBlobIsRecomputed() throws Exception {
        CacheLookup original = newCache().getOrCompute("ring", grayIconBytes);
        Files.write(cacheDir.resolve(TemplateCache.blobFileName("ring")), new byte[]{1, 2, 3, 4, 5});

        TemplateCache reopened = newCache();
        CacheLookup recomputed = reopened.getOrCompute("ring", grayIconBytes);

        assertThat(recomputed.isFresh()).isFalse();
        assertThat(recomputed.getHistogram()).isEqualTo(original.getHistogram());
        assertThat(reopened.getOrCompute("ring", grayIconBytes).isFresh()).isTrue();
    }

    @Test
    @DisplayName("Unreadable index starts an empty cache")
    void unreadableIndexStartsEmpty() throws Exception {
        newCache().getOrCompute("ring", grayIconBytes);
        Files.writeString(cacheDir.resolve(TemplateCache.INDEX_FILE), "{ not json", StandardCharsets.UTF_8);

        TemplateCache reopened = newCache();

        assertThat(reopened.stats().getEntryCount()).isZero();
        assertThat(reopened.getOrCompute("ring", grayIconBytes).isFresh()).isFalse();
    }

    @Test
    @DisplayName("Index entries pointing outside the cache directory are ignored")
    void indexBlobPathOutsideCacheIsIgnored() throws Exception {
        newCache().getOrCompute("ring", grayIconBytes);
        String blobName = TemplateCache.blobFileName("ring");
        Path outside = tempDir.resolve("outside.bin");
        Files.copy(cacheDir.resolve(blobName), outside);
        Path index = cacheDir.resolve(TemplateCache.INDEX_FILE);
        String json = Files.readString(index, StandardCharsets.UTF_8);
        Files.writeString(index, json.replace(blobName, "../outside.bin"), StandardCharsets.UTF_8);

        TemplateCache reopened = newCache();
        CacheLookup lookup = reopened.getOrCompute("ring", grayIconBytes);

        assertThat(lookup.isFresh()).isFalse();
        assertThat(Files.readString(index, StandardCharsets.UTF_8))
            .contains(blobName)
            .doesNotContain("outside.bin");
        assertThat(newCache().getOrCompute("ring", grayIconBytes).isFresh()).isTrue();
    }

    @Test
    @DisplayName("Invalidate removes the index entry and the blob")
    void invalidateRemovesEntry() throws Exception {
        TemplateCache cache = newCache();
        cache.getOrCompute("amulet", grayIconBytes);

        assertThat(cache.invalidate("amulet")).isTrue();
        assertThat(cache.invalidate("amulet")).isFalse();
        assertThat(cacheDir.resolve(TemplateCache.blobFileName("amulet"))).doesNotExist();
        assertThat(cache.indexedHash("amulet")).isEmpty();
        assertThat(newCache().indexedIds()).doesNotContain("amulet");
    }

    @Test
    @DisplayName("Descriptor sets are persisted and served after a restart")
    void descriptorsArePersisted() throws Exception {
        Mat textured = SyntheticImages.texturedIcon(3);
        byte[] bytes = SyntheticImages.encodePng(textured);
        TemplateCache cache = newCache();
        CacheLookup lookup = cache.getOrCompute("helmet", bytes);
        ReferenceTemplate template = new ReferenceTemplate("helmet", ImageLoader.decode(bytes, "helmet"),
            lookup.getContentHash(), lookup.getHistogram(), lookup.getCachedAt(), null);

        assertThat(cache.getCachedFeatures("helmet")).isEmpty();
        DescriptorSet computed = cache.getOrComputeFeatures(template);

        Optional<DescriptorSet> reloaded = newCache().getCachedFeatures("helmet");
        assertThat(computed.keyPointCount()).isGreaterThan(10);
        assertThat(reloaded).isPresent();
        assertThat(reloaded.get().keyPointCount()).isEqualTo(computed.keyPointCount());
        assertThat(reloaded.get().getDescriptorData()).isEqualTo(computed.getDescriptorData());
        assertThat(newCache().stats().getEntriesWithDescriptors()).isEqualTo(1);
        // 直方图仍然命中
        assertThat(newCache().getOrCompute("helmet", bytes).isFresh()).isTrue();
    }

    @Test
    @DisplayName("retainOnly drops entries whose files left the catalog")
    void retainOnlyPrunesRemovedTemplates() throws Exception {
        TemplateCache cache = newCache();
        cache.getOrCompute("a", grayIconBytes);
        cache.getOrCompute("b", redIconBytes);

        List<String> removed = cache.retainOnly(List.of("a"));

        assertThat(removed).containsExactly("b");
        assertThat(cache.indexedIds()).containsExactly("a");
        assertThat(cache.stats().getEntryCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Concurrent lookups of one template compute it exactly once")
    void concurrentLookupsComputeOnce() throws Exception {
        TemplateCache cache = newCache();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<CacheLookup>> tasks = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                tasks.add(() -> cache.getOrCompute("boots", grayIconBytes));
            }
            List<CacheLookup> lookups = new ArrayList<>();
            for (Future<CacheLookup> future : pool.invokeAll(tasks)) {
                lookups.add(future.get());
            }

            assertThat(lookups).filteredOn(l -> !l.isFresh()).hasSize(1);
            assertThat(lookups).extracting(CacheLookup::getHistogram).containsOnly(lookups.get(0).getHistogram());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("A cache directory that cannot be created is a configuration error")
    void unusableDirectoryIsFatal() throws Exception {
        Path plainFile = tempDir.resolve("not-a-directory");
        Files.writeString(plainFile, "x");

        assertThatThrownBy(() -> new TemplateCache(plainFile, histogramExtractor, descriptorExtractor))
            .isInstanceOf(CacheConfigurationException.class);
    }
}

package com.edge.equipment.service;

import com.edge.equipment.config.YamlConfig;
import com.edge.equipment.core.cache.CacheLookup;
import com.edge.equipment.core.cache.TemplateCache;
import com.edge.equipment.core.model.ReferenceTemplate;
import com.edge.equipment.util.ImageDecodeException;
import com.edge.equipment.util.ImageLoader;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 基准装备目录服务
 * <p>
 * 负责扫描目录、通过 TemplateCache 刷新缓存并加载模板，以及检查目录相对缓存索引的变化
 */
@Service
public class CatalogService {
    private static final Logger logger = LoggerFactory.getLogger(CatalogService.class);

    @Autowired
    private TemplateCache templateCache;

    @Autowired
    private YamlConfig yamlConfig;

    /**
     * 请求未指定目录时使用配置的基准目录
     */
    public Path resolveCatalogDirectory(String directory) {
        if (directory == null || directory.isBlank()) {
            return Paths.get(yamlConfig.getCatalog().getDirectory());
        }
        return Paths.get(directory);
    }

    /**
     * 列出目录下支持的图片文件（不递归），按文件名排序
     *
     * @param role 用于错误信息，如 "Catalog"、"Probe"
     */
    public List<Path> listImages(Path directory, String role) {
        if (directory == null || !Files.exists(directory)) {
            throw new CatalogConfigurationException(role + " directory does not exist: " + directory);
        }
        if (!Files.isDirectory(directory)) {
            throw new CatalogConfigurationException(role + " path is not a directory: " + directory);
        }

        try (Stream<Path> stream = Files.list(directory)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(ImageLoader::isSupportedImage)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new CatalogConfigurationException("Cannot list " + role.toLowerCase() + " directory "
                + directory + ": " + e.getMessage());
        }
    }

    /**
     * 刷新缓存并加载整个目录
     * <p>
     * 内容未变的模板直接复用缓存，变化或新增的同步重算；目录中已不存在的模板从缓存中移除。
     * 读取或解码失败的文件记入报告并跳过。
     *
     * @param forceRecompute 为 true 时忽略已有缓存全部重算
     */
    public CatalogLoad loadCatalog(Path directory, boolean forceRecompute) {
        List<Path> files = listImages(directory, "Catalog");
        long startTime = System.currentTimeMillis();
        logger.info("Loading catalog {} ({} files, forceRecompute={})", directory, files.size(), forceRecompute);

        BuildReport report = new BuildReport();
        report.total = files.size();
        List<ReferenceTemplate> templates = new ArrayList<>(files.size());
        Set<String> liveIds = new LinkedHashSet<>();

        for (Path file : files) {
            String templateId = ImageLoader.idOf(file);
            if (!liveIds.add(templateId)) {
                logger.error("Duplicate template id {} ({}), skipping", templateId, file.getFileName());
                report.fail(file.getFileName().toString(), "Duplicate template id: " + templateId);
                continue;
            }

            Mat pixels = null;
            try {
                byte[] bytes = ImageLoader.readBytes(file);
                pixels = ImageLoader.decode(bytes, file.toString());
                if (forceRecompute) {
                    templateCache.invalidate(templateId);
                }
                CacheLookup lookup = templateCache.getOrCompute(templateId, bytes, pixels);
                templates.add(new ReferenceTemplate(templateId, pixels, lookup.getContentHash(),
                    lookup.getHistogram(), lookup.getCachedAt(), file));
                if (lookup.isFresh()) {
                    report.reused++;
                } else {
                    report.recomputed++;
                }
                report.succeeded++;
            } catch (ImageDecodeException e) {
                logger.error("Skipping template {}: {}", file.getFileName(), e.getMessage(), e);
                report.fail(file.getFileName().toString(), e.getMessage());
            } catch (RuntimeException e) {
                logger.error("Failed to process template {}", file.getFileName(), e);
                report.fail(file.getFileName().toString(), e.getMessage());
                if (pixels != null) {
                    pixels.release();
                }
            }
        }

        report.removed = templateCache.retainOnly(liveIds);
        report.durationMs = System.currentTimeMillis() - startTime;
        logger.info("Catalog {} loaded: total={}, succeeded={}, failed={}, recomputed={}, reused={}, removed={}, {} ms",
            directory, report.total, report.succeeded, report.failed, report.recomputed, report.reused,
            report.removed.size(), report.durationMs);

        return new CatalogLoad(templates, report);
    }

    /**
     * 对比目录与缓存索引，不修改缓存
     */
    public UpdateReport checkForUpdates(Path directory) {
        List<Path> files = listImages(directory, "Catalog");
        UpdateReport report = new UpdateReport();
        Set<String> seen = new TreeSet<>();

        for (Path file : files) {
            String templateId = ImageLoader.idOf(file);
            if (!seen.add(templateId)) {
                continue;
            }
            byte[] bytes;
            try {
                bytes = ImageLoader.readBytes(file);
            } catch (ImageDecodeException e) {
                logger.warn("Cannot read {} while checking for updates: {}", file.getFileName(), e.getMessage());
                continue;
            }

            Optional<String> indexedHash = templateCache.indexedHash(templateId);
            if (indexedHash.isEmpty()) {
                report.added.add(templateId);
            } else if (!indexedHash.get().equals(TemplateCache.contentHash(bytes))) {
                report.modified.add(templateId);
            }
        }

        for (String cachedId : new TreeSet<>(templateCache.indexedIds())) {
            if (!seen.contains(cachedId)) {
                report.removed.add(cachedId);
            }
        }

        logger.info("Update check for {}: added={}, modified={}, removed={}",
            directory, report.added.size(), report.modified.size(), report.removed.size());
        return report;
    }

    /**
     * 已加载的模板及本次刷新的统计
     * <p>
     * 模板像素由持有者在使用完后通过 {@link #release()} 释放
     */
    public static class CatalogLoad {
        private final List<ReferenceTemplate> templates;
        private final BuildReport report;

        public CatalogLoad(List<ReferenceTemplate> templates, BuildReport report) {
            this.templates = Collections.unmodifiableList(templates);
            this.report = report;
        }

        public List<ReferenceTemplate> getTemplates() { return templates; }

        public BuildReport getReport() { return report; }

        public void release() {
            templates.forEach(ReferenceTemplate::release);
        }
    }

    /**
     * 缓存构建统计
     */
    public static class BuildReport {
        private int total;
        private int succeeded;
        private int failed;
        private int recomputed;
        private int reused;
        private List<String> removed = new ArrayList<>();
        private Map<String, String> failures = new LinkedHashMap<>();
        private long durationMs;

        void fail(String fileName, String reason) {
            failed++;
            failures.put(fileName, reason);
        }

        public int getTotal() { return total; }
        public int getSucceeded() { return succeeded; }
        public int getFailed() { return failed; }
        public int getRecomputed() { return recomputed; }
        public int getReused() { return reused; }
        public List<String> getRemoved() { return removed; }
        public Map<String, String> getFailures() { return failures; }
        public long getDurationMs() { return durationMs; }
    }

    /**
     * 目录相对缓存索引的变化
     */
    public static class UpdateReport {
        private final List<String> added = new ArrayList<>();
        private final List<String> modified = new ArrayList<>();
        private final List<String> removed = new ArrayList<>();

        public boolean hasUpdates() {
            return !added.isEmpty() || !modified.isEmpty() || !removed.isEmpty();
        }

        public List<String> getAdded() { return added; }
        public List<String> getModified() { return modified; }
        public List<String> getRemoved() { return removed; }
    }
}

package com.edge.equipment.service;

import com.edge.equipment.config.YamlConfig;
import com.edge.equipment.core.match.IconMatcher;
import com.edge.equipment.core.match.MatchStrategy;
import com.edge.equipment.core.model.MatchResult;
import com.edge.equipment.core.model.ProbeIcon;
import com.edge.equipment.core.model.ReferenceTemplate;
import com.edge.equipment.util.ImageDecodeException;
import com.edge.equipment.util.ImageLoader;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 装备匹配服务
 * <p>
 * 批量匹配分两个阶段：先加载并刷新基准目录缓存，完成后再把探针分发到固定大小线程池并行匹配。
 * 匹配期间模板只读。每个探针恰好产生一条结果，读取失败的探针记录错误信息。
 */
@Service
public class EquipmentMatchingService {
    private static final Logger logger = LoggerFactory.getLogger(EquipmentMatchingService.class);

    static final String BATCH_INTERRUPTED = "Batch interrupted";

    @Autowired
    private CatalogService catalogService;

    @Autowired
    private List<IconMatcher> matchers;

    @Autowired
    private YamlConfig yamlConfig;

    private final Map<MatchStrategy, IconMatcher> matchersByStrategy = new EnumMap<>(MatchStrategy.class);
    private ExecutorService matchExecutor;

    @PostConstruct
    public void init() {
        for (IconMatcher matcher : matchers) {
            matchersByStrategy.put(matcher.strategy(), matcher);
        }

        int parallelism = yamlConfig.getMatching().getParallelism();
        if (parallelism <= 0) {
            parallelism = Runtime.getRuntime().availableProcessors();
        }
        AtomicInteger threadIndex = new AtomicInteger();
        matchExecutor = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "Match-Worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        logger.info("EquipmentMatchingService ready: strategies={}, parallelism={}",
            matchersByStrategy.keySet(), parallelism);
    }

    @PreDestroy
    public void shutdown() {
        if (matchExecutor != null) {
            matchExecutor.shutdown();
            try {
                if (!matchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    matchExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                matchExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            matchExecutor = null;
        }
    }

    /**
     * 匹配探针目录下的所有图片
     *
     * @param catalogDirectory 为 null 时使用配置的基准目录
     */
    public BatchResult matchDirectory(Path probeDirectory, Path catalogDirectory, MatchStrategy strategy,
                                      boolean diagnostics) {
        IconMatcher matcher = matcherFor(strategy);
        List<Path> probes = catalogService.listImages(probeDirectory, "Probe");
        long startTime = System.currentTimeMillis();

        // 阶段 1：缓存刷新完成后才开始匹配
        CatalogService.CatalogLoad catalog = catalogService.loadCatalog(resolveCatalog(catalogDirectory), false);
        // 任务持读锁使用模板，释放模板前必须拿到写锁
        ReadWriteLock catalogLock = new ReentrantReadWriteLock();
        AtomicBoolean aborted = new AtomicBoolean(false);
        try {
            logger.info("Matching {} probes from {} against {} templates using {}",
                probes.size(), probeDirectory, catalog.getTemplates().size(), matcher.strategy());

            // 阶段 2：并行匹配
            List<Future<MatchResult>> futures = new ArrayList<>(probes.size());
            for (Path probeFile : probes) {
                futures.add(matchExecutor.submit(() -> {
                    catalogLock.readLock().lock();
                    try {
                        if (aborted.get()) {
                            return MatchResult.failed(ImageLoader.idOf(probeFile), BATCH_INTERRUPTED);
                        }
                        return matchProbe(probeFile, catalog.getTemplates(), matcher, diagnostics);
                    } finally {
                        catalogLock.readLock().unlock();
                    }
                }));
            }

            List<MatchResult> results = new ArrayList<>(probes.size());
            for (int i = 0; i < futures.size(); i++) {
                String probeId = ImageLoader.idOf(probes.get(i));
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    logger.error("Matching probe {} failed", probeId, e.getCause());
                    results.add(MatchResult.failed(probeId, String.valueOf(e.getCause().getMessage())));
                } catch (InterruptedException e) {
                    // 未开始的任务取消，已开始的任务在 finally 中等待其结束
                    aborted.set(true);
                    futures.subList(i, futures.size()).forEach(f -> f.cancel(false));
                    logger.warn("Batch interrupted, {} of {} probes left unmatched", futures.size() - i, futures.size());
                    for (int j = i; j < probes.size(); j++) {
                        results.add(MatchResult.failed(ImageLoader.idOf(probes.get(j)), BATCH_INTERRUPTED));
                    }
                    Thread.currentThread().interrupt();
                    break;
                }
            }

            long duration = System.currentTimeMillis() - startTime;
            long accepted = results.stream().filter(MatchResult::isAcceptedByThreshold).count();
            logger.info("Batch finished: {} probes, {} accepted, {} ms", results.size(), accepted, duration);
            return new BatchResult(matcher.strategy(), catalog.getReport(), results, duration);
        } finally {
            // lock() 不响应中断，会等到所有正在匹配的任务结束
            catalogLock.writeLock().lock();
            try {
                catalog.release();
            } finally {
                catalogLock.writeLock().unlock();
            }
        }
    }

    /**
     * 匹配单个探针文件
     */
    public MatchResult matchSingle(Path probeFile, Path catalogDirectory, MatchStrategy strategy, boolean diagnostics) {
        if (probeFile == null || !Files.isRegularFile(probeFile)) {
            throw new CatalogConfigurationException("Probe file does not exist: " + probeFile);
        }
        IconMatcher matcher = matcherFor(strategy);
        CatalogService.CatalogLoad catalog = catalogService.loadCatalog(resolveCatalog(catalogDirectory), false);
        try {
            return matchProbe(probeFile, catalog.getTemplates(), matcher, diagnostics);
        } finally {
            catalog.release();
        }
    }

    MatchResult matchProbe(Path probeFile, List<ReferenceTemplate> templates, IconMatcher matcher, boolean diagnostics) {
        String probeId = ImageLoader.idOf(probeFile);
        ProbeIcon probe;
        try {
            probe = new ProbeIcon(probeId, ImageLoader.read(probeFile), probeFile);
        } catch (ImageDecodeException e) {
            logger.error("Skipping probe {}: {}", probeFile.getFileName(), e.getMessage(), e);
            return MatchResult.failed(probeId, e.getMessage());
        }

        try {
            return matcher.match(probe, templates, diagnostics);
        } catch (RuntimeException e) {
            logger.error("Matching probe {} failed", probeId, e);
            return MatchResult.failed(probeId, e.getMessage());
        } finally {
            probe.release();
        }
    }

    private IconMatcher matcherFor(MatchStrategy strategy) {
        MatchStrategy effective = strategy != null ? strategy : MatchStrategy.PATTERN_COLOR;
        IconMatcher matcher = matchersByStrategy.get(effective);
        if (matcher == null) {
            throw new IllegalArgumentException("No matcher registered for strategy " + effective);
        }
        return matcher;
    }

    private Path resolveCatalog(Path catalogDirectory) {
        return catalogDirectory != null ? catalogDirectory : catalogService.resolveCatalogDirectory(null);
    }

    /**
     * 一次批量匹配的结果
     */
    public static class BatchResult {
        private final MatchStrategy strategy;
        private final CatalogService.BuildReport catalogReport;
        private final List<MatchResult> results;
        private final long durationMs;

        public BatchResult(MatchStrategy strategy, CatalogService.BuildReport catalogReport,
                           List<MatchResult> results, long durationMs) {
            this.strategy = strategy;
            this.catalogReport = catalogReport;
            this.results = results;
            this.durationMs = durationMs;
        }

        public MatchStrategy getStrategy() { return strategy; }

        public CatalogService.BuildReport getCatalogReport() { return catalogReport; }

        public List<MatchResult> getResults() { return results; }

        public long getDurationMs() { return durationMs; }
    }
}

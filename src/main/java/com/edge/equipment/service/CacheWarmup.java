package com.edge.equipment.service;

import com.edge.equipment.config.YamlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * 启动完成后按配置预先构建基准目录缓存
 */
@Component
public class CacheWarmup {
    private static final Logger logger = LoggerFactory.getLogger(CacheWarmup.class);

    @Autowired
    private CatalogService catalogService;

    @Autowired
    private YamlConfig yamlConfig;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        YamlConfig.CacheConfig cacheConfig = yamlConfig.getCache();
        if (!cacheConfig.isAutoBuild()) {
            logger.debug("Cache auto-build disabled");
            return;
        }

        Path catalogDirectory = catalogService.resolveCatalogDirectory(null);
        logger.info("Auto-building feature cache from {}", catalogDirectory);
        try {
            CatalogService.CatalogLoad load = catalogService.loadCatalog(catalogDirectory, cacheConfig.isForceRecompute());
            load.release();
        } catch (CatalogConfigurationException e) {
            logger.error("Cache auto-build skipped: {}", e.getMessage());
        }
    }
}

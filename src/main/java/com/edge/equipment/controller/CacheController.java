package com.edge.equipment.controller;

import com.edge.equipment.core.cache.CacheConfigurationException;
import com.edge.equipment.core.cache.TemplateCache;
import com.edge.equipment.dto.CacheBuildRequest;
import com.edge.equipment.dto.CacheBuildResponse;
import com.edge.equipment.service.CatalogConfigurationException;
import com.edge.equipment.service.CatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * 特征缓存管理 API
 */
@Tag(name = "特征缓存", description = "基准装备特征缓存的构建、状态查询和失效")
@RestController
@RequestMapping("/api/cache")
public class CacheController {
    private static final Logger logger = LoggerFactory.getLogger(CacheController.class);

    @Autowired
    private CatalogService catalogService;

    @Autowired
    private TemplateCache templateCache;

    /**
     * 从基准目录构建缓存
     * <p>
     * 内容未变的模板直接复用，forceRecompute=true 时全部重算
     */
    @Operation(summary = "构建缓存", description = "扫描基准装备目录，按内容哈希刷新特征缓存")
    @PostMapping("/build")
    public ResponseEntity<CacheBuildResponse> build(@RequestBody(required = false) CacheBuildRequest request) {
        CacheBuildRequest effective = request != null ? request : new CacheBuildRequest();
        try {
            Path catalogDirectory = catalogService.resolveCatalogDirectory(effective.getCatalogDirectory());
            logger.info("=== Build Cache: {} (force={}) ===", catalogDirectory, effective.isForceRecompute());

            CatalogService.CatalogLoad load = catalogService.loadCatalog(catalogDirectory, effective.isForceRecompute());
            load.release();
            return ResponseEntity.ok(CacheBuildResponse.success(catalogDirectory.toString(), load.getReport()));

        } catch (CatalogConfigurationException e) {
            logger.warn("Cache build rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(CacheBuildResponse.error(e.getMessage()));
        } catch (CacheConfigurationException e) {
            logger.error("Cache directory unusable", e);
            return ResponseEntity.internalServerError().body(CacheBuildResponse.error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Cache build failed", e);
            return ResponseEntity.internalServerError().body(CacheBuildResponse.error("缓存构建失败: " + e.getMessage()));
        }
    }

    @Operation(summary = "缓存状态", description = "缓存条目数、含描述子条目数、缓存目录和最近一次索引更新时间")
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", templateCache.stats());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "检查更新", description = "对比基准目录与缓存索引，列出新增、修改、删除的模板")
    @GetMapping("/updates")
    public ResponseEntity<Map<String, Object>> updates(@RequestParam(required = false) String catalogDirectory) {
        Map<String, Object> response = new HashMap<>();
        try {
            Path directory = catalogService.resolveCatalogDirectory(catalogDirectory);
            CatalogService.UpdateReport report = catalogService.checkForUpdates(directory);

            response.put("success", true);
            response.put("catalogDirectory", directory.toString());
            response.put("hasUpdates", report.hasUpdates());
            response.put("added", report.getAdded());
            response.put("modified", report.getModified());
            response.put("removed", report.getRemoved());
            return ResponseEntity.ok(response);

        } catch (CatalogConfigurationException e) {
            response.put("success", false);
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        }
    }

    @Operation(summary = "使单个模板缓存失效", description = "删除索引项和 blob，下次访问时重新计算")
    @DeleteMapping("/{templateId}")
    public ResponseEntity<Map<String, Object>> invalidate(@PathVariable String templateId) {
        boolean removed = templateCache.invalidate(templateId);
        if (!removed) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("success", false, "message", "缓存中不存在模板: " + templateId));
        }
        return ResponseEntity.ok(Map.of("success", true, "templateId", templateId));
    }
}

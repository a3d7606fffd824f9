package com.edge.equipment.controller;

import com.edge.equipment.core.cache.CacheConfigurationException;
import com.edge.equipment.core.model.MatchResult;
import com.edge.equipment.dto.MatchRecord;
import com.edge.equipment.dto.MatchRequest;
import com.edge.equipment.dto.MatchResponse;
import com.edge.equipment.dto.SingleMatchRequest;
import com.edge.equipment.service.CatalogConfigurationException;
import com.edge.equipment.service.EquipmentMatchingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * 装备图标匹配 API
 */
@Tag(name = "装备匹配", description = "截图图标与基准装备目录的匹配")
@RestController
@RequestMapping("/api/match")
public class MatchController {
    private static final Logger logger = LoggerFactory.getLogger(MatchController.class);

    @Autowired
    private EquipmentMatchingService matchingService;

    /**
     * 批量匹配探针目录，每个探针返回一条记录
     */
    @Operation(summary = "批量匹配", description = "匹配探针目录下的所有图标，策略可选 PATTERN_COLOR / DESCRIPTOR_GEOMETRIC")
    @PostMapping
    public ResponseEntity<MatchResponse> match(@RequestBody MatchRequest request) {
        if (request.getProbeDirectory() == null || request.getProbeDirectory().isBlank()) {
            return ResponseEntity.badRequest().body(MatchResponse.error("probeDirectory 不能为空"));
        }

        try {
            EquipmentMatchingService.BatchResult batch = matchingService.matchDirectory(
                Paths.get(request.getProbeDirectory()), toPath(request.getCatalogDirectory()),
                request.getStrategy(), request.isDiagnostics());
            return ResponseEntity.ok(MatchResponse.success(batch, request.isDiagnostics()));

        } catch (CatalogConfigurationException | IllegalArgumentException e) {
            logger.warn("Match request rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(MatchResponse.error(e.getMessage()));
        } catch (CacheConfigurationException e) {
            logger.error("Cache directory unusable", e);
            return ResponseEntity.internalServerError().body(MatchResponse.error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Batch match failed", e);
            return ResponseEntity.internalServerError().body(MatchResponse.error("匹配失败: " + e.getMessage()));
        }
    }

    @Operation(summary = "单图匹配", description = "匹配单个探针文件")
    @PostMapping("/single")
    public ResponseEntity<Map<String, Object>> matchSingle(@RequestBody SingleMatchRequest request) {
        Map<String, Object> response = new HashMap<>();
        if (request.getProbePath() == null || request.getProbePath().isBlank()) {
            response.put("success", false);
            response.put("message", "probePath 不能为空");
            return ResponseEntity.badRequest().body(response);
        }

        try {
            MatchResult result = matchingService.matchSingle(Paths.get(request.getProbePath()),
                toPath(request.getCatalogDirectory()), request.getStrategy(), request.isDiagnostics());

            response.put("success", result.getError() == null);
            response.put("data", MatchRecord.from(result, request.isDiagnostics()));
            return ResponseEntity.ok(response);

        } catch (CatalogConfigurationException | IllegalArgumentException e) {
            response.put("success", false);
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            logger.error("Single match failed", e);
            response.put("success", false);
            response.put("message", "匹配失败: " + e.getMessage());
            return ResponseEntity.internalServerError().body(response);
        }
    }

    private static Path toPath(String directory) {
        return directory == null || directory.isBlank() ? null : Paths.get(directory);
    }
}

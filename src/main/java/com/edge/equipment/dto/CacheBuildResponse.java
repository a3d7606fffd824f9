package com.edge.equipment.dto;

import com.edge.equipment.service.CatalogService;

import java.util.List;
import java.util.Map;

/**
 * 缓存构建响应
 */
public class CacheBuildResponse {
    private boolean success;
    private String message;
    private String catalogDirectory;
    private int total;
    private int succeeded;
    private int failed;
    private int recomputed;
    private int reused;
    private List<String> removed;
    private Map<String, String> failures;
    private long durationMs;

    public static CacheBuildResponse success(String catalogDirectory, CatalogService.BuildReport report) {
        CacheBuildResponse response = new CacheBuildResponse();
        response.success = true;
        response.message = report.getFailed() == 0 ? "缓存构建完成" : "缓存构建完成，部分文件失败";
        response.catalogDirectory = catalogDirectory;
        response.total = report.getTotal();
        response.succeeded = report.getSucceeded();
        response.failed = report.getFailed();
        response.recomputed = report.getRecomputed();
        response.reused = report.getReused();
        response.removed = report.getRemoved();
        response.failures = report.getFailures();
        response.durationMs = report.getDurationMs();
        return response;
    }

    public static CacheBuildResponse error(String message) {
        CacheBuildResponse response = new CacheBuildResponse();
        response.success = false;
        response.message = message;
        return response;
    }

    // Getters and Setters
    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getCatalogDirectory() { return catalogDirectory; }
    public void setCatalogDirectory(String catalogDirectory) { this.catalogDirectory = catalogDirectory; }

    public int getTotal() { return total; }
    public void setTotal(int total) { this.total = total; }

    public int getSucceeded() { return succeeded; }
    public void setSucceeded(int succeeded) { this.succeeded = succeeded; }

    public int getFailed() { return failed; }
    public void setFailed(int failed) { this.failed = failed; }

    public int getRecomputed() { return recomputed; }
    public void setRecomputed(int recomputed) { this.recomputed = recomputed; }

    public int getReused() { return reused; }
    public void setReused(int reused) { this.reused = reused; }

    public List<String> getRemoved() { return removed; }
    public void setRemoved(List<String> removed) { this.removed = removed; }

    public Map<String, String> getFailures() { return failures; }
    public void setFailures(Map<String, String> failures) { this.failures = failures; }

    public long getDurationMs() { return durationMs; }
    public void setDurationMs(long durationMs) { this.durationMs = durationMs; }
}

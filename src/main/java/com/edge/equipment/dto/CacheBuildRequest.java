package com.edge.equipment.dto;

/**
 * 缓存构建请求
 */
public class CacheBuildRequest {
    // 为空时使用配置的基准目录
    private String catalogDirectory;
    private boolean forceRecompute = false;

    public String getCatalogDirectory() { return catalogDirectory; }
    public void setCatalogDirectory(String catalogDirectory) { this.catalogDirectory = catalogDirectory; }

    public boolean isForceRecompute() { return forceRecompute; }
    public void setForceRecompute(boolean forceRecompute) { this.forceRecompute = forceRecompute; }
}

package com.edge.equipment.dto;

import com.edge.equipment.core.match.MatchStrategy;

/**
 * 批量匹配请求
 */
public class MatchRequest {
    private String probeDirectory;
    // 为空时使用配置的基准目录
    private String catalogDirectory;
    private MatchStrategy strategy = MatchStrategy.PATTERN_COLOR;
    // 返回所有模板的评分
    private boolean diagnostics = false;

    public String getProbeDirectory() { return probeDirectory; }
    public void setProbeDirectory(String probeDirectory) { this.probeDirectory = probeDirectory; }

    public String getCatalogDirectory() { return catalogDirectory; }
    public void setCatalogDirectory(String catalogDirectory) { this.catalogDirectory = catalogDirectory; }

    public MatchStrategy getStrategy() { return strategy; }
    public void setStrategy(MatchStrategy strategy) { this.strategy = strategy; }

    public boolean isDiagnostics() { return diagnostics; }
    public void setDiagnostics(boolean diagnostics) { this.diagnostics = diagnostics; }
}

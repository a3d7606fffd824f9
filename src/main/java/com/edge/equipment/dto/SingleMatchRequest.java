package com.edge.equipment.dto;

import com.edge.equipment.core.match.MatchStrategy;

/**
 * 单个探针匹配请求
 */
public class SingleMatchRequest {
    private String probePath;
    private String catalogDirectory;
    private MatchStrategy strategy = MatchStrategy.PATTERN_COLOR;
    private boolean diagnostics = false;

    public String getProbePath() { return probePath; }
    public void setProbePath(String probePath) { this.probePath = probePath; }

    public String getCatalogDirectory() { return catalogDirectory; }
    public void setCatalogDirectory(String catalogDirectory) { this.catalogDirectory = catalogDirectory; }

    public MatchStrategy getStrategy() { return strategy; }
    public void setStrategy(MatchStrategy strategy) { this.strategy = strategy; }

    public boolean isDiagnostics() { return diagnostics; }
    public void setDiagnostics(boolean diagnostics) { this.diagnostics = diagnostics; }
}

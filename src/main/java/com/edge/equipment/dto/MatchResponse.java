package com.edge.equipment.dto;

import com.edge.equipment.core.match.MatchStrategy;
import com.edge.equipment.service.EquipmentMatchingService;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 批量匹配响应
 */
public class MatchResponse {
    private boolean success;
    private String message;
    private MatchStrategy strategy;
    private int probeCount;
    private int acceptedCount;
    private int templateCount;
    private long durationMs;
    private List<MatchRecord> records;

    public static MatchResponse success(EquipmentMatchingService.BatchResult batch, boolean diagnostics) {
        MatchResponse response = new MatchResponse();
        response.success = true;
        response.message = "匹配完成";
        response.strategy = batch.getStrategy();
        response.records = batch.getResults().stream()
            .map(result -> MatchRecord.from(result, diagnostics))
            .collect(Collectors.toList());
        response.probeCount = response.records.size();
        response.acceptedCount = (int) response.records.stream().filter(MatchRecord::isAccepted).count();
        response.templateCount = batch.getCatalogReport().getSucceeded();
        response.durationMs = batch.getDurationMs();
        return response;
    }

    public static MatchResponse error(String message) {
        MatchResponse response = new MatchResponse();
        response.success = false;
        response.message = message;
        return response;
    }

    // Getters and Setters
    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public MatchStrategy getStrategy() { return strategy; }
    public void setStrategy(MatchStrategy strategy) { this.strategy = strategy; }

    public int getProbeCount() { return probeCount; }
    public void setProbeCount(int probeCount) { this.probeCount = probeCount; }

    public int getAcceptedCount() { return acceptedCount; }
    public void setAcceptedCount(int acceptedCount) { this.acceptedCount = acceptedCount; }

    public int getTemplateCount() { return templateCount; }
    public void setTemplateCount(int templateCount) { this.templateCount = templateCount; }

    public long getDurationMs() { return durationMs; }
    public void setDurationMs(long durationMs) { this.durationMs = durationMs; }

    public List<MatchRecord> getRecords() { return records; }
    public void setRecords(List<MatchRecord> records) { this.records = records; }
}

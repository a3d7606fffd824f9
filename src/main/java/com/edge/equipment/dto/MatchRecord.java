package com.edge.equipment.dto;

import com.edge.equipment.core.match.DescriptorMatchOutcome;
import com.edge.equipment.core.model.MatchCandidate;
import com.edge.equipment.core.model.MatchResult;
import com.edge.equipment.core.model.MatchedBy;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 单个探针的输出记录
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MatchRecord {
    private String probeId;
    private String bestTemplateId;
    private double compositeScore;
    private Double patternScore;
    private Double colorScore;
    private MatchedBy matchedBy;
    private boolean accepted;
    private String error;
    private DescriptorMatchOutcome descriptor;
    private List<MatchCandidate> candidates;

    public static MatchRecord from(MatchResult result, boolean diagnostics) {
        MatchRecord record = new MatchRecord();
        record.probeId = result.getProbeId();
        record.bestTemplateId = result.getBestTemplateId();
        record.compositeScore = result.getCompositeScore();
        record.matchedBy = result.getMatchedBy();
        record.accepted = result.isAcceptedByThreshold();
        record.error = result.getError();
        record.descriptor = result.getDescriptorOutcome();

        MatchCandidate best = result.getBestCandidate();
        if (best != null && result.getMatchedBy() != MatchedBy.DESCRIPTOR_GEOMETRIC) {
            record.patternScore = best.getPatternScore();
            record.colorScore = best.getColorScore();
        }
        if (diagnostics) {
            record.candidates = result.getCandidates();
        }
        return record;
    }

    public String getProbeId() { return probeId; }
    public void setProbeId(String probeId) { this.probeId = probeId; }

    public String getBestTemplateId() { return bestTemplateId; }
    public void setBestTemplateId(String bestTemplateId) { this.bestTemplateId = bestTemplateId; }

    public double getCompositeScore() { return compositeScore; }
    public void setCompositeScore(double compositeScore) { this.compositeScore = compositeScore; }

    public Double getPatternScore() { return patternScore; }
    public void setPatternScore(Double patternScore) { this.patternScore = patternScore; }

    public Double getColorScore() { return colorScore; }
    public void setColorScore(Double colorScore) { this.colorScore = colorScore; }

    public MatchedBy getMatchedBy() { return matchedBy; }
    public void setMatchedBy(MatchedBy matchedBy) { this.matchedBy = matchedBy; }

    public boolean isAccepted() { return accepted; }
    public void setAccepted(boolean accepted) { this.accepted = accepted; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public DescriptorMatchOutcome getDescriptor() { return descriptor; }
    public void setDescriptor(DescriptorMatchOutcome descriptor) { this.descriptor = descriptor; }

    public List<MatchCandidate> getCandidates() { return candidates; }
    public void setCandidates(List<MatchCandidate> candidates) { this.candidates = candidates; }
}

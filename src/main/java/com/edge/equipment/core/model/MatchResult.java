package com.edge.equipment.core.model;

import com.edge.equipment.core.match.DescriptorMatchOutcome;

import java.util.Collections;
import java.util.List;

/**
 * 一个探针的最终匹配结果
 * <p>
 * 每个探针恰好产生一条结果：无模板、全部失败或解码失败时 bestCandidate 为 null
 */
public class MatchResult {
    private String probeId;
    private MatchCandidate bestCandidate;
    private MatchedBy matchedBy;
    private boolean acceptedByThreshold;
    private List<MatchCandidate> candidates = Collections.emptyList();
    private DescriptorMatchOutcome descriptorOutcome;
    private String error;

    public static MatchResult of(String probeId, MatchCandidate best, MatchedBy matchedBy, boolean accepted) {
        MatchResult result = new MatchResult();
        result.probeId = probeId;
        result.bestCandidate = best;
        result.matchedBy = matchedBy;
        result.acceptedByThreshold = accepted;
        return result;
    }

    /**
     * 没有任何可用匹配，置信度为 0
     */
    public static MatchResult noMatch(String probeId, MatchedBy matchedBy) {
        MatchResult result = new MatchResult();
        result.probeId = probeId;
        result.matchedBy = matchedBy;
        result.acceptedByThreshold = false;
        return result;
    }

    /**
     * 探针本身无法处理（读取/解码失败）
     */
    public static MatchResult failed(String probeId, String error) {
        MatchResult result = new MatchResult();
        result.probeId = probeId;
        result.acceptedByThreshold = false;
        result.error = error;
        return result;
    }

    public boolean hasMatch() {
        return bestCandidate != null;
    }

    public String getBestTemplateId() {
        return bestCandidate != null ? bestCandidate.getTemplateId() : null;
    }

    public double getCompositeScore() {
        return bestCandidate != null ? bestCandidate.getCompositeScore() : 0.0;
    }

    public String getProbeId() { return probeId; }
    public void setProbeId(String probeId) { this.probeId = probeId; }

    public MatchCandidate getBestCandidate() { return bestCandidate; }
    public void setBestCandidate(MatchCandidate bestCandidate) { this.bestCandidate = bestCandidate; }

    public MatchedBy getMatchedBy() { return matchedBy; }
    public void setMatchedBy(MatchedBy matchedBy) { this.matchedBy = matchedBy; }

    public boolean isAcceptedByThreshold() { return acceptedByThreshold; }
    public void setAcceptedByThreshold(boolean acceptedByThreshold) { this.acceptedByThreshold = acceptedByThreshold; }

    public List<MatchCandidate> getCandidates() { return candidates; }
    public void setCandidates(List<MatchCandidate> candidates) { this.candidates = candidates; }

    public DescriptorMatchOutcome getDescriptorOutcome() { return descriptorOutcome; }
    public void setDescriptorOutcome(DescriptorMatchOutcome descriptorOutcome) { this.descriptorOutcome = descriptorOutcome; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
}

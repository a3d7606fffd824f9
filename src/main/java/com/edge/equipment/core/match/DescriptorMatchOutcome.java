package com.edge.equipment.core.match;

/**
 * 描述子匹配一次尝试的结果
 * <p>
 * 状态流转：EXTRACT → MATCH → VERIFY → VERIFIED | FAILED，FAILED 的置信度恒为 0
 */
public class DescriptorMatchOutcome {
    private String templateId;
    private Status status;
    private FailureReason failureReason;
    private double confidence;
    private boolean validMatch;
    private int probeKeyPoints;
    private int templateKeyPoints;
    private int knnPairs;
    private int goodMatches;
    private int inliers;

    public enum Status {
        VERIFIED,
        FAILED
    }

    /**
     * 按流水线阶段先后排列
     */
    public enum FailureReason {
        /** 任意一侧关键点少于下限 */
        INSUFFICIENT_KEYPOINTS,
        /** 比率测试后的匹配对不足 */
        INSUFFICIENT_MATCHES,
        /** RANSAC 无法估计单应性 */
        NO_HOMOGRAPHY,
        /** 内点数不足 */
        INSUFFICIENT_INLIERS
    }

    public DescriptorMatchOutcome() {
    }

    public static DescriptorMatchOutcome verified(int probeKeyPoints, int templateKeyPoints, int knnPairs,
                                                  int goodMatches, int inliers, double confidence,
                                                  double validConfidence) {
        DescriptorMatchOutcome outcome = new DescriptorMatchOutcome();
        outcome.status = Status.VERIFIED;
        outcome.probeKeyPoints = probeKeyPoints;
        outcome.templateKeyPoints = templateKeyPoints;
        outcome.knnPairs = knnPairs;
        outcome.goodMatches = goodMatches;
        outcome.inliers = inliers;
        outcome.confidence = confidence;
        outcome.validMatch = confidence >= validConfidence;
        return outcome;
    }

    public static DescriptorMatchOutcome failed(FailureReason reason, int probeKeyPoints, int templateKeyPoints,
                                                int knnPairs, int goodMatches, int inliers) {
        DescriptorMatchOutcome outcome = new DescriptorMatchOutcome();
        outcome.status = Status.FAILED;
        outcome.failureReason = reason;
        outcome.probeKeyPoints = probeKeyPoints;
        outcome.templateKeyPoints = templateKeyPoints;
        outcome.knnPairs = knnPairs;
        outcome.goodMatches = goodMatches;
        outcome.inliers = inliers;
        outcome.confidence = 0.0;
        outcome.validMatch = false;
        return outcome;
    }

    public DescriptorMatchOutcome forTemplate(String templateId) {
        this.templateId = templateId;
        return this;
    }

    public boolean isVerified() {
        return status == Status.VERIFIED;
    }

    public String getTemplateId() { return templateId; }
    public void setTemplateId(String templateId) { this.templateId = templateId; }

    public Status getStatus() { return status; }
    public void setStatus(Status status) { this.status = status; }

    public FailureReason getFailureReason() { return failureReason; }
    public void setFailureReason(FailureReason failureReason) { this.failureReason = failureReason; }

    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }

    public boolean isValidMatch() { return validMatch; }
    public void setValidMatch(boolean validMatch) { this.validMatch = validMatch; }

    public int getProbeKeyPoints() { return probeKeyPoints; }
    public void setProbeKeyPoints(int probeKeyPoints) { this.probeKeyPoints = probeKeyPoints; }

    public int getTemplateKeyPoints() { return templateKeyPoints; }
    public void setTemplateKeyPoints(int templateKeyPoints) { this.templateKeyPoints = templateKeyPoints; }

    public int getKnnPairs() { return knnPairs; }
    public void setKnnPairs(int knnPairs) { this.knnPairs = knnPairs; }

    public int getGoodMatches() { return goodMatches; }
    public void setGoodMatches(int goodMatches) { this.goodMatches = goodMatches; }

    public int getInliers() { return inliers; }
    public void setInliers(int inliers) { this.inliers = inliers; }

    @Override
    public String toString() {
        return status == Status.VERIFIED
            ? String.format("VERIFIED{%s, confidence=%.2f, good=%d, inliers=%d}", templateId, confidence, goodMatches, inliers)
            : String.format("FAILED{%s, %s, good=%d, inliers=%d}", templateId, failureReason, goodMatches, inliers);
    }
}

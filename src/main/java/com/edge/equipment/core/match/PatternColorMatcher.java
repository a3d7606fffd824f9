package com.edge.equipment.core.match;

import com.edge.equipment.core.cache.HistogramExtractor;
import com.edge.equipment.core.cache.PerceptualHistogram;
import com.edge.equipment.core.model.MatchCandidate;
import com.edge.equipment.core.model.MatchResult;
import com.edge.equipment.core.model.MatchedBy;
import com.edge.equipment.core.model.ProbeIcon;
import com.edge.equipment.core.model.ReferenceTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 两阶段匹配：图案初筛 → 颜色复核 → 综合评分
 */
public class PatternColorMatcher implements IconMatcher {
    private static final Logger logger = LoggerFactory.getLogger(PatternColorMatcher.class);

    private final PatternMatcher patternMatcher;
    private final ColorVerifier colorVerifier;
    private final CompositeScorer scorer;
    private final HistogramExtractor histogramExtractor;

    public PatternColorMatcher(PatternMatcher patternMatcher, ColorVerifier colorVerifier,
                               CompositeScorer scorer, HistogramExtractor histogramExtractor) {
        this.patternMatcher = patternMatcher;
        this.colorVerifier = colorVerifier;
        this.scorer = scorer;
        this.histogramExtractor = histogramExtractor;
    }

    @Override
    public MatchStrategy strategy() {
        return MatchStrategy.PATTERN_COLOR;
    }

    @Override
    public MatchResult match(ProbeIcon probe, List<ReferenceTemplate> catalog, boolean diagnostics) {
        if (catalog.isEmpty()) {
            logger.warn("Empty catalog, probe {} cannot be matched", probe.getId());
            return MatchResult.noMatch(probe.getId(), MatchedBy.PATTERN_ONLY);
        }

        // 诊断模式下额外给出缓存直方图的相关系数
        PerceptualHistogram probeHistogram = diagnostics ? histogramExtractor.extract(probe.getPixels()) : null;

        // 阶段 1：图案得分
        Map<String, ReferenceTemplate> templatesById = new HashMap<>();
        List<MatchCandidate> scored = new ArrayList<>(catalog.size());
        for (ReferenceTemplate template : catalog) {
            templatesById.put(template.getId(), template);
            double patternScore = patternMatcher.matchPattern(probe.getPixels(), template.getPixels());
            MatchCandidate candidate = MatchCandidate.patternOnly(template.getId(), patternScore);
            if (probeHistogram != null && template.getPerceptualHistogram() != null) {
                candidate.setPerceptualSimilarity(probeHistogram.correlation(template.getPerceptualHistogram()));
            }
            scored.add(candidate);
            logger.debug("{} vs {}: pattern={}", probe.getId(), template.getId(), String.format("%.2f", patternScore));
        }

        List<MatchCandidate> candidates = scorer.selectCandidates(scored);

        MatchResult result;
        List<MatchCandidate> refined = new ArrayList<>();
        if (candidates.isEmpty()) {
            MatchCandidate best = scorer.fallback(scored);
            logger.info("{}: no template reached pattern threshold {}, falling back to {} ({})",
                probe.getId(), scorer.getPatternThreshold(), best.getTemplateId(),
                String.format("%.2f", best.getPatternScore()));
            result = MatchResult.of(probe.getId(), best, MatchedBy.PATTERN_ONLY, scorer.accepts(best.getCompositeScore()));
        } else {
            // 阶段 2：只对候选做颜色复核
            for (MatchCandidate candidate : candidates) {
                ReferenceTemplate template = templatesById.get(candidate.getTemplateId());
                ColorVerification verification = colorVerifier.verify(probe.getPixels(), template.getPixels());
                MatchCandidate scoredCandidate = scorer.refine(candidate, verification);
                refined.add(scoredCandidate);
                logger.debug("{} vs {}: {} -> composite={}", probe.getId(), template.getId(), verification,
                    String.format("%.2f", scoredCandidate.getCompositeScore()));
            }
            MatchCandidate best = scorer.best(refined);
            result = MatchResult.of(probe.getId(), best, MatchedBy.PATTERN_AND_COLOR,
                scorer.accepts(best.getCompositeScore()));
            logger.info("{}: {} candidates, best {} (pattern={}, color={}, composite={})",
                probe.getId(), candidates.size(), best.getTemplateId(),
                String.format("%.2f", best.getPatternScore()), String.format("%.4f", best.getColorScore()),
                String.format("%.2f", best.getCompositeScore()));
        }

        if (diagnostics) {
            result.setCandidates(allCandidates(scored, refined));
        }
        return result;
    }

    /**
     * 复核过的候选替换其图案分版本，整体按综合分排序
     */
    private List<MatchCandidate> allCandidates(List<MatchCandidate> scored, List<MatchCandidate> refined) {
        Set<String> refinedIds = new HashSet<>();
        List<MatchCandidate> all = new ArrayList<>(refined);
        refined.forEach(c -> refinedIds.add(c.getTemplateId()));
        for (MatchCandidate candidate : scored) {
            if (!refinedIds.contains(candidate.getTemplateId())) {
                all.add(candidate);
            }
        }
        all.sort(CompositeScorer.BY_COMPOSITE);
        return all;
    }
}

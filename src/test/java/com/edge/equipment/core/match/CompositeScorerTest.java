package com.edge.equipment.core.match;

import com.edge.equipment.core.model.MatchCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CompositeScorerTest {

    private final CompositeScorer scorer = new CompositeScorer(70.0, 0.65, 0.35, 60.0, false);

    private static MatchCandidate refined(String id, double pattern, double color, double composite) {
        return MatchCandidate.withColor(MatchCandidate.patternOnly(id, pattern),
            new ColorVerification(color, 10.0, 0.4, 0.9, false), composite);
    }

    @Test
    void compositeIsWeightedSum() {
        assertThat(scorer.composite(90.0, 0.7)).isCloseTo(83.0, within(1e-9));
        assertThat(scorer.composite(100.0, 1.0)).isCloseTo(100.0, within(1e-9));
        assertThat(scorer.composite(0.0, 0.0)).isZero();
    }

    @Test
    @DisplayName("Composite rises with either input")
    void compositeIsMonotonic() {
        assertThat(scorer.composite(80.0, 0.5)).isLessThan(scorer.composite(81.0, 0.5));
        assertThat(scorer.composite(80.0, 0.5)).isLessThan(scorer.composite(80.0, 0.51));
    }

    @Test
    void candidatesRequirePatternThreshold() {
        List<MatchCandidate> scored = List.of(
            MatchCandidate.patternOnly("a", 69.99),
            MatchCandidate.patternOnly("b", 70.0),
            MatchCandidate.patternOnly("c", 95.0));

        assertThat(scorer.selectCandidates(scored)).extracting(MatchCandidate::getTemplateId)
            .containsExactly("b", "c");
    }

    @Test
    @DisplayName("Raising the pattern threshold never adds candidates")
    void candidateSetShrinksWithThreshold() {
        List<MatchCandidate> scored = List.of(
            MatchCandidate.patternOnly("a", 45.0),
            MatchCandidate.patternOnly("b", 71.0),
            MatchCandidate.patternOnly("c", 88.0),
            MatchCandidate.patternOnly("d", 99.5));

        int previous = Integer.MAX_VALUE;
        for (double threshold = 0.0; threshold <= 100.0; threshold += 5.0) {
            int size = new CompositeScorer(threshold, 0.65, 0.35, 60.0, false).selectCandidates(scored).size();
            assertThat(size).isLessThanOrEqualTo(previous);
            previous = size;
        }
    }

    @Test
    @DisplayName("Fallback keeps the pattern score as composite")
    void fallbackPicksHighestPattern() {
        MatchCandidate best = scorer.fallback(List.of(
            MatchCandidate.patternOnly("low", 55.0),
            MatchCandidate.patternOnly("high", 65.0)));

        assertThat(best.getTemplateId()).isEqualTo("high");
        assertThat(best.getCompositeScore()).isEqualTo(65.0);
        assertThat(best.getColorScore()).isNull();
        assertThat(scorer.accepts(best.getCompositeScore())).isTrue();
    }

    @Test
    @DisplayName("Ties break on pattern score, then on template id")
    void tieBreaking() {
        MatchCandidate higherPattern = refined("z", 90.0, 0.5, 80.0);
        MatchCandidate lowerPattern = refined("a", 80.0, 0.7, 80.0);
        assertThat(scorer.best(List.of(lowerPattern, higherPattern)).getTemplateId()).isEqualTo("z");

        MatchCandidate first = refined("alpha", 90.0, 0.5, 80.0);
        MatchCandidate second = refined("beta", 90.0, 0.5, 80.0);
        assertThat(scorer.best(List.of(second, first)).getTemplateId()).isEqualTo("alpha");

        assertThat(scorer.fallback(List.of(MatchCandidate.patternOnly("b", 50.0),
            MatchCandidate.patternOnly("a", 50.0))).getTemplateId()).isEqualTo("a");
    }

    @Test
    void lowScorePenaltyIsOptional() {
        CompositeScorer penalising = new CompositeScorer(70.0, 0.65, 0.35, 60.0, true);

        assertThat(penalising.composite(50.0, 0.4)).isCloseTo(20.45, within(1e-9));
        assertThat(scorer.composite(50.0, 0.4)).isCloseTo(46.5, within(1e-9));
        // 高分不受影响
        assertThat(penalising.composite(90.0, 0.7)).isCloseTo(scorer.composite(90.0, 0.7), within(1e-9));
    }

    @Test
    void acceptThresholdIsInclusive() {
        assertThat(scorer.accepts(60.0)).isTrue();
        assertThat(scorer.accepts(59.99)).isFalse();
    }

    @Test
    void emptyInputIsRejected() {
        assertThatThrownBy(() -> scorer.best(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scorer.fallback(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}

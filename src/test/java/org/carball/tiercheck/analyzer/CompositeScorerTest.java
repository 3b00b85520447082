package org.carball.tiercheck.analyzer;

import org.carball.tiercheck.config.ComplexityValidationConfig;
import org.carball.tiercheck.config.FrameworkWeights;
import org.carball.tiercheck.model.metrics.CampbellAttributes;
import org.carball.tiercheck.model.metrics.CoordinativeComplexity;
import org.carball.tiercheck.model.metrics.DynamicComplexity;
import org.carball.tiercheck.model.metrics.ElementInteractivityAnalysis;
import org.carball.tiercheck.model.metrics.LiuLiDimensions;
import org.carball.tiercheck.model.metrics.NoveltyLevel;
import org.carball.tiercheck.model.metrics.TimePressure;
import org.carball.tiercheck.model.metrics.UncertaintyLevel;
import org.carball.tiercheck.model.metrics.WoodMetrics;
import org.carball.tiercheck.model.scoring.ComplexityScore;
import org.carball.tiercheck.model.scoring.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class CompositeScorerTest {

    private CompositeScorer scorer;
    private ComplexityValidationConfig config;

    @BeforeEach
    void setUp() {
        scorer = new CompositeScorer();
        config = ComplexityValidationConfig.defaults();
    }

    @Test
    void shouldUseNormalizedDefaultWeights() {
        FrameworkWeights weights = FrameworkWeights.defaults();

        assertThat(weights.isNormalized()).isTrue();
        assertThat(weights.getLiuLi()).isEqualTo(0.30);
    }

    @Test
    void shouldScoreSimpleScenario() {
        // When
        ComplexityScore score = scorer.calculateCompositeScore(Tier.SIMPLE,
                simpleWood(), plainCampbell(), simpleLiuLi(), fullInteractivity(), config);

        // Then
        assertThat(score.calculationBreakdown().woodScore()).isEqualTo(3.0);
        assertThat(score.calculationBreakdown().campbellScore()).isZero();
        assertThat(score.calculationBreakdown().liuLiScore()).isEqualTo(1.3);
        assertThat(score.calculationBreakdown().interactivityScore()).isEqualTo(10.0);
        assertThat(score.overallScore()).isEqualTo(3.1); // 0.75 + 0 + 0.39 + 2.0
        assertThat(score.predictedTier()).isEqualTo(Tier.SIMPLE);
        assertThat(score.tierMatch()).isTrue();
        assertThat(score.confidenceScore()).isEqualTo(1.0);
        assertThat(score.analyzerVersion()).isEqualTo(CompositeScorer.ANALYZER_VERSION);
        assertThat(score.rejectionReasons()).containsExactly(
                "Element interactivity ratio too high for simple tier",
                "Element interactivity does not match simple tier expectations");
    }

    @Test
    void shouldListCriteriaInEvaluationOrder() {
        // When
        ComplexityScore score = scorer.calculateCompositeScore(Tier.SIMPLE,
                simpleWood(), plainCampbell(), simpleLiuLi(), fullInteractivity(), config);

        // Then
        assertThat(score.validationFlags().criteriaChecks().keySet()).containsExactly(
                CompositeScorer.WOOD_DISTINCT_ACTS_MIN,
                CompositeScorer.WOOD_DISTINCT_ACTS_MAX,
                CompositeScorer.WOOD_COORDINATIVE,
                CompositeScorer.WOOD_DYNAMIC,
                CompositeScorer.CAMPBELL_MULTIPLE_PATHS,
                CompositeScorer.CAMPBELL_MULTIPLE_OUTCOMES,
                CompositeScorer.CAMPBELL_CONFLICTING,
                CompositeScorer.CAMPBELL_UNCERTAINTY,
                CompositeScorer.LIULI_VARIETY_MIN,
                CompositeScorer.LIULI_VARIETY_MAX,
                CompositeScorer.LIULI_NOVELTY,
                CompositeScorer.LIULI_RELATIONSHIPS_MIN,
                CompositeScorer.LIULI_RELATIONSHIPS_MAX,
                CompositeScorer.INTERACTIVITY_MIN,
                CompositeScorer.INTERACTIVITY_MAX,
                CompositeScorer.SCORE_MIN,
                CompositeScorer.SCORE_MAX);
        assertThat(score.validationFlags().passedCount()).isEqualTo(16);
        assertThat(score.validationFlags().meetsMinimumCriteria()).isTrue();
        assertThat(score.validationFlags().hasRequiredAttributes()).isTrue();
        assertThat(score.validationFlags().withinTierBounds()).isTrue();
        assertThat(score.validationFlags().interactivityMatches()).isFalse();
    }

    @Test
    void shouldExplainTierMismatch() {
        // When
        ComplexityScore score = scorer.calculateCompositeScore(Tier.COMPLEX,
                simpleWood(), plainCampbell(), simpleLiuLi(), fullInteractivity(), config);

        // Then
        assertThat(score.tierMatch()).isFalse();
        assertThat(score.rejectionReasons().get(0))
                .isEqualTo("Tier mismatch: intended \"complex\" but analysis predicts \"simple\" (score: 3.1)");
        assertThat(score.rejectionReasons()).contains(
                "Requires at least 5 distinct calculation steps for complex tier",
                "Multiple solution paths required for complex tier",
                "Scenario does not meet minimum criteria threshold (60% of tier requirements)",
                "Missing required attributes for complex tier");
        assertThat(score.validationFlags().meetsMinimumCriteria()).isFalse();
    }

    @Test
    void shouldApplyExplicitWeights() {
        // Given
        FrameworkWeights woodOnly = FrameworkWeights.builder()
                .wood(1.0).campbell(0).liuLi(0).interactivity(0)
                .build();

        // When
        ComplexityScore score = scorer.calculateCompositeScore(Tier.SIMPLE,
                simpleWood(), plainCampbell(), simpleLiuLi(), fullInteractivity(), config, woodOnly);

        // Then
        assertThat(score.overallScore()).isEqualTo(3.0);
    }

    @Test
    void shouldKeepConfidenceWithinUnitInterval() {
        // Given
        WoodMetrics wood = WoodMetrics.builder()
                .distinctActs(9).informationCuesPerAct(4.0).totalElements(36)
                .coordinativeComplexity(CoordinativeComplexity.NETWORKED)
                .dynamicComplexity(DynamicComplexity.HIGH)
                .build();
        CampbellAttributes campbell = CampbellAttributes.builder()
                .multiplePaths(true).pathCount(4)
                .multipleOutcomes(true).outcomeCount(3)
                .conflictingInterdependence(true).conflicts(List.of("cost vs quality"))
                .uncertaintyLevel(UncertaintyLevel.HIGH).uncertaintyIndicators(4)
                .campbellType(15)
                .build();
        LiuLiDimensions liuLi = LiuLiDimensions.builder()
                .size(20).variety(0.8).ambiguity(0.7).relationships(0.9).variability(0.6).unreliability(0.5)
                .novelty(NoveltyLevel.NOVEL).incongruity(0.6).actionComplexity(18)
                .timePressure(TimePressure.HIGH)
                .build();
        ElementInteractivityAnalysis interactivity = ElementInteractivityAnalysis.builder()
                .totalElements(36).simultaneousElements(26).interactivityRatio(0.72)
                .dependencyDepth(4).dependencyEdges(12)
                .build();

        // When
        ComplexityScore score = scorer.calculateCompositeScore(Tier.COMPLEX, wood, campbell, liuLi,
                interactivity, config);

        // Then
        assertThat(score.overallScore()).isBetween(21.0, 23.0);
        assertThat(score.predictedTier()).isEqualTo(Tier.MODERATE);
        assertThat(score.confidenceScore()).isBetween(0.0, 1.0);
        assertThat(score.validationFlags().hasRequiredAttributes()).isTrue();
    }

    @Test
    void shouldAcceptWithinAllowedDeviation() {
        ComplexityScore score = scoreOf(Tier.MODERATE, Tier.SIMPLE, 0.8);

        assertThat(CompositeScorer.isValidScenario(score, config)).isTrue();
        assertThat(CompositeScorer.isValidScenario(score, config.toBuilder().strictMode(true).build())).isFalse();
        assertThat(CompositeScorer.isValidScenario(score, config.toBuilder().allowedTierDeviation(0).build()))
                .isFalse();
    }

    @Test
    void shouldRejectLowConfidenceOrDistantTier() {
        assertThat(CompositeScorer.isValidScenario(scoreOf(Tier.SIMPLE, Tier.SIMPLE, 0.5), config)).isFalse();
        assertThat(CompositeScorer.isValidScenario(scoreOf(Tier.COMPLEX, Tier.SIMPLE, 0.9), config)).isFalse();
        assertThat(CompositeScorer.isValidScenario(
                scoreOf(Tier.COMPLEX, Tier.SIMPLE, 0.9), config.toBuilder().allowedTierDeviation(2).build()))
                .isTrue();
    }

    @Test
    void shouldBuildZeroValuedErrorScore() {
        // When
        ComplexityScore score = CompositeScorer.errorScore(Tier.MODERATE, "boom");

        // Then
        assertThat(score.overallScore()).isZero();
        assertThat(score.confidenceScore()).isZero();
        assertThat(score.predictedTier()).isEqualTo(Tier.SIMPLE);
        assertThat(score.intendedTier()).isEqualTo(Tier.MODERATE);
        assertThat(score.tierMatch()).isFalse();
        assertThat(score.rejectionReasons()).containsExactly("Validation error: boom");
        assertThat(score.validationFlags().meetsMinimumCriteria()).isFalse();
        assertThat(score.validationFlags().criteriaChecks()).isEmpty();
    }

    @Test
    void shouldRequireTierSpecificCampbellAttributes() {
        CampbellAttributes uncertainOnly = CampbellAttributes.builder()
                .conflicts(List.of())
                .uncertaintyLevel(UncertaintyLevel.BOUNDED)
                .build();
        CampbellAttributes pathsAndConflict = CampbellAttributes.builder()
                .multiplePaths(true)
                .conflictingInterdependence(true)
                .conflicts(List.of("speed vs accuracy"))
                .uncertaintyLevel(UncertaintyLevel.NONE)
                .build();

        assertThat(CompositeScorer.hasRequiredAttributes(Tier.SIMPLE, plainCampbell())).isTrue();
        assertThat(CompositeScorer.hasRequiredAttributes(Tier.SIMPLE, pathsAndConflict)).isFalse();
        assertThat(CompositeScorer.hasRequiredAttributes(Tier.MODERATE, plainCampbell())).isFalse();
        assertThat(CompositeScorer.hasRequiredAttributes(Tier.MODERATE, uncertainOnly)).isTrue();
        assertThat(CompositeScorer.hasRequiredAttributes(Tier.COMPLEX, uncertainOnly)).isFalse();
        assertThat(CompositeScorer.hasRequiredAttributes(Tier.COMPLEX, pathsAndConflict)).isTrue();
    }

    private static ComplexityScore scoreOf(Tier intended, Tier predicted, double confidence) {
        return CompositeScorer.errorScore(intended, "unused").toBuilder()
                .predictedTier(predicted)
                .tierMatch(intended == predicted)
                .confidenceScore(confidence)
                .build();
    }

    static WoodMetrics simpleWood() {
        return WoodMetrics.builder()
                .distinctActs(2)
                .informationCuesPerAct(1.0)
                .totalElements(2)
                .coordinativeComplexity(CoordinativeComplexity.SEQUENTIAL)
                .dynamicComplexity(DynamicComplexity.STATIC)
                .componentComplexityScore(2.0)
                .build();
    }

    static CampbellAttributes plainCampbell() {
        return CampbellAttributes.builder()
                .pathCount(1)
                .outcomeCount(1)
                .conflicts(List.of())
                .uncertaintyLevel(UncertaintyLevel.NONE)
                .build();
    }

    static LiuLiDimensions simpleLiuLi() {
        return LiuLiDimensions.builder()
                .size(3)
                .novelty(NoveltyLevel.ROUTINE)
                .actionComplexity(2)
                .timePressure(TimePressure.LOW)
                .build();
    }

    static ElementInteractivityAnalysis fullInteractivity() {
        return ElementInteractivityAnalysis.builder()
                .totalElements(2)
                .simultaneousElements(2)
                .interactivityRatio(1.0)
                .build();
    }
}

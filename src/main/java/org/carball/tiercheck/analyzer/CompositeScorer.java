package org.carball.tiercheck.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.tiercheck.config.ComplexityValidationConfig;
import org.carball.tiercheck.config.FrameworkWeights;
import org.carball.tiercheck.config.TierRequirements;
import org.carball.tiercheck.model.metrics.CampbellAttributes;
import org.carball.tiercheck.model.metrics.CoordinativeComplexity;
import org.carball.tiercheck.model.metrics.DynamicComplexity;
import org.carball.tiercheck.model.metrics.ElementInteractivityAnalysis;
import org.carball.tiercheck.model.metrics.LiuLiDimensions;
import org.carball.tiercheck.model.metrics.NoveltyLevel;
import org.carball.tiercheck.model.metrics.TimePressure;
import org.carball.tiercheck.model.metrics.UncertaintyLevel;
import org.carball.tiercheck.model.metrics.WoodMetrics;
import org.carball.tiercheck.model.scoring.Bound;
import org.carball.tiercheck.model.scoring.CalculationBreakdown;
import org.carball.tiercheck.model.scoring.ComplexityScore;
import org.carball.tiercheck.model.scoring.Tier;
import org.carball.tiercheck.model.scoring.ValidationFlags;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fuses the four framework analyses into one weighted score, a predicted tier, a confidence value and
 * named requirement checks against the intended tier.
 */
@Slf4j
public class CompositeScorer {

    public static final String ANALYZER_VERSION = "1.0.0";

    public static final String WOOD_DISTINCT_ACTS_MIN = "wood.distinctActs.min";
    public static final String WOOD_DISTINCT_ACTS_MAX = "wood.distinctActs.max";
    public static final String WOOD_COORDINATIVE = "wood.coordinativeComplexity";
    public static final String WOOD_DYNAMIC = "wood.dynamicComplexity";
    public static final String CAMPBELL_MULTIPLE_PATHS = "campbell.multiplePaths";
    public static final String CAMPBELL_MULTIPLE_OUTCOMES = "campbell.multipleOutcomes";
    public static final String CAMPBELL_CONFLICTING = "campbell.conflictingInterdependence";
    public static final String CAMPBELL_UNCERTAINTY = "campbell.uncertaintyLevel";
    public static final String LIULI_VARIETY_MIN = "liuLi.variety.min";
    public static final String LIULI_VARIETY_MAX = "liuLi.variety.max";
    public static final String LIULI_NOVELTY = "liuLi.novelty";
    public static final String LIULI_RELATIONSHIPS_MIN = "liuLi.relationships.min";
    public static final String LIULI_RELATIONSHIPS_MAX = "liuLi.relationships.max";
    public static final String INTERACTIVITY_MIN = "interactivity.min";
    public static final String INTERACTIVITY_MAX = "interactivity.max";
    public static final String SCORE_MIN = "score.min";
    public static final String SCORE_MAX = "score.max";

    private static final double MINIMUM_CRITERIA_SHARE = 0.6;
    private static final double MARGIN_WIDTH_FACTOR = 0.3;
    private static final double MAX_MARGIN_BONUS = 0.1;
    private static final int COMPLEX_ATTRIBUTES_REQUIRED = 2;

    private final WoodAnalyzer woodAnalyzer;
    private final CampbellAnalyzer campbellAnalyzer;
    private final LiuLiAnalyzer liuLiAnalyzer;
    private final InteractivityAnalyzer interactivityAnalyzer;

    public CompositeScorer() {
        this(new WoodAnalyzer(), new CampbellAnalyzer(), new LiuLiAnalyzer(), new InteractivityAnalyzer());
    }

    public CompositeScorer(WoodAnalyzer woodAnalyzer, CampbellAnalyzer campbellAnalyzer,
                           LiuLiAnalyzer liuLiAnalyzer, InteractivityAnalyzer interactivityAnalyzer) {
        this.woodAnalyzer = woodAnalyzer;
        this.campbellAnalyzer = campbellAnalyzer;
        this.liuLiAnalyzer = liuLiAnalyzer;
        this.interactivityAnalyzer = interactivityAnalyzer;
    }

    public ComplexityScore calculateCompositeScore(Tier intendedTier,
                                                   WoodMetrics wood,
                                                   CampbellAttributes campbell,
                                                   LiuLiDimensions liuLi,
                                                   ElementInteractivityAnalysis interactivity,
                                                   ComplexityValidationConfig config) {
        return calculateCompositeScore(intendedTier, wood, campbell, liuLi, interactivity, config, config.getWeights());
    }

    /**
     * Scores a scenario with explicit framework weights instead of the configured ones.
     */
    public ComplexityScore calculateCompositeScore(Tier intendedTier,
                                                   WoodMetrics wood,
                                                   CampbellAttributes campbell,
                                                   LiuLiDimensions liuLi,
                                                   ElementInteractivityAnalysis interactivity,
                                                   ComplexityValidationConfig config,
                                                   FrameworkWeights weights) {
        Objects.requireNonNull(intendedTier, "intendedTier");

        CalculationBreakdown breakdown = new CalculationBreakdown(
                woodAnalyzer.calculateScore(wood),
                campbellAnalyzer.calculateScore(campbell),
                liuLiAnalyzer.calculateScore(liuLi),
                interactivityAnalyzer.calculateScore(interactivity));

        double weighted = breakdown.woodScore() * weights.getWood()
                + breakdown.campbellScore() * weights.getCampbell()
                + breakdown.liuLiScore() * weights.getLiuLi()
                + breakdown.interactivityScore() * weights.getInteractivity();
        double overallScore = WoodAnalyzer.round1(weighted);

        Tier predictedTier = config.classify(overallScore);

        double confidence = calculateConfidence(overallScore,
                TierRequirements.forTier(predictedTier, config), wood, campbell, liuLi, interactivity);

        TierRequirements intendedRequirements = TierRequirements.forTier(intendedTier, config);
        ValidationFlags flags = validateTierRequirements(intendedRequirements, wood, campbell, liuLi,
                interactivity, overallScore);

        List<String> reasons = generateRejectionReasons(intendedRequirements, predictedTier, flags, overallScore);

        log.debug("Composite score {} (wood {}, campbell {}, liuLi {}, interactivity {}) -> {} for intended {}",
                overallScore, breakdown.woodScore(), breakdown.campbellScore(), breakdown.liuLiScore(),
                breakdown.interactivityScore(), predictedTier, intendedTier);

        return ComplexityScore.builder()
                .overallScore(overallScore)
                .predictedTier(predictedTier)
                .intendedTier(intendedTier)
                .tierMatch(predictedTier == intendedTier)
                .confidenceScore(Math.round(confidence * 100) / 100.0)
                .woodMetrics(wood)
                .campbellAttributes(campbell)
                .liuLiDimensions(liuLi)
                .elementInteractivity(interactivity)
                .calculationBreakdown(breakdown)
                .validationFlags(flags)
                .rejectionReasons(reasons)
                .analyzerVersion(ANALYZER_VERSION)
                .build();
    }

    /**
     * Accepts a score when confidence reaches the configured minimum and the predicted tier lies within the
     * allowed distance of the intended one. Strict mode, or a deviation of zero, demands an exact match.
     */
    public static boolean isValidScenario(ComplexityScore score, ComplexityValidationConfig config) {
        if (score.confidenceScore() < config.getMinimumConfidence()) {
            return false;
        }
        if (config.isStrictMode() || config.getAllowedTierDeviation() == 0) {
            return score.tierMatch();
        }
        return score.intendedTier().distanceTo(score.predictedTier()) <= config.getAllowedTierDeviation();
    }

    /**
     * Zero-valued score for a scenario whose analysis failed.
     */
    public static ComplexityScore errorScore(Tier intendedTier, String reason) {
        return ComplexityScore.builder()
                .overallScore(0)
                .predictedTier(Tier.SIMPLE)
                .intendedTier(intendedTier)
                .tierMatch(false)
                .confidenceScore(0)
                .woodMetrics(new WoodMetrics(0, 0, 0, CoordinativeComplexity.SEQUENTIAL, DynamicComplexity.STATIC, 0))
                .campbellAttributes(new CampbellAttributes(false, 0, false, 0, false, List.of(),
                        UncertaintyLevel.NONE, 0, 0))
                .liuLiDimensions(new LiuLiDimensions(0, 0, 0, 0, 0, 0, NoveltyLevel.ROUTINE, 0, 0, TimePressure.LOW))
                .elementInteractivity(new ElementInteractivityAnalysis(0, 0, 0, 0, 0))
                .calculationBreakdown(CalculationBreakdown.zero())
                .validationFlags(ValidationFlags.allFailed())
                .rejectionReasons(List.of("Validation error: " + reason))
                .analyzerVersion(ANALYZER_VERSION)
                .build();
    }

    double calculateConfidence(double score, TierRequirements req, WoodMetrics wood, CampbellAttributes campbell,
                               LiuLiDimensions liuLi, ElementInteractivityAnalysis interactivity) {
        boolean[] checks = {
                req.distinctActs().satisfiesMin(wood.distinctActs()),
                req.distinctActs().satisfiesMax(wood.distinctActs()),
                req.coordinativeComplexity().contains(wood.coordinativeComplexity()),
                req.dynamicComplexity().contains(wood.dynamicComplexity()),
                matchesFlag(req.multiplePaths(), campbell.multiplePaths()),
                matchesFlag(req.multipleOutcomes(), campbell.multipleOutcomes()),
                matchesFlag(req.conflictingInterdependence(), campbell.conflictingInterdependence()),
                req.uncertaintyLevels().contains(campbell.uncertaintyLevel()),
                req.variety().satisfiesMin(liuLi.variety()),
                req.variety().satisfiesMax(liuLi.variety()),
                req.novelty().contains(liuLi.novelty()),
                req.relationships().satisfiesMin(liuLi.relationships()),
                req.interactivity().satisfiesMin(interactivity.interactivityRatio()),
                req.interactivity().satisfiesMax(interactivity.interactivityRatio()),
                req.scoreRange().contains(score)
        };

        int passed = 0;
        for (boolean check : checks) {
            if (check) {
                passed++;
            }
        }
        double confidence = passed / (double) checks.length;

        Bound range = req.scoreRange();
        if (range.hasFiniteWidth() && range.width() > 0) {
            double distanceFromBoundary = Math.min(score - range.min(), range.max() - score);
            double bonus = distanceFromBoundary / (range.width() * MARGIN_WIDTH_FACTOR);
            confidence += Math.max(0, Math.min(bonus, MAX_MARGIN_BONUS));
        }

        return Math.min(confidence, 1);
    }

    ValidationFlags validateTierRequirements(TierRequirements req, WoodMetrics wood, CampbellAttributes campbell,
                                             LiuLiDimensions liuLi, ElementInteractivityAnalysis interactivity,
                                             double score) {
        Map<String, Boolean> checks = new LinkedHashMap<>();

        checks.put(WOOD_DISTINCT_ACTS_MIN, req.distinctActs().satisfiesMin(wood.distinctActs()));
        checks.put(WOOD_DISTINCT_ACTS_MAX, req.distinctActs().satisfiesMax(wood.distinctActs()));
        checks.put(WOOD_COORDINATIVE, req.coordinativeComplexity().contains(wood.coordinativeComplexity()));
        checks.put(WOOD_DYNAMIC, req.dynamicComplexity().contains(wood.dynamicComplexity()));

        checks.put(CAMPBELL_MULTIPLE_PATHS, matchesFlag(req.multiplePaths(), campbell.multiplePaths()));
        checks.put(CAMPBELL_MULTIPLE_OUTCOMES, matchesFlag(req.multipleOutcomes(), campbell.multipleOutcomes()));
        checks.put(CAMPBELL_CONFLICTING,
                matchesFlag(req.conflictingInterdependence(), campbell.conflictingInterdependence()));
        checks.put(CAMPBELL_UNCERTAINTY, req.uncertaintyLevels().contains(campbell.uncertaintyLevel()));

        checks.put(LIULI_VARIETY_MIN, req.variety().satisfiesMin(liuLi.variety()));
        checks.put(LIULI_VARIETY_MAX, req.variety().satisfiesMax(liuLi.variety()));
        checks.put(LIULI_NOVELTY, req.novelty().contains(liuLi.novelty()));
        checks.put(LIULI_RELATIONSHIPS_MIN, req.relationships().satisfiesMin(liuLi.relationships()));
        checks.put(LIULI_RELATIONSHIPS_MAX, req.relationships().satisfiesMax(liuLi.relationships()));

        checks.put(INTERACTIVITY_MIN, req.interactivity().satisfiesMin(interactivity.interactivityRatio()));
        checks.put(INTERACTIVITY_MAX, req.interactivity().satisfiesMax(interactivity.interactivityRatio()));

        checks.put(SCORE_MIN, req.scoreRange().satisfiesMin(score));
        checks.put(SCORE_MAX, req.scoreRange().satisfiesMax(score));

        long passed = checks.values().stream().filter(Boolean::booleanValue).count();

        return new ValidationFlags(
                passed >= checks.size() * MINIMUM_CRITERIA_SHARE,
                hasRequiredAttributes(req.tier(), campbell),
                checks.get(SCORE_MIN) && checks.get(SCORE_MAX),
                checks.get(INTERACTIVITY_MIN) && checks.get(INTERACTIVITY_MAX),
                checks);
    }

    static boolean hasRequiredAttributes(Tier tier, CampbellAttributes campbell) {
        boolean uncertain = campbell.uncertaintyLevel() != null && campbell.uncertaintyLevel().isPresent();
        switch (tier) {
            case SIMPLE:
                return !campbell.multiplePaths()
                        && !campbell.multipleOutcomes()
                        && !campbell.conflictingInterdependence();
            case MODERATE:
                return campbell.multiplePaths() || campbell.multipleOutcomes() || uncertain;
            case COMPLEX:
            default:
                int present = 0;
                if (campbell.multiplePaths()) present++;
                if (campbell.multipleOutcomes()) present++;
                if (campbell.conflictingInterdependence()) present++;
                if (uncertain) present++;
                return present >= COMPLEX_ATTRIBUTES_REQUIRED;
        }
    }

    List<String> generateRejectionReasons(TierRequirements req, Tier predictedTier, ValidationFlags flags,
                                          double score) {
        Tier tier = req.tier();
        List<String> reasons = new ArrayList<>();

        if (tier != predictedTier) {
            reasons.add(String.format(Locale.ROOT,
                    "Tier mismatch: intended \"%s\" but analysis predicts \"%s\" (score: %.1f)",
                    tier, predictedTier, score));
        }

        flags.criteriaChecks().forEach((criterion, passed) -> {
            if (!passed) {
                reasons.add(formatCriterionFailure(criterion, req));
            }
        });

        if (!flags.meetsMinimumCriteria()) {
            reasons.add("Scenario does not meet minimum criteria threshold (60% of tier requirements)");
        }
        if (!flags.hasRequiredAttributes()) {
            reasons.add("Missing required attributes for " + tier + " tier");
        }
        if (!flags.interactivityMatches()) {
            reasons.add("Element interactivity does not match " + tier + " tier expectations");
        }

        return reasons;
    }

    static String formatCriterionFailure(String criterion, TierRequirements req) {
        Tier tier = req.tier();
        switch (criterion) {
            case WOOD_DISTINCT_ACTS_MIN:
                return "Requires at least " + whole(req.distinctActs().min())
                        + " distinct calculation steps for " + tier + " tier";
            case WOOD_DISTINCT_ACTS_MAX:
                return "Exceeds maximum " + whole(req.distinctActs().max())
                        + " distinct steps for " + tier + " tier";
            case WOOD_COORDINATIVE:
                return "Coordinative complexity should be " + joinLabels(req.coordinativeComplexity())
                        + " for " + tier + " tier";
            case WOOD_DYNAMIC:
                return "Dynamic complexity should be " + joinLabels(req.dynamicComplexity())
                        + " for " + tier + " tier";
            case CAMPBELL_MULTIPLE_PATHS:
                return "Multiple solution paths " + requiredOrNot(req.multiplePaths()) + " for " + tier + " tier";
            case CAMPBELL_MULTIPLE_OUTCOMES:
                return "Multiple outcomes " + requiredOrNot(req.multipleOutcomes()) + " for " + tier + " tier";
            case CAMPBELL_CONFLICTING:
                return "Conflicting interdependence " + requiredOrNot(req.conflictingInterdependence())
                        + " for " + tier + " tier";
            case CAMPBELL_UNCERTAINTY:
                return "Uncertainty level should be " + joinLabels(req.uncertaintyLevels()) + " for " + tier + " tier";
            case LIULI_VARIETY_MIN:
                return "Variety score too low for " + tier + " tier";
            case LIULI_VARIETY_MAX:
                return "Variety score too high for " + tier + " tier";
            case LIULI_NOVELTY:
                return "Novelty level should be " + joinLabels(req.novelty()) + " for " + tier + " tier";
            case LIULI_RELATIONSHIPS_MIN:
                return "Relationship score too low for " + tier + " tier";
            case LIULI_RELATIONSHIPS_MAX:
                return "Relationship score too high for " + tier + " tier";
            case INTERACTIVITY_MIN:
                return "Element interactivity ratio too low for " + tier + " tier";
            case INTERACTIVITY_MAX:
                return "Element interactivity ratio too high for " + tier + " tier";
            case SCORE_MIN:
                return "Composite score below minimum threshold for " + tier + " tier";
            case SCORE_MAX:
                return "Composite score above maximum threshold for " + tier + " tier";
            default:
                return "Criterion \"" + criterion + "\" not met for " + tier + " tier";
        }
    }

    private static boolean matchesFlag(Boolean required, boolean actual) {
        return required == null || required == actual;
    }

    private static String requiredOrNot(Boolean required) {
        return Boolean.TRUE.equals(required) ? "required" : "not expected";
    }

    static String joinLabels(Collection<?> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(" or "));
    }

    private static String whole(Double value) {
        return value == null ? "any" : String.valueOf(value.longValue());
    }
}

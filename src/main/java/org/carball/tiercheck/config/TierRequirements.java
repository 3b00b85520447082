package org.carball.tiercheck.config;

import lombok.Builder;
import org.carball.tiercheck.model.metrics.CoordinativeComplexity;
import org.carball.tiercheck.model.metrics.DynamicComplexity;
import org.carball.tiercheck.model.metrics.NoveltyLevel;
import org.carball.tiercheck.model.metrics.UncertaintyLevel;
import org.carball.tiercheck.model.scoring.Bound;
import org.carball.tiercheck.model.scoring.Tier;

import java.util.EnumSet;
import java.util.Set;

/**
 * What each framework should report for a scenario of a given tier.
 * A {@code null} flag means the tier does not care about that attribute.
 */
@Builder(toBuilder = true)
public record TierRequirements(
        Tier tier,
        // Wood
        Bound distinctActs,
        Bound informationCues,
        Bound totalElements,
        Set<CoordinativeComplexity> coordinativeComplexity,
        Set<DynamicComplexity> dynamicComplexity,
        // Campbell
        Boolean multiplePaths,
        Bound pathCount,
        Boolean multipleOutcomes,
        Boolean conflictingInterdependence,
        Set<UncertaintyLevel> uncertaintyLevels,
        // Liu & Li
        Bound variety,
        Bound ambiguity,
        Set<NoveltyLevel> novelty,
        Bound relationships,
        // Element interactivity and composite score
        Bound interactivity,
        Bound scoreRange) {

    private static final TierRequirements SIMPLE = TierRequirements.builder()
            .tier(Tier.SIMPLE)
            .distinctActs(Bound.between(2, 3))
            .informationCues(Bound.between(1, 2))
            .totalElements(Bound.atMost(6))
            .coordinativeComplexity(EnumSet.of(CoordinativeComplexity.SEQUENTIAL))
            .dynamicComplexity(EnumSet.of(DynamicComplexity.STATIC))
            .multiplePaths(false)
            .pathCount(Bound.atMost(1))
            .multipleOutcomes(false)
            .conflictingInterdependence(false)
            .uncertaintyLevels(EnumSet.of(UncertaintyLevel.NONE))
            .variety(Bound.atMost(0.3))
            .ambiguity(Bound.atMost(0.2))
            .novelty(EnumSet.of(NoveltyLevel.ROUTINE))
            .relationships(Bound.atMost(0.2))
            .build();

    private static final TierRequirements MODERATE = TierRequirements.builder()
            .tier(Tier.MODERATE)
            .distinctActs(Bound.between(4, 5))
            .informationCues(Bound.between(2, 3))
            .totalElements(Bound.between(8, 15))
            .coordinativeComplexity(EnumSet.of(CoordinativeComplexity.INTERDEPENDENT))
            .dynamicComplexity(EnumSet.of(DynamicComplexity.STATIC, DynamicComplexity.LOW))
            .multiplePaths(true)
            .pathCount(Bound.between(2, 3))
            .uncertaintyLevels(EnumSet.of(UncertaintyLevel.NONE, UncertaintyLevel.BOUNDED))
            .variety(Bound.between(0.3, 0.6))
            .ambiguity(Bound.between(0.2, 0.5))
            .novelty(EnumSet.of(NoveltyLevel.ROUTINE, NoveltyLevel.SEMI_FAMILIAR))
            .relationships(Bound.between(0.2, 0.5))
            .build();

    private static final TierRequirements COMPLEX = TierRequirements.builder()
            .tier(Tier.COMPLEX)
            .distinctActs(Bound.atLeast(5))
            .informationCues(Bound.atLeast(3))
            .totalElements(Bound.atLeast(15))
            .coordinativeComplexity(EnumSet.of(CoordinativeComplexity.INTERDEPENDENT, CoordinativeComplexity.NETWORKED))
            .dynamicComplexity(EnumSet.of(DynamicComplexity.LOW, DynamicComplexity.HIGH))
            .multiplePaths(true)
            .pathCount(Bound.atLeast(3))
            .multipleOutcomes(true)
            .conflictingInterdependence(true)
            .uncertaintyLevels(EnumSet.of(UncertaintyLevel.BOUNDED, UncertaintyLevel.HIGH))
            .variety(Bound.atLeast(0.6))
            .ambiguity(Bound.atLeast(0.5))
            .novelty(EnumSet.of(NoveltyLevel.SEMI_FAMILIAR, NoveltyLevel.NOVEL))
            .relationships(Bound.atLeast(0.5))
            .build();

    /**
     * Requirements for {@code tier}, with the score range and interactivity bounds taken from {@code config}.
     */
    public static TierRequirements forTier(Tier tier, ComplexityValidationConfig config) {
        TierRequirements base;
        switch (tier) {
            case SIMPLE:
                base = SIMPLE;
                break;
            case MODERATE:
                base = MODERATE;
                break;
            case COMPLEX:
            default:
                base = COMPLEX;
                break;
        }
        return base.toBuilder()
                .interactivity(config.getInteractivityThresholds().boundFor(tier))
                .scoreRange(config.scoreRange(tier))
                .build();
    }
}

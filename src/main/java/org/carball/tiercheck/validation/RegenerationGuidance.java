package org.carball.tiercheck.validation;

import org.carball.tiercheck.config.TierRequirements;
import org.carball.tiercheck.model.scoring.Bound;
import org.carball.tiercheck.model.scoring.Tier;
import org.carball.tiercheck.model.scoring.ValidationFlags;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import static org.carball.tiercheck.analyzer.CompositeScorer.CAMPBELL_CONFLICTING;
import static org.carball.tiercheck.analyzer.CompositeScorer.CAMPBELL_MULTIPLE_OUTCOMES;
import static org.carball.tiercheck.analyzer.CompositeScorer.CAMPBELL_MULTIPLE_PATHS;
import static org.carball.tiercheck.analyzer.CompositeScorer.CAMPBELL_UNCERTAINTY;
import static org.carball.tiercheck.analyzer.CompositeScorer.INTERACTIVITY_MAX;
import static org.carball.tiercheck.analyzer.CompositeScorer.INTERACTIVITY_MIN;
import static org.carball.tiercheck.analyzer.CompositeScorer.LIULI_NOVELTY;
import static org.carball.tiercheck.analyzer.CompositeScorer.LIULI_RELATIONSHIPS_MAX;
import static org.carball.tiercheck.analyzer.CompositeScorer.LIULI_RELATIONSHIPS_MIN;
import static org.carball.tiercheck.analyzer.CompositeScorer.LIULI_VARIETY_MAX;
import static org.carball.tiercheck.analyzer.CompositeScorer.LIULI_VARIETY_MIN;
import static org.carball.tiercheck.analyzer.CompositeScorer.SCORE_MAX;
import static org.carball.tiercheck.analyzer.CompositeScorer.SCORE_MIN;
import static org.carball.tiercheck.analyzer.CompositeScorer.WOOD_COORDINATIVE;
import static org.carball.tiercheck.analyzer.CompositeScorer.WOOD_DISTINCT_ACTS_MAX;
import static org.carball.tiercheck.analyzer.CompositeScorer.WOOD_DISTINCT_ACTS_MIN;
import static org.carball.tiercheck.analyzer.CompositeScorer.WOOD_DYNAMIC;

/**
 * Turns failed tier criteria into instructions for the scenario generator.
 */
public final class RegenerationGuidance {

    public static final int MAX_ENHANCEMENTS = 5;

    public static final String ERROR_ENHANCEMENT = "Ensure scenario has clear calculation steps and requirements";

    /** Criteria in the order their guidance is offered. */
    static final List<String> PRIORITY = List.of(
            WOOD_DISTINCT_ACTS_MIN,
            WOOD_COORDINATIVE,
            CAMPBELL_MULTIPLE_PATHS,
            CAMPBELL_CONFLICTING,
            LIULI_VARIETY_MIN,
            INTERACTIVITY_MIN,
            INTERACTIVITY_MAX,
            WOOD_DISTINCT_ACTS_MAX,
            WOOD_DYNAMIC,
            CAMPBELL_MULTIPLE_OUTCOMES,
            CAMPBELL_UNCERTAINTY,
            LIULI_VARIETY_MAX,
            LIULI_NOVELTY,
            LIULI_RELATIONSHIPS_MIN,
            LIULI_RELATIONSHIPS_MAX,
            SCORE_MIN,
            SCORE_MAX);

    private RegenerationGuidance() {
    }

    /**
     * At most {@value #MAX_ENHANCEMENTS} instructions, one per failed criterion in priority order.
     * Falls back to the tier's general guidance when no listed criterion failed.
     */
    public static List<String> promptEnhancements(TierRequirements requirements, ValidationFlags flags) {
        List<String> enhancements = new ArrayList<>();
        for (String criterion : PRIORITY) {
            if (enhancements.size() >= MAX_ENHANCEMENTS) {
                break;
            }
            if (flags.criteriaChecks().containsKey(criterion) && !flags.passed(criterion)) {
                enhancements.add(instructionFor(criterion, requirements));
            }
        }

        if (enhancements.isEmpty()) {
            enhancements.add(generalGuidance(requirements.tier()));
        }
        return List.copyOf(enhancements);
    }

    static String instructionFor(String criterion, TierRequirements req) {
        Tier tier = req.tier();
        switch (criterion) {
            case WOOD_DISTINCT_ACTS_MIN:
                return "Add more calculation steps (need at least " + whole(req.distinctActs().min())
                        + " distinct steps)";
            case WOOD_COORDINATIVE:
                return "Make dependencies " + join(req.coordinativeComplexity()) + " ("
                        + coordinativeGuidance(tier) + ")";
            case CAMPBELL_MULTIPLE_PATHS:
                return Boolean.TRUE.equals(req.multiplePaths())
                        ? "Include multiple valid solution approaches or methods"
                        : "Simplify to a single clear solution path";
            case CAMPBELL_CONFLICTING:
                return Boolean.TRUE.equals(req.conflictingInterdependence())
                        ? "Add trade-offs or conflicts between objectives"
                        : "Remove trade-offs to simplify the scenario";
            case LIULI_VARIETY_MIN:
                return "Include more diverse calculation types (financial, statistical, operational)";
            case INTERACTIVITY_MIN:
                return "Add more dependencies between calculation elements";
            case INTERACTIVITY_MAX:
                return "Reduce dependencies to make calculations more independent";
            case WOOD_DISTINCT_ACTS_MAX:
                return "Reduce the number of calculation steps (at most " + whole(req.distinctActs().max())
                        + " distinct steps)";
            case WOOD_DYNAMIC:
                return "Adjust how much values change during the task (dynamic complexity should be "
                        + join(req.dynamicComplexity()) + ")";
            case CAMPBELL_MULTIPLE_OUTCOMES:
                return Boolean.TRUE.equals(req.multipleOutcomes())
                        ? "State several objectives the answer must satisfy"
                        : "Focus the task on a single clear objective";
            case CAMPBELL_UNCERTAINTY:
                return "Set the level of missing or uncertain information to "
                        + join(req.uncertaintyLevels());
            case LIULI_VARIETY_MAX:
                return "Limit the scenario to fewer kinds of calculation";
            case LIULI_NOVELTY:
                return "Make the situation " + join(req.novelty()) + " for the reader";
            case LIULI_RELATIONSHIPS_MIN:
                return "Connect more of the quantities to each other";
            case LIULI_RELATIONSHIPS_MAX:
                return "Reduce the number of relationships between quantities";
            case SCORE_MIN:
                return "Increase overall complexity to reach the " + tier + " tier ("
                        + range(req.scoreRange()) + ")";
            case SCORE_MAX:
                return "Reduce overall complexity to stay within the " + tier + " tier ("
                        + range(req.scoreRange()) + ")";
            default:
                return generalGuidance(tier);
        }
    }

    static String coordinativeGuidance(Tier tier) {
        switch (tier) {
            case SIMPLE:
                return "calculations should be sequential, output of one feeds the next";
            case MODERATE:
                return "some calculations should depend on multiple previous results";
            case COMPLEX:
            default:
                return "create a network of interdependent calculations with feedback";
        }
    }

    public static String generalGuidance(Tier tier) {
        switch (tier) {
            case SIMPLE:
                return "Keep scenario straightforward with 2-3 sequential calculation steps and clear inputs";
            case MODERATE:
                return "Add moderate complexity with 4-5 interdependent steps and some ambiguity";
            case COMPLEX:
            default:
                return "Increase complexity with multiple objectives, trade-offs, and networked dependencies";
        }
    }

    private static String join(Collection<?> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(" or "));
    }

    private static String whole(Double value) {
        return value == null ? "any" : String.valueOf(value.longValue());
    }

    private static String range(Bound bound) {
        return "score " + bound.describe();
    }
}

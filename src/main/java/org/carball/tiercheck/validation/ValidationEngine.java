package org.carball.tiercheck.validation;

import lombok.extern.slf4j.Slf4j;
import org.carball.tiercheck.analyzer.AnalyzerResult;
import org.carball.tiercheck.analyzer.ComplexityAnalyzer;
import org.carball.tiercheck.analyzer.CompositeScorer;
import org.carball.tiercheck.config.ComplexityValidationConfig;
import org.carball.tiercheck.config.TierRequirements;
import org.carball.tiercheck.model.scenario.ScenarioInput;
import org.carball.tiercheck.model.scoring.ComplexityScore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Validates generated scenarios against their intended complexity tier, one at a time or in batches.
 */
@Slf4j
public class ValidationEngine {

    private final ComplexityAnalyzer analyzer;

    public ValidationEngine() {
        this(new ComplexityAnalyzer());
    }

    public ValidationEngine(ComplexityAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Validates one scenario. Analysis failures come back as an invalid, zero-scored result.
     */
    public ScenarioValidationResult validateScenario(ScenarioInput scenario, ValidationOptions options) {
        Objects.requireNonNull(scenario, "scenario");
        Objects.requireNonNull(scenario.intendedTier(), "intendedTier");
        ValidationOptions resolved = options == null ? ValidationOptions.defaults() : options;
        ComplexityValidationConfig config = resolved.getConfig();
        long start = System.nanoTime();

        ScenarioValidationResult result;
        try {
            AnalyzerResult<ComplexityScore> analysis = analyzer.analyze(scenario, config);
            if (analysis instanceof AnalyzerResult.Err<ComplexityScore> err) {
                result = errorResult(scenario, err.analyzer() + ": " + err.reason(), elapsedMs(start));
            } else {
                result = scoredResult(scenario, analysis.orElseThrow(), config, elapsedMs(start));
            }
        } catch (RuntimeException e) {
            log.warn("Unexpected failure validating scenario {}", scenario.id(), e);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            result = errorResult(scenario, reason, elapsedMs(start));
        }

        if (result.getValidationDurationMs() > config.getValidationTimeoutMs()) {
            log.warn("Validation of scenario {} took {}ms, over the {}ms budget",
                    scenario.id(), result.getValidationDurationMs(), config.getValidationTimeoutMs());
        }

        notifyListener(resolved.getListener(), completeEvent(result));
        return result;
    }

    public ScenarioValidationResult validateScenario(ScenarioInput scenario) {
        return validateScenario(scenario, ValidationOptions.defaults());
    }

    /**
     * Validates every scenario concurrently on at most {@code batchParallelism} threads.
     * Results keep the input order; progress events report a running completion count.
     */
    public BatchValidationResult validateBatch(List<ScenarioInput> scenarios, ValidationOptions options) {
        Objects.requireNonNull(scenarios, "scenarios");
        ValidationOptions resolved = options == null ? ValidationOptions.defaults() : options;
        ValidationProgressListener listener = resolved.getListener();
        int total = scenarios.size();
        long start = System.nanoTime();

        log.info("Starting validation of {} scenarios", total);
        notifyListener(listener, ValidationProgressEvent.builder()
                .type(ProgressEventType.VALIDATION_START)
                .current(0)
                .total(total)
                .percentage(0)
                .message("Starting validation of " + total + " scenarios")
                .build());

        List<ScenarioValidationResult> results = total == 0
                ? List.of()
                : runConcurrently(scenarios, resolved);

        ValidationBatchStats stats = ValidationBatchStats.from(results);
        String summary = String.format(Locale.ROOT, "Completed validation: %d/%d passed (%.1f%%)",
                stats.getPassed(), stats.getTotalValidated(), stats.getPassRate() * 100);
        log.info(summary);

        notifyListener(listener, ValidationProgressEvent.builder()
                .type(ProgressEventType.BATCH_COMPLETE)
                .current(total)
                .total(total)
                .percentage(100)
                .batchStats(stats)
                .message(summary)
                .elapsedMs(elapsedMs(start))
                .build());

        return new BatchValidationResult(results, stats);
    }

    public BatchValidationResult validateBatch(List<ScenarioInput> scenarios) {
        return validateBatch(scenarios, ValidationOptions.defaults());
    }

    private List<ScenarioValidationResult> runConcurrently(List<ScenarioInput> scenarios, ValidationOptions options) {
        int total = scenarios.size();
        int threads = Math.max(1, Math.min(options.getConfig().getBatchParallelism(), total));
        BatchProgress progress = new BatchProgress(options.getListener(), total);
        ValidationOptions perScenario = options.toBuilder().listener(progress).build();

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<CompletableFuture<ScenarioValidationResult>> futures = new ArrayList<>();
            for (ScenarioInput scenario : scenarios) {
                futures.add(CompletableFuture.supplyAsync(() -> validateScenario(scenario, perScenario), executor));
            }

            List<ScenarioValidationResult> results = new ArrayList<>(total);
            for (CompletableFuture<ScenarioValidationResult> future : futures) {
                results.add(future.join());
            }
            return results;
        } finally {
            executor.shutdown();
        }
    }

    private ScenarioValidationResult scoredResult(ScenarioInput scenario, ComplexityScore score,
                                                  ComplexityValidationConfig config, long durationMs) {
        boolean valid = CompositeScorer.isValidScenario(score, config);
        List<String> enhancements = valid
                ? List.of()
                : RegenerationGuidance.promptEnhancements(
                        TierRequirements.forTier(scenario.intendedTier(), config), score.validationFlags());
        String reason = valid || score.rejectionReasons().isEmpty() ? null : score.rejectionReasons().get(0);

        log.debug("Scenario {}: score {} predicted {} intended {} valid {}",
                scenario.id(), score.overallScore(), score.predictedTier(), score.intendedTier(), valid);

        return ScenarioValidationResult.builder()
                .scenarioId(scenario.id())
                .valid(valid)
                .complexityScore(score)
                .validationTimestamp(Instant.now())
                .validationDurationMs(durationMs)
                .shouldRegenerate(!valid && scenario.regenerationAttempts() < config.getMaxRegenerationAttempts())
                .regenerationReason(reason)
                .promptEnhancements(enhancements)
                .regenerationAttempts(scenario.regenerationAttempts())
                .build();
    }

    private ScenarioValidationResult errorResult(ScenarioInput scenario, String reason, long durationMs) {
        log.warn("Scenario {} could not be analyzed: {}", scenario.id(), reason);
        return ScenarioValidationResult.builder()
                .scenarioId(scenario.id())
                .valid(false)
                .complexityScore(CompositeScorer.errorScore(scenario.intendedTier(), reason))
                .validationTimestamp(Instant.now())
                .validationDurationMs(durationMs)
                .shouldRegenerate(true)
                .regenerationReason("Validation error: " + reason)
                .promptEnhancements(List.of(RegenerationGuidance.ERROR_ENHANCEMENT))
                .regenerationAttempts(scenario.regenerationAttempts())
                .build();
    }

    private static ValidationProgressEvent completeEvent(ScenarioValidationResult result) {
        ComplexityScore score = result.getComplexityScore();
        String message = result.isValid()
                ? "Scenario " + result.getScenarioId() + " passed validation"
                : "Scenario " + result.getScenarioId() + " failed validation: " + firstReason(score);
        return ValidationProgressEvent.builder()
                .type(ProgressEventType.VALIDATION_COMPLETE)
                .current(1)
                .total(1)
                .percentage(100)
                .scenarioId(result.getScenarioId())
                .validationResult(ValidationProgressEvent.ResultSummary.of(result.isValid(), score))
                .message(message)
                .elapsedMs(result.getValidationDurationMs())
                .build();
    }

    private static String firstReason(ComplexityScore score) {
        return score.rejectionReasons().isEmpty() ? "no reason recorded" : score.rejectionReasons().get(0);
    }

    /**
     * Delivers {@code event}; a failing listener is logged and never affects the validation result.
     */
    private static void notifyListener(ValidationProgressListener listener, ValidationProgressEvent event) {
        try {
            listener.onProgress(event);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on {} event for scenario {}", event.getType(), event.getScenarioId(), e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    /**
     * Rewrites per-scenario completion events as batch progress. Delivery is serialized so counts only grow.
     */
    private static final class BatchProgress implements ValidationProgressListener {

        private final ValidationProgressListener delegate;
        private final int total;
        private int completed;

        private BatchProgress(ValidationProgressListener delegate, int total) {
            this.delegate = delegate;
            this.total = total;
        }

        @Override
        public synchronized void onProgress(ValidationProgressEvent event) {
            if (event.getType() != ProgressEventType.VALIDATION_COMPLETE) {
                return;
            }
            completed++;
            notifyListener(delegate, event.toBuilder()
                    .type(ProgressEventType.VALIDATION_PROGRESS)
                    .current(completed)
                    .total(total)
                    .percentage(ValidationProgressEvent.percentage(completed, total))
                    .build());
        }
    }
}

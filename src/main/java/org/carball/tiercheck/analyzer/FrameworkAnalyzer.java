package org.carball.tiercheck.analyzer;

/**
 * A pure analyzer for one complexity framework.
 *
 * @param <I> the analyzer's input record
 * @param <M> the metrics it produces
 */
public interface FrameworkAnalyzer<I, M> {

    String getName();

    M analyze(I input);

    double calculateScore(M metrics);

    default AnalyzerResult<M> tryAnalyze(I input) {
        return AnalyzerResult.capture(getName(), () -> analyze(input));
    }
}

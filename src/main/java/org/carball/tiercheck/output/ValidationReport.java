package org.carball.tiercheck.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.tiercheck.analyzer.CompositeScorer;
import org.carball.tiercheck.config.ComplexityValidationConfig;
import org.carball.tiercheck.model.metrics.CampbellAttributes;
import org.carball.tiercheck.model.metrics.ElementInteractivityAnalysis;
import org.carball.tiercheck.model.metrics.LiuLiDimensions;
import org.carball.tiercheck.model.metrics.WoodMetrics;
import org.carball.tiercheck.model.scoring.CalculationBreakdown;
import org.carball.tiercheck.model.scoring.ComplexityScore;
import org.carball.tiercheck.model.scoring.Tier;
import org.carball.tiercheck.validation.BatchValidationResult;
import org.carball.tiercheck.validation.ScenarioValidationResult;
import org.carball.tiercheck.validation.ValidationBatchStats;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

@Slf4j
public class ValidationReport {

    private final BatchValidationResult batch;
    private final ComplexityValidationConfig config;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public ValidationReport(BatchValidationResult batch, ComplexityValidationConfig config) {
        this.batch = batch;
        this.config = config;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        ValidationBatchStats stats = batch.getStats();

        // Header
        md.append("# Scenario Complexity Validation Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Analyzer Version:** ").append(CompositeScorer.ANALYZER_VERSION).append("  \n");
        md.append("**Profile:** ").append(config.getProfileName()).append("  \n\n");

        // Summary
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Scenarios Validated | ").append(stats.getTotalValidated()).append(" |\n");
        md.append("| Passed | ").append(stats.getPassed()).append(" |\n");
        md.append("| Failed | ").append(stats.getFailed()).append(" |\n");
        md.append("| Pass Rate | ").append(percent(stats.getPassRate())).append(" |\n");
        md.append("| Average Confidence | ").append(format2(stats.getAvgConfidenceScore())).append(" |\n");
        md.append("| Average Validation Time | ").append(format1(stats.getAvgValidationTimeMs())).append(" ms |\n");
        md.append("| Regeneration Attempts | ").append(stats.getTotalRegenerationAttempts()).append(" |\n\n");

        // Tier distribution
        md.append("## Tier Distribution\n\n");
        md.append("| Tier | Intended | Predicted | Match Rate |\n");
        md.append("|------|----------|-----------|------------|\n");
        for (Tier tier : Tier.values()) {
            String label = tier.getLabel();
            Double matchRate = stats.getTierMatchRate().get(label);
            md.append("| ").append(tier.getBadge()).append(" ").append(label)
                    .append(" | ").append(stats.getIntendedTierDistribution().getOrDefault(label, 0))
                    .append(" | ").append(stats.getPredictedTierDistribution().getOrDefault(label, 0))
                    .append(" | ").append(matchRate == null ? "-" : percent(matchRate))
                    .append(" |\n");
        }
        md.append("\n");

        // Score guide
        md.append("### Complexity Score Guide\n\n");
        md.append("| Score Range | Tier | Description |\n");
        md.append("|-------------|------|-------------|\n");
        md.append("| ").append(config.scoreRange(Tier.COMPLEX).describe())
                .append(" | 🔴 **Complex** | Networked steps, competing objectives, uncertain inputs |\n");
        md.append("| ").append(config.scoreRange(Tier.MODERATE).describe())
                .append(" | 🟡 **Moderate** | Interdependent steps with some ambiguity |\n");
        md.append("| ").append(config.scoreRange(Tier.SIMPLE).describe())
                .append(" | 🟢 **Simple** | Few sequential steps with clear inputs |\n\n");

        // Scenarios
        md.append("## Scenarios\n\n");
        if (batch.getResults().isEmpty()) {
            md.append("**No scenarios were validated.**\n\n");
        }

        int number = 1;
        for (ScenarioValidationResult result : batch.getResults()) {
            appendScenario(md, number++, result);
        }

        // Footer
        md.append("---\n\n");
        md.append("*Generated by tiercheck scenario complexity validator*\n");

        return md.toString();
    }

    private void appendScenario(StringBuilder md, int number, ScenarioValidationResult result) {
        ComplexityScore score = result.getComplexityScore();
        CalculationBreakdown breakdown = score.calculationBreakdown();

        md.append("### ").append(number).append(". ").append(result.getScenarioId() == null ? "(unnamed)" : result.getScenarioId())
                .append(result.isValid() ? " ✅" : " ❌").append("\n\n");
        md.append("- **Intended Tier:** ").append(score.intendedTier().getBadge()).append(" ").append(score.intendedTier()).append("\n");
        md.append("- **Predicted Tier:** ").append(score.predictedTier().getBadge()).append(" ").append(score.predictedTier()).append("\n");
        md.append("- **Score:** ").append(format1(score.overallScore()))
                .append(" (confidence ").append(format2(score.confidenceScore())).append(")\n");
        md.append("- **Outcome:** ").append(result.outcome()).append("\n");
        md.append("- **Campbell Type:** ").append(CampbellAttributes.describeType(score.campbellAttributes().campbellType())).append("\n\n");

        md.append("| Framework | Score |\n");
        md.append("|-----------|-------|\n");
        md.append("| Wood | ").append(format1(breakdown.woodScore())).append(" |\n");
        md.append("| Campbell | ").append(format1(breakdown.campbellScore())).append(" |\n");
        md.append("| Liu & Li | ").append(format1(breakdown.liuLiScore())).append(" |\n");
        md.append("| Element Interactivity | ").append(format1(breakdown.interactivityScore())).append(" |\n\n");

        if (!score.rejectionReasons().isEmpty()) {
            md.append("**Rejection Reasons:**\n");
            score.rejectionReasons().forEach(reason -> md.append("- ").append(reason).append("\n"));
            md.append("\n");
        }

        if (!result.getPromptEnhancements().isEmpty()) {
            md.append("**Prompt Enhancements:**\n");
            result.getPromptEnhancements().forEach(e -> md.append("- ").append(e).append("\n"));
            md.append("\n");
        }
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setReportMetadata(new ReportMetadata(
                timestamp,
                CompositeScorer.ANALYZER_VERSION,
                config.getProfileName(),
                config.getConfigurationSummary()));
        report.setStats(batch.getStats());
        report.setScenarios(batch.getResults().stream().map(ValidationReport::toScenarioEntry).toList());
        return report;
    }

    private static ScenarioEntry toScenarioEntry(ScenarioValidationResult result) {
        ComplexityScore score = result.getComplexityScore();
        ScenarioEntry entry = new ScenarioEntry();
        entry.setScenarioId(result.getScenarioId());
        entry.setValid(result.isValid());
        entry.setOutcome(result.outcome().name());
        entry.setIntendedTier(score.intendedTier());
        entry.setPredictedTier(score.predictedTier());
        entry.setOverallScore(score.overallScore());
        entry.setConfidenceScore(score.confidenceScore());
        entry.setCampbellType(CampbellAttributes.describeType(score.campbellAttributes().campbellType()));
        entry.setBreakdown(score.calculationBreakdown());
        entry.setWoodMetrics(score.woodMetrics());
        entry.setCampbellAttributes(score.campbellAttributes());
        entry.setLiuLiDimensions(score.liuLiDimensions());
        entry.setElementInteractivity(score.elementInteractivity());
        entry.setRejectionReasons(score.rejectionReasons());
        entry.setShouldRegenerate(result.isShouldRegenerate());
        entry.setRegenerationReason(result.getRegenerationReason());
        entry.setPromptEnhancements(result.getPromptEnhancements());
        entry.setRegenerationAttempts(result.getRegenerationAttempts());
        entry.setValidationDurationMs(result.getValidationDurationMs());
        return entry;
    }

    private static String percent(double rate) {
        return String.format(Locale.ROOT, "%.1f%%", rate * 100);
    }

    private static String format1(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static String format2(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private ReportMetadata reportMetadata;
        private ValidationBatchStats stats;
        private List<ScenarioEntry> scenarios;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class ReportMetadata {
        private LocalDateTime timestamp;
        private String analyzerVersion;
        private String profile;
        private String configuration;
    }

    @lombok.Data
    private static class ScenarioEntry {
        private String scenarioId;
        @com.fasterxml.jackson.annotation.JsonProperty("isValid")
        private boolean valid;
        private String outcome;
        private Tier intendedTier;
        private Tier predictedTier;
        private double overallScore;
        private double confidenceScore;
        private String campbellType;
        private CalculationBreakdown breakdown;
        private WoodMetrics woodMetrics;
        private CampbellAttributes campbellAttributes;
        private LiuLiDimensions liuLiDimensions;
        private ElementInteractivityAnalysis elementInteractivity;
        private List<String> rejectionReasons;
        private boolean shouldRegenerate;
        private String regenerationReason;
        private List<String> promptEnhancements;
        private int regenerationAttempts;
        private long validationDurationMs;
    }
}

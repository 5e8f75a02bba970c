package com.mtb.parser.report;

import com.mtb.parser.model.DiagnosisRecord;
import com.mtb.parser.model.PatientRecord;
import com.mtb.parser.model.QualityMetrics;
import com.mtb.parser.model.TherapeuticRecommendation;
import com.mtb.parser.model.VariantRecord;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Generates formatted text summaries of parsed MTB reports
 */
public class ReportGenerator {

    private static final String SEPARATOR = "================================================================================";
    private static final String SUB_SEPARATOR = "--------------------------------------------------------------------------------";
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final String NOT_AVAILABLE = "N/A";

    private final Clock clock;

    public ReportGenerator() {
        this(Clock.systemDefaultZone());
    }

    public ReportGenerator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Generate a summary covering several parsed reports
     * @param reports Parsed reports, keyed by source name in display order
     * @return Formatted summary string
     */
    public String generateBatchReport(Map<String, ExtractionReport> reports) {
        if (reports == null || reports.isEmpty()) {
            return "No reports parsed.";
        }

        StringBuilder sb = new StringBuilder();

        // Header
        sb.append(SEPARATOR).append("\n");
        sb.append("MOLECULAR TUMOR BOARD REPORT EXTRACTION\n");
        sb.append("Date: ").append(LocalDate.now(clock).format(DATE_FORMATTER)).append("\n");
        sb.append(SEPARATOR).append("\n\n");

        for (Map.Entry<String, ExtractionReport> entry : reports.entrySet()) {
            sb.append("Source: ").append(entry.getKey()).append("\n");
            sb.append(formatReport(entry.getValue()));
            sb.append("\n").append(SUB_SEPARATOR).append("\n\n");
        }

        sb.append(generateSummary(List.copyOf(reports.values())));
        sb.append(generateWarningSummary(List.copyOf(reports.values())));
        sb.append(SEPARATOR).append("\n");

        return sb.toString();
    }

    /**
     * Generate the summary for one parsed report
     * @param report Parsed report
     * @return Formatted report string
     */
    public String generateReport(ExtractionReport report) {
        if (report == null) {
            return "No report parsed.";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(SEPARATOR).append("\n");
        sb.append("MTB REPORT SUMMARY\n");
        sb.append(SEPARATOR).append("\n\n");
        sb.append(formatReport(report));
        sb.append(SEPARATOR).append("\n");
        return sb.toString();
    }

    /**
     * Format patient, diagnosis, variants, TMB, recommendations and quality of one report
     * @param report Parsed report
     * @return Formatted section string
     */
    private String formatReport(ExtractionReport report) {
        StringBuilder sb = new StringBuilder();

        sb.append(formatPatient(report.getPatient()));
        sb.append(formatDiagnosis(report.getDiagnosis()));

        if (report.getNgsMethod() != null) {
            sb.append("NGS Method: ").append(report.getNgsMethod()).append("\n");
        }
        if (report.getReportDate() != null) {
            sb.append("Report Date: ").append(report.getReportDate()).append("\n");
        }
        sb.append("\n");

        // Variants
        sb.append("Genomic Variants (").append(report.getVariants().size()).append("):\n");
        if (report.getVariants().isEmpty()) {
            sb.append("  none\n");
        }
        for (VariantRecord variant : report.getVariants()) {
            sb.append(formatVariant(variant));
        }
        sb.append("\n");

        // TMB
        sb.append("TMB: ");
        if (report.getTmb() != null) {
            sb.append(report.getTmb()).append(" mut/Mb");
            if (report.hasHighTmb()) {
                sb.append(" (HIGH)");
            }
        } else {
            sb.append(NOT_AVAILABLE);
        }
        sb.append("\n\n");

        // Recommendations
        sb.append("Therapeutic Recommendations (").append(report.getRecommendations().size()).append("):\n");
        for (TherapeuticRecommendation recommendation : report.getRecommendations()) {
            sb.append(formatRecommendation(recommendation));
        }
        sb.append("\n");

        if (report.getQualityMetrics() != null) {
            sb.append(formatQuality(report.getQualityMetrics()));
        }

        return sb.toString();
    }

    private String formatPatient(PatientRecord patient) {
        StringBuilder sb = new StringBuilder();
        sb.append("Patient ID: ").append(orNotAvailable(patient.getId())).append("\n");
        sb.append("Age: ").append(patient.getAge() != null ? patient.getAge() : NOT_AVAILABLE);
        sb.append("  Sex: ").append(orNotAvailable(patient.getSex()));
        if (patient.getBirthDate() != null) {
            sb.append("  Born: ").append(patient.getBirthDate());
        }
        sb.append("\n");
        return sb.toString();
    }

    private String formatDiagnosis(DiagnosisRecord diagnosis) {
        StringBuilder sb = new StringBuilder();
        sb.append("Diagnosis: ").append(orNotAvailable(diagnosis.getPrimaryDiagnosis()));
        if (diagnosis.getStage() != null) {
            sb.append(" (stage ").append(diagnosis.getStage()).append(")");
        }
        if (diagnosis.getVocabularyCode() != null) {
            sb.append(" [ICD-O ").append(diagnosis.getVocabularyCode().getCode()).append("]");
        }
        sb.append("\n");
        if (diagnosis.getHistology() != null) {
            sb.append("Histology: ").append(diagnosis.getHistology()).append("\n");
        }
        return sb.toString();
    }

    /**
     * Format a single variant with its markers
     * @param variant Variant
     * @return Formatted variant line
     */
    private String formatVariant(VariantRecord variant) {
        StringBuilder sb = new StringBuilder();

        sb.append("  ").append(getVariantSymbol(variant)).append(" ");
        sb.append(variant.getGene());

        if (variant.getProteinChange() != null) {
            sb.append(" ").append(variant.getProteinChange());
        }
        if (variant.getCdnaChange() != null) {
            sb.append(" (").append(variant.getCdnaChange()).append(")");
        }
        if (variant.getVaf() != null) {
            sb.append(" VAF ").append(variant.getVaf()).append("%");
        }
        sb.append(" - ").append(variant.isClassified() ? variant.getClassification() : "unclassified");

        sb.append("\n");
        return sb.toString();
    }

    /**
     * Marker for a variant: fusion, actionable or other
     * @param variant Variant
     * @return Symbol string
     */
    private String getVariantSymbol(VariantRecord variant) {
        if (variant.isFusion()) {
            return "⇄";
        }
        return variant.isActionable() ? "★" : "•";
    }

    private String formatRecommendation(TherapeuticRecommendation recommendation) {
        StringBuilder sb = new StringBuilder();
        sb.append("  - ").append(recommendation.getDrug());
        if (recommendation.getGeneTarget() != null) {
            sb.append(" (target: ").append(recommendation.getGeneTarget()).append(")");
        }
        sb.append(" [").append(recommendation.getEvidenceLevel()).append("]");
        if (!recommendation.isMapped()) {
            sb.append(" (unmapped)");
        }
        sb.append("\n");
        return sb.toString();
    }

    private String formatQuality(QualityMetrics quality) {
        StringBuilder sb = new StringBuilder();
        sb.append("Quality:\n");
        for (String line : quality.getSummary().split("\n")) {
            sb.append("  ").append(line).append("\n");
        }
        if (!quality.getWarnings().isEmpty()) {
            sb.append("  Warnings: ").append(String.join("; ", quality.getWarnings())).append("\n");
        }
        return sb.toString();
    }

    /**
     * Generate summary statistics for all reports
     * @param reports Parsed reports
     * @return Formatted summary string
     */
    private String generateSummary(List<ExtractionReport> reports) {
        StringBuilder sb = new StringBuilder();

        sb.append(SEPARATOR).append("\n");
        sb.append("SUMMARY\n");
        sb.append(SEPARATOR).append("\n\n");

        int totalVariants = reports.stream().mapToInt(r -> r.getVariants().size()).sum();
        int actionable = reports.stream().mapToInt(r -> r.getActionableVariants().size()).sum();
        int fusions = reports.stream().mapToInt(r -> r.getFusionVariants().size()).sum();
        long highTmb = reports.stream().filter(ExtractionReport::hasHighTmb).count();
        double avgCompleteness = reports.stream()
                .filter(r -> r.getQualityMetrics() != null)
                .mapToDouble(r -> r.getQualityMetrics().getCompletenessPct())
                .average()
                .orElse(0.0);

        sb.append("Total Reports Parsed: ").append(reports.size()).append("\n");
        sb.append("  - Variants: ").append(totalVariants).append("\n");
        sb.append("  - Actionable Variants: ").append(actionable).append("\n");
        sb.append("  - Fusions: ").append(fusions).append("\n");
        sb.append("  - High TMB Reports: ").append(highTmb).append("\n");
        sb.append("  - Average Completeness: ").append(String.format(Locale.ROOT, "%.1f", avgCompleteness))
          .append("%\n");

        return sb.toString();
    }

    /**
     * Generate summary of warnings across all reports
     * @param reports Parsed reports
     * @return Formatted warning summary string
     */
    private String generateWarningSummary(List<ExtractionReport> reports) {
        StringBuilder sb = new StringBuilder();

        // Count occurrences of each warning
        Map<String, Integer> warningCounts = new HashMap<>();

        for (ExtractionReport report : reports) {
            if (report.getQualityMetrics() != null) {
                for (String warning : report.getQualityMetrics().getWarnings()) {
                    warningCounts.put(warning, warningCounts.getOrDefault(warning, 0) + 1);
                }
            }
        }

        if (warningCounts.isEmpty()) {
            return "";
        }

        sb.append("\nCommon Warnings:\n");

        // Sort by count (descending), then by text for a stable order
        warningCounts.entrySet().stream()
                .sorted((e1, e2) -> {
                    int byCount = e2.getValue().compareTo(e1.getValue());
                    return byCount != 0 ? byCount : e1.getKey().compareTo(e2.getKey());
                })
                .forEach(entry -> {
                    sb.append("  - ").append(entry.getKey())
                      .append(": ").append(entry.getValue())
                      .append(entry.getValue() == 1 ? " report" : " reports")
                      .append("\n");
                });

        return sb.toString();
    }

    private static String orNotAvailable(String value) {
        return value != null ? value : NOT_AVAILABLE;
    }
}

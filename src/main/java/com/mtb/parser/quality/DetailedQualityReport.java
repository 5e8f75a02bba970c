package com.mtb.parser.quality;

import com.mtb.parser.model.QualityLevel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Section-by-section quality assessment of a report, with scores, findings and
 * suggestions for improving the source document.
 */
public class DetailedQualityReport {
    private static final int SUMMARY_ITEM_LIMIT = 5;

    private double overallScore;
    private QualityLevel qualityLevel = QualityLevel.CRITICAL;

    private double patientScore;
    private double diagnosisScore;
    private double variantsScore;
    private double therapeuticsScore;

    private int totalFieldsExpected;
    private int totalFieldsFilled;
    private double completenessPct;

    private int variantsTotal;
    private int variantsWithHgvs;
    private int variantsWithVaf;
    private int variantsClassified;
    private int variantsActionable;
    private int variantsWithGeneCode;

    private boolean diagnosisMapped;
    private double drugsMappedPct;
    private double genesMappedPct;

    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> recommendations = new ArrayList<>();

    /**
     * Set the overall score and derive the quality level from it
     * @param overallScore Weighted score 0-100
     */
    void determineQualityLevel(double overallScore) {
        this.overallScore = overallScore;
        this.qualityLevel = QualityLevel.fromScore(overallScore);
    }

    void addError(String error) {
        errors.add(error);
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }

    void addRecommendation(String recommendation) {
        recommendations.add(recommendation);
    }

    /**
     * Get human-readable summary
     * @return Multi-line summary; at most five errors, warnings and recommendations are listed
     */
    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Quality Assessment Report ===\n");
        sb.append("Overall Score: ").append(format(overallScore)).append("/100\n");
        sb.append("Quality Level: ").append(qualityLevel.getLabel()).append("\n\n");

        sb.append("Section Scores:\n");
        sb.append("  Patient Data: ").append(format(patientScore)).append("/100\n");
        sb.append("  Diagnosis: ").append(format(diagnosisScore)).append("/100\n");
        sb.append("  Variants: ").append(format(variantsScore)).append("/100\n");
        sb.append("  Therapeutics: ").append(format(therapeuticsScore)).append("/100\n\n");

        sb.append("Completeness: ").append(format(completenessPct)).append("% (")
          .append(totalFieldsFilled).append("/").append(totalFieldsExpected).append(" fields)\n\n");

        sb.append("Variant Quality:\n");
        sb.append("  Total variants: ").append(variantsTotal).append("\n");
        sb.append("  With HGVS: ").append(variantsWithHgvs).append("\n");
        sb.append("  With VAF: ").append(variantsWithVaf).append("\n");
        sb.append("  Classified: ").append(variantsClassified).append("\n");
        sb.append("  Actionable: ").append(variantsActionable).append("\n");
        sb.append("  HGNC mapped: ").append(variantsWithGeneCode).append("\n\n");

        sb.append("Mapping Quality:\n");
        sb.append("  Diagnosis mapped: ").append(diagnosisMapped ? "Yes" : "No").append("\n");
        sb.append("  Drugs mapped: ").append(format(drugsMappedPct)).append("%\n");
        sb.append("  Genes mapped: ").append(format(genesMappedPct)).append("%\n");

        appendItems(sb, "Errors", errors);
        appendItems(sb, "Warnings", warnings);
        appendItems(sb, "Recommendations", recommendations);

        return sb.toString();
    }

    private static void appendItems(StringBuilder sb, String title, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        sb.append("\n").append(title).append(" (").append(items.size()).append("):\n");
        items.stream()
            .limit(SUMMARY_ITEM_LIMIT)
            .forEach(item -> sb.append("  - ").append(item).append("\n"));
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    // Getters and package-private setters
    public double getOverallScore() {
        return overallScore;
    }

    public QualityLevel getQualityLevel() {
        return qualityLevel;
    }

    public double getPatientScore() {
        return patientScore;
    }

    void setPatientScore(double patientScore) {
        this.patientScore = patientScore;
    }

    public double getDiagnosisScore() {
        return diagnosisScore;
    }

    void setDiagnosisScore(double diagnosisScore) {
        this.diagnosisScore = diagnosisScore;
    }

    public double getVariantsScore() {
        return variantsScore;
    }

    void setVariantsScore(double variantsScore) {
        this.variantsScore = variantsScore;
    }

    public double getTherapeuticsScore() {
        return therapeuticsScore;
    }

    void setTherapeuticsScore(double therapeuticsScore) {
        this.therapeuticsScore = therapeuticsScore;
    }

    public int getTotalFieldsExpected() {
        return totalFieldsExpected;
    }

    void setTotalFieldsExpected(int totalFieldsExpected) {
        this.totalFieldsExpected = totalFieldsExpected;
    }

    public int getTotalFieldsFilled() {
        return totalFieldsFilled;
    }

    void setTotalFieldsFilled(int totalFieldsFilled) {
        this.totalFieldsFilled = totalFieldsFilled;
    }

    public double getCompletenessPct() {
        return completenessPct;
    }

    void setCompletenessPct(double completenessPct) {
        this.completenessPct = completenessPct;
    }

    public int getVariantsTotal() {
        return variantsTotal;
    }

    void setVariantsTotal(int variantsTotal) {
        this.variantsTotal = variantsTotal;
    }

    public int getVariantsWithHgvs() {
        return variantsWithHgvs;
    }

    void setVariantsWithHgvs(int variantsWithHgvs) {
        this.variantsWithHgvs = variantsWithHgvs;
    }

    public int getVariantsWithVaf() {
        return variantsWithVaf;
    }

    void setVariantsWithVaf(int variantsWithVaf) {
        this.variantsWithVaf = variantsWithVaf;
    }

    public int getVariantsClassified() {
        return variantsClassified;
    }

    void setVariantsClassified(int variantsClassified) {
        this.variantsClassified = variantsClassified;
    }

    public int getVariantsActionable() {
        return variantsActionable;
    }

    void setVariantsActionable(int variantsActionable) {
        this.variantsActionable = variantsActionable;
    }

    public int getVariantsWithGeneCode() {
        return variantsWithGeneCode;
    }

    void setVariantsWithGeneCode(int variantsWithGeneCode) {
        this.variantsWithGeneCode = variantsWithGeneCode;
    }

    public boolean isDiagnosisMapped() {
        return diagnosisMapped;
    }

    void setDiagnosisMapped(boolean diagnosisMapped) {
        this.diagnosisMapped = diagnosisMapped;
    }

    public double getDrugsMappedPct() {
        return drugsMappedPct;
    }

    void setDrugsMappedPct(double drugsMappedPct) {
        this.drugsMappedPct = drugsMappedPct;
    }

    public double getGenesMappedPct() {
        return genesMappedPct;
    }

    void setGenesMappedPct(double genesMappedPct) {
        this.genesMappedPct = genesMappedPct;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<String> getRecommendations() {
        return Collections.unmodifiableList(recommendations);
    }
}

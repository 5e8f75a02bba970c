package com.mtb.parser.report;

import com.mtb.parser.model.DiagnosisRecord;
import com.mtb.parser.model.PatientRecord;
import com.mtb.parser.model.QualityMetrics;
import com.mtb.parser.model.TherapeuticRecommendation;
import com.mtb.parser.model.VariantRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything extracted from one MTB report. Instances are created only by
 * {@link ReportAssembler} and are immutable.
 */
public final class ExtractionReport {
    public static final double DEFAULT_HIGH_TMB_THRESHOLD = 10.0;

    private final PatientRecord patient;
    private final DiagnosisRecord diagnosis;
    private final List<VariantRecord> variants;
    private final List<TherapeuticRecommendation> recommendations;
    private final Double tmb;
    private final String ngsMethod;
    private final String reportDate;
    private final QualityMetrics qualityMetrics;

    ExtractionReport(PatientRecord patient, DiagnosisRecord diagnosis, List<VariantRecord> variants,
                     List<TherapeuticRecommendation> recommendations, Double tmb, String ngsMethod,
                     String reportDate, QualityMetrics qualityMetrics) {
        this.patient = patient != null ? patient : PatientRecord.empty();
        this.diagnosis = diagnosis != null ? diagnosis : DiagnosisRecord.empty();
        this.variants = variants != null
            ? Collections.unmodifiableList(new ArrayList<>(variants)) : Collections.emptyList();
        this.recommendations = recommendations != null
            ? Collections.unmodifiableList(new ArrayList<>(recommendations)) : Collections.emptyList();
        this.tmb = tmb;
        this.ngsMethod = ngsMethod;
        this.reportDate = reportDate;
        this.qualityMetrics = qualityMetrics;
    }

    /**
     * Variants with a gene code and a Pathogenic or Likely Pathogenic classification
     */
    public List<VariantRecord> getActionableVariants() {
        return variants.stream()
            .filter(VariantRecord::isActionable)
            .toList();
    }

    public List<VariantRecord> getFusionVariants() {
        return variants.stream()
            .filter(VariantRecord::isFusion)
            .toList();
    }

    /**
     * Check TMB against the conventional 10 mut/Mb cut-off
     */
    public boolean hasHighTmb() {
        return hasHighTmb(DEFAULT_HIGH_TMB_THRESHOLD);
    }

    /**
     * Check TMB against a threshold
     * @param threshold Cut-off in mutations per megabase
     * @return true if TMB is known and at or above the threshold
     */
    public boolean hasHighTmb(double threshold) {
        return tmb != null && tmb >= threshold;
    }

    public PatientRecord getPatient() {
        return patient;
    }

    public DiagnosisRecord getDiagnosis() {
        return diagnosis;
    }

    public List<VariantRecord> getVariants() {
        return variants;
    }

    public List<TherapeuticRecommendation> getRecommendations() {
        return recommendations;
    }

    public Double getTmb() {
        return tmb;
    }

    public String getNgsMethod() {
        return ngsMethod;
    }

    /** Report date in ISO form (YYYY-MM-DD), or null. */
    public String getReportDate() {
        return reportDate;
    }

    public QualityMetrics getQualityMetrics() {
        return qualityMetrics;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExtractionReport)) {
            return false;
        }
        ExtractionReport other = (ExtractionReport) o;
        return patient.equals(other.patient) && diagnosis.equals(other.diagnosis)
            && variants.equals(other.variants) && recommendations.equals(other.recommendations)
            && Objects.equals(tmb, other.tmb) && Objects.equals(ngsMethod, other.ngsMethod)
            && Objects.equals(reportDate, other.reportDate) && Objects.equals(qualityMetrics, other.qualityMetrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patient, diagnosis, variants, recommendations, tmb, ngsMethod, reportDate, qualityMetrics);
    }

    @Override
    public String toString() {
        return "ExtractionReport{patient=" + patient.getId() + ", variants=" + variants.size()
            + ", recommendations=" + recommendations.size() + ", tmb=" + tmb + "}";
    }
}

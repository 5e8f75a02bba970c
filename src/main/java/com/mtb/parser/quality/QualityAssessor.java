package com.mtb.parser.quality;

import com.mtb.parser.model.DiagnosisRecord;
import com.mtb.parser.model.PatientRecord;
import com.mtb.parser.model.QualityMetrics;
import com.mtb.parser.model.TherapeuticRecommendation;
import com.mtb.parser.model.VariantRecord;
import com.mtb.parser.report.ExtractionReport;

import java.util.List;

/**
 * Computes completeness metrics and warnings from a finished extraction.
 * <p>
 * Completeness counts six base fields (patient id, age and sex, diagnosis text
 * and stage, TMB) plus three fields per variant (gene code, VAF, classification),
 * so the percentage is only meaningful within one report.
 */
public class QualityAssessor {

    static final int BASE_FIELDS = 6;
    static final int FIELDS_PER_VARIANT = 3;

    public static final String WARNING_NO_VARIANTS = "No variants extracted";
    public static final String WARNING_NO_DIAGNOSIS = "Diagnosis not found";
    public static final String WARNING_DIAGNOSIS_UNMAPPED = "Diagnosis not mapped to ICD-O";
    public static final String WARNING_PATIENT_INCOMPLETE = "Patient information incomplete";
    public static final String WARNING_NO_TMB = "TMB not found";

    /**
     * Assess an assembled report
     * @param report Extraction report
     * @return Quality metrics for the report's entities
     */
    public QualityMetrics assess(ExtractionReport report) {
        if (report == null) {
            throw new IllegalArgumentException("Report cannot be null");
        }
        return assess(report.getPatient(), report.getDiagnosis(), report.getVariants(),
            report.getRecommendations(), report.getTmb());
    }

    /**
     * Assess extracted entities before assembly
     * @param patient Patient record
     * @param diagnosis Diagnosis record
     * @param variants Final variants
     * @param recommendations Therapeutic recommendations
     * @param tmb TMB, may be null
     * @return Quality metrics
     */
    public QualityMetrics assess(PatientRecord patient, DiagnosisRecord diagnosis, List<VariantRecord> variants,
                                 List<TherapeuticRecommendation> recommendations, Double tmb) {
        PatientRecord p = patient != null ? patient : PatientRecord.empty();
        DiagnosisRecord d = diagnosis != null ? diagnosis : DiagnosisRecord.empty();
        List<VariantRecord> vs = variants != null ? variants : List.of();
        List<TherapeuticRecommendation> rs = recommendations != null ? recommendations : List.of();

        int withVaf = (int) vs.stream().filter(v -> v.getVaf() != null).count();
        int classified = (int) vs.stream().filter(VariantRecord::isClassified).count();
        int withGeneCode = (int) vs.stream().filter(v -> v.getGeneVocabularyCode() != null).count();

        int filled = countPresent(p.getId(), p.getAge(), p.getSex(), d.getPrimaryDiagnosis(), d.getStage(), tmb)
            + withVaf + classified + withGeneCode;

        QualityMetrics.Builder builder = QualityMetrics.builder()
            .totalFieldsExpected(BASE_FIELDS + FIELDS_PER_VARIANT * vs.size())
            .filledFields(filled)
            .variantsFound(vs.size())
            .variantsWithVaf(withVaf)
            .variantsClassified(classified)
            .variantsWithGeneCode(withGeneCode)
            .drugsIdentified(rs.size())
            .drugsMapped((int) rs.stream().filter(TherapeuticRecommendation::isMapped).count())
            .diagnosisMapped(d.isMapped())
            .patientComplete(p.isComplete());

        if (vs.isEmpty()) {
            builder.addWarning(WARNING_NO_VARIANTS);
        }
        if (!d.hasDiagnosis()) {
            builder.addWarning(WARNING_NO_DIAGNOSIS);
        } else if (!d.isMapped()) {
            builder.addWarning(WARNING_DIAGNOSIS_UNMAPPED);
        }
        if (!p.isComplete()) {
            builder.addWarning(WARNING_PATIENT_INCOMPLETE);
        }
        if (tmb == null) {
            builder.addWarning(WARNING_NO_TMB);
        }

        return builder.build();
    }

    private static int countPresent(Object... values) {
        int count = 0;
        for (Object value : values) {
            if (value != null) {
                count++;
            }
        }
        return count;
    }
}

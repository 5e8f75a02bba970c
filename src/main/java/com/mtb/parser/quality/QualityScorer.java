package com.mtb.parser.quality;

import com.mtb.parser.model.DiagnosisRecord;
import com.mtb.parser.model.PatientRecord;
import com.mtb.parser.model.TherapeuticRecommendation;
import com.mtb.parser.model.VariantRecord;
import com.mtb.parser.report.ExtractionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Scores a report section by section and combines the sections into a weighted
 * overall score and quality level.
 */
public class QualityScorer {
    private static final Logger logger = LoggerFactory.getLogger(QualityScorer.class);

    // Section weights for the overall score
    private static final double PATIENT_WEIGHT = 0.20;
    private static final double DIAGNOSIS_WEIGHT = 0.25;
    private static final double VARIANTS_WEIGHT = 0.35;
    private static final double THERAPEUTICS_WEIGHT = 0.20;

    // Score given when no recommendations are present: not every report has actionable findings
    private static final double NO_RECOMMENDATIONS_SCORE = 50.0;

    private static final int COMPLETENESS_FIELDS = 8;

    /**
     * Perform a detailed quality assessment
     * @param report Extraction report
     * @return Detailed quality report
     */
    public DetailedQualityReport score(ExtractionReport report) {
        if (report == null) {
            throw new IllegalArgumentException("Report cannot be null");
        }

        DetailedQualityReport quality = new DetailedQualityReport();

        quality.setPatientScore(scorePatient(report.getPatient(), quality));
        quality.setDiagnosisScore(scoreDiagnosis(report.getDiagnosis(), quality));
        quality.setVariantsScore(scoreVariants(report, quality));
        quality.setTherapeuticsScore(scoreTherapeutics(report.getRecommendations(), quality));

        calculateCompleteness(report, quality);

        double overall = quality.getPatientScore() * PATIENT_WEIGHT
            + quality.getDiagnosisScore() * DIAGNOSIS_WEIGHT
            + quality.getVariantsScore() * VARIANTS_WEIGHT
            + quality.getTherapeuticsScore() * THERAPEUTICS_WEIGHT;
        quality.determineQualityLevel(round(overall));

        generateRecommendations(quality);

        logger.debug("Quality score {} ({})", quality.getOverallScore(), quality.getQualityLevel());
        return quality;
    }

    private double scorePatient(PatientRecord patient, DetailedQualityReport quality) {
        double score = 0.0;

        if (patient.getId() != null) {
            score += 30;
        } else {
            quality.addError("Patient ID missing");
        }
        if (patient.getAge() != null) {
            score += 25;
        } else {
            quality.addWarning("Patient age missing");
        }
        if (patient.getSex() != null) {
            score += 25;
        } else {
            quality.addWarning("Patient sex missing");
        }
        if (patient.getBirthDate() != null) {
            score += 20;
        } else {
            quality.addWarning("Patient birth date missing");
        }

        return score;
    }

    private double scoreDiagnosis(DiagnosisRecord diagnosis, DetailedQualityReport quality) {
        double score = 0.0;

        if (diagnosis.hasDiagnosis()) {
            score += 40;
        } else {
            quality.addError("Primary diagnosis missing");
        }
        if (diagnosis.isMapped()) {
            score += 30;
            quality.setDiagnosisMapped(true);
        } else {
            quality.addWarning("Diagnosis not mapped to ICD-O");
        }
        if (diagnosis.getStage() != null) {
            score += 20;
        } else {
            quality.addWarning("Cancer stage missing");
        }
        if (diagnosis.getHistology() != null) {
            score += 10;
        }

        return score;
    }

    private double scoreVariants(ExtractionReport report, DetailedQualityReport quality) {
        List<VariantRecord> variants = report.getVariants();
        if (variants.isEmpty()) {
            quality.addError("No variants found in report");
            return 0.0;
        }

        int total = variants.size();
        quality.setVariantsTotal(total);
        quality.setVariantsWithHgvs((int) variants.stream().filter(VariantRecord::hasHgvs).count());
        quality.setVariantsWithVaf((int) variants.stream().filter(v -> v.getVaf() != null).count());
        quality.setVariantsClassified((int) variants.stream().filter(VariantRecord::isClassified).count());
        quality.setVariantsActionable(report.getActionableVariants().size());
        quality.setVariantsWithGeneCode((int) variants.stream().filter(v -> v.getGeneVocabularyCode() != null).count());

        double hgvsPct = percent(quality.getVariantsWithHgvs(), total);
        double vafPct = percent(quality.getVariantsWithVaf(), total);
        double classifiedPct = percent(quality.getVariantsClassified(), total);
        double genePct = percent(quality.getVariantsWithGeneCode(), total);
        quality.setGenesMappedPct(genePct);

        if (hgvsPct < 50) {
            quality.addWarning("Less than 50% of variants have HGVS nomenclature");
        }
        if (vafPct < 50) {
            quality.addWarning("Less than 50% of variants have VAF");
        }
        if (classifiedPct < 50) {
            quality.addWarning("Less than 50% of variants are classified");
        }
        if (genePct < 80) {
            quality.addWarning("Less than 80% of genes mapped to HGNC");
        }

        // 20 points for having variants, 20 for each indicator in proportion
        return 20 + (hgvsPct + vafPct + classifiedPct + genePct) / 100 * 20;
    }

    private double scoreTherapeutics(List<TherapeuticRecommendation> recommendations, DetailedQualityReport quality) {
        if (recommendations.isEmpty()) {
            quality.addWarning("No therapeutic recommendations found");
            return NO_RECOMMENDATIONS_SCORE;
        }

        int total = recommendations.size();
        double mappedPct = percent(recommendations.stream().filter(TherapeuticRecommendation::isMapped).count(), total);
        double targetPct = percent(recommendations.stream().filter(r -> r.getGeneTarget() != null).count(), total);
        double evidencePct = percent(recommendations.stream().filter(r -> r.getEvidenceLevel() != null).count(), total);
        quality.setDrugsMappedPct(mappedPct);

        if (mappedPct < 80) {
            quality.addWarning("Less than 80% of drugs mapped to RxNorm");
        }

        return 30 + mappedPct / 100 * 40 + targetPct / 100 * 20 + evidencePct / 100 * 10;
    }

    private void calculateCompleteness(ExtractionReport report, DetailedQualityReport quality) {
        PatientRecord patient = report.getPatient();
        DiagnosisRecord diagnosis = report.getDiagnosis();

        int filled = 0;
        for (Object value : new Object[] {patient.getId(), patient.getAge(), patient.getSex(), patient.getBirthDate(),
                diagnosis.getPrimaryDiagnosis(), diagnosis.getStage(), diagnosis.getVocabularyCode(), report.getTmb()}) {
            if (value != null) {
                filled++;
            }
        }

        quality.setTotalFieldsExpected(COMPLETENESS_FIELDS);
        quality.setTotalFieldsFilled(filled);
        quality.setCompletenessPct(round(percent(filled, COMPLETENESS_FIELDS)));
    }

    private void generateRecommendations(DetailedQualityReport quality) {
        if (quality.getPatientScore() < 80) {
            quality.addRecommendation("Improve patient data completeness (ID, age, sex, birth date)");
        }
        if (!quality.isDiagnosisMapped()) {
            quality.addRecommendation("Map diagnosis to ICD-O codes for better interoperability");
        }
        if (quality.getVariantsWithHgvs() < quality.getVariantsTotal()) {
            quality.addRecommendation("Use HGVS nomenclature (c./p.) for all variants");
        }
        if (quality.getVariantsWithVaf() < quality.getVariantsTotal() * 0.8) {
            quality.addRecommendation("Include VAF (Variant Allele Frequency) for variants when available");
        }
        if (quality.getGenesMappedPct() < 90) {
            quality.addRecommendation("Verify gene symbols match HGNC nomenclature");
        }
        if (quality.getDrugsMappedPct() < 80) {
            quality.addRecommendation("Use standard drug names mappable to RxNorm");
        }
        if (quality.getOverallScore() < 60) {
            quality.addRecommendation("Review report format to ensure all key fields are extractable");
        }
    }

    private static double percent(long count, int total) {
        return total == 0 ? 0.0 : count * 100.0 / total;
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}

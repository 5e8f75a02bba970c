package com.mtb.parser.report;

import com.mtb.parser.model.DiagnosisRecord;
import com.mtb.parser.model.PatientRecord;
import com.mtb.parser.model.QualityMetrics;
import com.mtb.parser.model.TherapeuticRecommendation;
import com.mtb.parser.model.VariantRecord;

import java.util.List;

/**
 * Composes the extracted entities into the final immutable report. No validation happens here.
 */
public class ReportAssembler {

    /**
     * Assemble a report
     * @param patient Patient demographics
     * @param diagnosis Diagnosis
     * @param variants Final variant list
     * @param recommendations Therapeutic recommendations
     * @param tmb Tumor mutational burden, may be null
     * @param ngsMethod Sequencing panel, may be null
     * @param reportDate ISO report date, may be null
     * @param quality Quality metrics computed from the same entities
     * @return Immutable report
     */
    public ExtractionReport assemble(PatientRecord patient, DiagnosisRecord diagnosis, List<VariantRecord> variants,
                                     List<TherapeuticRecommendation> recommendations, Double tmb, String ngsMethod,
                                     String reportDate, QualityMetrics quality) {
        return new ExtractionReport(patient, diagnosis, variants, recommendations, tmb, ngsMethod, reportDate, quality);
    }
}

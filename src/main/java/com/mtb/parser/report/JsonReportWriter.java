package com.mtb.parser.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mtb.parser.model.DiagnosisRecord;
import com.mtb.parser.model.PatientRecord;
import com.mtb.parser.model.QualityMetrics;
import com.mtb.parser.model.TherapeuticRecommendation;
import com.mtb.parser.model.VariantRecord;
import com.mtb.parser.vocabulary.DiagnosisCode;
import com.mtb.parser.vocabulary.DrugCode;
import com.mtb.parser.vocabulary.GeneCode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes an {@link ExtractionReport} to JSON with a fixed key order, so equal
 * reports always produce identical output.
 */
public class JsonReportWriter {

    private final ObjectMapper objectMapper;

    public JsonReportWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Write the report to a file
     * @param report Extraction report
     * @param path Target file
     * @throws IOException if the file cannot be written
     */
    public void write(ExtractionReport report, Path path) throws IOException {
        objectMapper.writeValue(path.toFile(), toMap(report));
    }

    /**
     * Render the report as a JSON string
     * @param report Extraction report
     * @return Pretty-printed JSON
     */
    public String toJson(ExtractionReport report) {
        try {
            return objectMapper.writeValueAsString(toMap(report));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize report: " + e.getMessage(), e);
        }
    }

    Map<String, Object> toMap(ExtractionReport report) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("patient", patientToMap(report.getPatient()));
        json.put("diagnosis", diagnosisToMap(report.getDiagnosis()));
        json.put("variants", report.getVariants().stream().map(this::variantToMap).toList());
        json.put("recommendations", report.getRecommendations().stream().map(this::recommendationToMap).toList());
        json.put("tmb", report.getTmb());
        json.put("ngs_method", report.getNgsMethod());
        json.put("report_date", report.getReportDate());
        json.put("quality_metrics", qualityToMap(report.getQualityMetrics()));
        return json;
    }

    private Map<String, Object> patientToMap(PatientRecord patient) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", patient.getId());
        m.put("age", patient.getAge());
        m.put("sex", patient.getSex());
        m.put("birth_date", patient.getBirthDate());
        return m;
    }

    private Map<String, Object> diagnosisToMap(DiagnosisRecord diagnosis) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("primary_diagnosis", diagnosis.getPrimaryDiagnosis());
        m.put("stage", diagnosis.getStage());
        m.put("histology", diagnosis.getHistology());
        DiagnosisCode code = diagnosis.getVocabularyCode();
        if (code != null) {
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("code", code.getCode());
            c.put("display", code.getDisplay());
            c.put("topography", code.getTopography());
            m.put("icd_o_code", c);
        } else {
            m.put("icd_o_code", null);
        }
        return m;
    }

    private Map<String, Object> variantToMap(VariantRecord variant) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("gene", variant.getGene());
        m.put("cdna_change", variant.getCdnaChange());
        m.put("protein_change", variant.getProteinChange());
        m.put("classification", variant.getClassification());
        m.put("vaf", variant.getVaf());
        GeneCode code = variant.getGeneVocabularyCode();
        if (code != null) {
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("symbol", code.getSymbol());
            c.put("hgnc_id", code.getHgncId());
            c.put("name", code.getName());
            m.put("gene_code", c);
        } else {
            m.put("gene_code", null);
        }
        return m;
    }

    private Map<String, Object> recommendationToMap(TherapeuticRecommendation recommendation) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("drug", recommendation.getDrug());
        m.put("gene_target", recommendation.getGeneTarget());
        m.put("evidence_level", recommendation.getEvidenceLevel());
        DrugCode code = recommendation.getDrugVocabularyCode();
        if (code != null) {
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("rxcui", code.getRxcui());
            c.put("display", code.getDisplay());
            c.put("targets", code.getTargets());
            m.put("drug_code", c);
        } else {
            m.put("drug_code", null);
        }
        return m;
    }

    private Map<String, Object> qualityToMap(QualityMetrics quality) {
        if (quality == null) {
            return null;
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("total_fields_expected", quality.getTotalFieldsExpected());
        m.put("filled_fields", quality.getFilledFields());
        m.put("completeness_pct", quality.getCompletenessPct());
        m.put("variants_found", quality.getVariantsFound());
        m.put("variants_with_vaf", quality.getVariantsWithVaf());
        m.put("variants_classified", quality.getVariantsClassified());
        m.put("variants_with_gene_code", quality.getVariantsWithGeneCode());
        m.put("drugs_identified", quality.getDrugsIdentified());
        m.put("drugs_mapped", quality.getDrugsMapped());
        m.put("diagnosis_mapped", quality.isDiagnosisMapped());
        m.put("patient_complete", quality.isPatientComplete());
        List<String> warnings = quality.getWarnings();
        m.put("warnings", warnings);
        return m;
    }
}

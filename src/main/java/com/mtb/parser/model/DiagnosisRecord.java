package com.mtb.parser.model;

import com.mtb.parser.vocabulary.DiagnosisCode;

import java.util.Objects;

/**
 * Primary diagnosis with optional TNM stage, histology and ICD-O mapping.
 */
public final class DiagnosisRecord {
    private final String primaryDiagnosis;
    private final String stage;
    private final String histology;
    private final DiagnosisCode vocabularyCode;

    public DiagnosisRecord(String primaryDiagnosis, String stage, String histology, DiagnosisCode vocabularyCode) {
        this.primaryDiagnosis = primaryDiagnosis;
        this.stage = stage;
        this.histology = histology;
        this.vocabularyCode = vocabularyCode;
    }

    public static DiagnosisRecord empty() {
        return new DiagnosisRecord(null, null, null, null);
    }

    public boolean hasDiagnosis() {
        return primaryDiagnosis != null;
    }

    public boolean isMapped() {
        return vocabularyCode != null;
    }

    public String getPrimaryDiagnosis() {
        return primaryDiagnosis;
    }

    public String getStage() {
        return stage;
    }

    public String getHistology() {
        return histology;
    }

    public DiagnosisCode getVocabularyCode() {
        return vocabularyCode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DiagnosisRecord)) {
            return false;
        }
        DiagnosisRecord other = (DiagnosisRecord) o;
        return Objects.equals(primaryDiagnosis, other.primaryDiagnosis) && Objects.equals(stage, other.stage)
            && Objects.equals(histology, other.histology) && Objects.equals(vocabularyCode, other.vocabularyCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(primaryDiagnosis, stage, histology, vocabularyCode);
    }

    @Override
    public String toString() {
        return "DiagnosisRecord{primaryDiagnosis=" + primaryDiagnosis + ", stage=" + stage
            + ", histology=" + histology + ", vocabularyCode=" + vocabularyCode + "}";
    }
}

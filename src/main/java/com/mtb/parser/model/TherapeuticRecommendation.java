package com.mtb.parser.model;

import com.mtb.parser.vocabulary.DrugCode;

import java.util.Locale;
import java.util.Objects;

/**
 * A drug named in the report's therapeutic section, with its targets and evidence bucket.
 */
public final class TherapeuticRecommendation {
    private final String drug;
    private final String geneTarget;
    private final String evidenceLevel;
    private final DrugCode drugVocabularyCode;

    public TherapeuticRecommendation(String drug, String geneTarget, String evidenceLevel,
                                     DrugCode drugVocabularyCode) {
        if (drug == null || drug.isBlank()) {
            throw new IllegalArgumentException("Drug name cannot be empty");
        }
        this.drug = drug.toLowerCase(Locale.ROOT).trim();
        this.geneTarget = geneTarget;
        this.evidenceLevel = evidenceLevel;
        this.drugVocabularyCode = drugVocabularyCode;
    }

    /**
     * Check if recommendation is actionable (has drug and target)
     */
    public boolean isActionable() {
        return geneTarget != null;
    }

    public boolean isMapped() {
        return drugVocabularyCode != null;
    }

    public String getDrug() {
        return drug;
    }

    public String getGeneTarget() {
        return geneTarget;
    }

    public String getEvidenceLevel() {
        return evidenceLevel;
    }

    public DrugCode getDrugVocabularyCode() {
        return drugVocabularyCode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TherapeuticRecommendation)) {
            return false;
        }
        TherapeuticRecommendation other = (TherapeuticRecommendation) o;
        return drug.equals(other.drug) && Objects.equals(geneTarget, other.geneTarget)
            && Objects.equals(evidenceLevel, other.evidenceLevel)
            && Objects.equals(drugVocabularyCode, other.drugVocabularyCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(drug, geneTarget, evidenceLevel, drugVocabularyCode);
    }

    @Override
    public String toString() {
        return "TherapeuticRecommendation{drug=" + drug + ", geneTarget=" + geneTarget
            + ", evidenceLevel=" + evidenceLevel + "}";
    }
}

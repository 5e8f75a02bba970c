package com.mtb.parser.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Completeness and confidence indicators computed from a finished extraction.
 * Completeness is relative to the number of variants in the same report.
 */
public final class QualityMetrics {
    private final int totalFieldsExpected;
    private final int filledFields;
    private final double completenessPct;
    private final int variantsFound;
    private final int variantsWithVaf;
    private final int variantsClassified;
    private final int variantsWithGeneCode;
    private final int drugsIdentified;
    private final int drugsMapped;
    private final boolean diagnosisMapped;
    private final boolean patientComplete;
    private final List<String> warnings;

    private QualityMetrics(Builder builder) {
        if (builder.filledFields < 0 || builder.filledFields > builder.totalFieldsExpected) {
            throw new IllegalArgumentException("Filled fields " + builder.filledFields
                + " outside [0, " + builder.totalFieldsExpected + "]");
        }
        this.totalFieldsExpected = builder.totalFieldsExpected;
        this.filledFields = builder.filledFields;
        this.completenessPct = computeCompleteness(builder.filledFields, builder.totalFieldsExpected);
        this.variantsFound = builder.variantsFound;
        this.variantsWithVaf = builder.variantsWithVaf;
        this.variantsClassified = builder.variantsClassified;
        this.variantsWithGeneCode = builder.variantsWithGeneCode;
        this.drugsIdentified = builder.drugsIdentified;
        this.drugsMapped = builder.drugsMapped;
        this.diagnosisMapped = builder.diagnosisMapped;
        this.patientComplete = builder.patientComplete;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(builder.warnings));
    }

    public static Builder builder() {
        return new Builder();
    }

    private static double computeCompleteness(int filled, int total) {
        if (total <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(filled * 100.0 / total)
            .setScale(1, RoundingMode.HALF_UP)
            .doubleValue();
    }

    /**
     * Get human-readable summary
     * @return Multi-line summary of the metrics
     */
    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Completeness: ").append(completenessPct).append("%\n");
        sb.append("Variants: ").append(variantsFound)
          .append(" (").append(variantsWithVaf).append(" with VAF, ")
          .append(variantsClassified).append(" classified)\n");
        sb.append("Drugs: ").append(drugsIdentified).append(" (").append(drugsMapped).append(" mapped)\n");
        sb.append("Diagnosis mapped: ").append(diagnosisMapped ? "Yes" : "No").append("\n");
        sb.append("Patient complete: ").append(patientComplete ? "Yes" : "No");
        if (!warnings.isEmpty()) {
            sb.append("\nWarnings: ").append(warnings.size());
        }
        return sb.toString();
    }

    public int getTotalFieldsExpected() {
        return totalFieldsExpected;
    }

    public int getFilledFields() {
        return filledFields;
    }

    public double getCompletenessPct() {
        return completenessPct;
    }

    public int getVariantsFound() {
        return variantsFound;
    }

    public int getVariantsWithVaf() {
        return variantsWithVaf;
    }

    public int getVariantsClassified() {
        return variantsClassified;
    }

    public int getVariantsWithGeneCode() {
        return variantsWithGeneCode;
    }

    public int getDrugsIdentified() {
        return drugsIdentified;
    }

    public int getDrugsMapped() {
        return drugsMapped;
    }

    public boolean isDiagnosisMapped() {
        return diagnosisMapped;
    }

    public boolean isPatientComplete() {
        return patientComplete;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QualityMetrics)) {
            return false;
        }
        QualityMetrics other = (QualityMetrics) o;
        return totalFieldsExpected == other.totalFieldsExpected && filledFields == other.filledFields
            && variantsFound == other.variantsFound && variantsWithVaf == other.variantsWithVaf
            && variantsClassified == other.variantsClassified
            && variantsWithGeneCode == other.variantsWithGeneCode
            && drugsIdentified == other.drugsIdentified && drugsMapped == other.drugsMapped
            && diagnosisMapped == other.diagnosisMapped && patientComplete == other.patientComplete
            && warnings.equals(other.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalFieldsExpected, filledFields, variantsFound, variantsWithVaf, variantsClassified,
            variantsWithGeneCode, drugsIdentified, drugsMapped, diagnosisMapped, patientComplete, warnings);
    }

    public static final class Builder {
        private int totalFieldsExpected;
        private int filledFields;
        private int variantsFound;
        private int variantsWithVaf;
        private int variantsClassified;
        private int variantsWithGeneCode;
        private int drugsIdentified;
        private int drugsMapped;
        private boolean diagnosisMapped;
        private boolean patientComplete;
        private final List<String> warnings = new ArrayList<>();

        private Builder() {
        }

        public Builder totalFieldsExpected(int totalFieldsExpected) {
            this.totalFieldsExpected = totalFieldsExpected;
            return this;
        }

        public Builder filledFields(int filledFields) {
            this.filledFields = filledFields;
            return this;
        }

        public Builder variantsFound(int variantsFound) {
            this.variantsFound = variantsFound;
            return this;
        }

        public Builder variantsWithVaf(int variantsWithVaf) {
            this.variantsWithVaf = variantsWithVaf;
            return this;
        }

        public Builder variantsClassified(int variantsClassified) {
            this.variantsClassified = variantsClassified;
            return this;
        }

        public Builder variantsWithGeneCode(int variantsWithGeneCode) {
            this.variantsWithGeneCode = variantsWithGeneCode;
            return this;
        }

        public Builder drugsIdentified(int drugsIdentified) {
            this.drugsIdentified = drugsIdentified;
            return this;
        }

        public Builder drugsMapped(int drugsMapped) {
            this.drugsMapped = drugsMapped;
            return this;
        }

        public Builder diagnosisMapped(boolean diagnosisMapped) {
            this.diagnosisMapped = diagnosisMapped;
            return this;
        }

        public Builder patientComplete(boolean patientComplete) {
            this.patientComplete = patientComplete;
            return this;
        }

        /**
         * Add a warning unless the exact same text is already present
         * @param warning Warning message
         */
        public Builder addWarning(String warning) {
            if (warning != null && !warnings.contains(warning)) {
                warnings.add(warning);
            }
            return this;
        }

        public QualityMetrics build() {
            return new QualityMetrics(this);
        }
    }
}

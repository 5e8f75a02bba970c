package com.mtb.parser.model;

/**
 * ACMG-style pathogenicity buckets used for genomic variants.
 */
public enum VariantClassification {
    PATHOGENIC("Pathogenic"),
    LIKELY_PATHOGENIC("Likely Pathogenic"),
    VUS("VUS"),
    LIKELY_BENIGN("Likely Benign"),
    BENIGN("Benign"),
    UNKNOWN("unknown");

    private final String label;

    VariantClassification(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolve a normalized classification label to the enum
     * @param label Normalized label, may be null
     * @return Matching constant, UNKNOWN for null or free-text labels
     */
    public static VariantClassification fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        for (VariantClassification classification : values()) {
            if (classification.label.equals(label)) {
                return classification;
            }
        }
        return UNKNOWN;
    }

    public boolean isPathogenic() {
        return this == PATHOGENIC || this == LIKELY_PATHOGENIC;
    }
}

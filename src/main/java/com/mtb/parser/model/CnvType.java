package com.mtb.parser.model;

/**
 * Copy number alteration subtypes. The label is what ends up in the
 * protein_change slot of the resulting variant.
 */
public enum CnvType {
    AMPLIFICATION("amplification", true),
    DELETION("deletion", true),
    HOMOZYGOUS_DELETION("homozygous_deletion", true),
    LOH("LOH", true),
    COPY_NUMBER_VARIATION("copy_number_variation", false),
    CNV("CNV", false);

    // Copy number thresholds for numeric CN reports
    private static final double AMPLIFICATION_MIN_COPIES = 4.0;
    private static final double DELETION_MAX_COPIES = 1.0;

    private final String label;
    private final boolean pathogenic;

    CnvType(String label, boolean pathogenic) {
        this.label = label;
        this.pathogenic = pathogenic;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether alterations of this subtype are reported as Pathogenic.
     * Unclassified copy number changes are reported as VUS.
     */
    public boolean isPathogenic() {
        return pathogenic;
    }

    /**
     * Classify a numeric copy number value
     * @param copyNumber Reported copy number
     * @return AMPLIFICATION (≥4), DELETION (≤1) or COPY_NUMBER_VARIATION
     */
    public static CnvType fromCopyNumber(double copyNumber) {
        if (copyNumber >= AMPLIFICATION_MIN_COPIES) {
            return AMPLIFICATION;
        }
        if (copyNumber <= DELETION_MAX_COPIES) {
            return DELETION;
        }
        return COPY_NUMBER_VARIATION;
    }
}

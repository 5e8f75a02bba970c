package com.mtb.parser.merge;

import com.mtb.parser.model.VariantRecord;

import java.util.Objects;

/**
 * Identity of a variant within one report: (gene, protein change, cDNA change).
 */
public final class VariantKey {
    private final String gene;
    private final String proteinChange;
    private final String cdnaChange;

    public VariantKey(String gene, String proteinChange, String cdnaChange) {
        this.gene = Objects.requireNonNull(gene, "gene");
        this.proteinChange = proteinChange;
        this.cdnaChange = cdnaChange;
    }

    public static VariantKey of(VariantRecord variant) {
        return new VariantKey(variant.getGene(), variant.getProteinChange(), variant.getCdnaChange());
    }

    /**
     * Check whether this key describes nothing beyond what another key already says:
     * same gene, and every change this key carries is equal to the other's.
     * A key with no change at all subsumes nothing.
     * @param other Key of an already accepted variant
     * @return true if this key is covered by the other
     */
    public boolean isCoveredBy(VariantKey other) {
        if (!gene.equals(other.gene) || (proteinChange == null && cdnaChange == null)) {
            return false;
        }
        boolean proteinCovered = proteinChange == null || proteinChange.equals(other.proteinChange);
        boolean cdnaCovered = cdnaChange == null || cdnaChange.equals(other.cdnaChange);
        return proteinCovered && cdnaCovered;
    }

    public String getGene() {
        return gene;
    }

    public String getProteinChange() {
        return proteinChange;
    }

    public String getCdnaChange() {
        return cdnaChange;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VariantKey)) {
            return false;
        }
        VariantKey other = (VariantKey) o;
        return gene.equals(other.gene) && Objects.equals(proteinChange, other.proteinChange)
            && Objects.equals(cdnaChange, other.cdnaChange);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gene, proteinChange, cdnaChange);
    }

    @Override
    public String toString() {
        return gene + "_" + proteinChange + "_" + cdnaChange;
    }
}

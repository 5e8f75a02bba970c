package com.mtb.parser.model;

import com.mtb.parser.vocabulary.GeneCode;

import java.util.Objects;

/**
 * A genomic alteration found in the report: SNV/indel, fusion, CNV or exon-level event.
 * <p>
 * Fusions are encoded with gene "GENE1::GENE2" and protein change "fusion";
 * CNVs and exon alterations carry their alteration label in the protein change slot.
 * Instances are immutable; enrichment produces modified copies via {@link #withVaf(Double)}.
 */
public final class VariantRecord {
    public static final String FUSION = "fusion";
    public static final String FUSION_SEPARATOR = "::";

    private final String gene;
    private final String cdnaChange;
    private final String proteinChange;
    private final String classification;
    private final Double vaf;
    private final GeneCode geneVocabularyCode;
    private final String rawText;

    private VariantRecord(Builder builder) {
        if (builder.gene == null || builder.gene.isBlank()) {
            throw new IllegalArgumentException("Variant gene cannot be empty");
        }
        if (builder.vaf != null && !isValidVaf(builder.vaf)) {
            throw new IllegalArgumentException("VAF out of range (0, 100]: " + builder.vaf);
        }
        this.gene = builder.gene;
        this.cdnaChange = builder.cdnaChange;
        this.proteinChange = builder.proteinChange;
        this.classification = builder.classification;
        this.vaf = builder.vaf;
        this.geneVocabularyCode = builder.geneVocabularyCode;
        this.rawText = builder.rawText;
    }

    public static Builder builder(String gene) {
        return new Builder(gene);
    }

    /**
     * Check that a VAF percentage is plausible
     * @param vaf Percentage value
     * @return true if 0 &lt; vaf &le; 100
     */
    public static boolean isValidVaf(double vaf) {
        return vaf > 0 && vaf <= 100;
    }

    /**
     * Copy of this variant with the given allele frequency
     */
    public VariantRecord withVaf(Double vaf) {
        return toBuilder().vaf(vaf).build();
    }

    public Builder toBuilder() {
        return new Builder(gene)
            .cdnaChange(cdnaChange)
            .proteinChange(proteinChange)
            .classification(classification)
            .vaf(vaf)
            .geneVocabularyCode(geneVocabularyCode)
            .rawText(rawText);
    }

    public boolean isFusion() {
        return gene.contains(FUSION_SEPARATOR) || FUSION.equals(proteinChange);
    }

    /**
     * Check if variant is actionable (has gene code and is pathogenic)
     */
    public boolean isActionable() {
        return geneVocabularyCode != null && getClassificationCategory().isPathogenic();
    }

    public boolean isClassified() {
        return classification != null;
    }

    public boolean hasHgvs() {
        return cdnaChange != null || proteinChange != null;
    }

    public String getGene() {
        return gene;
    }

    public String getCdnaChange() {
        return cdnaChange;
    }

    public String getProteinChange() {
        return proteinChange;
    }

    /** Normalized classification label, or null when the report gives none. */
    public String getClassification() {
        return classification;
    }

    public VariantClassification getClassificationCategory() {
        return VariantClassification.fromLabel(classification);
    }

    public Double getVaf() {
        return vaf;
    }

    public GeneCode getGeneVocabularyCode() {
        return geneVocabularyCode;
    }

    public String getRawText() {
        return rawText;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VariantRecord)) {
            return false;
        }
        VariantRecord other = (VariantRecord) o;
        return gene.equals(other.gene) && Objects.equals(cdnaChange, other.cdnaChange)
            && Objects.equals(proteinChange, other.proteinChange)
            && Objects.equals(classification, other.classification) && Objects.equals(vaf, other.vaf)
            && Objects.equals(geneVocabularyCode, other.geneVocabularyCode)
            && Objects.equals(rawText, other.rawText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gene, cdnaChange, proteinChange, classification, vaf, geneVocabularyCode, rawText);
    }

    @Override
    public String toString() {
        return "VariantRecord{gene=" + gene + ", cdna=" + cdnaChange + ", protein=" + proteinChange
            + ", classification=" + classification + ", vaf=" + vaf + "}";
    }

    public static final class Builder {
        private final String gene;
        private String cdnaChange;
        private String proteinChange;
        private String classification;
        private Double vaf;
        private GeneCode geneVocabularyCode;
        private String rawText;

        private Builder(String gene) {
            this.gene = gene;
        }

        public Builder cdnaChange(String cdnaChange) {
            this.cdnaChange = cdnaChange;
            return this;
        }

        public Builder proteinChange(String proteinChange) {
            this.proteinChange = proteinChange;
            return this;
        }

        public Builder classification(String classification) {
            this.classification = classification;
            return this;
        }

        public Builder vaf(Double vaf) {
            this.vaf = vaf;
            return this;
        }

        public Builder geneVocabularyCode(GeneCode geneVocabularyCode) {
            this.geneVocabularyCode = geneVocabularyCode;
            return this;
        }

        public Builder rawText(String rawText) {
            this.rawText = rawText;
            return this;
        }

        public VariantRecord build() {
            return new VariantRecord(this);
        }
    }
}

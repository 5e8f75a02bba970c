package com.mtb.parser.extractor;

import com.mtb.parser.extractor.PatternFamily.Kind;
import com.mtb.parser.vocabulary.VocabularyService;

/**
 * Exon-level insertions, deletions and delins ("EGFR exon 19 deletion", "EGFR esone 20 inserzione").
 */
public class ExonAlterationExtractor extends FamilyExtractor {

    public ExonAlterationExtractor(VariantPatternRegistry registry, VocabularyService vocabulary) {
        super(registry, Kind.EXON, vocabulary);
    }

    @Override
    protected boolean accepts(String gene) {
        return resolves(gene);
    }
}

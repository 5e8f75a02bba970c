package com.mtb.parser.extractor;

import com.mtb.parser.extractor.PatternFamily.Kind;
import com.mtb.parser.vocabulary.VocabularyService;

/**
 * Copy number alterations: amplification, deletion, homozygous deletion, LOH and numeric copy number.
 */
public class CnvExtractor extends FamilyExtractor {

    public CnvExtractor(VariantPatternRegistry registry, VocabularyService vocabulary) {
        super(registry, Kind.CNV, vocabulary);
    }

    @Override
    protected boolean accepts(String gene) {
        return resolves(gene);
    }
}

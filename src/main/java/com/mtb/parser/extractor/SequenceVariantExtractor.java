package com.mtb.parser.extractor;

import com.mtb.parser.extractor.PatternFamily.Kind;
import com.mtb.parser.vocabulary.VocabularyService;

/**
 * SNVs, small indels, frameshift, nonsense, splice and duplication variants.
 */
public class SequenceVariantExtractor extends FamilyExtractor {

    public SequenceVariantExtractor(VariantPatternRegistry registry, VocabularyService vocabulary) {
        super(registry, Kind.SEQUENCE, vocabulary);
    }

    @Override
    protected boolean accepts(String gene) {
        return resolves(gene);
    }
}

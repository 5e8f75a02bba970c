package com.mtb.parser.extractor;

import com.mtb.parser.extractor.PatternFamily.Kind;
import com.mtb.parser.model.VariantRecord;
import com.mtb.parser.vocabulary.VocabularyService;

import java.util.regex.Pattern;

/**
 * Gene fusions and rearrangements. A fusion is kept when either partner resolves.
 */
public class FusionExtractor extends FamilyExtractor {

    private static final Pattern SEPARATOR = Pattern.compile(Pattern.quote(VariantRecord.FUSION_SEPARATOR));

    public FusionExtractor(VariantPatternRegistry registry, VocabularyService vocabulary) {
        super(registry, Kind.FUSION, vocabulary);
    }

    @Override
    protected boolean accepts(String gene) {
        for (String partner : SEPARATOR.split(gene)) {
            if (!partner.isEmpty() && resolves(partner)) {
                return true;
            }
        }
        return false;
    }
}

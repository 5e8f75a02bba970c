package com.mtb.parser.enrich;

import com.mtb.parser.model.VariantRecord;

import java.util.List;

/**
 * Post-extraction pass that completes variants using the surrounding text.
 */
public interface VariantEnricher {

    /**
     * Enrich variants
     * @param variants Deduplicated variants
     * @param text The same preprocessed text the variants were extracted from
     * @return Variants in the same order, with enriched copies where something was found
     */
    List<VariantRecord> enrich(List<VariantRecord> variants, String text);
}

package com.mtb.parser.extractor;

import com.mtb.parser.model.VariantRecord;

import java.util.List;

/**
 * Produces candidate variants from report text. Implementations are pure and
 * deterministic and return an empty list when nothing matches.
 */
public interface CandidateExtractor {

    /**
     * Extract candidate variants
     * @param text Preprocessed report text
     * @return Candidates in family priority order, possibly overlapping
     */
    List<VariantRecord> extract(String text);
}

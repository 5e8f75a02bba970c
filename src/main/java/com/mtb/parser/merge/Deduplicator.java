package com.mtb.parser.merge;

import com.mtb.parser.model.VariantRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Collapses unioned candidates so that no two variants share an identity key.
 * First seen wins: the input order is the family priority order, so the
 * highest-fidelity match of a variant is the one kept. Records are kept or
 * dropped whole; fields are not merged across duplicates.
 */
public class Deduplicator {
    private static final Logger logger = LoggerFactory.getLogger(Deduplicator.class);

    /**
     * Deduplicate candidates
     * @param candidates Candidates in priority order
     * @return Unique variants in first-seen order
     */
    public List<VariantRecord> deduplicate(List<VariantRecord> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        VariantAccumulator result = candidates.stream()
            .reduce(VariantAccumulator.empty(), VariantAccumulator::add, VariantAccumulator::combine);

        if (result.size() < candidates.size()) {
            logger.debug("Deduplicated {} candidates to {} variants", candidates.size(), result.size());
        }
        return result.records();
    }
}

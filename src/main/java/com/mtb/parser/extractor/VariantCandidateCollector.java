package com.mtb.parser.extractor;

import com.mtb.parser.model.VariantRecord;
import com.mtb.parser.vocabulary.VocabularyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs the variant sub-extractors in priority order and unions their candidates.
 * Redundant candidates are left for the deduplicator.
 */
public class VariantCandidateCollector implements CandidateExtractor {
    private static final Logger logger = LoggerFactory.getLogger(VariantCandidateCollector.class);

    private final List<CandidateExtractor> extractors;

    /**
     * Standard order: sequence variants, fusions, exon alterations, copy number
     * @param vocabulary Vocabulary used by the gene gate
     */
    public VariantCandidateCollector(VocabularyService vocabulary) {
        this(VariantPatternRegistry.standard(), vocabulary);
    }

    public VariantCandidateCollector(VariantPatternRegistry registry, VocabularyService vocabulary) {
        this(List.of(
            new SequenceVariantExtractor(registry, vocabulary),
            new FusionExtractor(registry, vocabulary),
            new ExonAlterationExtractor(registry, vocabulary),
            new CnvExtractor(registry, vocabulary)
        ));
    }

    public VariantCandidateCollector(List<CandidateExtractor> extractors) {
        if (extractors == null || extractors.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate extractor is required");
        }
        this.extractors = Collections.unmodifiableList(new ArrayList<>(extractors));
    }

    @Override
    public List<VariantRecord> extract(String text) {
        List<VariantRecord> candidates = new ArrayList<>();
        for (CandidateExtractor extractor : extractors) {
            candidates.addAll(extractor.extract(text));
        }
        logger.debug("Collected {} variant candidates", candidates.size());
        return candidates;
    }
}

package com.mtb.parser.extractor;

import com.mtb.parser.extractor.PatternFamily.Kind;
import com.mtb.parser.model.VariantRecord;
import com.mtb.parser.vocabulary.GeneCode;
import com.mtb.parser.vocabulary.VocabularyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base for extractors that run every registry family of one kind and keep the
 * candidates whose gene passes the vocabulary gate. Rejected tokens are dropped
 * without a warning.
 */
abstract class FamilyExtractor implements CandidateExtractor {
    private static final Logger logger = LoggerFactory.getLogger(FamilyExtractor.class);

    protected final VocabularyService vocabulary;
    private final List<PatternFamily> families;

    protected FamilyExtractor(VariantPatternRegistry registry, Kind kind, VocabularyService vocabulary) {
        Objects.requireNonNull(registry, "registry");
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        this.families = registry.families(kind);
    }

    @Override
    public List<VariantRecord> extract(String text) {
        List<VariantRecord> candidates = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return candidates;
        }

        for (PatternFamily family : families) {
            int kept = 0;
            for (VariantRecord.Builder builder : family.findAll(text)) {
                VariantRecord candidate = builder.build();
                if (!accepts(candidate.getGene())) {
                    logger.debug("Discarded unknown gene token '{}' from family {}", candidate.getGene(), family.getName());
                    continue;
                }
                GeneCode code = vocabulary.lookupGene(candidate.getGene()).orElse(null);
                candidates.add(candidate.toBuilder().geneVocabularyCode(code).build());
                kept++;
            }
            if (kept > 0) {
                logger.debug("Family {} produced {} candidates", family, kept);
            }
        }
        return candidates;
    }

    /**
     * Vocabulary gate for a candidate gene
     * @param gene Uppercase gene token (or fusion notation)
     * @return true if the candidate should be kept
     */
    protected abstract boolean accepts(String gene);

    /**
     * A symbol resolves if it is an official symbol or maps through the vocabulary (aliases)
     */
    protected boolean resolves(String symbol) {
        return vocabulary.isKnownGene(symbol) || vocabulary.lookupGene(symbol).isPresent();
    }
}

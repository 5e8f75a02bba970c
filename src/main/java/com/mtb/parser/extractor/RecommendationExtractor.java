package com.mtb.parser.extractor;

import com.mtb.parser.model.TherapeuticRecommendation;
import com.mtb.parser.vocabulary.DrugCode;
import com.mtb.parser.vocabulary.VocabularyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Extracts therapeutic recommendations by matching the vocabulary's drug names
 * in increasingly loose contexts. A drug is reported once, from the first
 * context that mentions it.
 */
public class RecommendationExtractor {
    private static final Logger logger = LoggerFactory.getLogger(RecommendationExtractor.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final String UNKNOWN_EVIDENCE = "Unknown";
    private static final String TARGET_SEPARATOR = ", ";

    private final VocabularyService vocabulary;
    private final List<Pattern> drugPatterns;

    public RecommendationExtractor(VocabularyService vocabulary) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        this.drugPatterns = buildPatterns(vocabulary.knownDrugNames());
    }

    /**
     * Drug mention patterns, each with the drug name in group 1.
     * Names are tried longest first so that combinations win over their components.
     */
    static List<Pattern> buildPatterns(List<String> drugNames) {
        if (drugNames == null || drugNames.isEmpty()) {
            return List.of();
        }
        String drugs = drugNames.stream()
            .filter(name -> name != null && !name.isBlank())
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        if (drugs.isEmpty()) {
            return List.of();
        }
        String drug = "\\b(" + drugs + ")\\b";

        return List.of(
            // "sensibilità a osimertinib"
            Pattern.compile("\\b(?:sensibilità|risposta|indicazione|approvato|sensitivity|response|indication|approved)"
                + "[^.]{0,50}?" + drug, FLAGS),
            // "trattamento con osimertinib"
            Pattern.compile("\\b(?:trattamento|terapia|treatment|therapy)\\s+(?:con|with)\\s+" + drug, FLAGS),
            // "osimertinib ... indicato"
            Pattern.compile(drug + "[^.]{0,50}?\\b(?:indicat[oa]|indicated|approvato|approved|rimborsato)", FLAGS),
            Pattern.compile(drug, FLAGS)
        );
    }

    /**
     * Extract therapeutic recommendations
     * @param text Preprocessed report text
     * @return Recommendations for drugs that map to RxNorm, in discovery order
     */
    public List<TherapeuticRecommendation> extract(String text) {
        List<TherapeuticRecommendation> recommendations = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return recommendations;
        }

        Set<String> seen = new LinkedHashSet<>();
        for (Pattern pattern : drugPatterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String drug = Normalizer.normalizeDrug(matcher.group(1));
                if (!seen.add(drug)) {
                    continue;
                }
                Optional<DrugCode> code = vocabulary.lookupDrug(drug);
                if (code.isEmpty()) {
                    logger.debug("Drug '{}' not mapped to RxNorm, skipping", drug);
                    continue;
                }
                recommendations.add(toRecommendation(drug, code.get()));
            }
        }
        return recommendations;
    }

    private static TherapeuticRecommendation toRecommendation(String drug, DrugCode code) {
        String target = code.getTargets().isEmpty() ? null : String.join(TARGET_SEPARATOR, code.getTargets());
        String evidence = code.getEvidenceLevel() != null ? code.getEvidenceLevel() : UNKNOWN_EVIDENCE;
        return new TherapeuticRecommendation(drug, target, evidence, code);
    }
}

package com.mtb.parser.extractor;

import com.mtb.parser.model.DiagnosisRecord;
import com.mtb.parser.vocabulary.DiagnosisCode;
import com.mtb.parser.vocabulary.VocabularyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Extracts the primary diagnosis, stage and histology and maps the diagnosis to ICD-O.
 * Diagnosis patterns are ordered from most to least specific.
 */
public class DiagnosisExtractor {
    private static final Logger logger = LoggerFactory.getLogger(DiagnosisExtractor.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.MULTILINE;

    private static final List<Pattern> DIAGNOSIS_PATTERNS = List.of(
        // "affetta da adenocarcinoma polmonare stadio IV"
        Pattern.compile("affett[oa]\\s+da\\s+([^.\\n]+?)\\s+(?:stadio|stage|con|in\\s+terapia|in\\s+trattamento|e)\\s+", FLAGS),
        Pattern.compile("affett[oa]\\s+da\\s+([^.\\n,]+?)\\s+in\\s+", FLAGS),
        Pattern.compile("con\\s+diagnosi\\s+di\\s+([^.\\n]+?)\\s+(?:stadio|stage|con)\\s+", FLAGS),
        Pattern.compile("^\\s*Diagnosi[:\\s]+([^\\n.(]+)", FLAGS),
        Pattern.compile("^\\s*Diagnosis[:\\s]+([^\\n.(]+)", FLAGS),
        Pattern.compile("^\\s*Tumore[:\\s]+([^\\n.(]+)", FLAGS),
        Pattern.compile("^\\s*Neoplasia[:\\s]+([^\\n.(]+)", FLAGS),
        Pattern.compile("\\b((?:adeno)?carcinoma\\s+\\w+(?:\\s+\\w+)?)\\s+stadio", FLAGS)
    );

    // IV before I{1,3} so that "IV" is not read as "I"
    private static final List<Pattern> STAGE_PATTERNS = List.of(
        Pattern.compile("\\bstadio[:\\s]+(IV[ABC]?|I{1,3}[ABC]?)\\b", FLAGS),
        Pattern.compile("\\bstage[:\\s]+(IV[ABC]?|I{1,3}[ABC]?)\\b", FLAGS)
    );

    private static final List<Pattern> HISTOLOGY_PATTERNS = List.of(
        Pattern.compile("^\\s*Istologia[:\\s]+([^\\n]+)", FLAGS),
        Pattern.compile("^\\s*Histology[:\\s]+([^\\n]+)", FLAGS)
    );

    private final VocabularyService vocabulary;

    public DiagnosisExtractor(VocabularyService vocabulary) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
    }

    /**
     * Extract diagnosis information
     * @param text Preprocessed report text
     * @return Diagnosis record; fields are null when not found
     */
    public DiagnosisRecord extract(String text) {
        if (text == null || text.isEmpty()) {
            return DiagnosisRecord.empty();
        }

        String primary = Patterns.firstGroup(DIAGNOSIS_PATTERNS, text)
            .map(Normalizer::collapseWhitespace)
            .filter(value -> !value.isEmpty())
            .orElse(null);
        String stage = Patterns.firstGroup(STAGE_PATTERNS, text)
            .map(value -> value.toUpperCase(Locale.ROOT))
            .orElse(null);
        String histology = Patterns.firstGroup(HISTOLOGY_PATTERNS, text)
            .map(Normalizer::collapseWhitespace)
            .filter(value -> !value.isEmpty())
            .orElse(null);

        DiagnosisCode code = null;
        if (primary != null) {
            code = vocabulary.lookupDiagnosis(primary).orElse(null);
            if (code == null) {
                logger.debug("Diagnosis '{}' not mapped to ICD-O", primary);
            }
        }

        return new DiagnosisRecord(primary, stage, histology, code);
    }
}

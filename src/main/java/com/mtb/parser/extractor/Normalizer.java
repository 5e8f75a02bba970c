package com.mtb.parser.extractor;

import org.apache.commons.text.WordUtils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Canonicalizes free-text field values. Every method is total: unknown input
 * is passed through in a cleaned form and null stays null.
 */
public final class Normalizer {

    private static final Map<String, String> CLASSIFICATION_SYNONYMS = new LinkedHashMap<>();
    private static final Map<String, String> SEX_SYNONYMS = new LinkedHashMap<>();

    static {
        CLASSIFICATION_SYNONYMS.put("pathogenic", "Pathogenic");
        CLASSIFICATION_SYNONYMS.put("patogenetica", "Pathogenic");
        CLASSIFICATION_SYNONYMS.put("patogenetico", "Pathogenic");
        CLASSIFICATION_SYNONYMS.put("patogenica", "Pathogenic");
        CLASSIFICATION_SYNONYMS.put("likely pathogenic", "Likely Pathogenic");
        CLASSIFICATION_SYNONYMS.put("probabilmente patogenetica", "Likely Pathogenic");
        CLASSIFICATION_SYNONYMS.put("vus", "VUS");
        CLASSIFICATION_SYNONYMS.put("uncertain significance", "VUS");
        CLASSIFICATION_SYNONYMS.put("variant of uncertain significance", "VUS");
        CLASSIFICATION_SYNONYMS.put("variante a significato incerto", "VUS");
        CLASSIFICATION_SYNONYMS.put("significato incerto", "VUS");
        CLASSIFICATION_SYNONYMS.put("likely benign", "Likely Benign");
        CLASSIFICATION_SYNONYMS.put("probabilmente benigna", "Likely Benign");
        CLASSIFICATION_SYNONYMS.put("benign", "Benign");
        CLASSIFICATION_SYNONYMS.put("benigna", "Benign");

        SEX_SYNONYMS.put("M", "M");
        SEX_SYNONYMS.put("MALE", "M");
        SEX_SYNONYMS.put("MASCHIO", "M");
        SEX_SYNONYMS.put("F", "F");
        SEX_SYNONYMS.put("FEMALE", "F");
        SEX_SYNONYMS.put("FEMMINA", "F");
    }

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DATE_SEPARATORS = Pattern.compile("[/.\\-]");

    private Normalizer() {
    }

    /**
     * Map a classification label to the canonical set
     * @param raw Label as written in the report
     * @return Canonical label, a title-cased copy of the input when unrecognized, or null
     */
    public static String normalizeClassification(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = collapseWhitespace(raw);
        if (cleaned.isEmpty()) {
            return null;
        }
        String canonical = CLASSIFICATION_SYNONYMS.get(cleaned.toLowerCase(Locale.ROOT));
        return canonical != null ? canonical : WordUtils.capitalizeFully(cleaned);
    }

    /**
     * Map a sex value to M/F
     * @param raw Value as written in the report
     * @return "M", "F", the uppercased input when unrecognized, or null
     */
    public static String normalizeSex(String raw) {
        if (raw == null) {
            return null;
        }
        String key = raw.trim().toUpperCase(Locale.ROOT);
        if (key.isEmpty()) {
            return null;
        }
        return SEX_SYNONYMS.getOrDefault(key, key);
    }

    /**
     * Convert a day-first date (DD/MM/YYYY, DD.MM.YYYY, DD-MM-YYYY) to ISO form.
     * Day and month are zero padded but not validated.
     * @param raw Date as written in the report
     * @return YYYY-MM-DD, the trimmed input if it does not have three parts, or null
     */
    public static String normalizeDate(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        String[] parts = DATE_SEPARATORS.split(trimmed);
        if (parts.length != 3) {
            return trimmed;
        }
        return parts[2] + "-" + padTwo(parts[1]) + "-" + padTwo(parts[0]);
    }

    public static String normalizeGene(String raw) {
        return raw == null ? null : raw.trim().toUpperCase(Locale.ROOT);
    }

    public static String normalizeDrug(String raw) {
        return raw == null ? null : raw.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Trim and collapse internal whitespace runs to single spaces
     */
    public static String collapseWhitespace(String raw) {
        return raw == null ? null : WHITESPACE.matcher(raw.trim()).replaceAll(" ");
    }

    private static String padTwo(String value) {
        return value.length() < 2 ? "0" + value : value;
    }
}

package com.mtb.parser.extractor;

import java.util.regex.Pattern;

/**
 * Cleans up report text exported from PDF/Word before pattern matching.
 * Table borders are flattened to spaces so tabular rows read like inline text;
 * line structure is kept for the line-anchored patterns.
 */
public class TextPreprocessor {

    // Unicode box drawing block plus ASCII pipes used as column separators
    private static final Pattern TABLE_BORDERS = Pattern.compile("[\\u2500-\\u257F|]");
    private static final Pattern PAGE_MARKER = Pattern.compile("(?i)\\b(?:page|pagina)\\s+\\d+\\s+(?:of|di)\\s+\\d+\\b");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\u00A0]{2,}");
    private static final Pattern TRAILING_SPACE = Pattern.compile("[ \\t]+\\n");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

    /**
     * Normalize raw report text
     * @param text Raw report text
     * @return Cleaned text, never null
     */
    public String preprocess(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String cleaned = text.replace("\r\n", "\n").replace('\r', '\n').replace('\f', '\n');
        cleaned = TABLE_BORDERS.matcher(cleaned).replaceAll(" ");
        cleaned = PAGE_MARKER.matcher(cleaned).replaceAll("");
        cleaned = HORIZONTAL_SPACE.matcher(cleaned).replaceAll(" ");
        cleaned = TRAILING_SPACE.matcher(cleaned).replaceAll("\n");
        cleaned = EXCESS_NEWLINES.matcher(cleaned).replaceAll("\n\n");

        return cleaned;
    }
}

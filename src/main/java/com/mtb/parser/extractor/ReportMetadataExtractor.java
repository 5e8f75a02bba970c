package com.mtb.parser.extractor;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Extracts report-level metadata: sequencing panel and report date.
 */
public class ReportMetadataExtractor {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> NGS_METHOD_PATTERNS = List.of(
        Pattern.compile("Pannello[:\\s]+([^\\n]+)", FLAGS),
        Pattern.compile("Panel[:\\s]+([^\\n]+)", FLAGS),
        Pattern.compile("\\bNGS[:\\s]+([^\\n]+)", FLAGS),
        Pattern.compile("(?:utilizzato|used)[:\\s]+([^\\n]+panel)", FLAGS)
    );

    private static final List<Pattern> REPORT_DATE_PATTERNS = List.of(
        Pattern.compile("Data\\s+report[:\\s]+(\\d{1,2}[/.\\-]\\d{1,2}[/.\\-]\\d{4})", FLAGS),
        Pattern.compile("Report\\s+date[:\\s]+(\\d{1,2}[/.\\-]\\d{1,2}[/.\\-]\\d{4})", FLAGS),
        Pattern.compile("\\bData[:\\s]+(\\d{1,2}[/.\\-]\\d{1,2}[/.\\-]\\d{4})", FLAGS)
    );

    /**
     * @param text Preprocessed report text
     * @return Panel or method description, or null
     */
    public String extractNgsMethod(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        return Patterns.firstGroup(NGS_METHOD_PATTERNS, text)
            .filter(value -> !value.isEmpty())
            .orElse(null);
    }

    /**
     * @param text Preprocessed report text
     * @return Report date in ISO form, or null
     */
    public String extractReportDate(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        return Patterns.firstGroup(REPORT_DATE_PATTERNS, text)
            .map(Normalizer::normalizeDate)
            .orElse(null);
    }
}

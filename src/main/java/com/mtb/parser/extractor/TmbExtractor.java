package com.mtb.parser.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts tumor mutational burden in mutations per megabase.
 */
public class TmbExtractor {
    private static final Logger logger = LoggerFactory.getLogger(TmbExtractor.class);

    // Plausible TMB range, exclusive on both ends
    private static final double MIN_TMB = 0.0;
    private static final double MAX_TMB = 1000.0;

    private static final List<Pattern> TMB_PATTERNS = List.of(
        Pattern.compile("TMB[:\\s]*(\\d+(?:\\.\\d+)?)\\s*muts?/?Mbp?", Pattern.CASE_INSENSITIVE),
        Pattern.compile("tumou?r\\s+mutational\\s+burden[:\\s]*(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("TMB[:\\s]+(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE)
    );

    /**
     * Extract TMB. The first match of each pattern is tried in order; an out-of-range
     * value falls through to the next pattern.
     * @param text Preprocessed report text
     * @return TMB value, or null if none is found in (0, 1000)
     */
    public Double extract(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        for (Pattern pattern : TMB_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                continue;
            }
            try {
                double value = Double.parseDouble(matcher.group(1));
                if (isPlausible(value)) {
                    return value;
                }
                logger.debug("Ignoring implausible TMB value {}", value);
            } catch (NumberFormatException e) {
                logger.debug("Unparseable TMB value '{}'", matcher.group(1));
            }
        }
        return null;
    }

    public static boolean isPlausible(double tmb) {
        return tmb > MIN_TMB && tmb < MAX_TMB;
    }
}

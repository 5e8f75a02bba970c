package com.mtb.parser.extractor;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * First-match-wins helpers for single-valued fields.
 */
final class Patterns {

    private Patterns() {
    }

    /**
     * Group 1 of the first pattern that matches, trimmed
     * @param patterns Patterns in priority order
     * @param text Text to search
     * @return Captured value, or empty if no pattern matches
     */
    static Optional<String> firstGroup(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(matcher.group(1).trim());
            }
        }
        return Optional.empty();
    }
}

package com.mtb.parser.model;

/**
 * Overall quality band of a parsed report, derived from the weighted score.
 */
public enum QualityLevel {
    EXCELLENT("Excellent", 90.0),
    GOOD("Good", 75.0),
    ACCEPTABLE("Acceptable", 60.0),
    POOR("Poor", 40.0),
    CRITICAL("Critical", 0.0);

    private final String label;
    private final double minScore;

    QualityLevel(String label, double minScore) {
        this.label = label;
        this.minScore = minScore;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Band for a score
     * @param score Overall score 0-100
     * @return Highest level whose minimum the score reaches
     */
    public static QualityLevel fromScore(double score) {
        for (QualityLevel level : values()) {
            if (score >= level.minScore) {
                return level;
            }
        }
        return CRITICAL;
    }
}

package com.mtb.parser.model;

/**
 * Administrative sex as reported in the patient header of an MTB report.
 */
public enum Sex {
    M("M"),
    F("F"),
    UNKNOWN("unknown");

    private final String code;

    Sex(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolve a normalized sex code to the enum
     * @param code Normalized code ("M", "F" or anything else)
     * @return Matching constant, UNKNOWN for null or unmapped codes
     */
    public static Sex fromCode(String code) {
        if ("M".equals(code)) {
            return M;
        }
        if ("F".equals(code)) {
            return F;
        }
        return UNKNOWN;
    }
}

package com.mtb.parser.vocabulary;

import java.util.Objects;

/**
 * ICD-O morphology code (with optional topography) resolved for a diagnosis text.
 */
public final class DiagnosisCode {
    public static final String SYSTEM = "http://terminology.hl7.org/CodeSystem/icd-o-3";

    private final String code;
    private final String display;
    private final String topography;

    public DiagnosisCode(String code, String display, String topography) {
        this.code = Objects.requireNonNull(code, "code");
        this.display = display;
        this.topography = topography;
    }

    public String getCode() {
        return code;
    }

    public String getDisplay() {
        return display;
    }

    public String getTopography() {
        return topography;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DiagnosisCode)) {
            return false;
        }
        DiagnosisCode other = (DiagnosisCode) o;
        return code.equals(other.code) && Objects.equals(topography, other.topography);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, topography);
    }

    @Override
    public String toString() {
        return code + (topography != null ? " / " + topography : "");
    }
}

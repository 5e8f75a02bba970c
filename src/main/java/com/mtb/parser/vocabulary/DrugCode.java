package com.mtb.parser.vocabulary;

import java.util.List;
import java.util.Objects;

/**
 * RxNorm drug entry resolved by the vocabulary service.
 */
public final class DrugCode {
    public static final String SYSTEM = "http://www.nlm.nih.gov/research/umls/rxnorm";

    private final String name;
    private final String rxcui;
    private final String display;
    private final List<String> targets;
    private final String evidenceLevel;

    public DrugCode(String name, String rxcui, String display, List<String> targets, String evidenceLevel) {
        this.name = Objects.requireNonNull(name, "name");
        this.rxcui = rxcui;
        this.display = display;
        this.targets = targets != null ? List.copyOf(targets) : List.of();
        this.evidenceLevel = evidenceLevel;
    }

    /** Lowercase generic name, the vocabulary key. */
    public String getName() {
        return name;
    }

    public String getRxcui() {
        return rxcui;
    }

    public String getDisplay() {
        return display;
    }

    public List<String> getTargets() {
        return targets;
    }

    public String getEvidenceLevel() {
        return evidenceLevel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DrugCode)) {
            return false;
        }
        DrugCode other = (DrugCode) o;
        return name.equals(other.name) && Objects.equals(rxcui, other.rxcui);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, rxcui);
    }

    @Override
    public String toString() {
        return name + " (RxCUI " + rxcui + ")";
    }
}

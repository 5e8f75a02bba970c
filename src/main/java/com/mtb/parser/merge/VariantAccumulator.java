package com.mtb.parser.merge;

import com.mtb.parser.model.VariantRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable fold state for deduplication: the variants accepted so far, keyed by identity.
 * {@link #add(VariantRecord)} returns a new accumulator and never modifies this one.
 */
public final class VariantAccumulator {
    private static final VariantAccumulator EMPTY = new VariantAccumulator(Collections.emptyMap());

    private final Map<VariantKey, VariantRecord> accepted;

    private VariantAccumulator(Map<VariantKey, VariantRecord> accepted) {
        this.accepted = accepted;
    }

    public static VariantAccumulator empty() {
        return EMPTY;
    }

    /**
     * Offer a candidate. It is accepted unless a variant with the same key was accepted
     * earlier, or an earlier variant of the same gene already carries all of its changes.
     * @param candidate Candidate variant
     * @return Accumulator including the candidate, or this accumulator if it was redundant
     */
    public VariantAccumulator add(VariantRecord candidate) {
        VariantKey key = VariantKey.of(candidate);
        if (isRedundant(key)) {
            return this;
        }
        Map<VariantKey, VariantRecord> next = new LinkedHashMap<>(accepted);
        next.put(key, candidate);
        return new VariantAccumulator(Collections.unmodifiableMap(next));
    }

    /**
     * Merge two accumulators; variants of this one take priority
     */
    public VariantAccumulator combine(VariantAccumulator other) {
        VariantAccumulator result = this;
        for (VariantRecord variant : other.records()) {
            result = result.add(variant);
        }
        return result;
    }

    public boolean isRedundant(VariantKey key) {
        if (accepted.containsKey(key)) {
            return true;
        }
        for (VariantKey seen : accepted.keySet()) {
            if (key.isCoveredBy(seen)) {
                return true;
            }
        }
        return false;
    }

    public boolean contains(VariantKey key) {
        return accepted.containsKey(key);
    }

    public int size() {
        return accepted.size();
    }

    /**
     * Accepted variants in acceptance order
     */
    public List<VariantRecord> records() {
        return Collections.unmodifiableList(new ArrayList<>(accepted.values()));
    }
}

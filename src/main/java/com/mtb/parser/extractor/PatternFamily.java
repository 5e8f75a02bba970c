package com.mtb.parser.extractor;

import com.mtb.parser.model.VariantRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One typed extraction rule: a pattern, the number of groups it captures and the
 * builder that turns a match into a candidate variant. Families of the same kind
 * are evaluated in registry order and their matches unioned.
 */
public final class PatternFamily {

    /**
     * Entity class a family contributes candidates to
     */
    public enum Kind {
        SEQUENCE,
        FUSION,
        EXON,
        CNV
    }

    /**
     * Builds a candidate from a match; empty when the match cannot form a variant
     */
    @FunctionalInterface
    public interface CandidateBuilder {
        Optional<VariantRecord.Builder> build(MatchResult match);
    }

    private final String name;
    private final Kind kind;
    private final Pattern pattern;
    private final int arity;
    private final CandidateBuilder builder;

    public PatternFamily(String name, Kind kind, Pattern pattern, int arity, CandidateBuilder builder) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.builder = Objects.requireNonNull(builder, "builder");
        int groups = pattern.matcher("").groupCount();
        if (groups != arity) {
            throw new IllegalArgumentException("Family " + name + " declares arity " + arity
                + " but its pattern has " + groups + " groups");
        }
        this.arity = arity;
    }

    /**
     * Run the family over the text, left to right, non-overlapping
     * @param text Preprocessed report text
     * @return Candidate builders in match order
     */
    public List<VariantRecord.Builder> findAll(String text) {
        List<VariantRecord.Builder> candidates = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            builder.build(matcher.toMatchResult()).ifPresent(candidates::add);
        }
        return candidates;
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public int getArity() {
        return arity;
    }

    @Override
    public String toString() {
        return kind + ":" + name + "/" + arity;
    }
}

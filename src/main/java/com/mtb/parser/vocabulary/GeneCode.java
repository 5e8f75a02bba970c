package com.mtb.parser.vocabulary;

import java.util.List;
import java.util.Objects;

/**
 * HGNC gene entry resolved by the vocabulary service.
 */
public final class GeneCode {
    public static final String SYSTEM = "http://www.genenames.org";

    private final String symbol;
    private final String hgncId;
    private final String name;
    private final String chromosome;
    private final boolean actionable;
    private final List<String> aliases;

    public GeneCode(String symbol, String hgncId, String name, String chromosome,
                    boolean actionable, List<String> aliases) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.hgncId = hgncId;
        this.name = name;
        this.chromosome = chromosome;
        this.actionable = actionable;
        this.aliases = aliases != null ? List.copyOf(aliases) : List.of();
    }

    public String getSymbol() {
        return symbol;
    }

    public String getHgncId() {
        return hgncId;
    }

    public String getName() {
        return name;
    }

    public String getChromosome() {
        return chromosome;
    }

    public boolean isActionable() {
        return actionable;
    }

    public List<String> getAliases() {
        return aliases;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeneCode)) {
            return false;
        }
        GeneCode other = (GeneCode) o;
        return symbol.equals(other.symbol) && Objects.equals(hgncId, other.hgncId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, hgncId);
    }

    @Override
    public String toString() {
        return symbol + " (" + hgncId + ")";
    }
}

package com.mtb.parser.enrich;

import com.mtb.parser.model.VariantRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Attaches an allele frequency to variants that were extracted without one, by
 * looking for a percentage near the gene symbol or the mutation token.
 * <p>
 * Strategies are tried in order and the first one that yields a value in (0, 100] wins:
 * <ol>
 *   <li>gene symbol directly followed by a percentage ("EGFR 16%")</li>
 *   <li>mutation token followed by "f.a.", "frequenza allelica" or a percentage</li>
 *   <li>first percentage within a fixed window around the first mention of the mutation</li>
 * </ol>
 * This is a proximity heuristic with no sentence awareness.
 */
public class ContextVafEnricher implements VariantEnricher {
    private static final Logger logger = LoggerFactory.getLogger(ContextVafEnricher.class);

    public static final int DEFAULT_WINDOW = 100;

    private static final String PERCENT = "(\\d+(?:\\.\\d+)?)%";
    private static final Pattern ANY_PERCENT = Pattern.compile(PERCENT);

    // {0} is replaced with the quoted mutation token
    private static final List<String> MUTATION_TEMPLATES = List.of(
        "{0}\\s+f\\.a\\.?\\s*" + PERCENT,
        "{0}.*?frequenza\\s+allelica\\s+" + PERCENT,
        "{0}\\s*\\)?\\s*" + PERCENT
    );

    private final int window;

    public ContextVafEnricher() {
        this(DEFAULT_WINDOW);
    }

    /**
     * @param window Number of characters searched on each side of the mutation mention
     */
    public ContextVafEnricher(int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("Window must be positive: " + window);
        }
        this.window = window;
    }

    @Override
    public List<VariantRecord> enrich(List<VariantRecord> variants, String text) {
        List<VariantRecord> enriched = new ArrayList<>(variants.size());
        for (VariantRecord variant : variants) {
            if (variant.getVaf() != null || text == null || text.isEmpty()) {
                enriched.add(variant);
                continue;
            }
            Optional<Double> vaf = findVaf(variant, text);
            if (vaf.isPresent()) {
                logger.debug("Enriched {} with VAF {}", variant.getGene(), vaf.get());
                enriched.add(variant.withVaf(vaf.get()));
            } else {
                enriched.add(variant);
            }
        }
        return enriched;
    }

    /**
     * Run the strategies for one variant
     * @param variant Variant lacking a VAF
     * @param text Report text
     * @return First plausible VAF found
     */
    Optional<Double> findVaf(VariantRecord variant, String text) {
        Optional<Double> byGene = geneAnchored(variant.getGene(), text);
        if (byGene.isPresent()) {
            return byGene;
        }

        String mutation = mutationToken(variant);
        if (mutation == null) {
            return Optional.empty();
        }

        Optional<Double> byMutation = mutationAnchored(mutation, text);
        if (byMutation.isPresent()) {
            return byMutation;
        }
        return window(mutation, text);
    }

    private Optional<Double> geneAnchored(String gene, String text) {
        Pattern pattern = Pattern.compile("\\b(" + Pattern.quote(gene) + ")\\s+" + PERCENT, Pattern.CASE_INSENSITIVE);
        return firstPlausible(pattern.matcher(text), 2);
    }

    private Optional<Double> mutationAnchored(String mutation, String text) {
        String quoted = Pattern.quote(mutation);
        for (String template : MUTATION_TEMPLATES) {
            Pattern pattern = Pattern.compile(template.replace("{0}", quoted), Pattern.CASE_INSENSITIVE);
            Optional<Double> vaf = firstPlausible(pattern.matcher(text), 1);
            if (vaf.isPresent()) {
                return vaf;
            }
        }
        return Optional.empty();
    }

    private Optional<Double> window(String mutation, String text) {
        // Offsets come from the original text; lower-casing can change its length
        Matcher mention = Pattern.compile(Pattern.quote(mutation), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
            .matcher(text);
        if (!mention.find()) {
            return Optional.empty();
        }
        int start = Math.max(0, mention.start() - window);
        int end = Math.min(text.length(), mention.end() + window);
        return firstPlausible(ANY_PERCENT.matcher(text.substring(start, end)), 1);
    }

    private static Optional<Double> firstPlausible(Matcher matcher, int group) {
        while (matcher.find()) {
            try {
                double value = Double.parseDouble(matcher.group(group));
                if (VariantRecord.isValidVaf(value)) {
                    return Optional.of(value);
                }
            } catch (NumberFormatException e) {
                logger.debug("Unparseable percentage '{}'", matcher.group(group));
            }
        }
        return Optional.empty();
    }

    /**
     * Protein change, else cDNA change, without its HGVS prefix
     */
    static String mutationToken(VariantRecord variant) {
        String change = variant.getProteinChange() != null ? variant.getProteinChange() : variant.getCdnaChange();
        if (change == null || change.isBlank()) {
            return null;
        }
        String lower = change.toLowerCase(Locale.ROOT);
        if (lower.startsWith("p.") || lower.startsWith("c.")) {
            change = change.substring(2);
        }
        return change.isBlank() ? null : change;
    }
}

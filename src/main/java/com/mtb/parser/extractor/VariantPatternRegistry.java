package com.mtb.parser.extractor;

import com.mtb.parser.extractor.PatternFamily.Kind;
import com.mtb.parser.model.CnvType;
import com.mtb.parser.model.VariantClassification;
import com.mtb.parser.model.VariantRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Ordered registry of all variant pattern families. Within a kind, earlier
 * families carry more fields, so first-seen-wins deduplication keeps the
 * richest record. Kinds are collected in the order SEQUENCE, FUSION, EXON, CNV.
 */
public final class VariantPatternRegistry {
    private static final Logger logger = LoggerFactory.getLogger(VariantPatternRegistry.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final String CLASSIFICATIONS =
        "Pathogenic|VUS|Benign|Risultati discordanti|Likely Pathogenic|Likely Benign";

    private static final Pattern CONTAINS_DIGIT = Pattern.compile("\\d");

    private static final String PATHOGENIC = VariantClassification.PATHOGENIC.getLabel();
    private static final String VUS = VariantClassification.VUS.getLabel();

    private final List<PatternFamily> families;

    private VariantPatternRegistry(List<PatternFamily> families) {
        this.families = Collections.unmodifiableList(new ArrayList<>(families));
    }

    /**
     * Registry with the standard bilingual (Italian/English) families
     */
    public static VariantPatternRegistry standard() {
        List<PatternFamily> families = new ArrayList<>();
        addSequenceFamilies(families);
        addFusionFamilies(families);
        addExonFamilies(families);
        addCnvFamilies(families);
        return new VariantPatternRegistry(families);
    }

    /**
     * Registry over an explicit family list, in the given order
     */
    public static VariantPatternRegistry of(List<PatternFamily> families) {
        return new VariantPatternRegistry(families);
    }

    public List<PatternFamily> all() {
        return families;
    }

    /**
     * Families of one kind, in priority order
     * @param kind Entity kind
     * @return Families of that kind
     */
    public List<PatternFamily> families(Kind kind) {
        return families.stream()
            .filter(family -> family.getKind() == kind)
            .toList();
    }

    // ========== Sequence variants ==========

    private static void addSequenceFamilies(List<PatternFamily> families) {
        // variante nell'esone 18 del gene EGFR (NM_005228.4): c.2155G>A, p.(Gly719Ser), frequenza allelica 11%
        families.add(new PatternFamily("exon-detail", Kind.SEQUENCE, Pattern.compile(
            "variante\\s+nell['’]esone\\s+\\d+\\s+del\\s+gene\\s+(\\w+)\\s*\\([^)]+\\):\\s*c\\.([^,\\s]+)"
                + "(?:,\\s*p\\.\\(([^)]+)\\))?(?:,?\\s*frequenza\\s+allelica\\s+(\\d+(?:\\.\\d+)?)%)?", FLAGS),
            4, match -> Optional.of(VariantRecord.builder(gene(match, 1))
                .cdnaChange(prefixed("c.", match.group(2)))
                .proteinChange(prefixed("p.", match.group(3)))
                .vaf(parseVaf(match.group(4))))));

        // EGFR c.2573T>G p.Leu858Arg Pathogenic 45%
        families.add(new PatternFamily("tabular", Kind.SEQUENCE, Pattern.compile(
            "(\\w+)\\s+c\\.([^\\s|]+)\\s+p\\.([^\\s|]+)\\s+(" + CLASSIFICATIONS + ")\\s+(\\d+(?:\\.\\d+)?)%", FLAGS),
            5, match -> Optional.of(VariantRecord.builder(gene(match, 1))
                .cdnaChange(prefixed("c.", match.group(2)))
                .proteinChange(prefixed("p.", match.group(3)))
                .classification(Normalizer.normalizeClassification(match.group(4)))
                .vaf(parseVaf(match.group(5))))));

        // EGFR c.2573T>G 45%
        families.add(new PatternFamily("inline-vaf", Kind.SEQUENCE, Pattern.compile(
            "(\\w+)\\s+([cp]\\.[^\\s,]+).*?(\\d+(?:\\.\\d+)?)%", FLAGS),
            3, match -> {
                String change = match.group(2);
                VariantRecord.Builder builder = VariantRecord.builder(gene(match, 1)).vaf(parseVaf(match.group(3)));
                if (change.toLowerCase(Locale.ROOT).startsWith("c.")) {
                    builder.cdnaChange("c." + change.substring(2));
                } else {
                    builder.proteinChange("p." + change.substring(2));
                }
                return Optional.of(builder);
            }));

        // EGFR L858R, KRAS G12D
        families.add(twoGroupProtein("short-protein", "\\b(\\w+)\\s+([A-Z]\\d+[A-Z*_]+)\\b"));

        // EGFR (L858R)
        families.add(twoGroupProtein("parenthesized", "\\b(\\w+)\\s*\\(([A-Z]\\d+[A-Z*]+)\\)"));

        // mutazione di BRAF V600E; only the first token after the gene is kept, and only if it has a position.
        // An HGVS-prefixed token goes to the slot its prefix names
        families.add(narrative("narrative-mutation", "mutazione|mutation"));
        families.add(narrative("narrative-alteration", "alterazione|alteration"));

        // TP53 p.Arg273fs
        families.add(new PatternFamily("frameshift", Kind.SEQUENCE, Pattern.compile(
            "\\b(\\w+)\\s+p\\.([A-Z][a-z]{2}\\d+fs[*X]?\\d*)", FLAGS),
            2, match -> Optional.of(VariantRecord.builder(gene(match, 1))
                .proteinChange("p." + match.group(2)))));

        // TP53 p.Arg213*
        families.add(new PatternFamily("stop-gained", Kind.SEQUENCE, Pattern.compile(
            "\\b(\\w+)\\s+p\\.([A-Z][a-z]{2}\\d+\\*)", FLAGS),
            2, match -> Optional.of(VariantRecord.builder(gene(match, 1))
                .proteinChange("p." + match.group(2)))));

        // BRCA2 c.8488-1G>A
        families.add(new PatternFamily("splice", Kind.SEQUENCE, Pattern.compile(
            "\\b(\\w+)\\s+c\\.(\\d+[-+]\\d+[ACGT]>[ACGT])\\b", FLAGS),
            2, match -> Optional.of(VariantRecord.builder(gene(match, 1))
                .cdnaChange("c." + match.group(2)))));

        // EGFR c.2235_2249dup
        families.add(new PatternFamily("duplication", Kind.SEQUENCE, Pattern.compile(
            "\\b(\\w+)\\s+c\\.(\\d+_\\d+dup)", FLAGS),
            2, match -> Optional.of(VariantRecord.builder(gene(match, 1))
                .cdnaChange("c." + match.group(2)))));
    }

    private static PatternFamily twoGroupProtein(String name, String regex) {
        return new PatternFamily(name, Kind.SEQUENCE, Pattern.compile(regex, FLAGS), 2,
            match -> Optional.of(VariantRecord.builder(gene(match, 1))
                .proteinChange(match.group(2).trim())));
    }

    private static PatternFamily narrative(String name, String keywords) {
        Pattern pattern = Pattern.compile(
            "(?:" + keywords + ")\\s+(?:(?:di|of|in)\\s+)?(\\w+)[:\\s]+([^\\s,;]+)", FLAGS);
        return new PatternFamily(name, Kind.SEQUENCE, pattern, 2, match -> {
            String token = stripTrailingPunctuation(match.group(2));
            if (!CONTAINS_DIGIT.matcher(token).find()) {
                return Optional.empty();
            }
            VariantRecord.Builder builder = VariantRecord.builder(gene(match, 1));
            String lower = token.toLowerCase(Locale.ROOT);
            if (lower.startsWith("c.")) {
                builder.cdnaChange(prefixed("c.", token.substring(2)));
            } else if (lower.startsWith("p.")) {
                builder.proteinChange(prefixed("p.", token.substring(2)));
            } else {
                builder.proteinChange(token);
            }
            return Optional.of(builder);
        });
    }

    // ========== Fusions ==========

    private static void addFusionFamilies(List<PatternFamily> families) {
        families.add(fusion("fusione", "fusione\\s+(\\w+)::(\\w+)"));
        families.add(fusion("riarrangiamento", "riarrangiamento\\s+(\\w+)[/:]+(\\w+)"));
        families.add(fusion("hyphen-fusion", "(\\w+)-(\\w+)\\s+fusion"));
        families.add(fusion("exon-numbered", "(\\w+)\\s*\\(\\d+\\)\\s*::\\s*(\\w+)\\s*\\(\\d+\\)"));
        families.add(fusion("double-colon", "\\b(\\w+)::(\\w+)\\b"));
        families.add(singleGeneFusion("fusion-detected",
            "\\b(\\w+)\\s+fusion\\s+(?:detected|identified|positiv[oa])"));
        families.add(singleGeneFusion("rearrangement", "\\b(\\w+)\\s+rearrangement"));
    }

    private static PatternFamily fusion(String name, String regex) {
        return new PatternFamily(name, Kind.FUSION, Pattern.compile(regex, FLAGS), 2,
            match -> Optional.of(fusionBuilder(gene(match, 1) + VariantRecord.FUSION_SEPARATOR + gene(match, 2))));
    }

    private static PatternFamily singleGeneFusion(String name, String regex) {
        return new PatternFamily(name, Kind.FUSION, Pattern.compile(regex, FLAGS), 1,
            match -> Optional.of(fusionBuilder(gene(match, 1))));
    }

    // Fusions are reported as Pathogenic regardless of the surrounding evidence
    private static VariantRecord.Builder fusionBuilder(String gene) {
        return VariantRecord.builder(gene)
            .proteinChange(VariantRecord.FUSION)
            .classification(PATHOGENIC);
    }

    // ========== Exon-level alterations ==========

    private static void addExonFamilies(List<PatternFamily> families) {
        families.add(new PatternFamily("exon-alteration", Kind.EXON, Pattern.compile(
            "\\b(\\w+)\\s+(?:exon|esone|es)\\s+(\\d+)\\s+(insertion|inserzione|deletion|delezione|delins)\\b", FLAGS),
            3, match -> Optional.of(VariantRecord.builder(gene(match, 1))
                .proteinChange("exon " + match.group(2) + " " + englishAlteration(match.group(3)))
                .classification(PATHOGENIC))));
    }

    private static String englishAlteration(String alteration) {
        String lower = alteration.toLowerCase(Locale.ROOT);
        return switch (lower) {
            case "inserzione" -> "insertion";
            case "delezione" -> "deletion";
            default -> lower;
        };
    }

    // ========== Copy number ==========

    private static void addCnvFamilies(List<PatternFamily> families) {
        families.add(cnv("homozygous-deletion",
            "\\b(\\w+)\\s+(?:homozygous|omozigotica)\\s+del(?:etion|ezione)", CnvType.HOMOZYGOUS_DELETION));
        families.add(cnv("amplification", "\\b(\\w+)\\s+amplif(?:ication|icazione)", CnvType.AMPLIFICATION));
        families.add(cnv("amplified", "\\b(\\w+)\\s+amplified", CnvType.AMPLIFICATION));
        families.add(numericCnv("copy-number", "\\b(\\w+)\\s+copy\\s+number[:\\s]+(\\d+(?:\\.\\d+)?)"));
        families.add(numericCnv("cn-value", "\\b(\\w+)\\s+CN[:\\s=]+(\\d+(?:\\.\\d+)?)"));
        families.add(cnv("loh", "\\b(\\w+)\\s+LOH\\b", CnvType.LOH));
        families.add(cnv("deletion", "\\b(\\w+)\\s+del(?:etion|ezione)\\b", CnvType.DELETION));
    }

    private static PatternFamily cnv(String name, String regex, CnvType type) {
        return new PatternFamily(name, Kind.CNV, Pattern.compile(regex, FLAGS), 1,
            match -> Optional.of(cnvBuilder(gene(match, 1), type, null)));
    }

    private static PatternFamily numericCnv(String name, String regex) {
        return new PatternFamily(name, Kind.CNV, Pattern.compile(regex, FLAGS), 2, match -> {
            String copyNumber = match.group(2);
            try {
                CnvType type = CnvType.fromCopyNumber(Double.parseDouble(copyNumber));
                return Optional.of(cnvBuilder(gene(match, 1), type, copyNumber));
            } catch (NumberFormatException e) {
                logger.debug("Unparseable copy number '{}' in family {}", copyNumber, name);
                return Optional.empty();
            }
        });
    }

    private static VariantRecord.Builder cnvBuilder(String gene, CnvType type, String copyNumber) {
        String raw = gene + " " + type.getLabel() + (copyNumber != null ? " (CN=" + copyNumber + ")" : "");
        return VariantRecord.builder(gene)
            .proteinChange(type.getLabel())
            .classification(type.isPathogenic() ? PATHOGENIC : VUS)
            .rawText(raw);
    }

    // ========== Helpers ==========

    private static String gene(MatchResult match, int group) {
        return Normalizer.normalizeGene(match.group(group));
    }

    private static String prefixed(String prefix, String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        return value.regionMatches(true, 0, prefix, 0, prefix.length()) ? value : prefix + value;
    }

    private static String stripTrailingPunctuation(String token) {
        int end = token.length();
        while (end > 0 && (token.charAt(end - 1) == '.' || token.charAt(end - 1) == ':')) {
            end--;
        }
        return token.substring(0, end);
    }

    /**
     * Parse a percentage, dropping values outside (0, 100]
     * @param raw Captured number, may be null
     * @return VAF or null
     */
    static Double parseVaf(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw);
            return VariantRecord.isValidVaf(value) ? value : null;
        } catch (NumberFormatException e) {
            logger.debug("Unparseable VAF '{}'", raw);
            return null;
        }
    }
}

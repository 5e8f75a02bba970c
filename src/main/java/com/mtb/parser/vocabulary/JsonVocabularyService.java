package com.mtb.parser.vocabulary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mtb.parser.config.ParserConfig;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Vocabulary service backed by the HGNC, RxNorm and ICD-O JSON files.
 * Files are read once at construction; the instance is immutable afterwards
 * and safe to share between threads.
 */
public class JsonVocabularyService implements VocabularyService {
    private static final Logger logger = LoggerFactory.getLogger(JsonVocabularyService.class);

    static final String GENES_FILE = "hgnc_genes.json";
    static final String DRUGS_FILE = "rxnorm_drugs.json";
    static final String DIAGNOSES_FILE = "icd_o_diagnoses.json";
    private static final String CLASSPATH_DIR = "/vocabularies/";

    private final Map<String, GeneCode> genes;
    private final Map<String, String> geneAliases;
    private final Map<String, DrugCode> drugs;
    private final Map<String, DiagnosisCode> diagnoses;
    private final double drugCutoff;
    private final double diagnosisCutoff;
    private final LevenshteinDistance levenshtein = LevenshteinDistance.getDefaultInstance();

    /**
     * Load the vocabularies bundled on the classpath with default cutoffs
     */
    public JsonVocabularyService() {
        this(ParserConfig.defaults());
    }

    /**
     * Load vocabularies from the configured directory, or from the classpath if none is set
     * @param config Parser configuration
     * @throws VocabularyLoadException if a file is missing or malformed
     */
    public JsonVocabularyService(ParserConfig config) {
        ObjectMapper mapper = new ObjectMapper();
        Optional<Path> dir = config.getVocabularyDir();

        JsonNode geneRoot = readVocabulary(mapper, dir, GENES_FILE);
        JsonNode drugRoot = readVocabulary(mapper, dir, DRUGS_FILE);
        JsonNode diagnosisRoot = readVocabulary(mapper, dir, DIAGNOSES_FILE);

        this.genes = new LinkedHashMap<>();
        this.geneAliases = new LinkedHashMap<>();
        loadGenes(section(geneRoot, "genes", GENES_FILE));

        this.drugs = new LinkedHashMap<>();
        loadDrugs(section(drugRoot, "drugs", DRUGS_FILE));

        this.diagnoses = new LinkedHashMap<>();
        loadDiagnoses(section(diagnosisRoot, "diagnoses", DIAGNOSES_FILE));

        this.drugCutoff = config.getDrugFuzzyCutoff();
        this.diagnosisCutoff = config.getDiagnosisFuzzyCutoff();

        logger.info("Loaded vocabularies from {}: {} genes ({} aliases), {} drugs, {} diagnoses",
            dir.map(Path::toString).orElse("classpath"), genes.size(), geneAliases.size(),
            drugs.size(), diagnoses.size());
    }

    private JsonNode readVocabulary(ObjectMapper mapper, Optional<Path> dir, String fileName) {
        try {
            if (dir.isPresent()) {
                Path file = dir.get().resolve(fileName);
                if (!Files.isRegularFile(file)) {
                    throw new VocabularyLoadException("Vocabulary file not found: " + file);
                }
                return mapper.readTree(file.toFile());
            }
            try (InputStream in = JsonVocabularyService.class.getResourceAsStream(CLASSPATH_DIR + fileName)) {
                if (in == null) {
                    throw new VocabularyLoadException("Vocabulary resource not found: " + CLASSPATH_DIR + fileName);
                }
                return mapper.readTree(in);
            }
        } catch (IOException e) {
            logger.error("Failed to read vocabulary {}: {}", fileName, e.getMessage(), e);
            throw new VocabularyLoadException("Invalid vocabulary file " + fileName + ": " + e.getMessage(), e);
        }
    }

    private static JsonNode section(JsonNode root, String field, String fileName) {
        JsonNode node = root == null ? null : root.get(field);
        if (node == null || !node.isObject()) {
            throw new VocabularyLoadException("Vocabulary file " + fileName + " has no '" + field + "' object");
        }
        return node;
    }

    private void loadGenes(JsonNode node) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String symbol = entry.getKey().toUpperCase(Locale.ROOT).trim();
            JsonNode info = entry.getValue();
            List<String> aliases = textList(info.get("aliases"));

            genes.put(symbol, new GeneCode(
                symbol,
                text(info, "hgnc_id"),
                text(info, "name"),
                text(info, "chromosome"),
                info.path("actionable").asBoolean(false),
                aliases
            ));
            for (String alias : aliases) {
                geneAliases.putIfAbsent(alias.toUpperCase(Locale.ROOT), symbol);
            }
        }
    }

    private void loadDrugs(JsonNode node) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String name = entry.getKey().toLowerCase(Locale.ROOT).trim();
            JsonNode info = entry.getValue();
            drugs.put(name, new DrugCode(
                name,
                text(info, "rxcui"),
                text(info, "display"),
                textList(info.get("target")),
                text(info, "evidence_level")
            ));
        }
    }

    private void loadDiagnoses(JsonNode node) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode info = entry.getValue();
            String code = text(info, "code");
            if (code == null) {
                throw new VocabularyLoadException("Diagnosis entry '" + entry.getKey() + "' has no code");
            }
            diagnoses.put(entry.getKey().toLowerCase(Locale.ROOT).trim(),
                new DiagnosisCode(code, text(info, "display"), text(info, "topography")));
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        }
        return values;
    }

    @Override
    public Optional<GeneCode> lookupGene(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return Optional.empty();
        }
        String key = symbol.toUpperCase(Locale.ROOT).trim();

        // Fusions resolve to their 5' partner
        int separator = key.indexOf("::");
        if (separator > 0) {
            key = key.substring(0, separator);
        }

        GeneCode code = genes.get(key);
        if (code == null && geneAliases.containsKey(key)) {
            code = genes.get(geneAliases.get(key));
        }
        return Optional.ofNullable(code);
    }

    @Override
    public boolean isKnownGene(String symbol) {
        return symbol != null && genes.containsKey(symbol.toUpperCase(Locale.ROOT).trim());
    }

    @Override
    public Optional<DrugCode> lookupDrug(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String key = name.toLowerCase(Locale.ROOT).trim();
        DrugCode exact = drugs.get(key);
        if (exact != null) {
            return Optional.of(exact);
        }
        return closestKey(key, drugs.keySet(), drugCutoff).map(drugs::get);
    }

    @Override
    public Optional<DiagnosisCode> lookupDiagnosis(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String key = text.toLowerCase(Locale.ROOT).trim();

        DiagnosisCode exact = diagnoses.get(key);
        if (exact != null) {
            return Optional.of(exact);
        }

        // Longest vocabulary term contained in the text, then text contained in a term
        String containedTerm = null;
        for (String term : diagnoses.keySet()) {
            if (key.contains(term) && (containedTerm == null || term.length() > containedTerm.length())) {
                containedTerm = term;
            }
        }
        if (containedTerm != null) {
            return Optional.of(diagnoses.get(containedTerm));
        }
        for (String term : diagnoses.keySet()) {
            if (term.contains(key)) {
                return Optional.of(diagnoses.get(term));
            }
        }

        return closestKey(key, diagnoses.keySet(), diagnosisCutoff).map(diagnoses::get);
    }

    @Override
    public List<String> knownDrugNames() {
        return Collections.unmodifiableList(new ArrayList<>(drugs.keySet()));
    }

    /**
     * Normalized Levenshtein similarity in [0, 1]
     */
    double similarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein.apply(a, b) / longest;
    }

    private Optional<String> closestKey(String key, Iterable<String> candidates, double cutoff) {
        String best = null;
        double bestScore = cutoff;
        for (String candidate : candidates) {
            double score = similarity(key, candidate);
            if (score >= bestScore && (best == null || score > bestScore)) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best != null) {
            logger.debug("Fuzzy vocabulary match '{}' -> '{}' ({})", key, best, bestScore);
        }
        return Optional.ofNullable(best);
    }
}

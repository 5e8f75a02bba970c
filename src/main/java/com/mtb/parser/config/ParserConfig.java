package com.mtb.parser.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Optional;
import java.util.Properties;

/**
 * Parser settings, read from {@code mtb-parser.properties} on the classpath and
 * overridable with system properties of the same name.
 */
public final class ParserConfig {
    private static final Logger logger = LoggerFactory.getLogger(ParserConfig.class);

    public static final String PROPERTIES_RESOURCE = "/mtb-parser.properties";

    public static final String KEY_VOCABULARY_DIR = "mtb.vocabulary.dir";
    public static final String KEY_DRUG_CUTOFF = "mtb.fuzzy.drug-cutoff";
    public static final String KEY_DIAGNOSIS_CUTOFF = "mtb.fuzzy.diagnosis-cutoff";
    public static final String KEY_ENRICHMENT_WINDOW = "mtb.enrichment.window";
    public static final String KEY_THREADS = "mtb.threads";

    private static final double DEFAULT_DRUG_CUTOFF = 0.8;
    private static final double DEFAULT_DIAGNOSIS_CUTOFF = 0.6;
    private static final int DEFAULT_ENRICHMENT_WINDOW = 100;
    private static final int DEFAULT_THREADS = 4;

    private final Path vocabularyDir;
    private final double drugFuzzyCutoff;
    private final double diagnosisFuzzyCutoff;
    private final int enrichmentWindow;
    private final int threads;
    private final Clock clock;

    private ParserConfig(Path vocabularyDir, double drugFuzzyCutoff, double diagnosisFuzzyCutoff,
                         int enrichmentWindow, int threads, Clock clock) {
        if (drugFuzzyCutoff < 0 || drugFuzzyCutoff > 1 || diagnosisFuzzyCutoff < 0 || diagnosisFuzzyCutoff > 1) {
            throw new IllegalArgumentException("Fuzzy cutoffs must be within [0, 1]");
        }
        if (enrichmentWindow <= 0) {
            throw new IllegalArgumentException("Enrichment window must be positive: " + enrichmentWindow);
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        this.vocabularyDir = vocabularyDir;
        this.drugFuzzyCutoff = drugFuzzyCutoff;
        this.diagnosisFuzzyCutoff = diagnosisFuzzyCutoff;
        this.enrichmentWindow = enrichmentWindow;
        this.threads = threads;
        this.clock = clock;
    }

    /**
     * Built-in defaults: bundled vocabularies, system clock
     */
    public static ParserConfig defaults() {
        return new ParserConfig(null, DEFAULT_DRUG_CUTOFF, DEFAULT_DIAGNOSIS_CUTOFF,
            DEFAULT_ENRICHMENT_WINDOW, DEFAULT_THREADS, Clock.systemDefaultZone());
    }

    /**
     * Load configuration from the classpath properties file, then apply system property overrides
     * @return Loaded configuration
     */
    public static ParserConfig load() {
        Properties properties = new Properties();
        try (InputStream in = ParserConfig.class.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.debug("No {} on classpath, using defaults", PROPERTIES_RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}: {}. Using defaults", PROPERTIES_RESOURCE, e.getMessage());
        }
        return fromProperties(properties, System.getProperties());
    }

    /**
     * Build a configuration from a base property set and an override set
     * @param base Base properties (typically the classpath file)
     * @param overrides Properties taking precedence (typically system properties)
     * @return Configuration
     */
    public static ParserConfig fromProperties(Properties base, Properties overrides) {
        String dir = value(KEY_VOCABULARY_DIR, base, overrides);
        Path vocabularyDir = dir != null && !dir.isBlank() ? Paths.get(dir.trim()) : null;

        return new ParserConfig(
            vocabularyDir,
            parseDouble(value(KEY_DRUG_CUTOFF, base, overrides), DEFAULT_DRUG_CUTOFF, KEY_DRUG_CUTOFF),
            parseDouble(value(KEY_DIAGNOSIS_CUTOFF, base, overrides), DEFAULT_DIAGNOSIS_CUTOFF, KEY_DIAGNOSIS_CUTOFF),
            parseInt(value(KEY_ENRICHMENT_WINDOW, base, overrides), DEFAULT_ENRICHMENT_WINDOW, KEY_ENRICHMENT_WINDOW),
            parseInt(value(KEY_THREADS, base, overrides), DEFAULT_THREADS, KEY_THREADS),
            Clock.systemDefaultZone()
        );
    }

    /**
     * Copy of this configuration with a different clock, used to freeze "now"
     */
    public ParserConfig withClock(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        return new ParserConfig(vocabularyDir, drugFuzzyCutoff, diagnosisFuzzyCutoff, enrichmentWindow, threads, clock);
    }

    /**
     * Copy of this configuration reading vocabularies from a directory instead of the classpath
     */
    public ParserConfig withVocabularyDir(Path vocabularyDir) {
        return new ParserConfig(vocabularyDir, drugFuzzyCutoff, diagnosisFuzzyCutoff, enrichmentWindow, threads, clock);
    }

    private static String value(String key, Properties base, Properties overrides) {
        String override = overrides != null ? overrides.getProperty(key) : null;
        return override != null ? override : base.getProperty(key);
    }

    private static double parseDouble(String raw, double fallback, String key) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid value for {}: {}. Using default: {}", key, raw, fallback);
            return fallback;
        }
    }

    private static int parseInt(String raw, int fallback, String key) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid value for {}: {}. Using default: {}", key, raw, fallback);
            return fallback;
        }
    }

    public Optional<Path> getVocabularyDir() {
        return Optional.ofNullable(vocabularyDir);
    }

    public double getDrugFuzzyCutoff() {
        return drugFuzzyCutoff;
    }

    public double getDiagnosisFuzzyCutoff() {
        return diagnosisFuzzyCutoff;
    }

    public int getEnrichmentWindow() {
        return enrichmentWindow;
    }

    public int getThreads() {
        return threads;
    }

    public Clock getClock() {
        return clock;
    }
}

package com.mtb.parser.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ParserConfig
 */
public class ParserConfigTest {

    // ========== Defaults Tests ==========

    @Test
    public void testDefaults_Values() {
        ParserConfig config = ParserConfig.defaults();

        assertTrue(config.getVocabularyDir().isEmpty());
        assertEquals(0.8, config.getDrugFuzzyCutoff());
        assertEquals(0.6, config.getDiagnosisFuzzyCutoff());
        assertEquals(100, config.getEnrichmentWindow());
        assertEquals(4, config.getThreads());
        assertNotNull(config.getClock());
    }

    @Test
    public void testLoad_ClasspathFileMatchesDefaults() {
        ParserConfig config = ParserConfig.load();

        assertTrue(config.getVocabularyDir().isEmpty());
        assertEquals(0.8, config.getDrugFuzzyCutoff());
        assertEquals(100, config.getEnrichmentWindow());
    }

    // ========== fromProperties Tests ==========

    @Test
    public void testFromProperties_OverridesWin() {
        Properties base = new Properties();
        base.setProperty(ParserConfig.KEY_THREADS, "2");
        base.setProperty(ParserConfig.KEY_ENRICHMENT_WINDOW, "50");
        Properties overrides = new Properties();
        overrides.setProperty(ParserConfig.KEY_THREADS, "8");

        ParserConfig config = ParserConfig.fromProperties(base, overrides);

        assertEquals(8, config.getThreads());
        assertEquals(50, config.getEnrichmentWindow());
    }

    @Test
    public void testFromProperties_VocabularyDir() {
        Properties base = new Properties();
        base.setProperty(ParserConfig.KEY_VOCABULARY_DIR, " /opt/vocab ");

        ParserConfig config = ParserConfig.fromProperties(base, null);

        assertEquals(Paths.get("/opt/vocab"), config.getVocabularyDir().orElseThrow());
    }

    @Test
    public void testFromProperties_BlankVocabularyDirMeansClasspath() {
        Properties base = new Properties();
        base.setProperty(ParserConfig.KEY_VOCABULARY_DIR, "");

        assertTrue(ParserConfig.fromProperties(base, null).getVocabularyDir().isEmpty());
    }

    @Test
    public void testFromProperties_UnparseableNumberFallsBackToDefault() {
        Properties base = new Properties();
        base.setProperty(ParserConfig.KEY_DRUG_CUTOFF, "high");
        base.setProperty(ParserConfig.KEY_THREADS, "many");

        ParserConfig config = ParserConfig.fromProperties(base, null);

        assertEquals(0.8, config.getDrugFuzzyCutoff());
        assertEquals(4, config.getThreads());
    }

    @Test
    public void testFromProperties_CutoffOutOfRange() {
        Properties base = new Properties();
        base.setProperty(ParserConfig.KEY_DIAGNOSIS_CUTOFF, "1.5");

        assertThrows(IllegalArgumentException.class, () -> ParserConfig.fromProperties(base, null));
    }

    @Test
    public void testFromProperties_NonPositiveWindow() {
        Properties base = new Properties();
        base.setProperty(ParserConfig.KEY_ENRICHMENT_WINDOW, "0");

        assertThrows(IllegalArgumentException.class, () -> ParserConfig.fromProperties(base, null));
    }

    @Test
    public void testFromProperties_NonPositiveThreads() {
        Properties base = new Properties();
        base.setProperty(ParserConfig.KEY_THREADS, "-1");

        assertThrows(IllegalArgumentException.class, () -> ParserConfig.fromProperties(base, null));
    }

    // ========== Copy Tests ==========

    @Test
    public void testWithClock() {
        Clock fixed = Clock.fixed(Instant.parse("2025-10-22T10:00:00Z"), ZoneOffset.UTC);

        ParserConfig config = ParserConfig.defaults().withClock(fixed);

        assertSame(fixed, config.getClock());
        assertEquals(0.8, config.getDrugFuzzyCutoff());
    }

    @Test
    public void testWithClock_Null() {
        assertThrows(IllegalArgumentException.class, () -> ParserConfig.defaults().withClock(null));
    }

    @Test
    public void testWithVocabularyDir() {
        ParserConfig config = ParserConfig.defaults().withVocabularyDir(Paths.get("vocab"));

        assertEquals(Paths.get("vocab"), config.getVocabularyDir().orElseThrow());
    }
}

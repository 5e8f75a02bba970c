package com.mtb.parser.vocabulary;

import com.mtb.parser.config.ParserConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for JsonVocabularyService
 */
public class JsonVocabularyServiceTest {

    private JsonVocabularyService vocabulary;

    @TempDir
    Path tempDir;

    @BeforeEach
    public void setUp() {
        vocabulary = new JsonVocabularyService();
    }

    // ========== Gene Tests ==========

    @Test
    public void testLookupGene_OfficialSymbol() {
        GeneCode egfr = vocabulary.lookupGene("EGFR").orElseThrow();

        assertEquals("EGFR", egfr.getSymbol());
        assertEquals("HGNC:3236", egfr.getHgncId());
        assertTrue(egfr.isActionable());
        assertTrue(egfr.getAliases().contains("HER1"));
    }

    @Test
    public void testLookupGene_CaseInsensitive() {
        assertEquals("KRAS", vocabulary.lookupGene(" kras ").orElseThrow().getSymbol());
    }

    @Test
    public void testLookupGene_AliasResolvesToOfficialSymbol() {
        assertEquals("ERBB2", vocabulary.lookupGene("HER2").orElseThrow().getSymbol());
        assertFalse(vocabulary.isKnownGene("HER2"));
    }

    @Test
    public void testLookupGene_FusionResolvesToFirstPartner() {
        assertEquals("EML4", vocabulary.lookupGene("EML4::ALK").orElseThrow().getSymbol());
    }

    @Test
    public void testLookupGene_Unknown() {
        assertTrue(vocabulary.lookupGene("XYZ1").isEmpty());
        assertTrue(vocabulary.lookupGene(null).isEmpty());
        assertTrue(vocabulary.lookupGene("  ").isEmpty());
    }

    @Test
    public void testIsKnownGene() {
        assertTrue(vocabulary.isKnownGene("tp53"));
        assertFalse(vocabulary.isKnownGene("PAZIENTE"));
        assertFalse(vocabulary.isKnownGene(null));
    }

    // ========== Drug Tests ==========

    @Test
    public void testLookupDrug_Exact() {
        DrugCode code = vocabulary.lookupDrug("Osimertinib").orElseThrow();

        assertEquals("osimertinib", code.getName());
        assertEquals("1721560", code.getRxcui());
        assertEquals("FDA Approved", code.getEvidenceLevel());
        assertEquals(1, code.getTargets().size());
        assertEquals("EGFR", code.getTargets().get(0));
    }

    @Test
    public void testLookupDrug_FuzzyWithinCutoff() {
        Optional<DrugCode> code = vocabulary.lookupDrug("osimertinb");

        assertTrue(code.isPresent());
        assertEquals("osimertinib", code.get().getName());
    }

    @Test
    public void testLookupDrug_FuzzyBelowCutoff() {
        assertTrue(vocabulary.lookupDrug("aspirin").isEmpty());
    }

    @Test
    public void testKnownDrugNames_Unmodifiable() {
        assertTrue(vocabulary.knownDrugNames().contains("pembrolizumab"));
        assertThrows(UnsupportedOperationException.class, () -> vocabulary.knownDrugNames().add("x"));
    }

    // ========== Diagnosis Tests ==========

    @Test
    public void testLookupDiagnosis_Exact() {
        assertEquals("8046/3", vocabulary.lookupDiagnosis("NSCLC").orElseThrow().getCode());
    }

    @Test
    public void testLookupDiagnosis_LongestContainedTerm() {
        DiagnosisCode code = vocabulary.lookupDiagnosis("Adenocarcinoma polmonare stadio IV").orElseThrow();

        assertEquals("8140/3", code.getCode());
        assertEquals("C34.9", code.getTopography());
    }

    @Test
    public void testLookupDiagnosis_TextContainedInTerm() {
        assertEquals("8160/3", vocabulary.lookupDiagnosis("colangio").orElseThrow().getCode());
    }

    @Test
    public void testLookupDiagnosis_Fuzzy() {
        assertEquals("8720/3", vocabulary.lookupDiagnosis("melanomma").orElseThrow().getCode());
    }

    @Test
    public void testLookupDiagnosis_NoMatch() {
        assertTrue(vocabulary.lookupDiagnosis("frattura del femore").isEmpty());
    }

    @Test
    public void testSimilarity() {
        assertEquals(1.0, vocabulary.similarity("", ""));
        assertEquals(1.0, vocabulary.similarity("abc", "abc"));
        assertEquals(0.75, vocabulary.similarity("abcd", "abce"), 1e-9);
    }

    // ========== Loading Tests ==========

    @Test
    public void testLoad_MissingDirectoryFiles() {
        ParserConfig config = ParserConfig.defaults().withVocabularyDir(tempDir);

        VocabularyLoadException e = assertThrows(VocabularyLoadException.class,
            () -> new JsonVocabularyService(config));
        assertTrue(e.getMessage().contains(JsonVocabularyService.GENES_FILE));
    }

    @Test
    public void testLoad_MalformedFile() throws IOException {
        writeValidFiles();
        Files.writeString(tempDir.resolve(JsonVocabularyService.DRUGS_FILE), "{ not json", StandardCharsets.UTF_8);
        ParserConfig config = ParserConfig.defaults().withVocabularyDir(tempDir);

        assertThrows(VocabularyLoadException.class, () -> new JsonVocabularyService(config));
    }

    @Test
    public void testLoad_MissingSection() throws IOException {
        writeValidFiles();
        Files.writeString(tempDir.resolve(JsonVocabularyService.DIAGNOSES_FILE), "{\"terms\": {}}",
            StandardCharsets.UTF_8);
        ParserConfig config = ParserConfig.defaults().withVocabularyDir(tempDir);

        VocabularyLoadException e = assertThrows(VocabularyLoadException.class,
            () -> new JsonVocabularyService(config));
        assertTrue(e.getMessage().contains("diagnoses"));
    }

    @Test
    public void testLoad_FromDirectory() throws IOException {
        writeValidFiles();
        ParserConfig config = ParserConfig.defaults().withVocabularyDir(tempDir);

        JsonVocabularyService custom = new JsonVocabularyService(config);

        assertTrue(custom.isKnownGene("BRAF"));
        assertFalse(custom.isKnownGene("EGFR"));
        assertEquals("BRAF", custom.lookupGene("B-RAF").orElseThrow().getSymbol());
        assertEquals("9999", custom.lookupDrug("dabrafenib").orElseThrow().getRxcui());
        assertEquals("8720/3", custom.lookupDiagnosis("melanoma cutaneo").orElseThrow().getCode());
    }

    private void writeValidFiles() throws IOException {
        Files.writeString(tempDir.resolve(JsonVocabularyService.GENES_FILE),
            "{\"genes\": {\"BRAF\": {\"hgnc_id\": \"HGNC:1097\", \"actionable\": true, \"aliases\": [\"B-RAF\"]}}}",
            StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve(JsonVocabularyService.DRUGS_FILE),
            "{\"drugs\": {\"dabrafenib\": {\"rxcui\": \"9999\", \"target\": [\"BRAF\"]}}}",
            StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve(JsonVocabularyService.DIAGNOSES_FILE),
            "{\"diagnoses\": {\"melanoma\": {\"code\": \"8720/3\"}}}",
            StandardCharsets.UTF_8);
    }
}

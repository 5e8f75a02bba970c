package com.mtb.parser.main;

import com.mtb.parser.report.ExtractionReport;
import com.mtb.parser.report.MtbReportParser;
import com.mtb.parser.vocabulary.JsonVocabularyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MtbParserApp argument handling and batch parsing
 */
public class MtbParserAppTest {

    @TempDir
    Path tempDir;

    private MtbReportParser parser;

    @BeforeEach
    public void setUp() {
        parser = new MtbReportParser(new JsonVocabularyService());
    }

    // ========== parseArguments Tests ==========

    @Test
    public void testParseArguments_FilesOnly() {
        MtbParserApp.Options options = MtbParserApp.parseArguments(new String[] {"a.txt", "b.txt"});

        assertFalse(options.json);
        assertFalse(options.fhir);
        assertEquals(List.of(Paths.get("a.txt"), Paths.get("b.txt")), options.files);
    }

    @Test
    public void testParseArguments_Flags() {
        MtbParserApp.Options options = MtbParserApp.parseArguments(
            new String[] {"--json", "report.txt", "--fhir"});

        assertTrue(options.json);
        assertTrue(options.fhir);
        assertEquals(List.of(Paths.get("report.txt")), options.files);
    }

    @Test
    public void testParseArguments_UnknownOptionIgnored() {
        MtbParserApp.Options options = MtbParserApp.parseArguments(new String[] {"--verbose", "report.txt"});

        assertFalse(options.json);
        assertEquals(1, options.files.size());
    }

    @Test
    public void testParseArguments_Empty() {
        assertTrue(MtbParserApp.parseArguments(new String[0]).files.isEmpty());
    }

    // ========== parseInParallel Tests ==========

    @Test
    public void testParseInParallel_PreservesArgumentOrder() throws IOException {
        List<Path> files = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            files.add(write("report" + i + ".txt", "ID Paziente: P00" + i + "\nKRAS G12D 8%"));
        }

        Map<String, ExtractionReport> reports = MtbParserApp.parseInParallel(files, parser, 3);

        assertEquals(List.of("report1.txt", "report2.txt", "report3.txt", "report4.txt", "report5.txt",
            "report6.txt"), new ArrayList<>(reports.keySet()));
        assertEquals("P004", reports.get("report4.txt").getPatient().getId());
        assertEquals(1, reports.get("report6.txt").getVariants().size());
    }

    @Test
    public void testParseInParallel_MissingFileSkipped() throws IOException {
        Path present = write("present.txt", "EGFR c.2573T>G p.Leu858Arg Pathogenic 45%");
        Path missing = tempDir.resolve("missing.txt");

        Map<String, ExtractionReport> reports = MtbParserApp.parseInParallel(List.of(missing, present), parser, 2);

        assertEquals(1, reports.size());
        assertTrue(reports.containsKey("present.txt"));
    }

    @Test
    public void testParseInParallel_DuplicateFileNamesKeptApart() throws IOException {
        Path first = write("report.txt", "ID Paziente: A1");
        Files.createDirectories(tempDir.resolve("other"));
        Path second = Files.writeString(tempDir.resolve("other").resolve("report.txt"), "ID Paziente: B2",
            StandardCharsets.UTF_8);

        Map<String, ExtractionReport> reports = MtbParserApp.parseInParallel(List.of(first, second), parser, 2);

        assertEquals(2, reports.size());
        assertEquals("A1", reports.get("report.txt").getPatient().getId());
        assertEquals("B2", reports.get(second.toString()).getPatient().getId());
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }
}

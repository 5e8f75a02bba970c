package com.mtb.parser.report;

import com.mtb.parser.config.ParserConfig;
import com.mtb.parser.model.QualityMetrics;
import com.mtb.parser.model.TherapeuticRecommendation;
import com.mtb.parser.model.VariantClassification;
import com.mtb.parser.model.VariantRecord;
import com.mtb.parser.quality.QualityAssessor;
import com.mtb.parser.vocabulary.JsonVocabularyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for MtbReportParser using the bundled vocabularies
 */
public class MtbReportParserTest {

    private static final String FULL_REPORT = String.join("\n",
        "REFERTO MOLECOLARE - TUMOR BOARD",
        "ID Paziente: P001",
        "Data di nascita: 15/03/1958",
        "Sesso: F",
        "Diagnosi: Adenocarcinoma polmonare stadio IV",
        "Istologia: adenocarcinoma acinare",
        "Data report: 22/10/2025",
        "Pannello: Oncomine Focus Assay",
        "",
        "┌──────┬────────────┬──────────────┬────────────┬─────┐",
        "│ EGFR │ c.2573T>G  │ p.Leu858Arg  │ Pathogenic │ 45% │",
        "└──────┴────────────┴──────────────┴────────────┴─────┘",
        "",
        "Riarrangiamento: fusione EML4::ALK rilevata.",
        "TMB: 12.5 mut/Mb",
        "Si raccomanda trattamento con osimertinib.");

    private MtbReportParser parser;

    @BeforeEach
    public void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-10-22T09:00:00Z"), ZoneOffset.UTC);
        ParserConfig config = ParserConfig.defaults().withClock(clock);
        parser = new MtbReportParser(new JsonVocabularyService(config), config);
    }

    // ========== Single Line Tests ==========

    @Test
    public void testParse_TabularVariant() {
        ExtractionReport report = parser.parse("EGFR c.2573T>G p.Leu858Arg Pathogenic 45%");

        assertEquals(1, report.getVariants().size());
        VariantRecord variant = report.getVariants().get(0);
        assertEquals("EGFR", variant.getGene());
        assertEquals("c.2573T>G", variant.getCdnaChange());
        assertEquals("p.Leu858Arg", variant.getProteinChange());
        assertEquals("Pathogenic", variant.getClassification());
        assertEquals(45.0, variant.getVaf());
        assertNotNull(variant.getGeneVocabularyCode());
        assertEquals("EGFR", variant.getGeneVocabularyCode().getSymbol());
    }

    @Test
    public void testParse_InlineVariantWithoutClassification() {
        ExtractionReport report = parser.parse("KRAS G12D 8%");

        assertEquals(1, report.getVariants().size());
        VariantRecord variant = report.getVariants().get(0);
        assertEquals("KRAS", variant.getGene());
        assertEquals("G12D", variant.getProteinChange());
        assertEquals(8.0, variant.getVaf());
        assertNull(variant.getClassification());
        assertEquals(VariantClassification.UNKNOWN, variant.getClassificationCategory());
    }

    @Test
    public void testParse_ItalianFusion() {
        ExtractionReport report = parser.parse("fusione ALK::EML4");

        assertEquals(1, report.getVariants().size());
        VariantRecord variant = report.getVariants().get(0);
        assertEquals("ALK::EML4", variant.getGene());
        assertEquals(VariantRecord.FUSION, variant.getProteinChange());
        assertEquals("Pathogenic", variant.getClassification());
        assertTrue(variant.isFusion());
    }

    @Test
    public void testParse_NarrativeCdnaMention() {
        ExtractionReport report = parser.parse("mutazione di KRAS c.35G>A 8%");

        assertEquals(1, report.getVariants().size());
        VariantRecord variant = report.getVariants().get(0);
        assertEquals("KRAS", variant.getGene());
        assertEquals("c.35G>A", variant.getCdnaChange());
        assertNull(variant.getProteinChange());
        assertEquals(8.0, variant.getVaf());
    }

    @Test
    public void testParse_PatientHeaderOnly() {
        ExtractionReport report = parser.parse("ID Paziente: 12345\nEtà: 65 anni\nSesso: M");

        assertEquals("12345", report.getPatient().getId());
        assertEquals(65, report.getPatient().getAge());
        assertEquals("M", report.getPatient().getSex());
        assertTrue(report.getVariants().isEmpty());

        QualityMetrics quality = report.getQualityMetrics();
        assertEquals(6, quality.getTotalFieldsExpected());
        assertEquals(3, quality.getFilledFields());
        assertEquals(50.0, quality.getCompletenessPct());
        assertTrue(quality.isPatientComplete());
        assertEquals(List.of(QualityAssessor.WARNING_NO_VARIANTS, QualityAssessor.WARNING_NO_DIAGNOSIS,
            QualityAssessor.WARNING_NO_TMB), quality.getWarnings());
    }

    @Test
    public void testParse_UnknownGeneDiscardedSilently() {
        ExtractionReport report = parser.parse("XYZ1 L858R 30%");

        assertTrue(report.getVariants().isEmpty());
        assertTrue(report.getQualityMetrics().getWarnings().stream().noneMatch(w -> w.contains("XYZ1")));
    }

    // ========== Full Report Tests ==========

    @Test
    public void testParse_FullReport() {
        ExtractionReport report = parser.parse(FULL_REPORT);

        assertEquals("P001", report.getPatient().getId());
        assertEquals(67, report.getPatient().getAge());
        assertEquals("F", report.getPatient().getSex());
        assertEquals("1958-03-15", report.getPatient().getBirthDate());

        assertTrue(report.getDiagnosis().isMapped());
        assertEquals("8140/3", report.getDiagnosis().getVocabularyCode().getCode());
        assertEquals("IV", report.getDiagnosis().getStage());
        assertEquals("adenocarcinoma acinare", report.getDiagnosis().getHistology());

        assertEquals("2025-10-22", report.getReportDate());
        assertEquals("Oncomine Focus Assay", report.getNgsMethod());
        assertEquals(12.5, report.getTmb());
        assertTrue(report.hasHighTmb());
    }

    @Test
    public void testParse_FullReportVariantsAndRecommendations() {
        ExtractionReport report = parser.parse(FULL_REPORT);

        assertEquals(2, report.getVariants().size());
        VariantRecord egfr = report.getVariants().stream()
            .filter(v -> v.getGene().equals("EGFR"))
            .findFirst()
            .orElseThrow();
        assertEquals(45.0, egfr.getVaf());
        assertTrue(egfr.isActionable());

        assertEquals(1, report.getFusionVariants().size());
        assertEquals("EML4::ALK", report.getFusionVariants().get(0).getGene());

        assertEquals(1, report.getRecommendations().size());
        TherapeuticRecommendation recommendation = report.getRecommendations().get(0);
        assertEquals("osimertinib", recommendation.getDrug());
        assertEquals("EGFR", recommendation.getGeneTarget());
        assertTrue(recommendation.isMapped());

        assertTrue(report.getQualityMetrics().getWarnings().isEmpty());
    }

    // ========== Edge Case Tests ==========

    @Test
    public void testParse_DuplicateMentionsCollapse() {
        ExtractionReport report = parser.parse("EGFR L858R rilevata. Conferma: EGFR L858R.");

        assertEquals(1, report.getVariants().size());
    }

    @Test
    public void testParse_OutOfRangeVafIgnored() {
        ExtractionReport report = parser.parse("EGFR c.2573T>G p.Leu858Arg Pathogenic 150%");

        assertEquals(1, report.getVariants().size());
        assertNull(report.getVariants().get(0).getVaf());
    }

    @Test
    public void testParse_EmptyText() {
        ExtractionReport report = parser.parse("");

        assertNull(report.getPatient().getId());
        assertFalse(report.getDiagnosis().hasDiagnosis());
        assertTrue(report.getVariants().isEmpty());
        assertTrue(report.getRecommendations().isEmpty());
        assertNull(report.getTmb());
        assertEquals(6, report.getQualityMetrics().getTotalFieldsExpected());
        assertEquals(0, report.getQualityMetrics().getFilledFields());
        assertTrue(report.getQualityMetrics().getWarnings().contains(QualityAssessor.WARNING_NO_VARIANTS));
    }

    @Test
    public void testParse_NullText() {
        assertThrows(NullPointerException.class, () -> parser.parse(null));
    }

    @Test
    public void testParse_Idempotent() {
        JsonReportWriter writer = new JsonReportWriter();

        assertEquals(writer.toJson(parser.parse(FULL_REPORT)), writer.toJson(parser.parse(FULL_REPORT)));
    }
}

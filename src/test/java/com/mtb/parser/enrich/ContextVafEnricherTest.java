package com.mtb.parser.enrich;

import com.mtb.parser.model.VariantRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ContextVafEnricher
 */
public class ContextVafEnricherTest {

    private ContextVafEnricher enricher;

    @BeforeEach
    public void setUp() {
        enricher = new ContextVafEnricher();
    }

    // ========== Strategy Tests ==========

    @Test
    public void testFindVaf_GeneAnchoredWinsFirst() {
        VariantRecord variant = VariantRecord.builder("KRAS").proteinChange("G12D").build();

        assertEquals(Optional.of(16.0), enricher.findVaf(variant, "KRAS 16% di cellule; G12D 8%"));
    }

    @Test
    public void testFindVaf_MutationFollowedByFa() {
        VariantRecord variant = VariantRecord.builder("EGFR").proteinChange("L858R").build();

        assertEquals(Optional.of(23.0), enricher.findVaf(variant, "mutazione EGFR L858R f.a. 23%"));
    }

    @Test
    public void testFindVaf_FrequenzaAllelica() {
        VariantRecord variant = VariantRecord.builder("EGFR").proteinChange("p.Leu858Arg").build();

        assertEquals(Optional.of(17.0),
            enricher.findVaf(variant, "EGFR p.Leu858Arg (esone 21), frequenza allelica 17%"));
    }

    @Test
    public void testFindVaf_MutationFollowedByPercentage() {
        VariantRecord variant = VariantRecord.builder("KRAS").proteinChange("G12D").build();

        assertEquals(Optional.of(8.0), enricher.findVaf(variant, "KRAS G12D 8%"));
    }

    @Test
    public void testFindVaf_Window() {
        VariantRecord variant = VariantRecord.builder("BRAF").proteinChange("V600E").build();

        assertEquals(Optional.of(35.0),
            enricher.findVaf(variant, "BRAF V600E rilevata; la frequenza è pari al 35%"));
    }

    @Test
    public void testFindVaf_OutsideWindow() {
        VariantRecord variant = VariantRecord.builder("BRAF").proteinChange("V600E").build();
        ContextVafEnricher narrow = new ContextVafEnricher(10);

        assertTrue(narrow.findVaf(variant, "BRAF V600E rilevata; la frequenza è pari al 35%").isEmpty());
    }

    @Test
    public void testFindVaf_WindowAfterCharactersThatGrowWhenLowerCased() {
        VariantRecord variant = VariantRecord.builder("EGFR").proteinChange("L858R").build();
        // 'İ' lower-cases to two chars
        String text = "İ".repeat(200) + " L858R rilevata, cellule tumorali al 30%";

        assertEquals(Optional.of(30.0), enricher.findVaf(variant, text));
    }

    @Test
    public void testFindVaf_ImplausibleValuesSkipped() {
        VariantRecord variant = VariantRecord.builder("EGFR").proteinChange("L858R").build();

        assertEquals(Optional.of(12.0), enricher.findVaf(variant, "EGFR 0% e EGFR 150%; L858R 12%"));
    }

    @Test
    public void testFindVaf_NoChangeNoGeneMatch() {
        VariantRecord variant = VariantRecord.builder("MET").build();

        assertTrue(enricher.findVaf(variant, "MET amplificato, 40% cellule tumorali").isEmpty());
    }

    // ========== enrich Tests ==========

    @Test
    public void testEnrich_ExistingVafUntouched() {
        VariantRecord withVaf = VariantRecord.builder("KRAS").proteinChange("G12D").vaf(45.0).build();

        List<VariantRecord> result = enricher.enrich(List.of(withVaf), "KRAS G12D 8%");

        assertSame(withVaf, result.get(0));
    }

    @Test
    public void testEnrich_ReturnsCopiesInOrder() {
        VariantRecord kras = VariantRecord.builder("KRAS").proteinChange("G12D").build();
        VariantRecord tp53 = VariantRecord.builder("TP53").proteinChange("p.Arg273fs").build();

        List<VariantRecord> result = enricher.enrich(List.of(kras, tp53), "KRAS G12D 8%");

        assertEquals(2, result.size());
        assertEquals(8.0, result.get(0).getVaf());
        assertNull(kras.getVaf());
        assertSame(tp53, result.get(1));
    }

    @Test
    public void testEnrich_EmptyText() {
        VariantRecord kras = VariantRecord.builder("KRAS").proteinChange("G12D").build();

        assertSame(kras, enricher.enrich(List.of(kras), "").get(0));
    }

    // ========== Helper Tests ==========

    @Test
    public void testMutationToken() {
        assertEquals("Leu858Arg", ContextVafEnricher.mutationToken(
            VariantRecord.builder("EGFR").proteinChange("p.Leu858Arg").cdnaChange("c.2573T>G").build()));
        assertEquals("35G>A", ContextVafEnricher.mutationToken(
            VariantRecord.builder("KRAS").cdnaChange("c.35G>A").build()));
        assertNull(ContextVafEnricher.mutationToken(VariantRecord.builder("KRAS").proteinChange("p.").build()));
        assertNull(ContextVafEnricher.mutationToken(VariantRecord.builder("KRAS").build()));
    }

    @Test
    public void testConstructor_NonPositiveWindow() {
        assertThrows(IllegalArgumentException.class, () -> new ContextVafEnricher(0));
    }
}

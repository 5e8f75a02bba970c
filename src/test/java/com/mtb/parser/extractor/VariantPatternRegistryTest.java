package com.mtb.parser.extractor;

import com.mtb.parser.extractor.PatternFamily.Kind;
import com.mtb.parser.model.VariantRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for VariantPatternRegistry: family order and what each family captures
 */
public class VariantPatternRegistryTest {

    private VariantPatternRegistry registry;

    @BeforeEach
    public void setUp() {
        registry = VariantPatternRegistry.standard();
    }

    // ========== Order Tests ==========

    @Test
    public void testStandard_KindsInPriorityOrder() {
        List<PatternFamily> all = registry.all();

        assertEquals(Kind.SEQUENCE, all.get(0).getKind());
        assertEquals(Kind.CNV, all.get(all.size() - 1).getKind());
        int lastFusion = all.lastIndexOf(registry.families(Kind.FUSION).get(registry.families(Kind.FUSION).size() - 1));
        int firstExon = all.indexOf(registry.families(Kind.EXON).get(0));
        assertTrue(lastFusion < firstExon);
    }

    @Test
    public void testStandard_RichestSequenceFamiliesFirst() {
        List<PatternFamily> sequence = registry.families(Kind.SEQUENCE);

        assertEquals("exon-detail", sequence.get(0).getName());
        assertEquals("tabular", sequence.get(1).getName());
        assertEquals("inline-vaf", sequence.get(2).getName());
        assertEquals(5, sequence.get(1).getArity());
    }

    @Test
    public void testAll_Unmodifiable() {
        assertThrows(UnsupportedOperationException.class, () -> registry.all().clear());
    }

    // ========== Sequence Family Tests ==========

    @Test
    public void testExonDetail() {
        VariantRecord variant = first("exon-detail",
            "variante nell'esone 18 del gene EGFR (NM_005228.4): c.2155G>A, p.(Gly719Ser), frequenza allelica 11%");

        assertEquals("EGFR", variant.getGene());
        assertEquals("c.2155G>A", variant.getCdnaChange());
        assertEquals("p.Gly719Ser", variant.getProteinChange());
        assertEquals(11.0, variant.getVaf());
    }

    @Test
    public void testTabular_ClassificationNormalized() {
        VariantRecord variant = first("tabular", "pik3ca c.3140A>G p.His1047Arg likely pathogenic 12.5%");

        assertEquals("PIK3CA", variant.getGene());
        assertEquals("c.3140A>G", variant.getCdnaChange());
        assertEquals("p.His1047Arg", variant.getProteinChange());
        assertEquals("Likely Pathogenic", variant.getClassification());
        assertEquals(12.5, variant.getVaf());
    }

    @Test
    public void testTabular_VafOutOfRangeDropped() {
        VariantRecord variant = first("tabular", "EGFR c.2573T>G p.Leu858Arg Pathogenic 150%");

        assertNull(variant.getVaf());
    }

    @Test
    public void testInlineVaf_ProteinChange() {
        VariantRecord variant = first("inline-vaf", "BRAF p.V600E rilevata al 30%");

        assertEquals("p.V600E", variant.getProteinChange());
        assertNull(variant.getCdnaChange());
        assertEquals(30.0, variant.getVaf());
    }

    @Test
    public void testShortProtein() {
        VariantRecord variant = first("short-protein", "KRAS G12D 8%");

        assertEquals("KRAS", variant.getGene());
        assertEquals("G12D", variant.getProteinChange());
        assertNull(variant.getVaf());
        assertNull(variant.getClassification());
    }

    @Test
    public void testParenthesized() {
        assertEquals("L858R", first("parenthesized", "EGFR (L858R)").getProteinChange());
    }

    @Test
    public void testNarrative_TokenWithPosition() {
        VariantRecord variant = first("narrative-mutation", "Si rileva mutazione di BRAF V600E.");

        assertEquals("BRAF", variant.getGene());
        assertEquals("V600E", variant.getProteinChange());
    }

    @Test
    public void testNarrative_CdnaTokenGoesToCdnaSlot() {
        VariantRecord variant = first("narrative-mutation", "mutazione di KRAS c.35G>A 8%");

        assertEquals("KRAS", variant.getGene());
        assertEquals("c.35G>A", variant.getCdnaChange());
        assertNull(variant.getProteinChange());
    }

    @Test
    public void testNarrative_ProteinTokenKeepsPrefix() {
        VariantRecord variant = first("narrative-alteration", "alterazione di BRAF p.Val600Glu.");

        assertEquals("p.Val600Glu", variant.getProteinChange());
        assertNull(variant.getCdnaChange());
    }

    @Test
    public void testNarrative_TokenWithoutDigitSkipped() {
        assertTrue(family("narrative-mutation").findAll("mutation in KRAS: none").isEmpty());
    }

    @Test
    public void testFrameshiftStopSpliceDuplication() {
        assertEquals("p.Arg273fs", first("frameshift", "TP53 p.Arg273fs").getProteinChange());
        assertEquals("p.Arg213*", first("stop-gained", "TP53 p.Arg213* detected").getProteinChange());
        assertEquals("c.8488-1G>A", first("splice", "BRCA2 c.8488-1G>A").getCdnaChange());
        assertEquals("c.2235_2249dup", first("duplication", "EGFR c.2235_2249dup").getCdnaChange());
    }

    // ========== Fusion Family Tests ==========

    @Test
    public void testFusionFamilies_TwoPartnerNotation() {
        assertEquals("ALK::EML4", first("fusione", "fusione ALK::EML4").getGene());
        assertEquals("ROS1::CD74", first("riarrangiamento", "riarrangiamento ROS1/CD74").getGene());
        assertEquals("EML4::ALK", first("hyphen-fusion", "EML4-ALK fusion").getGene());
        assertEquals("EML4::ALK", first("exon-numbered", "EML4(13)::ALK(20)").getGene());
        assertEquals("KIF5B::RET", first("double-colon", "KIF5B::RET").getGene());
    }

    @Test
    public void testFusionFamilies_AlwaysPathogenic() {
        VariantRecord variant = first("fusion-detected", "ROS1 fusion detected");

        assertEquals("ROS1", variant.getGene());
        assertEquals(VariantRecord.FUSION, variant.getProteinChange());
        assertEquals("Pathogenic", variant.getClassification());
    }

    // ========== Exon Family Tests ==========

    @Test
    public void testExonAlteration_EnglishLabel() {
        VariantRecord deletion = first("exon-alteration", "EGFR exon 19 deletion");
        VariantRecord insertion = first("exon-alteration", "EGFR esone 20 inserzione");

        assertEquals("exon 19 deletion", deletion.getProteinChange());
        assertEquals("exon 20 insertion", insertion.getProteinChange());
        assertEquals("Pathogenic", insertion.getClassification());
    }

    // ========== CNV Family Tests ==========

    @Test
    public void testCnv_Amplification() {
        VariantRecord variant = first("amplification", "MET amplification");

        assertEquals("MET", variant.getGene());
        assertEquals("amplification", variant.getProteinChange());
        assertEquals("Pathogenic", variant.getClassification());
        assertEquals("MET amplification", variant.getRawText());
    }

    @Test
    public void testCnv_NumericCopyNumber() {
        VariantRecord amplified = first("copy-number", "ERBB2 copy number: 8");
        VariantRecord neutral = first("cn-value", "MYC CN=3");

        assertEquals("amplification", amplified.getProteinChange());
        assertEquals("ERBB2 amplification (CN=8)", amplified.getRawText());
        assertEquals("copy_number_variation", neutral.getProteinChange());
        assertEquals("VUS", neutral.getClassification());
    }

    @Test
    public void testCnv_HomozygousDeletionIsPathogenic() {
        VariantRecord variant = first("homozygous-deletion", "CDKN2A homozygous deletion");

        assertEquals("homozygous_deletion", variant.getProteinChange());
        assertEquals("Pathogenic", variant.getClassification());
    }

    // ========== parseVaf Tests ==========

    @Test
    public void testParseVaf() {
        assertEquals(45.5, VariantPatternRegistry.parseVaf("45.5"));
        assertEquals(100.0, VariantPatternRegistry.parseVaf("100"));
        assertNull(VariantPatternRegistry.parseVaf("0"));
        assertNull(VariantPatternRegistry.parseVaf("150"));
        assertNull(VariantPatternRegistry.parseVaf(null));
    }

    private PatternFamily family(String name) {
        return registry.all().stream()
            .filter(family -> family.getName().equals(name))
            .findFirst()
            .orElseThrow();
    }

    private VariantRecord first(String familyName, String text) {
        List<VariantRecord.Builder> builders = family(familyName).findAll(text);
        assertFalse(builders.isEmpty(), "family " + familyName + " found nothing in: " + text);
        return builders.get(0).build();
    }
}

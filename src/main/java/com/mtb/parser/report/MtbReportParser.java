package com.mtb.parser.report;

import com.mtb.parser.config.ParserConfig;
import com.mtb.parser.enrich.ContextVafEnricher;
import com.mtb.parser.enrich.VariantEnricher;
import com.mtb.parser.extractor.CandidateExtractor;
import com.mtb.parser.extractor.DiagnosisExtractor;
import com.mtb.parser.extractor.PatientExtractor;
import com.mtb.parser.extractor.RecommendationExtractor;
import com.mtb.parser.extractor.ReportMetadataExtractor;
import com.mtb.parser.extractor.TextPreprocessor;
import com.mtb.parser.extractor.TmbExtractor;
import com.mtb.parser.extractor.VariantCandidateCollector;
import com.mtb.parser.merge.Deduplicator;
import com.mtb.parser.model.DiagnosisRecord;
import com.mtb.parser.model.PatientRecord;
import com.mtb.parser.model.QualityMetrics;
import com.mtb.parser.model.TherapeuticRecommendation;
import com.mtb.parser.model.VariantRecord;
import com.mtb.parser.quality.QualityAssessor;
import com.mtb.parser.vocabulary.VocabularyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Parses one MTB report text into an {@link ExtractionReport}.
 * <p>
 * Pipeline: preprocess, extract every entity class, deduplicate variant candidates,
 * enrich missing VAFs from context, assess quality, assemble. The parser keeps no
 * per-call state, so one instance can parse independent reports concurrently.
 */
public class MtbReportParser {
    private static final Logger logger = LoggerFactory.getLogger(MtbReportParser.class);

    private final TextPreprocessor preprocessor;
    private final PatientExtractor patientExtractor;
    private final DiagnosisExtractor diagnosisExtractor;
    private final CandidateExtractor variantExtractor;
    private final Deduplicator deduplicator;
    private final VariantEnricher enricher;
    private final RecommendationExtractor recommendationExtractor;
    private final TmbExtractor tmbExtractor;
    private final ReportMetadataExtractor metadataExtractor;
    private final QualityAssessor qualityAssessor;
    private final ReportAssembler assembler;

    public MtbReportParser(VocabularyService vocabulary) {
        this(vocabulary, ParserConfig.defaults());
    }

    public MtbReportParser(VocabularyService vocabulary, ParserConfig config) {
        this(vocabulary, config, new ContextVafEnricher(config.getEnrichmentWindow()));
    }

    /**
     * Create a parser with a custom enrichment stage
     * @param vocabulary Loaded vocabulary service
     * @param config Parser configuration (clock, enrichment window)
     * @param enricher Post-extraction variant enricher
     */
    public MtbReportParser(VocabularyService vocabulary, ParserConfig config, VariantEnricher enricher) {
        Objects.requireNonNull(vocabulary, "vocabulary");
        Objects.requireNonNull(config, "config");
        this.preprocessor = new TextPreprocessor();
        this.patientExtractor = new PatientExtractor(config.getClock());
        this.diagnosisExtractor = new DiagnosisExtractor(vocabulary);
        this.variantExtractor = new VariantCandidateCollector(vocabulary);
        this.deduplicator = new Deduplicator();
        this.enricher = Objects.requireNonNull(enricher, "enricher");
        this.recommendationExtractor = new RecommendationExtractor(vocabulary);
        this.tmbExtractor = new TmbExtractor();
        this.metadataExtractor = new ReportMetadataExtractor();
        this.qualityAssessor = new QualityAssessor();
        this.assembler = new ReportAssembler();
    }

    /**
     * Parse a complete report
     * @param text Raw report text
     * @return Extraction report; never null, even for empty text
     */
    public ExtractionReport parse(String text) {
        Objects.requireNonNull(text, "text");

        String clean = preprocessor.preprocess(text);

        PatientRecord patient = patientExtractor.extract(clean);
        DiagnosisRecord diagnosis = diagnosisExtractor.extract(clean);

        List<VariantRecord> candidates = variantExtractor.extract(clean);
        List<VariantRecord> unique = deduplicator.deduplicate(candidates);
        List<VariantRecord> variants = enricher.enrich(unique, clean);

        List<TherapeuticRecommendation> recommendations = recommendationExtractor.extract(clean);
        Double tmb = tmbExtractor.extract(clean);
        String ngsMethod = metadataExtractor.extractNgsMethod(clean);
        String reportDate = metadataExtractor.extractReportDate(clean);

        QualityMetrics quality = qualityAssessor.assess(patient, diagnosis, variants, recommendations, tmb);

        ExtractionReport report = assembler.assemble(patient, diagnosis, variants, recommendations,
            tmb, ngsMethod, reportDate, quality);

        logger.info("Parsed report for patient {}: {} variants ({} candidates), {} recommendations, completeness {}%",
            patient.getId(), variants.size(), candidates.size(), recommendations.size(),
            quality.getCompletenessPct());
        return report;
    }
}

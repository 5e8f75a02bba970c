package com.mtb.parser.fhir;

import ca.uhn.fhir.context.FhirContext;
import com.mtb.parser.model.DiagnosisRecord;
import com.mtb.parser.model.PatientRecord;
import com.mtb.parser.model.TherapeuticRecommendation;
import com.mtb.parser.model.VariantRecord;
import com.mtb.parser.report.ExtractionReport;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Condition;
import org.hl7.fhir.r4.model.DateTimeType;
import org.hl7.fhir.r4.model.DateType;
import org.hl7.fhir.r4.model.DiagnosticReport;
import org.hl7.fhir.r4.model.Enumerations;
import org.hl7.fhir.r4.model.MedicationStatement;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Patient;
import org.hl7.fhir.r4.model.Quantity;
import org.hl7.fhir.r4.model.Reference;
import org.hl7.fhir.r4.model.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Maps a parsed MTB report to a FHIR R4 transaction bundle following the
 * genomics reporting conventions (LOINC-coded variant and TMB observations
 * grouped under one DiagnosticReport).
 */
public class FhirBundleMapper {
    private static final Logger logger = LoggerFactory.getLogger(FhirBundleMapper.class);

    static final String LOINC = "http://loinc.org";
    static final String HGNC = "http://www.genenames.org";
    static final String RXNORM = "http://www.nlm.nih.gov/research/umls/rxnorm";
    static final String ICD_O = "http://terminology.hl7.org/CodeSystem/icd-o-3";
    static final String UCUM = "http://unitsofmeasure.org";
    static final String OBSERVATION_CATEGORY = "http://terminology.hl7.org/CodeSystem/observation-category";
    static final String PATIENT_ID_SYSTEM = "urn:mtb:patient-id";

    static final String LOINC_VARIANT = "69548-6";
    static final String LOINC_GENE = "48018-6";
    static final String LOINC_DNA_CHANGE = "48004-6";
    static final String LOINC_AMINO_ACID_CHANGE = "48005-3";
    static final String LOINC_VAF = "81258-6";
    static final String LOINC_TMB = "94076-7";
    static final String LOINC_GENETIC_REPORT = "81247-9";

    private static final String URN_UUID = "urn:uuid:";

    // Building a FhirContext scans the whole model; share one per JVM
    private static final FhirContext FHIR_CONTEXT = FhirContext.forR4();

    private final Supplier<UUID> idSupplier;

    public FhirBundleMapper() {
        this(UUID::randomUUID);
    }

    /**
     * @param idSupplier Source of the UUIDs used for bundle entry full URLs
     */
    public FhirBundleMapper(Supplier<UUID> idSupplier) {
        this.idSupplier = Objects.requireNonNull(idSupplier, "idSupplier");
    }

    /**
     * Build a transaction bundle for a parsed report
     * @param report Parsed report
     * @return Bundle with Patient, Condition, Observations, MedicationStatements and DiagnosticReport
     */
    public Bundle toBundle(ExtractionReport report) {
        Objects.requireNonNull(report, "report");

        Bundle bundle = new Bundle();
        bundle.setType(Bundle.BundleType.TRANSACTION);

        String patientUrl = addEntry(bundle, toPatient(report.getPatient()));
        Reference subject = new Reference(patientUrl);

        DiagnosisRecord diagnosis = report.getDiagnosis();
        if (diagnosis.hasDiagnosis()) {
            addEntry(bundle, toCondition(diagnosis, subject));
        }

        List<Reference> results = new ArrayList<>();
        for (VariantRecord variant : report.getVariants()) {
            results.add(new Reference(addEntry(bundle, toVariantObservation(variant, subject))));
        }
        if (report.getTmb() != null) {
            results.add(new Reference(addEntry(bundle, toTmbObservation(report.getTmb(), subject))));
        }

        for (TherapeuticRecommendation recommendation : report.getRecommendations()) {
            addEntry(bundle, toMedicationStatement(recommendation, subject));
        }

        addEntry(bundle, toDiagnosticReport(report, subject, results));

        logger.debug("Mapped report for patient {} to bundle with {} entries",
            report.getPatient().getId(), bundle.getEntry().size());
        return bundle;
    }

    /**
     * Serialize a report as a FHIR JSON bundle
     * @param report Parsed report
     * @return Pretty-printed JSON
     */
    public String toJson(ExtractionReport report) {
        return FHIR_CONTEXT.newJsonParser().setPrettyPrint(true).encodeResourceToString(toBundle(report));
    }

    private String addEntry(Bundle bundle, Resource resource) {
        String fullUrl = URN_UUID + idSupplier.get();
        bundle.addEntry()
            .setFullUrl(fullUrl)
            .setResource(resource)
            .getRequest()
                .setMethod(Bundle.HTTPVerb.POST)
                .setUrl(resource.fhirType());
        return fullUrl;
    }

    private Patient toPatient(PatientRecord record) {
        Patient patient = new Patient();
        if (record.getId() != null) {
            patient.addIdentifier().setSystem(PATIENT_ID_SYSTEM).setValue(record.getId());
        }
        switch (record.getSexCategory()) {
            case M -> patient.setGender(Enumerations.AdministrativeGender.MALE);
            case F -> patient.setGender(Enumerations.AdministrativeGender.FEMALE);
            default -> patient.setGender(Enumerations.AdministrativeGender.UNKNOWN);
        }
        LocalDate birthDate = parseDate(record.getBirthDate());
        if (birthDate != null) {
            // DateType months are zero-based
            patient.setBirthDateElement(new DateType(birthDate.getYear(), birthDate.getMonthValue() - 1,
                birthDate.getDayOfMonth()));
        }
        return patient;
    }

    private Condition toCondition(DiagnosisRecord diagnosis, Reference subject) {
        Condition condition = new Condition();
        condition.setSubject(subject);

        CodeableConcept code = new CodeableConcept().setText(diagnosis.getPrimaryDiagnosis());
        if (diagnosis.isMapped()) {
            code.addCoding(new Coding(ICD_O, diagnosis.getVocabularyCode().getCode(),
                diagnosis.getVocabularyCode().getDisplay()));
        }
        condition.setCode(code);

        if (diagnosis.getStage() != null) {
            condition.addStage().setSummary(new CodeableConcept().setText(diagnosis.getStage()));
        }
        if (diagnosis.getHistology() != null) {
            condition.addNote().setText("Histology: " + diagnosis.getHistology());
        }
        return condition;
    }

    private Observation toVariantObservation(VariantRecord variant, Reference subject) {
        Observation observation = laboratoryObservation(LOINC_VARIANT, "Genetic variant assessment", subject);
        observation.setValue(new CodeableConcept(new Coding(LOINC, "LA9633-4", "Present")));

        CodeableConcept gene = new CodeableConcept().setText(variant.getGene());
        if (variant.getGeneVocabularyCode() != null) {
            gene.addCoding(new Coding(HGNC, variant.getGeneVocabularyCode().getHgncId(),
                variant.getGeneVocabularyCode().getSymbol()));
        }
        observation.addComponent()
            .setCode(loinc(LOINC_GENE, "Gene studied [ID]"))
            .setValue(gene);

        if (variant.getCdnaChange() != null) {
            observation.addComponent()
                .setCode(loinc(LOINC_DNA_CHANGE, "DNA change (c.HGVS)"))
                .setValue(new CodeableConcept().setText(variant.getCdnaChange()));
        }
        if (variant.getProteinChange() != null) {
            observation.addComponent()
                .setCode(loinc(LOINC_AMINO_ACID_CHANGE, "Amino acid change (pHGVS)"))
                .setValue(new CodeableConcept().setText(variant.getProteinChange()));
        }
        if (variant.getVaf() != null) {
            observation.addComponent()
                .setCode(loinc(LOINC_VAF, "Sample variant allelic frequency [NFr]"))
                .setValue(new Quantity().setValue(variant.getVaf()).setUnit("%").setSystem(UCUM).setCode("%"));
        }
        if (variant.isClassified()) {
            observation.addInterpretation().setText(variant.getClassification());
        }
        return observation;
    }

    private Observation toTmbObservation(double tmb, Reference subject) {
        Observation observation = laboratoryObservation(LOINC_TMB, "Tumor mutation burden", subject);
        observation.setValue(new Quantity().setValue(tmb).setUnit("mut/Mb")
            .setSystem(UCUM).setCode("1/1000000{Base}"));
        return observation;
    }

    private MedicationStatement toMedicationStatement(TherapeuticRecommendation recommendation, Reference subject) {
        MedicationStatement statement = new MedicationStatement();
        statement.setStatus(MedicationStatement.MedicationStatementStatus.INTENDED);
        statement.setSubject(subject);

        CodeableConcept medication = new CodeableConcept().setText(recommendation.getDrug());
        if (recommendation.isMapped()) {
            medication.addCoding(new Coding(RXNORM, recommendation.getDrugVocabularyCode().getRxcui(),
                recommendation.getDrugVocabularyCode().getDisplay()));
        }
        statement.setMedication(medication);

        if (recommendation.getGeneTarget() != null) {
            statement.addReasonCode().setText("Target: " + recommendation.getGeneTarget());
        }
        statement.addNote().setText("Evidence: " + recommendation.getEvidenceLevel());
        return statement;
    }

    private DiagnosticReport toDiagnosticReport(ExtractionReport report, Reference subject, List<Reference> results) {
        DiagnosticReport diagnosticReport = new DiagnosticReport();
        diagnosticReport.setStatus(DiagnosticReport.DiagnosticReportStatus.FINAL);
        diagnosticReport.setCode(loinc(LOINC_GENETIC_REPORT, "Master HL7 genetic variant reporting panel"));
        diagnosticReport.setSubject(subject);
        results.forEach(diagnosticReport::addResult);

        LocalDate reportDate = parseDate(report.getReportDate());
        if (reportDate != null) {
            diagnosticReport.setEffective(new DateTimeType(reportDate.toString()));
        }
        if (report.getNgsMethod() != null) {
            diagnosticReport.setConclusion("NGS method: " + report.getNgsMethod());
        }
        return diagnosticReport;
    }

    private static Observation laboratoryObservation(String code, String display, Reference subject) {
        Observation observation = new Observation();
        observation.setStatus(Observation.ObservationStatus.FINAL);
        observation.addCategory(new CodeableConcept(new Coding(OBSERVATION_CATEGORY, "laboratory", "Laboratory")));
        observation.setCode(loinc(code, display));
        observation.setSubject(subject);
        return observation;
    }

    private static CodeableConcept loinc(String code, String display) {
        return new CodeableConcept(new Coding(LOINC, code, display));
    }

    /**
     * Parse an ISO date, dropping values that are not real calendar dates
     * (day-first dates are normalized without validation upstream)
     */
    private static LocalDate parseDate(String iso) {
        if (iso == null) {
            return null;
        }
        try {
            return LocalDate.parse(iso);
        } catch (DateTimeParseException e) {
            logger.warn("Skipping invalid date '{}' in FHIR mapping", iso);
            return null;
        }
    }
}

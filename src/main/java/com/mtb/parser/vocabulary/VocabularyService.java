package com.mtb.parser.vocabulary;

import java.util.List;
import java.util.Optional;

/**
 * Read-only controlled vocabulary lookups (HGNC, RxNorm, ICD-O).
 * An empty result means "unmapped" and is never an error.
 */
public interface VocabularyService {

    /**
     * Resolve a gene symbol (or alias, or fusion notation) to its HGNC entry
     * @param symbol Gene symbol as found in text
     * @return HGNC entry, or empty if unmapped
     */
    Optional<GeneCode> lookupGene(String symbol);

    /**
     * Check whether a token is an official gene symbol
     * @param symbol Candidate symbol
     * @return true if the symbol is a known HGNC symbol
     */
    boolean isKnownGene(String symbol);

    /**
     * Resolve a drug name to its RxNorm entry
     * @param name Drug name as found in text
     * @return RxNorm entry, or empty if unmapped
     */
    Optional<DrugCode> lookupDrug(String name);

    /**
     * Resolve a free-text diagnosis to an ICD-O code using similarity matching
     * @param text Diagnosis text
     * @return ICD-O entry, or empty if no entry is similar enough
     */
    Optional<DiagnosisCode> lookupDiagnosis(String text);

    /**
     * Names of all drugs the vocabulary knows, used to build drug mention patterns
     * @return Lowercase drug names
     */
    List<String> knownDrugNames();
}

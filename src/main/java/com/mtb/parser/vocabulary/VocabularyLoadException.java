package com.mtb.parser.vocabulary;

/**
 * Thrown when a vocabulary file is missing or malformed at start-up.
 */
public class VocabularyLoadException extends RuntimeException {

    public VocabularyLoadException(String message) {
        super(message);
    }

    public VocabularyLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

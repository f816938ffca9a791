package org.laminar.extraction;

/**
 * No process could be extracted from a sheet with the strategies the policy allows.
 */
public class ProcessExtractionException extends Exception {

    public ProcessExtractionException(String message) {
        super(message);
    }

    public ProcessExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}

package de.leipzig.htwk.gitrdf.fixstrategy.exception;

/**
 * The external sentence encoder could not be reached or returned an unusable answer.
 */
public class EmbeddingServiceException extends RuntimeException {

    public EmbeddingServiceException(String message) {
        super(message);
    }

    public EmbeddingServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}

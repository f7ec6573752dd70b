package pl.marcinmilkowski.usas_eval.grammar;

/**
 * Exception thrown when a USAS tag, a corpus line or a corpus file is malformed.
 */
public class UsasFormatException extends RuntimeException {

    public UsasFormatException(String message) {
        super(message);
    }

    public UsasFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.csvchange.diff;

/**
 * A comparison could not be performed: an input is unreadable or unparseable, or key columns are missing.
 */
public class DiffException extends Exception {

    public DiffException(String message, Throwable cause) {
        super(message, cause);
    }

    public DiffException(String message) {
        super(message);
    }
}

package io.github.yok.sheetsync.source;

/**
 * Signals that a sheet could not be read from the spreadsheet source.
 *
 * @author Yasuharu.Okawauchi
 */
public class SourceException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message description
     */
    public SourceException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message description
     * @param cause root cause
     */
    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }
}

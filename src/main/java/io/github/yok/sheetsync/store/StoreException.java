package io.github.yok.sheetsync.store;

/**
 * Signals a transport or constraint failure reported by the relational store.
 *
 * @author Yasuharu.Okawauchi
 */
public class StoreException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message description
     */
    public StoreException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message description
     * @param cause root cause
     */
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

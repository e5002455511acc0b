package io.github.yok.statlink.db;

import io.github.yok.statlink.StatLinkException;

/**
 * Raised when the database cannot be reached or a statement fails.
 *
 * @author Yasuharu.Okawauchi
 */
public class BackendException extends StatLinkException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public BackendException(String message) {
        super(message);
    }

    /**
     * Creates an exception wrapping a JDBC or driver failure.
     *
     * @param message detail message
     * @param cause root cause
     */
    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}

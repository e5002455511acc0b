package io.github.yok.statlink.core;

import io.github.yok.statlink.StatLinkException;

/**
 * Raised when a dataset row does not fit the declared columns of an entity type.
 *
 * @author Yasuharu.Okawauchi
 */
public class ShapeException extends StatLinkException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public ShapeException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    public ShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}

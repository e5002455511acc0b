package io.github.yok.statlink.core;

import io.github.yok.statlink.StatLinkException;

/**
 * Raised when candidates cannot be classified against the persisted history of their entity.
 *
 * @author Yasuharu.Okawauchi
 */
public class ClassificationException extends StatLinkException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public ClassificationException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}

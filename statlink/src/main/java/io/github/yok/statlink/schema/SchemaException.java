package io.github.yok.statlink.schema;

import io.github.yok.statlink.StatLinkException;

/**
 * Raised when an entity description is incomplete, uses an unsupported type, or conflicts with a
 * definition registered earlier in the same run.
 *
 * @author Yasuharu.Okawauchi
 */
public class SchemaException extends StatLinkException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public SchemaException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}

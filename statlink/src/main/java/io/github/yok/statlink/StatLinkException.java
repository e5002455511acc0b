package io.github.yok.statlink;

/**
 * Base class of all errors raised by StatLink.
 *
 * <p>
 * Subclasses are unchecked so that they can cross the {@link AutoCloseable} unit-of-work boundary
 * and the Spring command-line runner without being rewrapped. JDBC and parser failures are wrapped
 * into a subclass at the component that detects them.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class StatLinkException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public StatLinkException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    public StatLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.github.yok.statlink.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Logs a fatal error and echoes a concise message to {@code System.err}.
 *
 * <p>
 * The import runner reports a failing job here and moves on to the next one; the process itself is
 * never terminated. Tests can switch the current thread to throwing instead, so failures surface as
 * {@link IllegalStateException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Makes the current thread throw instead of only reporting.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the message with the stack trace of {@code cause} and prints a short line to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     * @throws IllegalStateException when throwing is enabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
    }

    /**
     * Logs the message at error level and prints it to {@code System.err}.
     *
     * @param message message to log
     * @throws IllegalStateException when throwing is enabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}

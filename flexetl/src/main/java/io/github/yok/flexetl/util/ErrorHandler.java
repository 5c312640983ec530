package io.github.yok.flexetl.util;

import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal error of a run and echoes a concise message to
 * {@code System.err}.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error using SLF4J, with the full stack trace when a cause is given.</li>
 * <li>Writes a concise message to {@code System.err}.</li>
 * <li>Does not terminate the JVM by itself; the caller decides the exit code.</li>
 * <li>In tests, the current thread can be switched to throwing {@link IllegalStateException}
 * instead.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Prevents instantiation.
     */
    @Generated
    private ErrorHandler() {}

    /**
     * Switch to "throw exception instead of reporting" for the current thread.
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
     * Logs the given message and root cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     * @throws IllegalStateException if reporting is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
    }

    /**
     * Logs the given message at error level and prints it to {@code System.err}.
     *
     * @param message message to log
     * @throws IllegalStateException if reporting is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}

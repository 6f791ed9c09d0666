package io.github.yok.ciflink.util;

import io.github.yok.ciflink.validation.ConversionException;
import java.io.PrintStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports a fatal conversion error on behalf of the command-line entry point.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error with its stack trace.</li>
 * <li>Writes a concise message to {@code System.err}. For a {@link ConversionException} every
 * violation is listed on its own line.</li>
 * <li>Remembers a non-zero exit status for the current thread; the caller decides how to end the
 * process.</li>
 * <li>When exit is disabled for the current thread an {@link IllegalStateException} is thrown
 * instead, so tests can observe the failure.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    /** Exit status reported after a fatal error. */
    public static final int FAILURE_STATUS = 1;

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private static final ThreadLocal<Integer> EXIT_STATUS = ThreadLocal.withInitial(() -> 0);

    private ErrorHandler() {
        throw new AssertionError("ErrorHandler must not be instantiated.");
    }

    /**
     * Makes {@code errorAndExit} throw instead of printing on the current thread.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores normal reporting and clears the exit status of the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
        EXIT_STATUS.remove();
    }

    /**
     * Returns the exit status of the current thread: {@code 0}, or {@link #FAILURE_STATUS} after
     * a reported error.
     *
     * @return exit status
     */
    public static int exitStatus() {
        return EXIT_STATUS.get();
    }

    /**
     * Reports an error with its cause.
     *
     * @param message message to log
     * @param cause root cause
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        EXIT_STATUS.set(FAILURE_STATUS);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        PrintStream err = System.err;
        err.println("ERROR: " + message);
        if (cause instanceof ConversionException) {
            for (String violation : ((ConversionException) cause).getViolations()) {
                err.println("  - " + violation);
            }
        } else {
            err.println(ExceptionUtils.getRootCauseMessage(cause));
        }
    }

    /**
     * Reports an error without a cause, such as an invalid command-line argument.
     *
     * @param message message to log
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        EXIT_STATUS.set(FAILURE_STATUS);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}

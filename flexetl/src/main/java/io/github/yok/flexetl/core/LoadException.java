package io.github.yok.flexetl.core;

/**
 * Signals that a dataset could not be written to its target table.
 *
 * <p>
 * The message is meant for the operator and names the table and the reason.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class LoadException extends Exception {

    private static final long serialVersionUID = 1L;

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

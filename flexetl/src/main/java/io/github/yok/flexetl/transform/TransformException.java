package io.github.yok.flexetl.transform;

/**
 * Signals that a transform stage could not produce its output dataset.
 *
 * @author Yasuharu.Okawauchi
 */
public class TransformException extends Exception {

    private static final long serialVersionUID = 1L;

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}

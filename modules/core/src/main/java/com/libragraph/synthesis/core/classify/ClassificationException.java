package com.libragraph.synthesis.core.classify;

/**
 * The classifier timed out, could not be reached, or answered with something that is not a
 * usable judgment.
 */
public class ClassificationException extends RuntimeException {

    public ClassificationException(String message) {
        super(message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}

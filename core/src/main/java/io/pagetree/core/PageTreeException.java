package io.pagetree.core;

/**
 * Base unchecked exception for data-integrity failures around pages and trees.
 * Invalid user operations are never reported through exceptions; they are no-ops.
 */
public class PageTreeException extends RuntimeException {

    public PageTreeException(String message) {
        super(message);
    }

    public PageTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}

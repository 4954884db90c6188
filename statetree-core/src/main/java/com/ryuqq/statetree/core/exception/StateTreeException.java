package com.ryuqq.statetree.core.exception;

/**
 * Base class of the exceptions raised by the state tree.
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public class StateTreeException extends RuntimeException {

    public StateTreeException(String message) {
        super(message);
    }

    public StateTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}

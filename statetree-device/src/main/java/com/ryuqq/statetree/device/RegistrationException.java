package com.ryuqq.statetree.device;

import com.ryuqq.statetree.core.exception.StateTreeException;

/**
 * The registration response body could not be read as a JSON object.
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public class RegistrationException extends StateTreeException {

    public RegistrationException(String message) {
        super(message);
    }

    public RegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.ryuqq.statetree.core.event;

/**
 * Receives failures that cannot be thrown back to a mutation caller.
 *
 * <p><strong>Reported failures:</strong></p>
 * <ul>
 *   <li>A listener threw while a pass was emitting</li>
 *   <li>A collection record was rejected as malformed during a batch</li>
 *   <li>A listener cascade overflowed the dispatcher's pass limit</li>
 * </ul>
 *
 * @author StateTree Team
 * @since 1.0.0
 * @see ErrorObservers
 */
@FunctionalInterface
public interface ErrorObserver {

    /**
     * @param event the event being delivered when the failure happened, or null if none
     * @param error the failure
     */
    void onError(ChangeEvent event, Throwable error);
}

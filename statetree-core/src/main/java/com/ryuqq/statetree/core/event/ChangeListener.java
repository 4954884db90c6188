package com.ryuqq.statetree.core.event;

/**
 * Callback registered with {@code on(eventName, listener)}.
 *
 * <p>Listeners run synchronously while a dispatch pass is emitting. A listener may mutate the
 * tree; the mutation is applied at once and notified in a follow-up pass.</p>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ChangeListener {

    /**
     * Called once per dispatch pass for the event the listener was registered under.
     *
     * @param event the change notification
     */
    void onChange(ChangeEvent event);
}

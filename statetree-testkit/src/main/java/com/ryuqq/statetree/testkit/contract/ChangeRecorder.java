package com.ryuqq.statetree.testkit.contract;

import com.ryuqq.statetree.core.event.ChangeEvent;
import com.ryuqq.statetree.core.event.ChangeListener;

import java.util.ArrayList;
import java.util.List;

/**
 * Listener spy that records every event it receives.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ChangeRecorder recorder = new ChangeRecorder("device change");
 * device.on("change", recorder);
 * ...
 * assertEquals(1, recorder.count());
 * </pre>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public final class ChangeRecorder implements ChangeListener {

    private final String label;
    private final List<ChangeEvent> events = new ArrayList<>();

    public ChangeRecorder(String label) {
        this.label = label;
    }

    @Override
    public void onChange(ChangeEvent event) {
        events.add(event);
    }

    public int count() {
        return events.size();
    }

    public boolean wasCalled() {
        return !events.isEmpty();
    }

    public List<ChangeEvent> events() {
        return List.copyOf(events);
    }

    /**
     * @return most recent event
     * @throws IllegalStateException if nothing was recorded
     */
    public ChangeEvent last() {
        if (events.isEmpty()) {
            throw new IllegalStateException(label + " recorded no events");
        }
        return events.get(events.size() - 1);
    }

    public void reset() {
        events.clear();
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label + " (" + events.size() + " calls)";
    }
}

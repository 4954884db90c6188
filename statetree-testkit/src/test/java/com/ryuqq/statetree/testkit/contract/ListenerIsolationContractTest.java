package com.ryuqq.statetree.testkit.contract;

import com.ryuqq.statetree.core.event.ChangeEvent;
import com.ryuqq.statetree.core.event.ErrorObserver;
import com.ryuqq.statetree.core.event.ErrorObservers;
import com.ryuqq.statetree.core.exception.MalformedEntryException;
import com.ryuqq.statetree.core.model.EntryDiff;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.verify;

/**
 * Contract Test: failures inside the model never reach the mutation caller.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Throwing listener → other listeners still run, failure reported to the ErrorObserver</li>
 *   <li>Malformed feature record in a payload → record skipped and reported, rest applied</li>
 * </ul>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ListenerIsolationContractTest extends AbstractPropagationContractTest {

    @Mock
    private ErrorObserver errorObserver;

    @Test
    void testIsolation_ThrowingListener_OthersStillCalled() {
        // Given
        ErrorObservers.set(errorObserver);
        IllegalStateException failure = new IllegalStateException("listener failed");
        features.on("change:developer", e -> {
            throw failure;
        });

        // When
        assertDoesNotThrow(() -> developer.add(feature("another-feature", "true", true, false)));

        // Then
        assertCalledOnceAtEveryScope();
        ArgumentCaptor<ChangeEvent> event = ArgumentCaptor.forClass(ChangeEvent.class);
        verify(errorObserver).onError(event.capture(), same(failure));
        assertEquals("change:developer", event.getValue().name());
        assertSame(features, event.getValue().target());
    }

    @Test
    void testIsolation_MalformedRecord_SkippedAndReported() {
        // Given
        ErrorObservers.set(errorObserver);
        Map<String, Object> fixture = deviceFixture();
        Map<String, Object> noKey = new HashMap<>();
        noKey.put("val", "true");
        developerFeatures(fixture).add(noKey);
        developerFeatures(fixture).add(feature("another-feature", "true", true, false));

        // When
        device.replace(fixture);

        // Then
        assertCalledOnceAtEveryScope();
        assertEquals(List.of("console", "feature-flag", "rollout-percentage", "another-feature"), developer.keys());
        EntryDiff diff = (EntryDiff) featuresChangeDeveloper.last().value();
        assertEquals(1, diff.rejected().size());
        assertEquals(3, diff.rejected().get(0).getIndex());

        ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
        verify(errorObserver).onError(isNull(), error.capture());
        assertInstanceOf(MalformedEntryException.class, error.getValue());
    }

    @Test
    void testIsolation_OnlyMalformedRecords_NoEvents() {
        // Given
        ErrorObservers.set(errorObserver);
        Map<String, Object> fixture = deviceFixture();
        developerFeatures(fixture).add(Map.of("val", "orphan"));

        // When
        device.replace(fixture);

        // Then
        assertNoEventsAtAnyScope();
        verify(errorObserver).onError(isNull(), any(MalformedEntryException.class));
    }
}

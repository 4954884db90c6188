package com.ryuqq.statetree.testkit.contract;

import com.ryuqq.statetree.core.event.ChangeListener;
import com.ryuqq.statetree.core.event.ErrorObserver;
import com.ryuqq.statetree.core.event.ErrorObservers;
import com.ryuqq.statetree.core.exception.DispatchOverflowException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;

/**
 * Contract Test: mutations and subscriptions made from inside a listener.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Listener mutation is visible immediately, its notifications run as a later pass</li>
 *   <li>Listener added during a pass is not called in that pass</li>
 *   <li>Two listeners feeding each other are stopped by maxCascadePasses</li>
 * </ul>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ReentrancyContractTest extends AbstractPropagationContractTest {

    @Mock
    private ErrorObserver errorObserver;

    @Test
    void testReentrancy_ListenerMutation_QueuedAsNextPass() {
        // Given: enabling the flag turns the console off
        List<String> trace = new ArrayList<>();
        features.on("change:developer", e -> {
            trace.add("developer:" + developer.get("feature-flag").get("val"));
            if ("true".equals(developer.get("feature-flag").get("val"))
                && "true".equals(developer.get("console").get("val"))) {
                developer.upsert(feature("console", "false", false, false));
                trace.add("console now " + developer.get("console").get("val"));
            }
        });
        spark.on("change", e -> trace.add("spark"));

        // When
        developer.upsert(feature("feature-flag", "true", true, true));

        // Then
        assertEquals(List.of("developer:true", "console now false", "spark", "developer:true", "spark"), trace);
        assertEquals(2, sparkChange.count());
        assertEquals(2, featuresChangeDeveloper.count());
    }

    @Test
    void testReentrancy_ListenerAddedDuringPass_NotCalledInThatPass() {
        // Given
        ChangeRecorder late = new ChangeRecorder("late");
        ChangeListener subscriber = e -> spark.on("change", late);
        device.on("change", subscriber);

        // When
        device.set("name", "first");

        // Then
        assertFalse(late.wasCalled());
        assertEquals(1, sparkChange.count());

        // When
        device.off("change", subscriber);
        device.set("name", "second");

        // Then
        assertEquals(1, late.count());
    }

    @Test
    void testReentrancy_MutualFeedback_StoppedAtCascadeLimit() {
        // Given
        ErrorObservers.set(errorObserver);
        int limit = spark.config().maxCascadePasses();
        device.on("change:name", e -> device.set("model", String.valueOf(device.get("name")) + "+"));
        device.on("change:model", e -> device.set("name", String.valueOf(device.get("model")) + "+"));

        // When
        device.set("name", "seed");

        // Then: initial pass plus `limit` follow-ups
        assertEquals(limit + 1, deviceChange.count());
        ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
        verify(errorObserver).onError(isNull(), error.capture());
        assertInstanceOf(DispatchOverflowException.class, error.getValue());
    }
}

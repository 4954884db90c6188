package com.ryuqq.statetree.testkit.contract;

import com.ryuqq.statetree.core.model.EntryDiff;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: one notification per scope for every feature lifecycle step.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Feature added → every scope fires once</li>
 *   <li>Feature updated → every scope fires once</li>
 *   <li>Feature removed → every scope fires once</li>
 *   <li>Registration payload replaces a feature at the same position → every scope fires once</li>
 * </ul>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
class FeatureLifecycleContractTest extends AbstractPropagationContractTest {

    @Test
    void testFeatureAdded_EveryScopeFiresOnce() {
        // When
        developer.add(feature("another-feature", "true", true, false));

        // Then
        assertCalledOnceAtEveryScope();
        assertEquals(EntryDiff.added("another-feature"), featuresChangeDeveloper.last().value());
        assertTrue(developer.contains("another-feature"));
    }

    @Test
    void testFeatureUpdated_EveryScopeFiresOnce() {
        // When
        developer.upsert(feature("console", "false", false, false));

        // Then
        assertCalledOnceAtEveryScope();
        assertEquals(EntryDiff.updated("console"), deviceChangeFeaturesDeveloper.last().value());
        assertEquals(false, developer.get("console").get("value"));
    }

    @Test
    void testFeatureRemoved_EveryScopeFiresOnce() {
        // When
        developer.removeByKey("feature-flag");

        // Then
        assertCalledOnceAtEveryScope();
        assertEquals(EntryDiff.removed("feature-flag"), sparkChangeDeviceFeaturesDeveloper.last().value());
        assertFalse(developer.contains("feature-flag"));
    }

    @Test
    void testRegistrationReplacesFeatureAtSamePosition_EveryScopeFiresOnce() {
        // Given: position 1 now holds a different key
        Map<String, Object> fixture = deviceFixture();
        List<Object> developerList = developerFeatures(fixture);
        developerList.set(1, feature("another-feature", "true", true, false));

        // When
        device.replace(fixture);

        // Then
        assertCalledOnceAtEveryScope();
        EntryDiff diff = (EntryDiff) featuresChangeDeveloper.last().value();
        assertEquals(List.of("another-feature"), diff.added());
        assertEquals(List.of("feature-flag"), diff.removed());
        assertTrue(diff.updated().isEmpty());
        assertFalse(diff.reordered());
        assertEquals(List.of("console", "another-feature", "rollout-percentage"), developer.keys());
    }

    @Test
    void testRegistrationUpdatesFeatureValue_EveryScopeFiresOnce() {
        // Given
        Map<String, Object> fixture = deviceFixture();
        developerFeatures(fixture).set(0, feature("console", "false", false, false));

        // When
        device.replace(fixture);

        // Then
        assertCalledOnceAtEveryScope();
        assertEquals(List.of("console"), ((EntryDiff) sparkChangeDeviceFeaturesDeveloper.last().value()).updated());
    }

    @Test
    void testRegistrationDropsFeature_EveryScopeFiresOnce() {
        // Given
        Map<String, Object> fixture = deviceFixture();
        developerFeatures(fixture).remove(2);

        // When
        device.replace(fixture);

        // Then
        assertCalledOnceAtEveryScope();
        assertEquals(2, developer.size());
    }
}

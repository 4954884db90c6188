package com.ryuqq.statetree.testkit.contract;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: a replace or batch touching many leaves fires once per scope.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Payload changing every feature category and an attribute → one event per scope</li>
 *   <li>Batch of many single-record calls → one event per scope</li>
 *   <li>Change limited to one category → sibling-specific scopes stay silent</li>
 * </ul>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
class BatchCoalescingContractTest extends AbstractPropagationContractTest {

    @Test
    @SuppressWarnings("unchecked")
    void testCoalescing_PayloadTouchingAllCategories_OneEventPerScope() {
        // Given
        Map<String, Object> fixture = deviceFixture();
        fixture.put("name", "renamed");
        Map<String, Object> featureSets = (Map<String, Object>) fixture.get("features");
        developerFeatures(fixture).add(feature("extra-1", "true", true, false));
        developerFeatures(fixture).add(feature("extra-2", "true", true, false));
        featureSets.put("entitlement", List.of());
        ((List<Object>) featureSets.get("user")).add(feature("user-extra", "false", false, true));

        ChangeRecorder deviceChangeName = record(device, "change:name");
        ChangeRecorder sparkChangeDeviceFeaturesUser = record(spark, "change:device.features.user");

        // When
        device.replace(fixture);

        // Then
        assertCalledOnceAtEveryScope();
        assertEquals(1, deviceChangeName.count());
        assertEquals(1, sparkChangeDeviceFeaturesUser.count());
        assertTrue(entitlement.isEmpty());
    }

    @Test
    void testCoalescing_BatchOfSingleCalls_OneEventPerScope() {
        // When
        spark.batch(() -> {
            for (int i = 0; i < 20; i++) {
                developer.upsert(feature("bulk-" + i, "true", true, false));
            }
            developer.removeByKey("console");
            user.removeByKey("mention-notifications");
        });

        // Then
        assertCalledOnceAtEveryScope();
        assertEquals(22, developer.size());
    }

    @Test
    void testCoalescing_OtherCategoryOnly_DeveloperScopesSilent() {
        // When
        entitlement.upsert(feature("new-entitlement", "true", true, false));

        // Then
        assertFalse(featuresChangeDeveloper.wasCalled());
        assertFalse(deviceChangeFeaturesDeveloper.wasCalled());
        assertFalse(sparkChangeDeviceFeaturesDeveloper.wasCalled());
        assertEquals(1, deviceChangeFeatures.count());
        assertEquals(1, sparkChangeDeviceFeatures.count());
        assertEquals(1, sparkChange.count());
    }

    @Test
    void testCoalescing_AttributeOnly_FeatureScopesSilent() {
        // When
        device.set("url", "https://wdm.example.com/wdm/api/v1/devices/other");

        // Then
        assertEquals(1, deviceChange.count());
        assertEquals(1, sparkChangeDevice.count());
        assertEquals(1, sparkChange.count());
        assertFalse(deviceChangeFeatures.wasCalled());
        assertFalse(sparkChangeDeviceFeatures.wasCalled());
    }
}

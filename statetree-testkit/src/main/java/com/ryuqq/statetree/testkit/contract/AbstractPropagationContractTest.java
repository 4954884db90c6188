package com.ryuqq.statetree.testkit.contract;

import com.ryuqq.statetree.core.event.ErrorObservers;
import com.ryuqq.statetree.core.tree.EntryCollection;
import com.ryuqq.statetree.core.tree.ObservableNode;
import com.ryuqq.statetree.core.tree.RootModel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for propagation contract tests.
 *
 * <p>Builds the device fixture tree, loads the fixture snapshot, then attaches a
 * {@link ChangeRecorder} at each of the eight observed listener scopes:</p>
 *
 * <pre>
 * spark (root)             change, change:device, change:device.features, change:device.features.developer
 *  └─ device               change, change:features, change:features.developer
 *      └─ features         change:developer
 *          ├─ developer
 *          ├─ entitlement
 *          └─ user
 * </pre>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractPropagationContractTest {
 *     {@literal @}Test
 *     void addingFeatureFiresEveryScopeOnce() {
 *         developer.add(feature("new-feature", "true", true, false));
 *         assertCalledOnceAtEveryScope();
 *     }
 * }
 * </pre>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public abstract class AbstractPropagationContractTest {

    protected RootModel spark;
    protected ObservableNode device;
    protected ObservableNode features;
    protected EntryCollection developer;
    protected EntryCollection entitlement;
    protected EntryCollection user;

    protected ChangeRecorder featuresChangeDeveloper;
    protected ChangeRecorder deviceChangeFeaturesDeveloper;
    protected ChangeRecorder deviceChangeFeatures;
    protected ChangeRecorder deviceChange;
    protected ChangeRecorder sparkChange;
    protected ChangeRecorder sparkChangeDevice;
    protected ChangeRecorder sparkChangeDeviceFeatures;
    protected ChangeRecorder sparkChangeDeviceFeaturesDeveloper;

    /**
     * Builds the tree, loads {@link #deviceFixture()} and attaches the scope recorders.
     *
     * <p>Recorders are attached after the initial load so it does not count.</p>
     */
    @BeforeEach
    protected void setUpTree() {
        spark = new RootModel("spark");
        device = spark.addNode("device");
        features = device.addNode("features");
        developer = features.addCollection("developer");
        entitlement = features.addCollection("entitlement");
        user = features.addCollection("user");

        device.replace(deviceFixture());

        featuresChangeDeveloper = record(features, "change:developer");
        deviceChangeFeaturesDeveloper = record(device, "change:features.developer");
        deviceChangeFeatures = record(device, "change:features");
        deviceChange = record(device, "change");
        sparkChange = record(spark, "change");
        sparkChangeDevice = record(spark, "change:device");
        sparkChangeDeviceFeatures = record(spark, "change:device.features");
        sparkChangeDeviceFeaturesDeveloper = record(spark, "change:device.features.developer");
    }

    /**
     * Closes the tree and restores the default error observer.
     */
    @AfterEach
    protected void tearDownTree() {
        if (spark != null) {
            spark.close();
        }
        ErrorObservers.reset();
    }

    /**
     * Fresh, mutable copy of the device registration fixture.
     *
     * @return fixture snapshot
     */
    protected Map<String, Object> deviceFixture() {
        Map<String, Object> fixture = new LinkedHashMap<>();
        fixture.put("url", "https://wdm.example.com/wdm/api/v1/devices/9f3b");
        fixture.put("webSocketUrl", "wss://mercury.example.com/v1/apps/wx2/registrations/9f3b/messages");
        fixture.put("deviceType", "UNKNOWN");
        fixture.put("name", "statetree-test");

        Map<String, Object> featureSets = new LinkedHashMap<>();
        featureSets.put("developer", new ArrayList<>(List.of(
            feature("console", "true", true, false),
            feature("feature-flag", "false", false, true),
            feature("rollout-percentage", "30", 30L, false)
        )));
        featureSets.put("entitlement", new ArrayList<>(List.of(
            feature("squared-call-initiation", "true", true, false)
        )));
        featureSets.put("user", new ArrayList<>(List.of(
            feature("mention-notifications", "true", true, true)
        )));
        fixture.put("features", featureSets);
        return fixture;
    }

    /**
     * Creates a feature record.
     *
     * @param key identity key
     * @param val raw string value
     * @param value parsed value
     * @param mutable whether the user may change it
     * @return mutable record map
     */
    protected static Map<String, Object> feature(String key, String val, Object value, boolean mutable) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("key", key);
        record.put("val", val);
        record.put("value", value);
        record.put("mutable", mutable);
        return record;
    }

    /**
     * The developer feature list inside a fixture snapshot.
     *
     * @param fixture snapshot from {@link #deviceFixture()}
     * @return mutable developer list
     */
    @SuppressWarnings("unchecked")
    protected static List<Object> developerFeatures(Map<String, Object> fixture) {
        Map<String, Object> featureSets = (Map<String, Object>) fixture.get("features");
        return (List<Object>) featureSets.get("developer");
    }

    /**
     * Registers a new recorder on a component.
     *
     * @param node component to listen on
     * @param eventName event name
     * @return the recorder
     */
    protected ChangeRecorder record(ObservableNode node, String eventName) {
        ChangeRecorder recorder = new ChangeRecorder(node.path() + " " + eventName);
        node.on(eventName, recorder);
        return recorder;
    }

    /**
     * All eight scope recorders.
     *
     * @return recorders in leaf-to-root order
     */
    protected List<ChangeRecorder> allScopes() {
        return List.of(
            featuresChangeDeveloper,
            deviceChangeFeaturesDeveloper,
            deviceChangeFeatures,
            deviceChange,
            sparkChange,
            sparkChangeDevice,
            sparkChangeDeviceFeatures,
            sparkChangeDeviceFeaturesDeveloper
        );
    }

    /**
     * Asserts that every scope recorder was called exactly once.
     */
    protected void assertCalledOnceAtEveryScope() {
        for (ChangeRecorder recorder : allScopes()) {
            assertEquals(1, recorder.count(),
                String.format("Expected exactly one call for %s but got %d", recorder.label(), recorder.count()));
        }
    }

    /**
     * Asserts that no scope recorder was called.
     */
    protected void assertNoEventsAtAnyScope() {
        for (ChangeRecorder recorder : allScopes()) {
            assertFalse(recorder.wasCalled(),
                String.format("Expected no calls for %s but got %d", recorder.label(), recorder.count()));
        }
    }

    /**
     * Resets every scope recorder.
     */
    protected void resetRecorders() {
        allScopes().forEach(ChangeRecorder::reset);
    }
}

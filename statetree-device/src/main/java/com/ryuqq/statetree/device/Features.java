package com.ryuqq.statetree.device;

import com.ryuqq.statetree.core.event.ChangeListener;
import com.ryuqq.statetree.core.model.Entry;
import com.ryuqq.statetree.core.tree.EntryCollection;
import com.ryuqq.statetree.core.tree.ObservableNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The {@code features} node of a device: one entry collection per feature category.
 *
 * <p>Listeners on this object see {@code change:<category>} for a category's collection and one
 * generic {@code change} per dispatch pass.</p>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public final class Features {

    /**
     * Name of the features node under the device.
     */
    public static final String NODE_NAME = "features";

    private final ObservableNode node;
    private final Map<String, EntryCollection> categories = new LinkedHashMap<>();

    Features(ObservableNode device, List<String> categoryNames) {
        this.node = device.addNode(NODE_NAME);
        for (String category : categoryNames) {
            categories.put(category, node.addCollection(category));
        }
    }

    public EntryCollection developer() {
        return category("developer");
    }

    public EntryCollection entitlement() {
        return category("entitlement");
    }

    public EntryCollection user() {
        return category("user");
    }

    /**
     * Collection of one category.
     *
     * @param name category name
     * @return the collection
     * @throws IllegalArgumentException if the category is not configured
     */
    public EntryCollection category(String name) {
        EntryCollection collection = categories.get(name);
        if (collection == null) {
            throw new IllegalArgumentException("Unknown feature category: " + name + " (configured: " + categories.keySet() + ")");
        }
        return collection;
    }

    public List<String> categoryNames() {
        return List.copyOf(categories.keySet());
    }

    /**
     * Looks a feature up by category and key.
     *
     * @param category category name
     * @param key feature key
     * @return the feature, if present
     */
    public Optional<Feature> feature(String category, String key) {
        Entry entry = category(category).get(key);
        return entry == null ? Optional.empty() : Optional.of(Feature.from(entry));
    }

    /**
     * Features of one category in source order.
     *
     * @param category category name
     * @return features
     */
    public List<Feature> list(String category) {
        List<Feature> features = new ArrayList<>();
        category(category).entries().forEach(e -> features.add(Feature.from(e)));
        return Collections.unmodifiableList(features);
    }

    /**
     * Whether a feature exists and its value is {@code true}.
     *
     * @param category category name
     * @param key feature key
     * @return true if enabled
     */
    public boolean isEnabled(String category, String key) {
        return feature(category, key).map(Feature::isEnabled).orElse(false);
    }

    /**
     * Adds or updates one feature.
     *
     * @param category category name
     * @param feature feature to store
     * @return true if the collection changed
     */
    public boolean put(String category, Feature feature) {
        return category(category).upsert(feature.toRecord());
    }

    public void on(String eventName, ChangeListener listener) {
        node.on(eventName, listener);
    }

    public void off(String eventName, ChangeListener listener) {
        node.off(eventName, listener);
    }

    public ObservableNode node() {
        return node;
    }
}

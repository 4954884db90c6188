package com.ryuqq.statetree.core.tree;

import com.ryuqq.statetree.core.exception.ValidationException;
import com.ryuqq.statetree.core.model.AttributeType;
import com.ryuqq.statetree.core.model.Values;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tree node composing attributes, entry collections and child nodes.
 *
 * <p>Children are created through this node's {@code add*} factory methods and are never moved,
 * so the structure is a tree by construction. Every node owns one inline {@link AttributeSet}
 * whose keys sit directly under the node's path.</p>
 *
 * <p><strong>Propagation:</strong> a change below this node is re-emitted here as
 * {@code change:<relative.path>} for every distinct prefix of the changed path, then as one
 * generic {@code change}, once per dispatch pass.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RootModel spark = new RootModel("spark");
 * ObservableNode device = spark.addNode("device");
 * ObservableNode features = device.addNode("features");
 * EntryCollection developer = features.addCollection("developer");
 *
 * spark.on("change:device.features.developer", event -&gt; refreshToggles());
 * device.replace(registrationBody);
 * </pre>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public sealed class ObservableNode extends ModelComponent permits RootModel {

    private final Map<String, ModelComponent> children = new LinkedHashMap<>();
    private final AttributeSet attributes;

    ObservableNode(ModelTree tree, ObservableNode parent, String name) {
        super(tree, parent, name);
        this.attributes = new AttributeSet(tree, this, null);
    }

    // ------------------------------------------------------------
    // Structure
    // ------------------------------------------------------------

    /**
     * Creates a child node.
     *
     * @param name path segment
     * @return the new node
     * @throws IllegalArgumentException if the name is invalid or already used
     */
    public ObservableNode addNode(String name) {
        requireFreeName(name);
        return register(name, new ObservableNode(tree, this, name));
    }

    /**
     * Creates a child entry collection.
     *
     * @param name path segment
     * @return the new collection
     */
    public EntryCollection addCollection(String name) {
        requireFreeName(name);
        return register(name, new EntryCollection(tree, this, name));
    }

    /**
     * Creates a named attribute set.
     *
     * @param name path segment
     * @return the new attribute set
     */
    public AttributeSet addAttributeSet(String name) {
        requireFreeName(name);
        return register(name, new AttributeSet(tree, this, name));
    }

    /**
     * Creates a named attribute set with type guards.
     *
     * @param name path segment
     * @param schema key → type
     * @return the new attribute set
     */
    public AttributeSet addAttributeSet(String name, Map<String, AttributeType> schema) {
        AttributeSet set = addAttributeSet(name);
        schema.forEach(set::define);
        return set;
    }

    public ObservableNode node(String name) {
        return child(name, ObservableNode.class);
    }

    public EntryCollection collection(String name) {
        return child(name, EntryCollection.class);
    }

    public AttributeSet attributeSet(String name) {
        return child(name, AttributeSet.class);
    }

    /**
     * Child component by name.
     *
     * @param name path segment
     * @return child, or null if none
     */
    public ModelComponent child(String name) {
        return children.get(name);
    }

    public Set<String> childNames() {
        return Collections.unmodifiableSet(children.keySet());
    }

    boolean hasChild(String name) {
        return children.containsKey(name);
    }

    // ------------------------------------------------------------
    // Inline attributes
    // ------------------------------------------------------------

    /**
     * The inline attribute set (keys directly under this node's path).
     *
     * @return inline attributes
     */
    public AttributeSet attributes() {
        return attributes;
    }

    public Object get(String key) {
        return attributes.get(key);
    }

    /**
     * Sets an inline attribute.
     *
     * @param key attribute key
     * @param value new value (null removes the key)
     * @return true if the value changed
     * @throws ValidationException if the key names a child or the value fails its type guard
     */
    public boolean set(String key, Object value) {
        return attributes.set(key, value);
    }

    /**
     * Declares the type of an inline attribute.
     *
     * @param key attribute key
     * @param type allowed type
     */
    public void define(String key, AttributeType type) {
        attributes.define(key, type);
    }

    // ------------------------------------------------------------
    // Snapshot
    // ------------------------------------------------------------

    /**
     * Replaces this subtree's state from a plain-data snapshot, in one dispatch pass.
     *
     * <p><strong>Walk:</strong></p>
     * <ul>
     *   <li>key naming a child node → the node's {@code replace} with the nested map</li>
     *   <li>key naming a named attribute set → its {@code replaceAll} with the nested map</li>
     *   <li>key naming a collection → its {@code replaceAll} with the nested list</li>
     *   <li>every other key → inline attribute; inline attributes are replaced wholesale</li>
     *   <li>children absent from the snapshot (or mapped to null) are left untouched</li>
     * </ul>
     *
     * <p>The whole snapshot is validated before anything changes.</p>
     *
     * @param snapshot JSON-compatible map
     * @throws ValidationException if the snapshot does not fit the tree's shape or type guards
     */
    public void replace(Map<String, ?> snapshot) {
        tree.checkOpen();
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        Map<String, Object> frozen;
        try {
            frozen = Values.freezeMap(snapshot);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(path(), e.getMessage());
        }
        validateSnapshot(frozen);
        tree.dispatcher().mutate(pass -> {
            applySnapshot(frozen, pass);
            return null;
        });
    }

    /**
     * Runs several mutations as one dispatch pass.
     *
     * @param mutations code that mutates this tree
     */
    public void batch(Runnable mutations) {
        tree.checkOpen();
        if (mutations == null) {
            throw new IllegalArgumentException("mutations cannot be null");
        }
        tree.dispatcher().mutate(pass -> {
            mutations.run();
            return null;
        });
    }

    @Override
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>(attributes.toMap());
        children.forEach((name, child) -> snapshot.put(name, child.toSnapshot()));
        return Collections.unmodifiableMap(snapshot);
    }

    @Override
    Object eventValue(DispatchPass pass) {
        return this;
    }

    @SuppressWarnings("unchecked")
    private void validateSnapshot(Map<String, Object> snapshot) {
        Map<String, Object> inline = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : snapshot.entrySet()) {
            ModelComponent child = children.get(entry.getKey());
            Object value = entry.getValue();
            if (child == null) {
                inline.put(entry.getKey(), value);
            } else if (value == null) {
                continue;
            } else if (child instanceof ObservableNode) {
                ((ObservableNode) child).validateSnapshot((Map<String, Object>) requireShape(child, value, Map.class));
            } else if (child instanceof AttributeSet) {
                ((AttributeSet) child).validateAll((Map<String, Object>) requireShape(child, value, Map.class));
            } else {
                requireShape(child, value, List.class);
            }
        }
        attributes.validateAll(inline);
    }

    @SuppressWarnings("unchecked")
    private void applySnapshot(Map<String, Object> snapshot, DispatchPass pass) {
        Map<String, Object> inline = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : snapshot.entrySet()) {
            ModelComponent child = children.get(entry.getKey());
            Object value = entry.getValue();
            if (child == null) {
                if (value != null) {
                    inline.put(entry.getKey(), value);
                }
            } else if (value == null) {
                continue;
            } else if (child instanceof ObservableNode) {
                ((ObservableNode) child).applySnapshot((Map<String, Object>) value, pass);
            } else if (child instanceof AttributeSet) {
                ((AttributeSet) child).applyAll((Map<String, Object>) value, pass);
            } else {
                ((EntryCollection) child).applyAll((List<?>) value, pass);
            }
        }
        attributes.applyAll(inline, pass);
    }

    private static Object requireShape(ModelComponent child, Object value, Class<?> shape) {
        if (!shape.isInstance(value)) {
            throw new ValidationException(child.path(),
                child.getClass().getSimpleName() + " expects " + shape.getSimpleName().toLowerCase()
                    + " but snapshot has " + value.getClass().getSimpleName());
        }
        return value;
    }

    private <T extends ModelComponent> T child(String name, Class<T> type) {
        ModelComponent child = children.get(name);
        if (child == null) {
            throw new IllegalArgumentException("No child named '" + name + "' under " + this);
        }
        if (!type.isInstance(child)) {
            throw new IllegalArgumentException("Child '" + name + "' is a " + child.getClass().getSimpleName()
                + ", not a " + type.getSimpleName());
        }
        return type.cast(child);
    }

    private void requireFreeName(String name) {
        tree.checkOpen();
        if (children.containsKey(name)) {
            throw new IllegalArgumentException("Child '" + name + "' already exists under " + this);
        }
        if (name != null && attributes.has(name)) {
            throw new IllegalArgumentException("'" + name + "' is already an attribute of " + this);
        }
    }

    private <T extends ModelComponent> T register(String name, T child) {
        children.put(name, child);
        return child;
    }
}

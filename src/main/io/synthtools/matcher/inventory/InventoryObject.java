package io.synthtools.matcher.inventory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * An object fetched from the inventory API (device, interface or agent), exposed to rules as a read-only mapping
 * of attributes. Typed accessors on the subclasses cover the attributes the engine itself reads; everything else
 * the API returns stays reachable by path.
 */
@Immutable
@ThreadSafe
public abstract class InventoryObject {

    private final ObjectNode attributes;

    protected InventoryObject(@Nonnull final JsonNode attributes) {
        if (!attributes.isObject()) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " must be a JSON object, got "
                    + attributes.getNodeType());
        }
        // detached from the caller's tree
        this.attributes = ((ObjectNode) attributes).deepCopy();
    }

    /**
     * Walks nested mappings key by key. Returns absent, not an error, when a key is missing or when a non-mapping
     * value is reached with path left over.
     *
     * @param path the attribute path
     * @return the resolved value
     */
    public AttributeValue resolve(@Nonnull final AttributePath path) {
        JsonNode node = attributes;
        for (String step : path.steps()) {
            if (node == null || !node.isObject()) {
                return AttributeValue.absent();
            }
            node = node.get(step);
        }
        return AttributeValue.of(node);
    }

    public AttributeValue resolve(@Nonnull final String path) {
        return resolve(AttributePath.of(path));
    }

    /**
     * @return the canonical string form of a top-level scalar attribute, or null when it is absent
     */
    protected String scalar(final String key) {
        final JsonNode node = attributes.get(key);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return AttributeValue.canonicalString(node);
    }

    /**
     * @return a copy of the attribute mapping
     */
    public ObjectNode attributes() {
        return attributes.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return attributes.equals(((InventoryObject) o).attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + attributes;
    }
}

package io.synthtools.matcher.address;

import com.fasterxml.jackson.databind.JsonNode;
import io.synthtools.matcher.ConfigurationException;

import javax.annotation.concurrent.Immutable;
import java.util.Iterator;

/**
 * Family and public-only filter applied to the addresses of one {@link AddressSource}.
 */
@Immutable
public final class AddressSelection {

    static final String FAMILY = "family";
    static final String PUBLIC_ONLY = "public_only";

    private final AddressFamily family;
    private final boolean publicOnly;

    public AddressSelection(final AddressFamily family, final boolean publicOnly) {
        this.family = family;
        this.publicOnly = publicOnly;
    }

    public static AddressSelection defaults() {
        return new AddressSelection(AddressFamily.DUAL, false);
    }

    /**
     * Parses {"family": ..., "public_only": ...}. An empty object, JSON true or JSON null select the defaults.
     *
     * @param node the configuration value of a source key
     * @param defaultFamily family used when the node does not name one
     * @throws ConfigurationException on unknown keys or ill-typed values
     */
    public static AddressSelection fromJson(final JsonNode node, final AddressFamily defaultFamily) {
        if (node == null || node.isNull() || (node.isBoolean() && node.booleanValue())) {
            return new AddressSelection(defaultFamily, false);
        }
        if (!node.isObject()) {
            throw new ConfigurationException("Address selection must be an object, got " + node);
        }
        final Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            final String name = names.next();
            if (!FAMILY.equals(name) && !PUBLIC_ONLY.equals(name)) {
                throw new ConfigurationException("Unknown address selection key '" + name + "'");
            }
        }

        AddressFamily family = defaultFamily;
        final JsonNode familyNode = node.get(FAMILY);
        if (familyNode != null) {
            if (!familyNode.isTextual()) {
                throw new ConfigurationException("'" + FAMILY + "' must be a string, got " + familyNode);
            }
            family = AddressFamily.fromName(familyNode.asText());
        }

        boolean publicOnly = false;
        final JsonNode publicNode = node.get(PUBLIC_ONLY);
        if (publicNode != null) {
            if (!publicNode.isBoolean()) {
                throw new ConfigurationException("'" + PUBLIC_ONLY + "' must be true or false, got " + publicNode);
            }
            publicOnly = publicNode.booleanValue();
        }
        return new AddressSelection(family, publicOnly);
    }

    public AddressFamily family() {
        return family;
    }

    public boolean publicOnly() {
        return publicOnly;
    }

    /**
     * @param address a normalized address literal
     * @return true if the address passes the family filter and, when required, is publicly routable
     */
    public boolean accepts(final String address) {
        if (!family.accepts(address)) {
            return false;
        }
        return !publicOnly || SpecialPurposeRanges.isPublic(IPAddress.toBytes(address));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AddressSelection that = (AddressSelection) o;
        return family == that.family && publicOnly == that.publicOnly;
    }

    @Override
    public int hashCode() {
        return 31 * family.hashCode() + (publicOnly ? 1 : 0);
    }

    @Override
    public String toString() {
        return "AddressSelection{family=" + family + ", publicOnly=" + publicOnly + "}";
    }
}

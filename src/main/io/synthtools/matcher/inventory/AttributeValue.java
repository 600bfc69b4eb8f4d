package io.synthtools.matcher.inventory;

import com.fasterxml.jackson.databind.JsonNode;
import io.synthtools.matcher.ConfigurationException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The result of resolving an {@link AttributePath} on an inventory object. Either absent, or present and holding a
 * scalar, a sequence or a nested mapping.
 */
@Immutable
public final class AttributeValue {

    public enum Kind {
        ABSENT,
        SCALAR,
        SEQUENCE,
        MAPPING
    }

    private static final AttributeValue ABSENT = new AttributeValue(Kind.ABSENT, null);

    private final Kind kind;
    private final JsonNode node;

    private AttributeValue(final Kind kind, final JsonNode node) {
        this.kind = kind;
        this.node = node;
    }

    public static AttributeValue absent() {
        return ABSENT;
    }

    /**
     * JSON null and missing nodes are treated as absent.
     */
    static AttributeValue of(@Nullable final JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ABSENT;
        }
        if (node.isArray()) {
            return new AttributeValue(Kind.SEQUENCE, node);
        }
        if (node.isObject()) {
            return new AttributeValue(Kind.MAPPING, node);
        }
        return new AttributeValue(Kind.SCALAR, node);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isPresent() {
        return kind != Kind.ABSENT;
    }

    /**
     * @param path the path the value was resolved from, for error messages
     * @return the canonical string form of a scalar value
     * @throws ConfigurationException if the value is a sequence or a mapping
     * @throws IllegalStateException if the value is absent
     */
    public String asScalarString(final AttributePath path) {
        switch (kind) {
        case SCALAR:
            return canonicalString(node);
        case SEQUENCE:
            throw new ConfigurationException("Attribute '" + path + "' is multi-valued and cannot be compared to a "
                    + "single value");
        case MAPPING:
            throw new ConfigurationException("Attribute '" + path + "' is a nested object and cannot be compared to a "
                    + "single value; use a dotted path to one of its fields");
        default:
            throw new IllegalStateException("Attribute '" + path + "' is absent");
        }
    }

    /**
     * @return the elements of a sequence value, a single-element list for a scalar, or an empty list otherwise
     */
    public List<JsonNode> elements() {
        if (kind == Kind.SEQUENCE) {
            final List<JsonNode> elements = new ArrayList<>(node.size());
            node.forEach(elements::add);
            return elements;
        }
        if (kind == Kind.SCALAR) {
            return Collections.singletonList(node);
        }
        return Collections.emptyList();
    }

    @Nullable
    public JsonNode node() {
        return node;
    }

    /**
     * Canonical scalar-to-string coercion shared by rule values and attribute values, so that a numeric ASN
     * compares equal to the same ASN written as a string. Integral numbers render without a fraction, other
     * numbers in plain (non-exponent) notation, booleans as "true"/"false".
     */
    public static String canonicalString(@Nonnull final JsonNode scalar) {
        if (scalar.isNumber()) {
            if (scalar.canConvertToExactIntegral()) {
                return scalar.decimalValue().toBigIntegerExact().toString();
            }
            return scalar.decimalValue().stripTrailingZeros().toPlainString();
        }
        return scalar.asText();
    }

    @Override
    public String toString() {
        return kind == Kind.ABSENT ? "<absent>" : node.toString();
    }
}

package io.synthtools.matcher;

import io.synthtools.matcher.inventory.AttributePath;

import javax.annotation.concurrent.Immutable;
import java.util.Objects;

/**
 * Case-sensitive equality between the canonical string form of an attribute and a value.
 */
@Immutable
public final class DirectMatch extends Rule {

    private final AttributePath attribute;
    private final String value;

    DirectMatch(final AttributePath attribute, final String value) {
        super(MatchType.DIRECT);
        this.attribute = attribute;
        this.value = value;
    }

    public AttributePath attribute() {
        return attribute;
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || !o.getClass().equals(getClass())) {
            return false;
        }
        DirectMatch that = (DirectMatch) o;
        return attribute.equals(that.attribute) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return 31 * attribute.hashCode() + (value != null ? value.hashCode() : 0);
    }

    @Override
    public String toString() {
        return attribute + "=" + value + " (" + super.toString() + ")";
    }
}

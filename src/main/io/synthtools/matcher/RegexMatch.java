package io.synthtools.matcher;

import io.synthtools.matcher.inventory.AttributePath;

import javax.annotation.concurrent.Immutable;
import java.util.regex.Pattern;

/**
 * Unanchored regular expression search in the canonical string form of an attribute.
 */
@Immutable
public final class RegexMatch extends Rule {

    private final AttributePath attribute;
    private final Pattern pattern;

    RegexMatch(final AttributePath attribute, final Pattern pattern) {
        super(MatchType.REGEX);
        this.attribute = attribute;
        this.pattern = pattern;
    }

    public AttributePath attribute() {
        return attribute;
    }

    public Pattern pattern() {
        return pattern;
    }

    boolean matches(final String value) {
        return pattern.matcher(value).find();
    }

    // Pattern has identity equality, so compare the source text
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || !o.getClass().equals(getClass())) {
            return false;
        }
        RegexMatch that = (RegexMatch) o;
        return attribute.equals(that.attribute) && pattern.pattern().equals(that.pattern.pattern());
    }

    @Override
    public int hashCode() {
        return 31 * attribute.hashCode() + pattern.pattern().hashCode();
    }

    @Override
    public String toString() {
        return attribute + "~/" + pattern.pattern() + "/ (" + super.toString() + ")";
    }
}

package io.synthtools.matcher.inventory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A dot-separated path into the nested attribute mappings of an inventory object, e.g. "site.site_name".
 * Paths are split once, when the rule that carries them is compiled.
 */
@Immutable
public final class AttributePath {
    private final static char SEPARATOR = '.';

    private final String name;
    private final List<String> steps;

    private AttributePath(final String name, final List<String> steps) {
        this.name = name;
        this.steps = steps;
    }

    /**
     * @param name the path as written in configuration
     * @return the parsed path
     * @throws IllegalArgumentException if the path is empty or has an empty step
     */
    public static AttributePath of(@Nonnull final String name) {
        final List<String> steps = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= name.length(); i++) {
            if (i == name.length() || name.charAt(i) == SEPARATOR) {
                if (i == start) {
                    throw new IllegalArgumentException("Empty step in attribute path '" + name + "'");
                }
                steps.add(name.substring(start, i));
                start = i + 1;
            }
        }
        return new AttributePath(name, Collections.unmodifiableList(steps));
    }

    public List<String> steps() {
        return steps;
    }

    /**
     * @return the pathname as a .-separated string
     */
    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((AttributePath) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}

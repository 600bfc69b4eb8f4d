package io.synthtools.matcher;

import io.synthtools.matcher.inventory.AttributePath;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds attribute paths to lists of wanted values. Not a predicate: {@link OneOfEachSelector} uses it to pick at
 * most one object for every combination of the bound values.
 */
@Immutable
public final class OneOfEach extends Rule {

    private final Map<AttributePath, List<String>> bindings;

    OneOfEach(final Map<AttributePath, List<String>> bindings) {
        super(MatchType.ONE_OF_EACH);
        final Map<AttributePath, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<AttributePath, List<String>> binding : bindings.entrySet()) {
            copy.put(binding.getKey(), Collections.unmodifiableList(new ArrayList<>(binding.getValue())));
        }
        this.bindings = Collections.unmodifiableMap(copy);
    }

    public Map<AttributePath, List<String>> bindings() {
        return bindings;
    }

    public List<AttributePath> attributes() {
        return new ArrayList<>(bindings.keySet());
    }

    /**
     * @return size of the Cartesian product of the bound values, saturating at Long.MAX_VALUE
     */
    public long combinationCount() {
        long count = 1;
        for (List<String> values : bindings.values()) {
            if (count > Long.MAX_VALUE / values.size()) {
                return Long.MAX_VALUE;
            }
            count *= values.size();
        }
        return count;
    }

    /**
     * The Cartesian product of the bound values. The first declared attribute varies slowest, so for
     * {asn: [1, 2], country: [US, CA]} the order is (1,US) (1,CA) (2,US) (2,CA). Each combination lists values in
     * the order of {@link #attributes()}.
     *
     * @return all combinations, in deterministic order
     */
    public List<List<String>> combinations() {
        final List<List<String>> axes = new ArrayList<>(bindings.values());
        final List<List<String>> result = new ArrayList<>();
        final int[] odometer = new int[axes.size()];
        while (true) {
            final List<String> combination = new ArrayList<>(axes.size());
            for (int i = 0; i < axes.size(); i++) {
                combination.add(axes.get(i).get(odometer[i]));
            }
            result.add(combination);

            // advance, last axis fastest
            int i = axes.size() - 1;
            while (i >= 0 && ++odometer[i] == axes.get(i).size()) {
                odometer[i] = 0;
                i--;
            }
            if (i < 0) {
                return result;
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || !o.getClass().equals(getClass())) {
            return false;
        }
        return bindings.equals(((OneOfEach) o).bindings);
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public String toString() {
        return bindings + " (" + super.toString() + ")";
    }
}

package io.synthtools.matcher;

import io.synthtools.matcher.inventory.AttributePath;
import io.synthtools.matcher.inventory.InventoryObject;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Greedy one-per-combination assignment for {@link OneOfEach}.
 * <p>
 * For every combination of bound values, in {@link OneOfEach#combinations()} order, the first candidate (in the
 * order given) whose attributes equal all values of the combination is picked. Picks are not exclusive: the same
 * object may be picked for several combinations, in which case it appears once, at its first pick. Combinations
 * without a matching object contribute nothing.
 * <p>
 * The output follows combination order, not candidate order. When several objects tie for a combination the first
 * one wins, so the result is only as stable as the order the inventory API returns objects in.
 */
public final class OneOfEachSelector {

    private final long maxCombinations;

    public OneOfEachSelector(final long maxCombinations) {
        this.maxCombinations = maxCombinations;
    }

    /**
     * @throws ConfigurationException if the selector expands into more combinations than allowed
     */
    public <T extends InventoryObject> List<T> select(@Nonnull final OneOfEach selector,
                                                      @Nonnull final List<T> candidates) {
        final long count = selector.combinationCount();
        if (count > maxCombinations) {
            throw new ConfigurationException("'" + Constants.ONE_OF_EACH + "' expands to " + count
                    + " combinations, more than the allowed " + maxCombinations);
        }

        final List<AttributePath> attributes = selector.attributes();
        final List<T> picked = new ArrayList<>();
        for (List<String> combination : selector.combinations()) {
            for (T candidate : candidates) {
                if (matchesCombination(candidate, attributes, combination)) {
                    // identity, not equals(): two distinct objects with equal attributes are still two picks
                    if (!containsSame(picked, candidate)) {
                        picked.add(candidate);
                    }
                    break;
                }
            }
        }
        return picked;
    }

    private static boolean matchesCombination(final InventoryObject candidate, final List<AttributePath> attributes,
                                              final List<String> combination) {
        for (int i = 0; i < attributes.size(); i++) {
            if (!RuleMatcher.matchesValue(candidate, attributes.get(i), combination.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean containsSame(final List<?> list, final Object o) {
        for (Object element : list) {
            if (element == o) {
                return true;
            }
        }
        return false;
    }
}

package io.synthtools.matcher;

import io.synthtools.matcher.inventory.InventoryObject;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A compiled top-level rule list, such as the value of "devices" or "agents".
 * <p>
 * The list is an implicit AND of its predicate entries. A one_of_each entry and a limit directive are structural:
 * the first narrows the objects that passed all predicates, the second truncates what is left. Objects keep the
 * order they were supplied in, except after one_of_each, which emits them in combination order.
 */
@Immutable
@ThreadSafe
public final class RuleSet {

    private final List<Rule> predicates;
    private final OneOfEach oneOfEach;
    private final Integer limit;
    private final OneOfEachSelector selector;

    private RuleSet(final List<Rule> predicates, @Nullable final OneOfEach oneOfEach, @Nullable final Integer limit,
                    final Configuration configuration) {
        this.predicates = Collections.unmodifiableList(predicates);
        this.oneOfEach = oneOfEach;
        this.limit = limit;
        this.selector = new OneOfEachSelector(configuration.getMaxCombinations());
    }

    /**
     * Partitions rule list entries into predicates and the (at most one) one_of_each selector.
     *
     * @param entries the entries in list order
     * @param limit optional positive cap on the result size
     * @param configuration engine configuration
     * @return the rule set
     * @throws ConfigurationException on a second one_of_each entry or a limit below 1
     */
    public static RuleSet of(@Nonnull final List<Rule> entries, @Nullable final Integer limit,
                             @Nonnull final Configuration configuration) {
        final List<Rule> predicates = new ArrayList<>();
        OneOfEach oneOfEach = null;
        for (Rule entry : entries) {
            if (entry.type() == MatchType.ONE_OF_EACH) {
                if (oneOfEach != null) {
                    throw new ConfigurationException("Only one '" + Constants.ONE_OF_EACH
                            + "' entry is allowed in a rule list");
                }
                oneOfEach = (OneOfEach) entry;
            } else {
                predicates.add(entry);
            }
        }
        if (limit != null && limit < 1) {
            throw new ConfigurationException("'" + Constants.LIMIT + "' must be a positive integer, got " + limit);
        }
        return new RuleSet(predicates, oneOfEach, limit, configuration);
    }

    public static RuleSet of(@Nonnull final List<Rule> entries) {
        return of(entries, null, Configuration.defaults());
    }

    public List<Rule> predicates() {
        return predicates;
    }

    @Nullable
    public OneOfEach oneOfEach() {
        return oneOfEach;
    }

    @Nullable
    public Integer limit() {
        return limit;
    }

    /**
     * @param object candidate
     * @return true if every predicate entry matches; true for an empty predicate list
     */
    public boolean matchesAll(@Nonnull final InventoryObject object) {
        for (Rule predicate : predicates) {
            if (!RuleMatcher.matches(predicate, object)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param candidates fully materialized inventory, in API order
     * @return the selected objects
     * @throws ConfigurationException if a rule turns out to reference a multi-valued attribute
     */
    public <T extends InventoryObject> List<T> select(@Nonnull final List<T> candidates) {
        return truncate(selectUnlimited(candidates), limit);
    }

    /**
     * Predicates and one_of_each without the limit, for callers that post-process before truncating.
     */
    <T extends InventoryObject> List<T> selectUnlimited(final List<T> candidates) {
        List<T> selected = new ArrayList<>();
        for (T candidate : candidates) {
            if (matchesAll(candidate)) {
                selected.add(candidate);
            }
        }
        if (oneOfEach != null) {
            selected = selector.select(oneOfEach, selected);
        }
        return selected;
    }

    static <T> List<T> truncate(final List<T> list, @Nullable final Integer limit) {
        if (limit == null || list.size() <= limit) {
            return list;
        }
        return new ArrayList<>(list.subList(0, limit));
    }

    @Override
    public String toString() {
        return "RuleSet{predicates=" + predicates + ", oneOfEach=" + oneOfEach + ", limit=" + limit + "}";
    }
}

package io.synthtools.matcher;

import io.synthtools.matcher.inventory.AttributePath;
import io.synthtools.matcher.inventory.AttributeValue;
import io.synthtools.matcher.inventory.InventoryObject;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Evaluates a single predicate rule against a single inventory object. Evaluation is pure: it reads the object's
 * attributes and nothing else. A missing attribute means "no match"; a multi-valued or nested attribute under a
 * direct or regex rule is a configuration error, raised the first time such an object is seen.
 */
@ThreadSafe
@Immutable
public final class RuleMatcher {

    private RuleMatcher() { }

    /**
     * @param rule a predicate rule (anything but {@link MatchType#ONE_OF_EACH})
     * @param object the object to test
     * @return true if the object satisfies the rule
     * @throws ConfigurationException if the rule compares a single value with a multi-valued attribute
     * @throws IllegalArgumentException if the rule is a one-of-each selector
     */
    public static boolean matches(@Nonnull final Rule rule, @Nonnull final InventoryObject object) {
        switch (rule.type()) {
        case DIRECT:
            final DirectMatch direct = (DirectMatch) rule;
            return matchesValue(object, direct.attribute(), direct.value());

        case REGEX:
            final RegexMatch regex = (RegexMatch) rule;
            final AttributeValue value = object.resolve(regex.attribute());
            return value.isPresent() && regex.matches(value.asScalarString(regex.attribute()));

        case ANY_OF:
            for (Rule sub : ((CompositeRule) rule).rules()) {
                if (matches(sub, object)) {
                    return true;
                }
            }
            return false;

        case ALL_OF:
            for (Rule sub : ((CompositeRule) rule).rules()) {
                if (!matches(sub, object)) {
                    return false;
                }
            }
            return true;

        case ONE_OF_EACH:
            throw new IllegalArgumentException("'one_of_each' selects over a collection and is not a predicate");

        default:
            throw new IllegalStateException("Unsupported rule type " + rule.type());
        }
    }

    static boolean matchesValue(final InventoryObject object, final AttributePath path, final String wanted) {
        final AttributeValue value = object.resolve(path);
        return value.isPresent() && value.asScalarString(path).equals(wanted);
    }
}

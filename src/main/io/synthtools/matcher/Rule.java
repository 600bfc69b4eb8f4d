package io.synthtools.matcher;

import io.synthtools.matcher.inventory.AttributePath;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A node of the selection rule grammar. Subclasses exist per {@link MatchType}; the set is closed (constructors are
 * package-private) and evaluation switches over {@link #type()}.
 * This class also acts as the factory for rules, which is useful if you want to build rules directly instead of
 * compiling them from a configuration tree with {@link JsonRuleCompiler}.
 */
public abstract class Rule {

    private final MatchType type;

    Rule(final MatchType type) {
        this.type = type;
    }

    public MatchType type() {
        return type;
    }

    public static DirectMatch directMatch(final String attribute, final String value) {
        return new DirectMatch(path(attribute), value);
    }

    /**
     * @throws ConfigurationException if the pattern does not compile
     */
    public static RegexMatch regexMatch(final String attribute, final String regex) {
        final AttributePath path = path(attribute);
        try {
            return new RegexMatch(path, Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid regex for attribute '" + attribute + "': " + e.getMessage(), e);
        }
    }

    public static CompositeRule anyOf(final List<Rule> rules) {
        return new CompositeRule(MatchType.ANY_OF, predicates(rules));
    }

    public static CompositeRule allOf(final List<Rule> rules) {
        return new CompositeRule(MatchType.ALL_OF, predicates(rules));
    }

    /**
     * @param bindings attribute path to the values wanted for it, in declaration order
     * @throws ConfigurationException if there are no bindings or a binding has no values
     */
    public static OneOfEach oneOfEach(final Map<String, List<String>> bindings) {
        if (bindings.isEmpty()) {
            throw new ConfigurationException("'" + Constants.ONE_OF_EACH + "' needs at least one attribute");
        }
        final Map<AttributePath, List<String>> parsed = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> binding : bindings.entrySet()) {
            if (binding.getValue().isEmpty()) {
                throw new ConfigurationException("'" + Constants.ONE_OF_EACH + "' attribute '" + binding.getKey()
                        + "' has no values");
            }
            parsed.put(path(binding.getKey()), binding.getValue());
        }
        return new OneOfEach(parsed);
    }

    private static AttributePath path(final String attribute) {
        try {
            return AttributePath.of(attribute);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static List<Rule> predicates(final List<Rule> rules) {
        for (Rule rule : rules) {
            if (!rule.type().isPredicate()) {
                throw new ConfigurationException("'" + Constants.ONE_OF_EACH
                        + "' selects over the whole list and cannot be nested in 'any' or 'all'");
            }
        }
        return new ArrayList<>(rules);
    }

    @Override
    public String toString() {
        return "T:" + type;
    }
}

package io.synthtools.matcher;

import javax.annotation.concurrent.Immutable;
import java.util.Collections;
import java.util.List;

/**
 * Logical OR ({@link MatchType#ANY_OF}) or AND ({@link MatchType#ALL_OF}) over an ordered list of predicate rules.
 */
@Immutable
public final class CompositeRule extends Rule {

    private final List<Rule> rules;

    CompositeRule(final MatchType type, final List<Rule> rules) {
        super(type);
        this.rules = Collections.unmodifiableList(rules);
    }

    public List<Rule> rules() {
        return rules;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || !o.getClass().equals(getClass())) {
            return false;
        }
        CompositeRule that = (CompositeRule) o;
        return type() == that.type() && rules.equals(that.rules);
    }

    @Override
    public int hashCode() {
        return 31 * type().hashCode() + rules.hashCode();
    }

    @Override
    public String toString() {
        return rules + " (" + super.toString() + ")";
    }
}

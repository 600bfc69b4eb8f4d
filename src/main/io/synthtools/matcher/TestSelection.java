package io.synthtools.matcher;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Targets and agents selected for one test, ready for test configuration assembly.
 */
@Immutable
public final class TestSelection {

    private final TestType type;
    private final List<String> targets;
    private final List<String> agentIds;

    TestSelection(final TestType type, final List<String> targets, final List<String> agentIds) {
        this.type = type;
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
        this.agentIds = Collections.unmodifiableList(new ArrayList<>(agentIds));
    }

    public TestType type() {
        return type;
    }

    /**
     * @return derived target addresses; empty for tests that do not derive targets
     */
    public List<String> targets() {
        return targets;
    }

    public List<String> agentIds() {
        return agentIds;
    }

    @Override
    public String toString() {
        return "TestSelection{type=" + type.apiName() + ", targets=" + targets + ", agentIds=" + agentIds + "}";
    }
}

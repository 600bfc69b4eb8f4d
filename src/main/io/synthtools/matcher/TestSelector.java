package io.synthtools.matcher;

import com.fasterxml.jackson.databind.JsonNode;
import io.synthtools.matcher.inventory.InventorySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Runs target and agent selection for one test and refuses to hand back a selection a test cannot be created from.
 * Inventory is fetched once per call; nothing is cached between calls.
 */
public final class TestSelector {

    private static final Logger log = LoggerFactory.getLogger(TestSelector.class);

    private final TestType type;
    private final TargetSelector targets;
    private final AgentSelector agents;

    public TestSelector(@Nonnull final TestType type, @Nullable final TargetSelector targets,
                        @Nonnull final AgentSelector agents) {
        if (type.derivesTargets() && targets == null) {
            throw new ConfigurationException("'" + type.apiName() + "' tests need a target section");
        }
        if (!type.derivesTargets() && targets != null) {
            throw new ConfigurationException("'" + type.apiName() + "' tests do not take device-derived targets");
        }
        this.type = type;
        this.targets = targets;
        this.agents = agents;
    }

    /**
     * @param type test type
     * @param targetSection target section, null for test types that do not derive targets
     * @param agentSection agent rule list
     * @param configuration engine configuration
     * @return the selector
     * @throws ConfigurationException if either section is malformed or does not fit the test type
     */
    public static TestSelector compile(@Nonnull final TestType type, @Nullable final JsonNode targetSection,
                                       @Nonnull final JsonNode agentSection,
                                       @Nonnull final Configuration configuration) {
        final TargetSelector targets = targetSection == null || targetSection.isNull()
                ? null : TargetSelector.compile(targetSection, configuration);
        return new TestSelector(type, targets, AgentSelector.compile(agentSection, configuration));
    }

    /**
     * @param inventory the inventory to select from
     * @return the selection
     * @throws EmptySelectionException if no target (for target-deriving tests) or no agent was selected
     * @throws IOException if the inventory cannot be fetched
     */
    public TestSelection select(@Nonnull final InventorySource inventory) throws IOException {
        List<String> addresses = Collections.emptyList();
        if (targets != null) {
            addresses = targets.select(inventory);
            if (addresses.isEmpty()) {
                throw new EmptySelectionException("No targets matched for '" + type.apiName()
                        + "' test; refusing to create a test without targets");
            }
        }
        final List<String> agentIds = agents.select(inventory);
        if (agentIds.isEmpty()) {
            throw new EmptySelectionException("No agents matched for '" + type.apiName()
                    + "' test; refusing to create a test without agents");
        }
        log.info("{} test: {} target(s), {} agent(s)", type.apiName(), addresses.size(), agentIds.size());
        return new TestSelection(type, addresses, agentIds);
    }
}

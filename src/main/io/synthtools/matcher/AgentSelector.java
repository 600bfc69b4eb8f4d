package io.synthtools.matcher;

import com.fasterxml.jackson.databind.JsonNode;
import io.synthtools.matcher.inventory.Agent;
import io.synthtools.matcher.inventory.InventorySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Selects the agents a test runs on: the agents rule list applied to the whole agent inventory.
 */
@Immutable
public final class AgentSelector {

    private static final Logger log = LoggerFactory.getLogger(AgentSelector.class);

    private final RuleSet rules;

    public AgentSelector(@Nonnull final RuleSet rules) {
        this.rules = rules;
    }

    public static AgentSelector compile(@Nonnull final JsonNode section) {
        return compile(section, Configuration.defaults());
    }

    /**
     * @param section a rule list, or an object holding one under "agents"
     * @param configuration engine configuration
     * @return the selector
     * @throws ConfigurationException if the rule list is malformed
     */
    public static AgentSelector compile(@Nonnull final JsonNode section, @Nonnull final Configuration configuration) {
        JsonNode rules = section;
        if (section.isObject()) {
            rules = section.get(Constants.AGENTS);
            if (rules == null || section.size() != 1) {
                throw new ConfigurationException("Agents section must be a rule list or {\"" + Constants.AGENTS
                        + "\": [...]}");
            }
        }
        return new AgentSelector(JsonRuleCompiler.compile(rules, configuration));
    }

    public RuleSet rules() {
        return rules;
    }

    /**
     * @param agents the full agent inventory
     * @return ids of the selected agents, without duplicates, in selection order, at most limit of them
     */
    public List<String> select(@Nonnull final List<Agent> agents) {
        final List<Agent> matched = rules.selectUnlimited(agents);
        final Set<String> unique = new LinkedHashSet<>();
        for (Agent agent : matched) {
            unique.add(agent.id());
        }
        // the limit counts distinct ids
        final List<String> ids = RuleSet.truncate(new ArrayList<>(unique), rules.limit());
        if (ids.isEmpty()) {
            log.warn("No agents selected out of {}", agents.size());
        } else {
            log.debug("Selected {} of {} agent(s): {}", ids.size(), agents.size(), ids);
        }
        return ids;
    }

    /**
     * @throws IOException if the agent inventory cannot be fetched
     */
    public List<String> select(@Nonnull final InventorySource inventory) throws IOException {
        return select(inventory.listAgents());
    }
}

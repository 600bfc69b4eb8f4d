package io.synthtools.matcher;

import io.synthtools.matcher.inventory.Device;
import io.synthtools.matcher.inventory.StaticInventory;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RuleSetTest {

    private List<Device> devices;

    @Before
    public void setUp() throws Exception {
        devices = StaticInventory.fromFixtures().listDevices();
    }

    private static List<String> ids(List<Device> devices) {
        List<String> ids = new ArrayList<>();
        for (Device device : devices) {
            ids.add(device.id());
        }
        return ids;
    }

    @Test
    public void testEmptyRuleListSelectsAllInOrder() throws Exception {
        assertEquals(Arrays.asList("101", "102", "201", "301"),
                ids(JsonRuleCompiler.compile("[]").select(devices)));
    }

    @Test
    public void testTopLevelEntriesAreAnded() throws Exception {
        RuleSet rules = JsonRuleCompiler.compile("[ { \"device_type\": \"router\" }, "
                + "{ \"device_name\": { \"regex\": \"02$\" } } ]");
        assertEquals(Collections.singletonList("102"), ids(rules.select(devices)));
    }

    @Test
    public void testScenarioAnyOfAllOf() throws Exception {
        RuleSet rules = JsonRuleCompiler.compile("[ { \"any\": [\n"
                + "  { \"all\": [ { \"site.site_name\": \"DC3\" }, { \"device_type\": \"router\" } ] },\n"
                + "  { \"all\": [ { \"site.site_name\": \"FRA1\" }, { \"device_type\": \"gateway\" } ] }\n"
                + "] } ]");
        assertEquals(Arrays.asList("101", "102", "201"), ids(rules.select(devices)));
    }

    @Test
    public void testLimitKeepsEncounterOrder() throws Exception {
        RuleSet rules = JsonRuleCompiler.compile("[ { \"site.site_name\": { \"regex\": \".\" } }, { \"limit\": 1 } ]");
        assertEquals(Collections.singletonList("101"), ids(rules.select(devices)));

        RuleSet generous = JsonRuleCompiler.compile("[ { \"limit\": 10 } ]");
        assertEquals(4, generous.select(devices).size());
    }

    @Test
    public void testLimitAppliesAfterOneOfEach() throws Exception {
        RuleSet rules = JsonRuleCompiler.compile("[ { \"one_of_each\": { \"device_type\": "
                + "[ \"switch\", \"gateway\", \"router\" ] } }, { \"limit\": 2 } ]");
        // combination order, not inventory order
        assertEquals(Arrays.asList("301", "201"), ids(rules.select(devices)));
    }

    @Test
    public void testPredicatesFilterBeforeOneOfEach() throws Exception {
        RuleSet rules = JsonRuleCompiler.compile("[ { \"device_name\": { \"regex\": \"02\" } }, "
                + "{ \"one_of_each\": { \"device_type\": [ \"router\" ] } } ]");
        assertEquals(Collections.singletonList("102"), ids(rules.select(devices)));
    }

    @Test
    public void testNoMatchIsEmptyNotAnError() throws Exception {
        RuleSet rules = JsonRuleCompiler.compile("[ { \"device_type\": \"firewall\" } ]");
        assertTrue(rules.select(devices).isEmpty());
    }

    @Test
    public void testRuleOnMultiValuedAttributeFailsFast() throws Exception {
        RuleSet rules = JsonRuleCompiler.compile("[ { \"sending_ips\": \"10.3.0.2\" } ]");
        try {
            rules.select(devices);
            fail("rule against sending_ips accepted");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().contains("sending_ips"));
        }
    }

    @Test
    public void testPartitioning() {
        Rule direct = Rule.directMatch("device_type", "router");
        Rule oneOfEach = Rule.oneOfEach(Collections.singletonMap("device_type",
                Collections.singletonList("router")));
        RuleSet rules = RuleSet.of(Arrays.asList(direct, oneOfEach), 5, Configuration.defaults());
        assertEquals(Collections.singletonList(direct), rules.predicates());
        assertEquals(oneOfEach, rules.oneOfEach());
        assertEquals(Integer.valueOf(5), rules.limit());
    }

    @Test(expected = ConfigurationException.class)
    public void testNonPositiveLimitRejected() {
        RuleSet.of(Collections.<Rule>emptyList(), 0, Configuration.defaults());
    }
}

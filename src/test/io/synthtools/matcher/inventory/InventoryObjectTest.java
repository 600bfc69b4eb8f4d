package io.synthtools.matcher.inventory;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.synthtools.matcher.ConfigurationException;
import org.junit.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

import static io.synthtools.matcher.inventory.StaticInventory.json;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class InventoryObjectTest {

    @Test
    public void testDottedPathResolution() throws IOException {
        Device device = new Device(json("{\"site\": {\"site_name\": \"DC3\"}}"));
        AttributeValue value = device.resolve("site.site_name");
        assertEquals(AttributeValue.Kind.SCALAR, value.kind());
        assertEquals("DC3", value.asScalarString(AttributePath.of("site.site_name")));
    }

    @Test
    public void testMissingPathsAreAbsentNotErrors() throws IOException {
        Device device = new Device(json("{\"site\": {\"site_name\": \"DC3\"}, \"device_type\": \"router\"}"));
        assertFalse(device.resolve("site.missing").isPresent());
        assertFalse(device.resolve("nope").isPresent());
        assertFalse(device.resolve("nope.deeper").isPresent());
        // a scalar with path left over
        assertFalse(device.resolve("device_type.length").isPresent());
    }

    @Test
    public void testNullIsAbsent() throws IOException {
        Device device = new Device(json("{\"snmp_ip\": null}"));
        assertFalse(device.resolve("snmp_ip").isPresent());
        assertNull(device.snmpIp());
    }

    @Test
    public void testSequencesAreReturnedAsIs() throws IOException {
        Device device = new Device(json("{\"sending_ips\": [\"10.0.0.1\", \"10.0.0.2\"]}"));
        AttributeValue value = device.resolve("sending_ips");
        assertEquals(AttributeValue.Kind.SEQUENCE, value.kind());
        assertEquals(2, value.elements().size());
        assertEquals(Arrays.asList("10.0.0.1", "10.0.0.2"), device.sendingIps());
    }

    @Test
    public void testSequenceCannotBeComparedAsScalar() throws IOException {
        Device device = new Device(json("{\"labels\": [\"a\"], \"site\": {\"id\": 1}}"));
        try {
            device.resolve("labels").asScalarString(AttributePath.of("labels"));
            fail("sequence compared as a scalar");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().contains("labels"));
        }
        try {
            device.resolve("site").asScalarString(AttributePath.of("site"));
            fail("mapping compared as a scalar");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().contains("site"));
        }
    }

    @Test
    public void testCanonicalStrings() throws IOException {
        Agent agent = new Agent(json("{\"id\": 593, \"asn\": 16509, \"lat\": 45.50, \"big\": 1.0E3, \"enabled\": true}"));
        assertEquals("593", agent.id());
        assertEquals("16509", agent.asn());
        AttributePath lat = AttributePath.of("lat");
        assertEquals("45.5", agent.resolve(lat).asScalarString(lat));
        AttributePath big = AttributePath.of("big");
        assertEquals("1000", agent.resolve(big).asScalarString(big));
        AttributePath enabled = AttributePath.of("enabled");
        assertEquals("true", agent.resolve(enabled).asScalarString(enabled));
    }

    @Test
    public void testObjectsAreDetachedFromTheCallersTree() throws IOException {
        ObjectNode tree = (ObjectNode) json("{\"id\": \"1\", \"device_type\": \"router\"}");
        Device device = new Device(tree);
        tree.put("device_type", "switch");
        assertEquals("router", device.deviceType());
        device.attributes().put("device_type", "gateway");
        assertEquals("router", device.deviceType());
    }

    @Test
    public void testSecondaryIpsInBothShapes() throws IOException {
        NetworkInterface networkInterface = new NetworkInterface(json("{\"ip_address\": \"10.0.0.1\", "
                + "\"secondary_ips\": [\"10.0.0.2\", {\"address\": \"10.0.0.3\", \"netmask\": \"255.0.0.0\"}, {}]}"));
        assertEquals("10.0.0.1", networkInterface.ipAddress());
        assertEquals(Arrays.asList("10.0.0.2", "10.0.0.3"), networkInterface.secondaryIps());

        NetworkInterface bare = new NetworkInterface(json("{\"secondary_ips\": null}"));
        assertNull(bare.ipAddress());
        assertEquals(Collections.<String>emptyList(), bare.secondaryIps());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAgentNeedsAnId() throws IOException {
        new Agent(json("{\"name\": \"nameless\"}"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInventoryObjectMustBeAnObject() throws IOException {
        new Device(json("[1, 2]"));
    }
}

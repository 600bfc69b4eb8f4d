package io.synthtools.matcher.address;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class IPAddressTest {

    @Test
    public void testNormalize() {
        assertEquals("10.0.0.1", IPAddress.normalize(" 10.0.0.1 "));
        assertEquals("10.0.0.1", IPAddress.normalize("10.0.0.1/24"));
        assertEquals("fe80::1", IPAddress.normalize("FE80::1"));
        assertEquals("2001:db8::1", IPAddress.normalize("2001:DB8::1/64"));
        assertEquals("fe80::1", IPAddress.normalize("fe80::1%eth0"));
        assertEquals("fe80::1", IPAddress.normalize("FE80::1%2/64"));
        assertNull(IPAddress.normalize(""));
        assertNull(IPAddress.normalize("   "));
        assertNull(IPAddress.normalize(null));
    }

    @Test
    public void testLiterals() {
        assertTrue(IPAddress.isLiteral("8.8.8.8"));
        assertTrue(IPAddress.isLiteral("2001:4860:4860::8888"));
        assertTrue(IPAddress.isLiteral("::"));
        assertTrue(IPAddress.isLiteral("::ffff:192.0.2.1"));
    }

    @Test
    public void testNonLiterals() {
        String[] bads = {
                "700.168.0.1",
                "foo",
                "example.com",
                "192.-3.0.1",
                "10.10.10.10.10",
                "10.10.10",
                "2400:6500:3:3:-5:3:3:3:3:3FF00::36FB:1F80",
                "2400:6500:3:3:3:3:FFFFFFFFFFF:3:3:3FF00::36FB:1F80"
        };
        for (String bad : bads) {
            assertFalse(bad, IPAddress.isLiteral(bad));
        }
    }

    @Test
    public void testBytes() {
        assertArrayEquals(new byte[] { 10, 0, 0, (byte) 255 }, IPAddress.toBytes("10.0.0.255"));
        assertEquals(16, IPAddress.toBytes("::1").length);
        // IPv4-mapped comes back as IPv4
        assertArrayEquals(new byte[] { (byte) 192, 0, 2, 1 }, IPAddress.toBytes("::ffff:192.0.2.1"));
    }

    @Test
    public void testCanonicalize() {
        assertEquals("8.8.8.8", IPAddress.canonicalize("08.008.8.8"));
        assertEquals("10.0.0.255", IPAddress.canonicalize("10.0.0.255"));
        assertEquals("2001:4860:4860::8888", IPAddress.canonicalize("2001:4860:4860:0:0:0:0:8888"));
        assertEquals("2001:4860:4860::8888", IPAddress.canonicalize("2001:4860:4860:0000::8888"));
        assertEquals("2001:db8::1", IPAddress.canonicalize("2001:0DB8:0000:0000:0000:0000:0000:0001"));
        assertEquals("::", IPAddress.canonicalize("0:0:0:0:0:0:0:0"));
        assertEquals("::1", IPAddress.canonicalize("0:0:0:0:0:0:0:1"));
        assertEquals("2001:db8::", IPAddress.canonicalize("2001:db8:0:0:0:0:0:0"));
        // a lone zero group is kept; of several zero runs the longest, then the first, is collapsed
        assertEquals("2001:db8:0:1:1:1:1:1", IPAddress.canonicalize("2001:db8::1:1:1:1:1"));
        assertEquals("2001:0:0:1::1", IPAddress.canonicalize("2001:0:0:1:0:0:0:1"));
        assertEquals("2001::1:0:0:1:1", IPAddress.canonicalize("2001:0:0:1:0:0:1:1"));
        assertEquals("::ffff:192.0.2.1", IPAddress.canonicalize("::FFFF:c000:0201"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCanonicalizeRejectsNonLiterals() {
        IPAddress.canonicalize("example.com");
    }
}

package io.synthtools.matcher.address;

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CIDRTest {

    @Test
    public void SpotMalformedCIDRs() {
        String[] badCIDrs = {
                "192.168.0.1/33",
                "foo",
                "foo/bar/baz",
                "192.168.0.1/foo",
                "192.168.0.1/-3424",
                "snorkle/3",
                "10.10.10.10.10/3",
                "2.1.0.-1/3",
                "300.1.1.1/8",
                "2400:6500:3:3:3:3:3:3:3:3FF00::36FB:1F80/122",
                "2400:6500:3:3:-5:3:3:3:3:3FF00::36FB:1F80/122",
                "2400:6500:FF00::36FB:1F80/222"
        };
        for (String bad : badCIDrs) {
            try {
                CIDR.cidr(bad);
                fail("Allowed bad CIDR: " + bad);
            } catch (Exception e) {
                //yay
            }
        }
    }

    @Test
    public void testIPv4Containment() {
        CIDR cidr = CIDR.cidr("172.16.0.0/12");
        assertTrue(cidr.contains("172.16.0.0"));
        assertTrue(cidr.contains("172.20.1.1"));
        assertTrue(cidr.contains("172.31.255.255"));
        assertFalse(cidr.contains("172.32.0.0"));
        assertFalse(cidr.contains("172.15.255.255"));
    }

    @Test
    public void testHighBitBytesCompareUnsigned() {
        CIDR multicast = CIDR.cidr("224.0.0.0/4");
        assertTrue(multicast.contains("224.0.0.1"));
        assertTrue(multicast.contains("239.255.255.255"));
        assertFalse(multicast.contains("240.0.0.0"));
        assertFalse(multicast.contains("8.8.8.8"));
    }

    @Test
    public void testIPv6Containment() {
        CIDR linkLocal = CIDR.cidr("fe80::/10");
        assertTrue(linkLocal.contains("fe80::1"));
        assertTrue(linkLocal.contains("febf:ffff::1"));
        assertFalse(linkLocal.contains("fec0::1"));
        assertFalse(linkLocal.contains("2001:4860:4860::8888"));
    }

    @Test
    public void testFamiliesNeverOverlap() {
        CIDR everything = CIDR.cidr("0.0.0.0/0");
        assertTrue(everything.contains("255.255.255.255"));
        assertFalse(everything.contains("::1"));
        assertFalse(CIDR.cidr("::/0").contains("10.0.0.1"));
    }

    @Test
    public void testHostRoutes() {
        assertTrue(CIDR.cidr("255.255.255.255/32").contains("255.255.255.255"));
        assertFalse(CIDR.cidr("255.255.255.255/32").contains("255.255.255.254"));
        assertTrue(CIDR.cidr("::1/128").contains("0:0:0:0:0:0:0:1"));
    }
}

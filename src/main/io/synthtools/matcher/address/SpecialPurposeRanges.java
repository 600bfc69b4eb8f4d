package io.synthtools.matcher.address;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Address blocks that are not publicly routable: private, loopback, link-local, multicast, documentation and the
 * other entries of the IANA IPv4 and IPv6 special-purpose registries.
 * IPv4-mapped IPv6 addresses parse to their IPv4 bytes and are judged by the IPv4 blocks.
 */
public final class SpecialPurposeRanges {

    private static final List<CIDR> RANGES = Collections.unmodifiableList(blocks(
            // IPv4
            "0.0.0.0/8",            // "this network"
            "10.0.0.0/8",           // private
            "100.64.0.0/10",        // shared address space (CGN)
            "127.0.0.0/8",          // loopback
            "169.254.0.0/16",       // link-local
            "172.16.0.0/12",        // private
            "192.0.0.0/24",         // IETF protocol assignments
            "192.0.2.0/24",         // TEST-NET-1
            "192.88.99.0/24",       // 6to4 relay anycast
            "192.168.0.0/16",       // private
            "198.18.0.0/15",        // benchmarking
            "198.51.100.0/24",      // TEST-NET-2
            "203.0.113.0/24",       // TEST-NET-3
            "224.0.0.0/4",          // multicast
            "240.0.0.0/4",          // reserved
            "255.255.255.255/32",   // limited broadcast
            // IPv6
            "::/128",               // unspecified
            "::1/128",              // loopback
            "64:ff9b:1::/48",       // local-use IPv4/IPv6 translation
            "100::/64",             // discard-only
            "2001::/23",            // IETF protocol assignments
            "2001:db8::/32",        // documentation
            "2002::/16",            // 6to4
            "fc00::/7",             // unique local
            "fe80::/10",            // link-local
            "ff00::/8"              // multicast
    ));

    private SpecialPurposeRanges() { }

    /**
     * @param address 4 or 16 address bytes
     * @return true if the address falls in none of the special-purpose blocks
     */
    public static boolean isPublic(final byte[] address) {
        for (CIDR range : RANGES) {
            if (range.contains(address)) {
                return false;
            }
        }
        return true;
    }

    public static boolean isPublic(final String address) {
        return isPublic(IPAddress.toBytes(address));
    }

    static List<CIDR> ranges() {
        return RANGES;
    }

    private static List<CIDR> blocks(final String... cidrs) {
        final List<CIDR> blocks = new ArrayList<>(cidrs.length);
        for (String cidr : cidrs) {
            blocks.add(CIDR.cidr(cidr));
        }
        return blocks;
    }
}

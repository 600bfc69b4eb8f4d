package io.synthtools.matcher.address;

import javax.annotation.Nullable;
import java.net.InetAddress;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parsing and normalization of IPv4 and IPv6 address literals.
 */
public final class IPAddress {

    private final static Pattern IPv4_REGEX = Pattern.compile("[0-9]{1,3}\\.[0-9]{1,3}\\.[0-9]{1,3}\\.[0-9]{1,3}");
    // dots allow an embedded IPv4 tail, as in ::ffff:192.0.2.1
    private final static Pattern IPv6_REGEX = Pattern.compile("[0-9a-fA-F:][0-9a-fA-F:.]*");

    private IPAddress() { }

    /**
     * Trims, drops a "/prefix-length" suffix and an IPv6 "%zone" suffix, and lower-cases.
     *
     * @param raw an address as found in inventory
     * @return the normalized form, or null if nothing is left
     */
    @Nullable
    public static String normalize(@Nullable final String raw) {
        if (raw == null) {
            return null;
        }
        String address = raw.trim();
        final int slash = address.indexOf('/');
        if (slash >= 0) {
            address = address.substring(0, slash).trim();
        }
        // IPv6 zone id, as in fe80::1%eth0
        final int percent = address.indexOf('%');
        if (percent >= 0) {
            address = address.substring(0, percent).trim();
        }
        return address.isEmpty() ? null : address.toLowerCase(Locale.ROOT);
    }

    /**
     * @return true if the string is a valid IPv4 or IPv6 literal
     */
    public static boolean isLiteral(final String address) {
        try {
            toBytes(address);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Rewrites an address literal in one canonical spelling: dotted decimal without leading zeros for IPv4,
     * RFC 5952 text for IPv6 (lower-case hex, no leading zeros, the longest run of two or more zero groups
     * collapsed to "::"). IPv4-mapped IPv6 literals come back as "::ffff:" followed by the dotted IPv4 address.
     *
     * @throws IllegalArgumentException if the string is not an address literal
     */
    public static String canonicalize(final String ip) {
        final byte[] bytes = toBytes(ip);
        if (bytes.length == 4) {
            final String dotted = (bytes[0] & 0xff) + "." + (bytes[1] & 0xff) + "." + (bytes[2] & 0xff) + "."
                    + (bytes[3] & 0xff);
            return ip.indexOf(':') >= 0 ? "::ffff:" + dotted : dotted;
        }
        return ipv6ToString(bytes);
    }

    private static String ipv6ToString(final byte[] bytes) {
        final int[] groups = new int[8];
        for (int i = 0; i < 8; i++) {
            groups[i] = ((bytes[2 * i] & 0xff) << 8) | (bytes[2 * i + 1] & 0xff);
        }

        // longest run of zero groups, first one on a tie
        int bestStart = -1;
        int bestLength = 0;
        for (int i = 0; i < 8; ) {
            if (groups[i] != 0) {
                i++;
                continue;
            }
            int end = i;
            while (end < 8 && groups[end] == 0) {
                end++;
            }
            if (end - i > bestLength) {
                bestStart = i;
                bestLength = end - i;
            }
            i = end;
        }
        if (bestLength < 2) {
            bestStart = -1;
        }

        final StringBuilder text = new StringBuilder();
        for (int i = 0; i < 8; i++) {
            if (i == bestStart) {
                text.append("::");
                i += bestLength - 1;
                continue;
            }
            if (text.length() > 0 && text.charAt(text.length() - 1) != ':') {
                text.append(':');
            }
            text.append(Integer.toHexString(groups[i]));
        }
        return text.toString();
    }

    /**
     * Converts an address literal into its 4 or 16 bytes. IPv4-mapped IPv6 literals come back as 4 bytes.
     * Never performs a DNS lookup.
     *
     * @throws IllegalArgumentException if the string is not an address literal
     */
    public static byte[] toBytes(final String ip) {
        if (IPv4_REGEX.matcher(ip).matches()) {
            return ipv4ToBytes(ip);
        }
        // have to do the regex check because if we pass what looks like a hostname, InetAddress.getByName will
        //  launch a DNS search
        if (ip.indexOf(':') >= 0 && IPv6_REGEX.matcher(ip).matches()) {
            try {
                return InetAddress.getByName(ip).getAddress();
            } catch (Exception e) {
                throw new IllegalArgumentException("Invalid IP address: " + ip, e);
            }
        }
        throw new IllegalArgumentException("Not an IP address: " + ip);
    }

    private static byte[] ipv4ToBytes(final String ip) {
        final String[] octets = ip.split("\\.");
        final byte[] addr = new byte[4];
        for (int i = 0; i < 4; i++) {
            final int octet = Integer.parseInt(octets[i]);
            if (octet > 255) {
                throw new IllegalArgumentException("Invalid IP address: " + ip);
            }
            addr[i] = (byte) octet;
        }
        return addr;
    }
}

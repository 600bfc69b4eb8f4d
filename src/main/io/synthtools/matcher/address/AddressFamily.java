package io.synthtools.matcher.address;

import io.synthtools.matcher.ConfigurationException;

import java.util.Locale;

/**
 * IP address family accepted by an address source.
 */
public enum AddressFamily {
    DUAL,
    V4,
    V6;

    /**
     * Classifies an address by syntax: anything containing ':' is IPv6.
     */
    public static AddressFamily of(final String address) {
        return address.indexOf(':') >= 0 ? V6 : V4;
    }

    public boolean accepts(final String address) {
        return this == DUAL || this == of(address);
    }

    /**
     * @param name configuration spelling: dual, ipv4/v4/inet, ipv6/v6/inet6 (any case)
     * @throws ConfigurationException for anything else
     */
    public static AddressFamily fromName(final String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
        case "dual":
            return DUAL;
        case "ipv4":
        case "v4":
        case "inet":
            return V4;
        case "ipv6":
        case "v6":
        case "inet6":
            return V6;
        default:
            throw new ConfigurationException("Unknown address family '" + name + "', expected dual, ipv4 or ipv6");
        }
    }
}

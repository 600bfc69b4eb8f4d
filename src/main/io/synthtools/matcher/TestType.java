package io.synthtools.matcher;

import java.util.Locale;

/**
 * Kinds of synthetic test, by the name the API uses for them.
 */
public enum TestType {
    IP("ip", true),
    NETWORK_GRID("network_grid", true),
    HOSTNAME("hostname", false),
    DNS("dns", false),
    DNS_GRID("dns_grid", false),
    URL("url", false),
    PAGE_LOAD("page_load", false),
    AGENT("agent", false),
    MESH("mesh", false);

    private final String apiName;
    private final boolean derivesTargets;

    TestType(final String apiName, final boolean derivesTargets) {
        this.apiName = apiName;
        this.derivesTargets = derivesTargets;
    }

    public String apiName() {
        return apiName;
    }

    /**
     * @return true if the test measures addresses derived from matched devices; the other kinds either name their
     * target literally or, like mesh, have none
     */
    public boolean derivesTargets() {
        return derivesTargets;
    }

    /**
     * @throws ConfigurationException for an unknown name
     */
    public static TestType fromApiName(final String name) {
        final String wanted = name.toLowerCase(Locale.ROOT).replace('-', '_');
        for (TestType type : values()) {
            if (type.apiName.equals(wanted)) {
                return type;
            }
        }
        throw new ConfigurationException("Unsupported test type '" + name + "'");
    }
}

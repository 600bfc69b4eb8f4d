package io.synthtools.matcher.address;

/**
 * Where target addresses of a matched device come from.
 */
public enum AddressSource {
    INTERFACE_ADDRESSES("interface_addresses"),   // ip_address and secondary_ips of every interface
    SENDING_IPS("sending_ips"),                   // the device's sending_ips list
    SNMP_IP("snmp_ip");                           // the device's snmp_ip

    private final String key;

    AddressSource(final String key) {
        this.key = key;
    }

    /**
     * @return the key that configures this source in a target section
     */
    public String key() {
        return key;
    }
}

package io.synthtools.matcher.address;

import io.synthtools.matcher.ConfigurationException;
import io.synthtools.matcher.inventory.Device;
import io.synthtools.matcher.inventory.InventorySource;
import io.synthtools.matcher.inventory.NetworkInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives target addresses from devices that already passed the device rules.
 * <p>
 * Sources are visited in the order they were configured, devices in the order given. Every collected value is
 * normalized, rewritten in canonical form (only address literals have one), filtered by the source's
 * {@link AddressSelection} and added to an insertion-ordered set. The result is therefore deduplicated on the
 * canonical spelling, with the first occurrence deciding the position.
 */
public final class TargetAddressDeriver {

    private static final Logger log = LoggerFactory.getLogger(TargetAddressDeriver.class);

    private final Map<AddressSource, AddressSelection> sources;

    /**
     * @param sources configured sources in configuration order
     * @throws ConfigurationException if no source is configured
     */
    public TargetAddressDeriver(@Nonnull final Map<AddressSource, AddressSelection> sources) {
        if (sources.isEmpty()) {
            throw new ConfigurationException("At least one address source is required: "
                    + AddressSource.INTERFACE_ADDRESSES.key() + ", " + AddressSource.SENDING_IPS.key() + " or "
                    + AddressSource.SNMP_IP.key());
        }
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
    }

    public Map<AddressSource, AddressSelection> sources() {
        return sources;
    }

    /**
     * @param devices matched devices
     * @param inventory used to fetch interfaces, only when interface addresses are configured
     * @return deduplicated addresses in first-seen order
     * @throws IOException if fetching interfaces fails
     */
    public Set<String> derive(@Nonnull final List<Device> devices, @Nonnull final InventorySource inventory)
            throws IOException {
        final Set<String> addresses = new LinkedHashSet<>();
        for (Map.Entry<AddressSource, AddressSelection> source : sources.entrySet()) {
            final AddressSelection selection = source.getValue();
            int before = addresses.size();
            for (Device device : devices) {
                for (String candidate : collect(source.getKey(), device, inventory)) {
                    add(addresses, candidate, selection, device);
                }
            }
            log.debug("{} contributed {} new address(es) from {} device(s)", source.getKey().key(),
                    addresses.size() - before, devices.size());
        }
        return addresses;
    }

    private static List<String> collect(final AddressSource source, final Device device,
                                        final InventorySource inventory) throws IOException {
        switch (source) {
        case INTERFACE_ADDRESSES:
            final List<String> candidates = new ArrayList<>();
            for (NetworkInterface networkInterface : inventory.listInterfaces(device)) {
                if (networkInterface.ipAddress() != null) {
                    candidates.add(networkInterface.ipAddress());
                }
                candidates.addAll(networkInterface.secondaryIps());
            }
            return candidates;
        case SENDING_IPS:
            return device.sendingIps();
        case SNMP_IP:
            return device.snmpIp() == null
                    ? Collections.<String>emptyList() : Collections.singletonList(device.snmpIp());
        default:
            throw new IllegalStateException("Unsupported address source " + source);
        }
    }

    private static void add(final Set<String> addresses, final String candidate, final AddressSelection selection,
                            final Device device) {
        final String normalized = IPAddress.normalize(candidate);
        if (normalized == null) {
            return;
        }
        final String address;
        try {
            address = IPAddress.canonicalize(normalized);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping '{}' of device {}: not an IP address", candidate, device.id());
            return;
        }
        if (selection.accepts(address)) {
            addresses.add(address);
        }
    }
}

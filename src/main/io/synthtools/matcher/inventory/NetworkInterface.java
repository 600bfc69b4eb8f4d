package io.synthtools.matcher.inventory;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.List;

/**
 * An interface of a {@link Device}, carrying a primary and any number of secondary addresses.
 */
@Immutable
public final class NetworkInterface extends InventoryObject {

    public static final String IP_ADDRESS = "ip_address";
    public static final String SECONDARY_IPS = "secondary_ips";
    static final String SECONDARY_ADDRESS = "address";

    public NetworkInterface(@Nonnull final JsonNode attributes) {
        super(attributes);
    }

    @Nullable
    public String ipAddress() {
        return scalar(IP_ADDRESS);
    }

    /**
     * Secondary addresses are either plain strings or objects of the form {"address": ..., "netmask": ...}.
     *
     * @return the secondary addresses in API order
     */
    public List<String> secondaryIps() {
        final List<String> ips = new ArrayList<>();
        for (JsonNode entry : resolve(SECONDARY_IPS).elements()) {
            if (entry.isObject()) {
                final JsonNode address = entry.get(SECONDARY_ADDRESS);
                if (address != null && address.isValueNode() && !address.isNull()) {
                    ips.add(address.asText());
                }
            } else if (entry.isValueNode() && !entry.isNull()) {
                ips.add(entry.asText());
            }
        }
        return ips;
    }
}

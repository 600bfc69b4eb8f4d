package io.synthtools.matcher.inventory;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.List;

/**
 * A monitored network device.
 */
@Immutable
public final class Device extends InventoryObject {

    public static final String ID = "id";
    public static final String DEVICE_NAME = "device_name";
    public static final String DEVICE_TYPE = "device_type";
    public static final String SENDING_IPS = "sending_ips";
    public static final String SNMP_IP = "snmp_ip";

    public Device(@Nonnull final JsonNode attributes) {
        super(attributes);
    }

    @Nullable
    public String id() {
        return scalar(ID);
    }

    @Nullable
    public String deviceName() {
        return scalar(DEVICE_NAME);
    }

    @Nullable
    public String deviceType() {
        return scalar(DEVICE_TYPE);
    }

    /**
     * @return the sending IPs in API order; a single scalar is accepted as a one-element list
     */
    public List<String> sendingIps() {
        final List<String> ips = new ArrayList<>();
        for (JsonNode ip : resolve(SENDING_IPS).elements()) {
            if (ip.isValueNode() && !ip.isNull()) {
                ips.add(ip.asText());
            }
        }
        return ips;
    }

    @Nullable
    public String snmpIp() {
        return scalar(SNMP_IP);
    }
}

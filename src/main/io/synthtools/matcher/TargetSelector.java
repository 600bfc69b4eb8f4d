package io.synthtools.matcher;

import com.fasterxml.jackson.databind.JsonNode;
import io.synthtools.matcher.address.AddressSelection;
import io.synthtools.matcher.address.AddressSource;
import io.synthtools.matcher.address.TargetAddressDeriver;
import io.synthtools.matcher.inventory.Device;
import io.synthtools.matcher.inventory.InventorySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Selects test targets from the device inventory. Compiled from a target section such as
 *   {
 *     "devices": [ { "device_type": "router" }, { "site.site_name": { "regex": "^DC" } } ],
 *     "interface_addresses": { "family": "ipv4", "public_only": true },
 *     "sending_ips": {},
 *     "limit": 20
 *   }
 * Devices are matched with the compiled "devices" rule list, then every configured address source contributes
 * addresses of the matched devices. The section-level "limit" truncates the deduplicated address list.
 */
@Immutable
public final class TargetSelector {

    private static final Logger log = LoggerFactory.getLogger(TargetSelector.class);

    private final RuleSet deviceRules;
    private final TargetAddressDeriver deriver;
    private final Integer limit;

    public TargetSelector(@Nonnull final RuleSet deviceRules, @Nonnull final TargetAddressDeriver deriver,
                          @Nullable final Integer limit) {
        if (limit != null && limit < 1) {
            throw new ConfigurationException("'" + Constants.LIMIT + "' must be a positive integer, got " + limit);
        }
        this.deviceRules = deviceRules;
        this.deriver = deriver;
        this.limit = limit;
    }

    public static TargetSelector compile(@Nonnull final JsonNode section) {
        return compile(section, Configuration.defaults());
    }

    /**
     * @param section the target section
     * @param configuration engine configuration
     * @return the selector
     * @throws ConfigurationException if the section is malformed or configures no address source
     */
    public static TargetSelector compile(@Nonnull final JsonNode section, @Nonnull final Configuration configuration) {
        if (!section.isObject()) {
            throw new ConfigurationException("Target section must be an object");
        }
        final JsonNode devices = section.get(Constants.DEVICES);
        if (devices == null) {
            throw new ConfigurationException("Target section has no '" + Constants.DEVICES + "' rule list");
        }
        final RuleSet deviceRules = JsonRuleCompiler.compile(devices, configuration);

        final Map<AddressSource, AddressSelection> sources = new LinkedHashMap<>();
        Integer limit = null;
        final Iterator<Map.Entry<String, JsonNode>> fields = section.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            final String key = field.getKey();
            if (Constants.DEVICES.equals(key)) {
                continue;
            }
            if (Constants.isLimitKey(key)) {
                limit = JsonRuleCompiler.parseLimit(field.getValue());
                continue;
            }
            final AddressSource source = sourceFor(key);
            sources.put(source, AddressSelection.fromJson(field.getValue(), configuration.getDefaultFamily()));
        }
        return new TargetSelector(deviceRules, new TargetAddressDeriver(sources), limit);
    }

    private static AddressSource sourceFor(final String key) {
        for (AddressSource source : AddressSource.values()) {
            if (source.key().equals(key)) {
                return source;
            }
        }
        throw new ConfigurationException("Unknown key '" + key + "' in target section");
    }

    public RuleSet deviceRules() {
        return deviceRules;
    }

    @Nullable
    public Integer limit() {
        return limit;
    }

    /**
     * @param inventory device and interface inventory
     * @return target addresses, deduplicated, in first-seen order, at most limit of them
     * @throws IOException if the inventory cannot be fetched
     */
    public List<String> select(@Nonnull final InventorySource inventory) throws IOException {
        final List<Device> all = inventory.listDevices();
        final List<Device> matched = deviceRules.select(all);
        log.debug("{} of {} device(s) matched", matched.size(), all.size());

        final List<String> addresses = RuleSet.truncate(new ArrayList<>(deriver.derive(matched, inventory)), limit);
        if (addresses.isEmpty()) {
            log.warn("No target addresses selected ({} device(s) matched)", matched.size());
        } else {
            log.info("Selected {} target address(es) from {} device(s)", addresses.size(), matched.size());
        }
        return addresses;
    }
}

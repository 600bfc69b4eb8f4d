package io.synthtools.matcher.inventory;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the inventory that rules are evaluated against. Implementations talk to the API; every call returns a
 * fully materialized list, and their errors reach the caller unchanged.
 */
public interface InventorySource {

    List<Device> listDevices() throws IOException;

    List<NetworkInterface> listInterfaces(Device device) throws IOException;

    List<Agent> listAgents() throws IOException;
}

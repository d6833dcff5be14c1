package com.microsoft.cloudgovernance.analysis;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Abbreviations expected at the start of resource names, keyed by lower-case ARM type.
 *
 * Based on the Cloud Adoption Framework abbreviation list.
 */
final class ResourceTypePrefixes {

    private static final Map<String, List<String>> PREFIXES = Map.ofEntries(
            Map.entry("microsoft.compute/virtualmachines", List.of("vm")),
            Map.entry("microsoft.compute/disks", List.of("disk", "osdisk")),
            Map.entry("microsoft.storage/storageaccounts", List.of("st", "stor", "storage")),
            Map.entry("microsoft.network/virtualnetworks", List.of("vnet")),
            Map.entry("microsoft.network/networkinterfaces", List.of("nic")),
            Map.entry("microsoft.network/networksecuritygroups", List.of("nsg")),
            Map.entry("microsoft.network/publicipaddresses", List.of("pip")),
            Map.entry("microsoft.network/loadbalancers", List.of("lb", "lbi", "lbe")),
            Map.entry("microsoft.web/sites", List.of("app", "web", "func")),
            Map.entry("microsoft.web/serverfarms", List.of("plan", "asp")),
            Map.entry("microsoft.sql/servers", List.of("sql")),
            Map.entry("microsoft.sql/servers/databases", List.of("sqldb")),
            Map.entry("microsoft.keyvault/vaults", List.of("kv", "vault")),
            Map.entry("microsoft.containerregistry/registries", List.of("cr", "acr")),
            Map.entry("microsoft.containerservice/managedclusters", List.of("aks"))
    );

    private ResourceTypePrefixes() {
    }

    /**
     * Expected prefixes for the type, or an empty list when the type has no convention.
     */
    static List<String> forType(String resourceType) {
        if (resourceType == null) {
            return List.of();
        }
        return PREFIXES.getOrDefault(resourceType.toLowerCase(Locale.ROOT), List.of());
    }

    static boolean hasExpectedPrefix(String name, List<String> prefixes) {
        String lower = name.toLowerCase(Locale.ROOT);
        return prefixes.stream().anyMatch(lower::startsWith);
    }
}

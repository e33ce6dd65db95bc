package io.meshview.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public record Device(
        String id,
        String hostname,
        String dnsName,
        List<String> addresses,
        String os,
        boolean online,
        Instant lastSeen,
        boolean exitNodeCapable,
        ExitNodeStatus exitNodeStatus,
        Set<String> advertisedRoutes,
        Set<String> allowedRoutes,
        Set<String> tags,
        RemoteDetails remote
) {
    public Device {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("device id cannot be empty");
        }
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
        advertisedRoutes = advertisedRoutes == null ? Set.of() : sortedCopy(advertisedRoutes);
        allowedRoutes = allowedRoutes == null ? Set.of() : sortedCopy(allowedRoutes);
        tags = tags == null ? Set.of() : sortedCopy(tags);
        exitNodeStatus = exitNodeStatus == null ? ExitNodeStatus.DISABLED : exitNodeStatus;
    }

    public String primaryAddress() {
        return addresses.isEmpty() ? null : addresses.get(0);
    }

    public boolean subnetRouter() {
        for (String route : advertisedRoutes) {
            if (!Cidr.isDefaultRoute(route)) {
                return true;
            }
        }
        return false;
    }

    public Device withRemote(RemoteDetails details, Set<String> remoteTags) {
        Set<String> mergedTags = new TreeSet<>(tags);
        if (remoteTags != null) {
            mergedTags.addAll(remoteTags);
        }
        return new Device(
                id,
                hostname,
                dnsName,
                addresses,
                os,
                online,
                lastSeen,
                exitNodeCapable,
                exitNodeStatus,
                advertisedRoutes,
                allowedRoutes,
                mergedTags,
                details
        );
    }

    private static Set<String> sortedCopy(Set<String> values) {
        return Collections.unmodifiableSet(new TreeSet<>(values));
    }
}

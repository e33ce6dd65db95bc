package io.meshview.parse;

import io.meshview.model.Cidr;
import io.meshview.model.Device;
import io.meshview.model.ExitNodeStatus;
import io.meshview.model.SelfDevice;
import io.meshview.model.Snapshot;
import io.meshview.model.SourceMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

public final class StatusNormalizer {
    private static final Logger log = LoggerFactory.getLogger(StatusNormalizer.class);
    private static final Instant ZERO_TIME = Instant.parse("0001-01-01T00:00:00Z");

    private final Clock clock;

    public StatusNormalizer() {
        this(Clock.systemUTC());
    }

    public StatusNormalizer(Clock clock) {
        this.clock = clock;
    }

    public Snapshot normalize(RawStatus raw) {
        RawStatus.Node rawSelf = raw.self();
        Device selfDevice = toDevice(rawSelf);
        String activeExitNodeId = null;
        Map<String, Device> peers = new LinkedHashMap<>();
        for (Map.Entry<String, RawStatus.Node> entry : raw.peersOrEmpty().entrySet()) {
            RawStatus.Node node = entry.getValue();
            if (selfDevice.id().equals(node.id())) {
                log.debug("Dropping peer entry {} that repeats the self device", entry.getKey());
                continue;
            }
            Device device = toDevice(node);
            if (peers.put(device.id(), device) != null) {
                log.warn("Agent reported peer id {} more than once; keeping the last entry", device.id());
            }
            if (Boolean.TRUE.equals(node.exitNode())) {
                activeExitNodeId = device.id();
            }
        }
        SelfDevice self = new SelfDevice(
                selfDevice,
                Boolean.TRUE.equals(rawSelf.exitNodeOption()),
                raw.backendState(),
                raw.version(),
                trimDot(raw.magicDnsSuffix()),
                activeExitNodeId,
                rawSelf.txBytes() == null ? 0L : rawSelf.txBytes(),
                rawSelf.rxBytes() == null ? 0L : rawSelf.rxBytes()
        );
        return new Snapshot(self, peers, clock.instant(), SourceMode.LOCAL_ONLY, 0L, false, null);
    }

    static Device toDevice(RawStatus.Node node) {
        boolean exitNodeOption = Boolean.TRUE.equals(node.exitNodeOption());
        List<String> addresses = new ArrayList<>();
        Set<String> ownHostRoutes = new TreeSet<>();
        // A logged-out agent reports its own addresses as null.
        List<String> ips = node.tailscaleIps() == null ? List.of() : node.tailscaleIps();
        for (String ip : ips) {
            String canonical = Cidr.canonical(ip);
            ownHostRoutes.add(canonical);
            addresses.add(canonical.substring(0, canonical.indexOf('/')));
        }

        Set<String> allowedAll = Cidr.canonicalSet(node.allowedIps());
        Set<String> allowed = new TreeSet<>(allowedAll);
        allowed.removeAll(ownHostRoutes);

        Set<String> advertised;
        if (node.advertisedRoutes() != null) {
            advertised = Cidr.canonicalSet(node.advertisedRoutes());
        } else {
            advertised = new TreeSet<>(Cidr.canonicalSet(node.primaryRoutes()));
            if (exitNodeOption) {
                for (String route : allowedAll) {
                    if (Cidr.isDefaultRoute(route)) {
                        advertised.add(route);
                    }
                }
            }
        }
        boolean advertisesDefault = false;
        for (String route : advertised) {
            if (Cidr.isDefaultRoute(route)) {
                advertisesDefault = true;
                break;
            }
        }

        return new Device(
                node.id(),
                node.hostName(),
                trimDot(node.dnsName()),
                addresses,
                node.os() == null ? "" : node.os(),
                Boolean.TRUE.equals(node.online()),
                lastSeen(node.lastSeen()),
                exitNodeOption || advertisesDefault,
                ExitNodeStatus.classify(exitNodeOption, allowedAll),
                advertised,
                allowed,
                node.tags() == null ? Set.of() : new TreeSet<>(node.tags()),
                null
        );
    }

    private static Instant lastSeen(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        Instant parsed = Instant.parse(raw);
        return parsed.equals(ZERO_TIME) ? null : parsed;
    }

    private static String trimDot(String name) {
        if (name == null) {
            return "";
        }
        return name.endsWith(".") ? name.substring(0, name.length() - 1) : name;
    }
}

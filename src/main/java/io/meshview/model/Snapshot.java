package io.meshview.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public record Snapshot(
        SelfDevice self,
        Map<String, Device> peers,
        Instant capturedAt,
        SourceMode sourceMode,
        long generation,
        boolean stale,
        String staleReason
) {
    public Snapshot {
        if (self == null) {
            throw new IllegalArgumentException("snapshot self cannot be null");
        }
        if (capturedAt == null) {
            throw new IllegalArgumentException("snapshot capturedAt cannot be null");
        }
        TreeMap<String, Device> copy = new TreeMap<>();
        if (peers != null) {
            for (Map.Entry<String, Device> entry : peers.entrySet()) {
                Device device = entry.getValue();
                if (device == null || !device.id().equals(entry.getKey())) {
                    throw new IllegalArgumentException("peer map key does not match device id: " + entry.getKey());
                }
                if (device.id().equals(self.id())) {
                    throw new IllegalArgumentException("peers cannot contain the self device: " + device.id());
                }
                copy.put(entry.getKey(), device);
            }
        }
        peers = Collections.unmodifiableMap(copy);
        sourceMode = sourceMode == null ? SourceMode.LOCAL_ONLY : sourceMode;
        staleReason = stale ? staleReason : null;
    }

    public Snapshot withGeneration(long nextGeneration) {
        return new Snapshot(self, peers, capturedAt, sourceMode, nextGeneration, false, null);
    }

    public Snapshot asStale(String reason) {
        String safeReason = reason == null || reason.isBlank() ? "refresh failed" : reason;
        return new Snapshot(self, peers, capturedAt, sourceMode, generation, true, safeReason);
    }

    public Snapshot withAugmentation(SelfDevice augmentedSelf, Map<String, Device> augmentedPeers) {
        return new Snapshot(augmentedSelf, augmentedPeers, capturedAt, SourceMode.AUGMENTED, generation, stale, staleReason);
    }

    public Optional<Device> activeExitNode() {
        String id = self.activeExitNodeId();
        return id == null ? Optional.empty() : Optional.ofNullable(peers.get(id));
    }

    public List<Device> exitNodeCapablePeers() {
        List<Device> out = new ArrayList<>();
        for (Device peer : peers.values()) {
            if (peer.exitNodeCapable()) {
                out.add(peer);
            }
        }
        return out;
    }

    public List<Device> subnetRouters() {
        List<Device> out = new ArrayList<>();
        if (self.device().subnetRouter()) {
            out.add(self.device());
        }
        for (Device peer : peers.values()) {
            if (peer.subnetRouter()) {
                out.add(peer);
            }
        }
        return out;
    }

    public int onlinePeerCount() {
        int count = 0;
        for (Device peer : peers.values()) {
            if (peer.online()) {
                count++;
            }
        }
        return count;
    }
}

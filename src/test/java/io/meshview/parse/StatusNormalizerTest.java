package io.meshview.parse;

import io.meshview.model.Device;
import io.meshview.model.ExitNodeStatus;
import io.meshview.model.SelfDevice;
import io.meshview.model.Snapshot;
import io.meshview.model.SourceMode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

final class StatusNormalizerTest {
    private static final Instant NOW = Instant.parse("2026-10-18T10:00:00Z");

    private final StatusNormalizer normalizer = new StatusNormalizer(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void selfIsNormalizedWithTrafficAndExitNodeState() throws Exception {
        Snapshot snapshot = normalizer.normalize(new StatusParser().parse(StatusParserTest.fixture("/agent/status-basic.json")));

        SelfDevice self = snapshot.self();
        Device device = self.device();
        Assertions.assertEquals("nSelf1CNTRL", self.id());
        Assertions.assertEquals("laptop.tail1234.ts.net", device.dnsName());
        Assertions.assertEquals("tail1234.ts.net", self.magicDnsSuffix());
        Assertions.assertEquals(List.of("100.64.0.1", "fd7a:115c:a1e0::1"), device.addresses());
        Assertions.assertEquals("100.64.0.1", device.primaryAddress());
        Assertions.assertNull(device.lastSeen());
        Assertions.assertTrue(self.exitNodeOption());
        Assertions.assertEquals(ExitNodeStatus.ACTIVE, device.exitNodeStatus());
        Assertions.assertTrue(device.exitNodeCapable());
        Assertions.assertEquals(Set.of("0.0.0.0/0", "::/0"), device.allowedRoutes());
        Assertions.assertEquals(Set.of("0.0.0.0/0", "192.168.10.0/24", "::/0"), device.advertisedRoutes());
        Assertions.assertTrue(device.subnetRouter());
        Assertions.assertEquals(1024L, self.txBytes());
        Assertions.assertEquals(2048L, self.rxBytes());
        Assertions.assertEquals("Running", self.backendState());
        Assertions.assertEquals("1.66.4-t2b9d5a8c3", self.agentVersion());
    }

    @Test
    void peersAreKeyedByDeviceIdWithTriStateExitStatus() throws Exception {
        Snapshot snapshot = normalizer.normalize(new StatusParser().parse(StatusParserTest.fixture("/agent/status-basic.json")));

        Assertions.assertEquals(List.of("nPeerA", "nPeerB", "nPeerC"), List.copyOf(snapshot.peers().keySet()));

        Device exitBox = snapshot.peers().get("nPeerA");
        Assertions.assertEquals(ExitNodeStatus.ACTIVE, exitBox.exitNodeStatus());
        Assertions.assertEquals(Instant.parse("2026-10-18T09:00:00Z"), exitBox.lastSeen());

        Device nas = snapshot.peers().get("nPeerB");
        Assertions.assertEquals(ExitNodeStatus.DISABLED, nas.exitNodeStatus());
        Assertions.assertFalse(nas.exitNodeCapable());
        Assertions.assertFalse(nas.online());
        Assertions.assertEquals(Set.of("10.1.2.0/24"), nas.advertisedRoutes());
        Assertions.assertEquals(Set.of("10.1.2.0/24"), nas.allowedRoutes());
        Assertions.assertEquals(Set.of("tag:server"), nas.tags());

        Device phone = snapshot.peers().get("nPeerC");
        Assertions.assertEquals(ExitNodeStatus.PENDING, phone.exitNodeStatus());
        Assertions.assertTrue(phone.exitNodeCapable());
        Assertions.assertTrue(phone.advertisedRoutes().isEmpty());
    }

    @Test
    void snapshotIsLocalOnlyUnstampedAndDerivesExitNodeViews() throws Exception {
        Snapshot snapshot = normalizer.normalize(new StatusParser().parse(StatusParserTest.fixture("/agent/status-basic.json")));

        Assertions.assertEquals(SourceMode.LOCAL_ONLY, snapshot.sourceMode());
        Assertions.assertEquals(0L, snapshot.generation());
        Assertions.assertFalse(snapshot.stale());
        Assertions.assertEquals(NOW, snapshot.capturedAt());
        Assertions.assertEquals("nPeerA", snapshot.self().activeExitNodeId());
        Assertions.assertEquals("exit-box", snapshot.activeExitNode().orElseThrow().hostname());
        Assertions.assertEquals(List.of("nPeerA", "nPeerC"),
                snapshot.exitNodeCapablePeers().stream().map(Device::id).toList());
        Assertions.assertEquals(List.of("nSelf1CNTRL", "nPeerB"),
                snapshot.subnetRouters().stream().map(Device::id).toList());
        Assertions.assertEquals(2, snapshot.onlinePeerCount());
    }

    @Test
    void loggedOutAgentNormalizesToSelfWithoutAddresses() throws Exception {
        String json = """
                {"BackendState": "NeedsLogin", "Self": {"ID": "n1", "HostName": "laptop", "TailscaleIPs": null}}
                """;
        Snapshot snapshot = normalizer.normalize(new StatusParser().parse(json.getBytes(StandardCharsets.UTF_8)));

        Assertions.assertEquals("NeedsLogin", snapshot.self().backendState());
        Assertions.assertTrue(snapshot.self().device().addresses().isEmpty());
        Assertions.assertNull(snapshot.self().device().primaryAddress());
        Assertions.assertTrue(snapshot.peers().isEmpty());
    }

    @Test
    void peerRepeatingSelfIsDropped() throws Exception {
        String json = """
                {
                  "Self": {"ID": "n1", "HostName": "me", "TailscaleIPs": ["100.64.0.1"]},
                  "Peer": {
                    "nodekey:me": {"ID": "n1", "HostName": "me", "TailscaleIPs": ["100.64.0.1"]},
                    "nodekey:other": {"ID": "n2", "HostName": "other", "TailscaleIPs": ["100.64.0.2"]}
                  }
                }
                """;
        Snapshot snapshot = normalizer.normalize(new StatusParser().parse(json.getBytes(StandardCharsets.UTF_8)));

        Assertions.assertEquals(Set.of("n2"), snapshot.peers().keySet());
        Assertions.assertNull(snapshot.self().activeExitNodeId());
        Assertions.assertTrue(snapshot.activeExitNode().isEmpty());
        Assertions.assertEquals("", snapshot.self().device().os());
    }

    @Test
    void explicitAdvertisedRoutesWinOverPrimaryRoutes() throws Exception {
        String json = """
                {
                  "Self": {
                    "ID": "n1", "HostName": "router", "TailscaleIPs": ["100.64.0.1"],
                    "AllowedIPs": ["100.64.0.1/32"],
                    "PrimaryRoutes": [],
                    "AdvertisedRoutes": ["10.9.8.7/16", "0.0.0.0/0"]
                  }
                }
                """;
        Device device = normalizer.normalize(new StatusParser().parse(json.getBytes(StandardCharsets.UTF_8))).self().device();

        Assertions.assertEquals(Set.of("0.0.0.0/0", "10.9.0.0/16"), device.advertisedRoutes());
        Assertions.assertTrue(device.exitNodeCapable());
        Assertions.assertEquals(ExitNodeStatus.DISABLED, device.exitNodeStatus());
        Assertions.assertTrue(device.allowedRoutes().isEmpty());
    }
}

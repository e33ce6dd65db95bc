package io.meshview.cli;

import io.meshview.config.MeshViewConfig;
import io.meshview.config.MeshViewSettings;
import io.meshview.model.Device;
import io.meshview.model.Snapshot;
import io.meshview.runtime.MeshViewRuntime;
import io.meshview.runtime.SnapshotUnavailableException;
import io.meshview.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "meshview",
        mixinStandardHelpOptions = true,
        description = "Cached view of the local overlay agent's device and peer state",
        subcommands = {
                MeshViewCommand.StatusCommand.class,
                MeshViewCommand.PeersCommand.class,
                MeshViewCommand.ExitNodeCommand.class,
                MeshViewCommand.WatchCommand.class,
                MeshViewCommand.SettingsCommand.class
        }
)
public final class MeshViewCommand implements Runnable {
    static final int EXIT_UNAVAILABLE = 2;

    @Option(names = {"--root"}, description = "Directory holding meshview-settings.json", defaultValue = MeshViewConfig.DEFAULT_ROOT)
    String root;

    @Option(names = {"--refresh"}, description = "Bypass the cache for this read")
    boolean refresh;

    PrintStream out = System.out;

    @Override
    public void run() {
        out.println("Use subcommands: status | peers | exit-node | watch | settings");
    }

    MeshViewSettings settings() {
        return MeshViewSettings.load(MeshViewConfig.fromRoot(root), System.getenv());
    }

    MeshViewRuntime runtime() {
        return new MeshViewRuntime(settings());
    }

    int readOnce(SnapshotView view) {
        try (MeshViewRuntime runtime = runtime()) {
            Snapshot snapshot = refresh ? runtime.liveSnapshot() : runtime.snapshot();
            out.println(Jsons.toJson(view.render(snapshot)));
            return 0;
        } catch (SnapshotUnavailableException e) {
            out.println(Jsons.toJson(new Unavailable(false, e.getMessage())));
            return EXIT_UNAVAILABLE;
        }
    }

    interface SnapshotView {
        Object render(Snapshot snapshot);
    }

    record Unavailable(boolean available, String error) {
    }

    record DeviceSummary(
            String id,
            String hostname,
            String address,
            String os,
            boolean online,
            String exitNodeStatus
    ) {
        static DeviceSummary of(Device device) {
            return new DeviceSummary(
                    device.id(),
                    device.hostname(),
                    device.primaryAddress(),
                    device.os(),
                    device.online(),
                    device.exitNodeStatus().label()
            );
        }
    }

    record ExitNodeReport(
            String selfExitNodeStatus,
            boolean selfExitNodeOption,
            DeviceSummary activeExitNode,
            List<DeviceSummary> exitNodeCapablePeers,
            List<DeviceSummary> subnetRouters,
            String sourceMode,
            long generation,
            boolean stale,
            String staleReason
    ) {
        static ExitNodeReport of(Snapshot snapshot) {
            return new ExitNodeReport(
                    snapshot.self().device().exitNodeStatus().label(),
                    snapshot.self().exitNodeOption(),
                    snapshot.activeExitNode().map(DeviceSummary::of).orElse(null),
                    summaries(snapshot.exitNodeCapablePeers()),
                    summaries(snapshot.subnetRouters()),
                    snapshot.sourceMode().label(),
                    snapshot.generation(),
                    snapshot.stale(),
                    snapshot.staleReason()
            );
        }
    }

    static List<DeviceSummary> summaries(List<Device> devices) {
        List<DeviceSummary> rows = new ArrayList<>(devices.size());
        for (Device device : devices) {
            rows.add(DeviceSummary.of(device));
        }
        return rows;
    }

    static String summaryLine(Snapshot snapshot) {
        return String.format(
                "generation=%d peers=%d online=%d mode=%s exit-node=%s%s",
                snapshot.generation(),
                snapshot.peers().size(),
                snapshot.onlinePeerCount(),
                snapshot.sourceMode().label(),
                snapshot.self().device().exitNodeStatus().label(),
                snapshot.stale() ? " STALE(" + snapshot.staleReason() + ")" : ""
        );
    }

    @Command(name = "status", description = "Print the full snapshot")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        MeshViewCommand parent;

        @Override
        public Integer call() {
            return parent.readOnce(snapshot -> snapshot);
        }
    }

    @Command(name = "peers", description = "List peers")
    static final class PeersCommand implements Callable<Integer> {
        @ParentCommand
        MeshViewCommand parent;

        @Option(names = {"--online"}, description = "Only peers that are currently online")
        boolean onlineOnly;

        @Override
        public Integer call() {
            return parent.readOnce(snapshot -> {
                List<Device> selected = new ArrayList<>();
                for (Device peer : snapshot.peers().values()) {
                    if (!onlineOnly || peer.online()) {
                        selected.add(peer);
                    }
                }
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("generation", snapshot.generation());
                body.put("sourceMode", snapshot.sourceMode().label());
                body.put("stale", snapshot.stale());
                body.put("peers", selected);
                return body;
            });
        }
    }

    @Command(name = "exit-node", description = "Exit-node status, active exit node, exit-node and subnet routers")
    static final class ExitNodeCommand implements Callable<Integer> {
        @ParentCommand
        MeshViewCommand parent;

        @Override
        public Integer call() {
            return parent.readOnce(ExitNodeReport::of);
        }
    }

    @Command(name = "watch", description = "Keep the cache warm and print one line per new generation")
    static final class WatchCommand implements Callable<Integer> {
        @ParentCommand
        MeshViewCommand parent;

        @Option(names = {"--count"}, description = "Stop after this many generations (0 = until interrupted)", defaultValue = "0")
        int count;

        @Option(names = {"--poll-ms"}, description = "How often to look for a new generation", defaultValue = "250")
        long pollMs;

        @Override
        public Integer call() throws InterruptedException {
            try (MeshViewRuntime runtime = parent.runtime()) {
                runtime.startBackgroundRefresh();
                long lastGeneration = 0L;
                boolean lastStale = false;
                int printed = 0;
                while (count <= 0 || printed < count) {
                    Snapshot current = runtime.cache().current().orElse(null);
                    if (current != null && (current.generation() != lastGeneration || current.stale() != lastStale)) {
                        parent.out.println(summaryLine(current));
                        lastGeneration = current.generation();
                        lastStale = current.stale();
                        printed++;
                    }
                    Thread.sleep(Math.max(10L, pollMs));
                }
                return 0;
            }
        }
    }

    @Command(name = "settings", description = "Print effective settings (secrets masked)")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        MeshViewCommand parent;

        @Override
        public Integer call() {
            parent.out.println(Jsons.toJson(parent.settings().toView()));
            return 0;
        }
    }
}

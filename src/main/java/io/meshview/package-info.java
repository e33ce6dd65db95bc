/**
 * MeshView source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.meshview.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.meshview.runtime.MeshViewRuntime} wires the cache, refresh threads and background refresher.</li>
 *   <li>{@code io.meshview.runtime.SnapshotCache} is the single-flight, stale-serving snapshot cache.</li>
 *   <li>{@code io.meshview.agent.AgentCommandExecutor} is the only place that spawns the agent CLI.</li>
 * </ul>
 */
package io.meshview;

/**
 * Refresh orchestration package.
 *
 * <p>{@link io.meshview.runtime.SnapshotCache} owns freshness, request coalescing,
 * retries and stale-serving; {@link io.meshview.runtime.AgentSnapshotLoader} does
 * one refresh's external work; {@link io.meshview.runtime.BackgroundRefresher}
 * keeps the cache warm between reads.
 */
package io.meshview.runtime;

// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.metrics.runtime.core.MetricCell;
import org.hiero.metrics.runtime.core.MetricIdentity;
import org.hiero.metrics.runtime.core.MetricRegistry;
import org.hiero.metrics.runtime.core.ProxyRegistration;
import org.hiero.metrics.runtime.core.SnapshotEntry;

/**
 * Produces {@link Snapshot}s of a registry.
 * <p>
 * A snapshot walks the set of cells present when the walk begins, reads each one and then invokes every registered
 * proxy exactly once. Writers are never blocked, each cell read is a plain atomic read. A proxy that throws is
 * logged and contributes no entries. Walks of the same controller are serialized.
 */
public final class Controller {

    private static final Logger logger = LogManager.getLogger(Controller.class);

    private static final Comparator<SnapshotEntry> ENTRY_ORDER = Comparator.comparing(SnapshotEntry::identity);

    private final MetricRegistry registry;

    Controller(@NonNull MetricRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Take a snapshot synchronously.
     *
     * @return new immutable snapshot
     */
    @NonNull
    public Snapshot snapshot() {
        return Objects.requireNonNull(collect(() -> false));
    }

    /**
     * Take a snapshot on the given executor. Cancelling the returned future stops the walk at the next cell
     * or proxy and discards the partial result; the registry is never left locked.
     *
     * @param executor executor to run the walk on
     * @return future completed with the snapshot
     */
    @NonNull
    public CompletableFuture<Snapshot> snapshotAsync(@NonNull Executor executor) {
        Objects.requireNonNull(executor, "executor must not be null");
        CompletableFuture<Snapshot> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                if (future.isDone()) {
                    return;
                }
                try {
                    Snapshot snapshot = collect(future::isCancelled);
                    if (snapshot != null) {
                        future.complete(snapshot);
                    }
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * @return snapshot, or {@code null} if cancelled
     */
    @Nullable
    private synchronized Snapshot collect(BooleanSupplier cancelled) {
        List<SnapshotEntry> entries = new ArrayList<>(registry.size());
        for (Map.Entry<MetricIdentity, MetricCell> cell : registry.cells().entrySet()) {
            if (cancelled.getAsBoolean()) {
                logger.debug("Snapshot cancelled after {} entries", entries.size());
                return null;
            }
            entries.add(new SnapshotEntry(cell.getKey(), cell.getValue().measure()));
        }
        for (ProxyRegistration proxy : registry.proxies()) {
            if (cancelled.getAsBoolean()) {
                logger.debug("Snapshot cancelled after {} entries", entries.size());
                return null;
            }
            try {
                entries.addAll(proxy.invoke());
            } catch (RuntimeException e) {
                logger.warn("Proxy {} failed, its measurements are skipped", proxy.scope().qualify(proxy.prefix()), e);
            }
        }
        // stable sort keeps production order of proxy entries with equal identities
        entries.sort(ENTRY_ORDER);
        return new Snapshot(entries);
    }
}

// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.metrics.runtime.config.ReceiverConfig;

/**
 * Thread-safe store of {@link MetricCell}s by {@link MetricIdentity} and of registered proxies.
 * <p>
 * Exactly one cell ever exists per identity: concurrent first-time requests for the same identity
 * are coordinated by the map, after creation lookups are lock-free reads.
 * Cells are never removed for the life of the registry.
 */
public final class MetricRegistry {

    private static final Logger logger = LogManager.getLogger(MetricRegistry.class);

    private final int histogramPrecisionBits;
    private final int histogramShards;
    private final double[] quantiles;

    private final Map<MetricIdentity, MetricCell> cells;
    private final Map<MetricIdentity, MetricCell> cellsView;
    private final List<ProxyRegistration> proxies = new CopyOnWriteArrayList<>();

    /**
     * @param config receiver configuration supplying capacity and histogram options
     */
    public MetricRegistry(@NonNull ReceiverConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.histogramPrecisionBits = config.histogramPrecisionBits();
        this.histogramShards = config.histogramShards();
        this.quantiles = config.quantilesArray();
        this.cells = new ConcurrentHashMap<>(config.capacityHint());
        this.cellsView = Collections.unmodifiableMap(cells);
    }

    /**
     * Get the cell bound to the identity, creating a cell of the requested kind if none exists.
     *
     * @param identity the metric identity
     * @param kind     the requested kind
     * @return the cell, of the requested kind
     * @throws KindMismatchException if the identity is already bound to a cell of another kind
     */
    @NonNull
    public MetricCell getOrCreate(@NonNull MetricIdentity identity, @NonNull MetricKind kind) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(kind, "kind must not be null");

        MetricCell cell = cells.get(identity);
        if (cell == null) {
            cell = cells.computeIfAbsent(identity, id -> {
                logger.debug("Creating {} for metric: {}", kind, id);
                return createCell(kind);
            });
        }
        if (cell.kind() != kind) {
            throw new KindMismatchException(identity, cell.kind(), kind);
        }
        return cell;
    }

    /**
     * @see #getOrCreate(MetricIdentity, MetricKind)
     */
    @NonNull
    public Counter counter(@NonNull MetricIdentity identity) {
        return (Counter) getOrCreate(identity, MetricKind.COUNTER);
    }

    /**
     * @see #getOrCreate(MetricIdentity, MetricKind)
     */
    @NonNull
    public Gauge gauge(@NonNull MetricIdentity identity) {
        return (Gauge) getOrCreate(identity, MetricKind.GAUGE);
    }

    /**
     * @see #getOrCreate(MetricIdentity, MetricKind)
     */
    @NonNull
    public Histogram histogram(@NonNull MetricIdentity identity) {
        return (Histogram) getOrCreate(identity, MetricKind.HISTOGRAM);
    }

    /**
     * @param identity the metric identity
     * @return the existing cell or {@code null}, never creates a cell
     */
    @Nullable
    public MetricCell find(@NonNull MetricIdentity identity) {
        return cells.get(Objects.requireNonNull(identity, "identity must not be null"));
    }

    /**
     * Register a proxy. Several producers may be registered under the same scope and prefix,
     * all of them are invoked and their outputs concatenated.
     *
     * @param scope    scope of produced measurements
     * @param prefix   name prefix of produced measurements
     * @param producer the producer
     */
    public void registerProxy(@NonNull Scope scope, @NonNull String prefix, @NonNull MetricProducer producer) {
        ProxyRegistration registration = new ProxyRegistration(scope, prefix, producer);
        proxies.add(registration);
        logger.debug("Registered proxy: {}", scope.qualify(prefix));
    }

    /**
     * @return live unmodifiable view of all cells, iteration is weakly consistent
     */
    @NonNull
    public Map<MetricIdentity, MetricCell> cells() {
        return cellsView;
    }

    /**
     * @return immutable copy of registered proxies in registration order
     */
    @NonNull
    public List<ProxyRegistration> proxies() {
        return List.copyOf(proxies);
    }

    /**
     * @return number of cells
     */
    public int size() {
        return cells.size();
    }

    private MetricCell createCell(MetricKind kind) {
        return switch (kind) {
            case COUNTER -> new Counter();
            case GAUGE -> new Gauge();
            case HISTOGRAM -> new Histogram(histogramPrecisionBits, histogramShards, quantiles);
        };
    }
}

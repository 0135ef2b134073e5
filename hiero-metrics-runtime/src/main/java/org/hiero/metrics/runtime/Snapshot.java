// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.hiero.metrics.runtime.core.Labels;
import org.hiero.metrics.runtime.core.Measurement;
import org.hiero.metrics.runtime.core.SnapshotEntry;

/**
 * Immutable point-in-time view of all metrics of a registry and the output of all proxies.
 * <p>
 * Entries are ordered by identity. For equal identities, which only proxies can produce,
 * entries keep the order in which they were produced.
 */
public final class Snapshot {

    private final List<SnapshotEntry> entries;

    Snapshot(@NonNull List<SnapshotEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    @NonNull
    public List<SnapshotEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Find the first entry with the given qualified name and no labels.
     *
     * @param qualifiedName scope segments and name joined with {@code .}
     * @return the measurement, if present
     */
    @NonNull
    public Optional<Measurement> find(@NonNull String qualifiedName) {
        return find(qualifiedName, Labels.empty());
    }

    /**
     * Find the first entry with the given qualified name and labels.
     *
     * @param qualifiedName scope segments and name joined with {@code .}
     * @param labels        exact labels of the entry
     * @return the measurement, if present
     */
    @NonNull
    public Optional<Measurement> find(@NonNull String qualifiedName, @NonNull Labels labels) {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        Objects.requireNonNull(labels, "labels must not be null");
        for (SnapshotEntry entry : entries) {
            if (entry.identity().labels().equals(labels)
                    && entry.identity().qualifiedName().equals(qualifiedName)) {
                return Optional.of(entry.measurement());
            }
        }
        return Optional.empty();
    }

    /**
     * @param qualifiedName scope segments and name joined with {@code .}
     * @return all entries with the given qualified name, any labels
     */
    @NonNull
    public List<SnapshotEntry> findAll(@NonNull String qualifiedName) {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        return entries.stream()
                .filter(entry -> entry.identity().qualifiedName().equals(qualifiedName))
                .toList();
    }

    /**
     * Visit all entries in order.
     *
     * @param observer the observer
     */
    public void observe(@NonNull SnapshotObserver observer) {
        Objects.requireNonNull(observer, "observer must not be null");
        for (SnapshotEntry entry : entries) {
            Measurement measurement = entry.measurement();
            if (measurement instanceof Measurement.Counter counter) {
                observer.observeCounter(entry.identity(), counter.value());
            } else if (measurement instanceof Measurement.Gauge gauge) {
                observer.observeGauge(entry.identity(), gauge.value());
            } else if (measurement instanceof Measurement.Histogram histogram) {
                observer.observeHistogram(entry.identity(), histogram.summary());
            }
        }
    }

    @Override
    public String toString() {
        return "Snapshot" + entries;
    }
}

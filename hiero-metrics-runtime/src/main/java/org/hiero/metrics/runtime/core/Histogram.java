// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Histogram of non-negative {@code long} samples, backed by sharded log-linear buckets.
 * <p>
 * Values below {@code 2^precisionBits} are counted exactly. Larger values fall into one of {@code 2^precisionBits}
 * linear sub-buckets of their power-of-two magnitude, so the relative error of a quantile estimate is below
 * {@code 2^-precisionBits}. Bucket rows are allocated lazily on first use.
 * <p>
 * Writers are spread over a fixed number of shards by thread id, each shard created on first use.
 * {@link #record(long)} touches only the caller's shard. {@link #summarize()} merges all shards into a new
 * structure without modifying them, so it can be called any number of times while writers continue.
 */
public final class Histogram implements MetricCell {

    private final int precisionBits;
    private final int subBucketCount;
    private final int rowCount;
    private final int shardMask;
    private final double[] quantiles;

    private final AtomicReferenceArray<Shard> shards;

    /**
     * @param precisionBits number of sub-bucket bits per magnitude, in {@code [1, 10]}
     * @param shardCount    number of writer shards, power of two in {@code [1, 64]}
     * @param quantiles     quantiles to estimate on {@link #summarize()}, each in {@code [0, 1]}
     * @throws IllegalArgumentException if any argument is out of range
     */
    public Histogram(int precisionBits, int shardCount, @NonNull double[] quantiles) {
        if (precisionBits < 1 || precisionBits > 10) {
            throw new IllegalArgumentException("precisionBits must be in [1, 10], but was: " + precisionBits);
        }
        if (shardCount < 1 || shardCount > 64 || Integer.bitCount(shardCount) != 1) {
            throw new IllegalArgumentException("shardCount must be a power of two in [1, 64], but was: " + shardCount);
        }
        Objects.requireNonNull(quantiles, "quantiles must not be null");
        for (double quantile : quantiles) {
            if (!(quantile >= 0.0 && quantile <= 1.0)) {
                throw new IllegalArgumentException("quantile must be in [0, 1], but was: " + quantile);
            }
        }
        this.precisionBits = precisionBits;
        this.subBucketCount = 1 << precisionBits;
        this.rowCount = Long.SIZE - precisionBits;
        this.shardMask = shardCount - 1;
        this.quantiles = quantiles.clone();
        this.shards = new AtomicReferenceArray<>(shardCount);
    }

    /**
     * Records one sample.
     *
     * @param value the sample
     * @throws IllegalArgumentException if the sample is negative
     */
    public void record(long value) {
        MetricUtils.throwArgNegative(value, "Histogram value");
        final int row;
        final int column;
        if (value < subBucketCount) {
            row = 0;
            column = (int) value;
        } else {
            int shift = (Long.SIZE - 1 - Long.numberOfLeadingZeros(value)) - precisionBits;
            row = shift + 1;
            column = (int) (value >>> shift) - subBucketCount;
        }
        shard().record(row, column, value);
    }

    /**
     * Merge all shards into a summary. Reflects at least every sample recorded before this call.
     * <p>
     * While writers are active the summary is not atomic: a sample being recorded concurrently may already be
     * part of {@code sum}, {@code min} or {@code max} without being part of {@code count} or any quantile.
     * It is never the other way round.
     *
     * @return summary of recorded samples
     */
    @NonNull
    public HistogramSummary summarize() {
        long[][] merged = new long[rowCount][];
        long count = 0L;
        long sum = 0L;
        long min = Long.MAX_VALUE;
        long max = 0L;
        for (int i = 0; i < shards.length(); i++) {
            Shard shard = shards.get(i);
            if (shard == null) {
                continue;
            }
            for (int row = 0; row < rowCount; row++) {
                AtomicLongArray buckets = shard.rows.get(row);
                if (buckets == null) {
                    continue;
                }
                long[] target = merged[row];
                if (target == null) {
                    target = new long[subBucketCount];
                    merged[row] = target;
                }
                for (int column = 0; column < subBucketCount; column++) {
                    long bucketCount = buckets.get(column);
                    target[column] += bucketCount;
                    count += bucketCount;
                }
            }
            // buckets are incremented last on record, totals read after them cover every counted sample,
            // they may also include samples whose bucket increment is still pending
            sum += shard.sum.get();
            min = Math.min(min, shard.min.get());
            max = Math.max(max, shard.max.get());
        }

        List<HistogramSummary.Quantile> estimates = new ArrayList<>(quantiles.length);
        if (count == 0L) {
            for (double quantile : quantiles) {
                estimates.add(new HistogramSummary.Quantile(quantile, 0L));
            }
            return new HistogramSummary(0L, 0L, 0L, 0L, estimates);
        }
        for (double quantile : quantiles) {
            long value = valueAtRank(merged, rank(quantile, count));
            estimates.add(new HistogramSummary.Quantile(quantile, Math.max(min, Math.min(max, value))));
        }
        return new HistogramSummary(count, sum, min, max, estimates);
    }

    private static long rank(double quantile, long count) {
        return Math.max(1L, (long) Math.ceil(quantile * count));
    }

    private long valueAtRank(long[][] merged, long rank) {
        long seen = 0L;
        long last = 0L;
        for (int row = 0; row < rowCount; row++) {
            long[] buckets = merged[row];
            if (buckets == null) {
                continue;
            }
            for (int column = 0; column < subBucketCount; column++) {
                if (buckets[column] == 0L) {
                    continue;
                }
                seen += buckets[column];
                last = highestEquivalentValue(row, column);
                if (seen >= rank) {
                    return last;
                }
            }
        }
        return last;
    }

    /**
     * @return the largest value that falls into the given bucket
     */
    long highestEquivalentValue(int row, int column) {
        if (row == 0) {
            return column;
        }
        int shift = row - 1;
        long lowest = ((long) column + subBucketCount) << shift;
        return lowest + (1L << shift) - 1L;
    }

    @NonNull
    @Override
    public MetricKind kind() {
        return MetricKind.HISTOGRAM;
    }

    @NonNull
    @Override
    public Measurement measure() {
        return new Measurement.Histogram(summarize());
    }

    private Shard shard() {
        long id = Thread.currentThread().getId();
        int index = (int) ((id * 0x9E3779B97F4A7C15L) >>> 32) & shardMask;
        Shard shard = shards.get(index);
        if (shard == null) {
            Shard created = new Shard(rowCount);
            shard = shards.compareAndSet(index, null, created) ? created : shards.get(index);
        }
        return shard;
    }

    private final class Shard {

        private final AtomicReferenceArray<AtomicLongArray> rows;
        private final AtomicLong sum = new AtomicLong();
        private final AtomicLong min = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong max = new AtomicLong();

        private Shard(int rowCount) {
            this.rows = new AtomicReferenceArray<>(rowCount);
        }

        private void record(int row, int column, long value) {
            AtomicLongArray buckets = rows.get(row);
            if (buckets == null) {
                AtomicLongArray created = new AtomicLongArray(subBucketCount);
                buckets = rows.compareAndSet(row, null, created) ? created : rows.get(row);
            }
            // totals before the bucket, see summarize()
            updateMin(value);
            updateMax(value);
            sum.addAndGet(value);
            buckets.incrementAndGet(column);
        }

        private void updateMin(long value) {
            long current = min.get();
            while (value < current && !min.compareAndSet(current, value)) {
                current = min.get();
            }
        }

        private void updateMax(long value) {
            long current = max.get();
            while (value > current && !max.compareAndSet(current, value)) {
                current = max.get();
            }
        }
    }
}

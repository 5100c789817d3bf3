package com.catmepim.chartsync.opc;

/**
 * Safety limits applied whenever a ZIP container (the outer package or an embedded
 * workbook) is inflated.
 *
 * @invariant maxEntrySizeBytes > 0
 * @invariant maxInflationFactor > 0
 * @invariant 0 < minInflateRatio < 1
 */
public final class ArchiveLimits {

    public static final long DEFAULT_MAX_ENTRY_SIZE = 100L * 1024 * 1024; // 100 MB max for single entry
    public static final int DEFAULT_MAX_INFLATION_FACTOR = 1000; // Max 1000x inflation allowed
    public static final double DEFAULT_MIN_INFLATE_RATIO = 0.01;

    private static final ArchiveLimits DEFAULTS =
            new ArchiveLimits(DEFAULT_MAX_ENTRY_SIZE, DEFAULT_MAX_INFLATION_FACTOR, DEFAULT_MIN_INFLATE_RATIO);

    private final long maxEntrySizeBytes;
    private final int maxInflationFactor;
    private final double minInflateRatio;

    /**
     * @param maxEntrySizeBytes largest uncompressed size accepted for one entry
     * @param maxInflationFactor largest accepted uncompressed/compressed ratio
     * @param minInflateRatio smallest compressed/uncompressed ratio POI's {@code ZipSecureFile} accepts
     * @throws IllegalArgumentException if a limit is out of range
     */
    public ArchiveLimits(long maxEntrySizeBytes, int maxInflationFactor, double minInflateRatio) {
        if (maxEntrySizeBytes <= 0) {
            throw new IllegalArgumentException("Max entry size must be positive");
        }
        if (maxInflationFactor <= 0) {
            throw new IllegalArgumentException("Max inflation factor must be positive");
        }
        if (minInflateRatio <= 0 || minInflateRatio >= 1) {
            throw new IllegalArgumentException("Min inflate ratio must be between 0 and 1 (exclusive)");
        }
        this.maxEntrySizeBytes = maxEntrySizeBytes;
        this.maxInflationFactor = maxInflationFactor;
        this.minInflateRatio = minInflateRatio;
    }

    public static ArchiveLimits defaults() {
        return DEFAULTS;
    }

    public long getMaxEntrySizeBytes() {
        return maxEntrySizeBytes;
    }

    public int getMaxInflationFactor() {
        return maxInflationFactor;
    }

    public double getMinInflateRatio() {
        return minInflateRatio;
    }

    @Override
    public String toString() {
        return "ArchiveLimits{maxEntrySizeBytes=" + maxEntrySizeBytes + ", maxInflationFactor="
                + maxInflationFactor + ", minInflateRatio=" + minInflateRatio + '}';
    }
}

package com.traininginsight.core.ensemble;

/**
 * Shape of the training series, used by
 * {@link EnsembleCombiner#selectBestModel}.
 *
 * @since 1.0.0
 */
public final class DataCharacteristics {

    private final boolean hasOutliers;
    private final boolean trending;
    private final boolean highVolatility;
    private final int sampleSize;

    public DataCharacteristics(boolean hasOutliers, boolean trending, boolean isVolatile, int sampleSize) {
        this.hasOutliers = hasOutliers;
        this.trending = trending;
        this.highVolatility = isVolatile;
        this.sampleSize = sampleSize;
    }

    public boolean hasOutliers() {
        return hasOutliers;
    }

    public boolean isTrending() {
        return trending;
    }

    public boolean isVolatile() {
        return highVolatility;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    @Override
    public String toString() {
        return "DataCharacteristics{outliers=" + hasOutliers + ", trending=" + trending
                + ", volatile=" + highVolatility + ", sampleSize=" + sampleSize + '}';
    }
}

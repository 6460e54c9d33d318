package com.traininginsight.core.detection;

import java.util.Locale;
import java.util.Objects;

/**
 * Statistical tests available for flagging anomalous observations.
 *
 * @since 1.0.0
 */
public enum OutlierMethod {

    Z_SCORE("z_score", true),
    MODIFIED_Z_SCORE("modified_z_score", true),
    IQR("iqr", true),
    TIME_SERIES_WINDOW("time_series_window", true),
    MAHALANOBIS("mahalanobis", false);

    private final String key;
    private final boolean univariate;

    OutlierMethod(String key, boolean univariate) {
        this.key = key;
        this.univariate = univariate;
    }

    /** @return the name reported in {@link OutlierResult#getMethod()} */
    public String getKey() {
        return key;
    }

    /** @return {@code true} if the method scores a series of scalars */
    public boolean isUnivariate() {
        return univariate;
    }

    /**
     * Resolve a method from its key, case-insensitively.
     *
     * @throws IllegalArgumentException for an unknown key
     */
    public static OutlierMethod fromKey(String key) {
        Objects.requireNonNull(key, "Outlier method must not be null");
        String normalised = key.toLowerCase(Locale.ROOT);
        for (OutlierMethod m : values()) {
            if (m.key.equals(normalised)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown outlier method: '" + key
                + "'. Supported: z_score, modified_z_score, iqr, time_series_window, mahalanobis");
    }
}

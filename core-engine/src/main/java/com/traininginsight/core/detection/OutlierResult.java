package com.traininginsight.core.detection;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * Verdict for a single observation.
 *
 * @since 1.0.0
 */
public final class OutlierResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean outlier;
    private final double score;
    private final String method;
    private final String reason;

    /**
     * @param outlier whether the point was flagged
     * @param score   test statistic (always finite)
     * @param method  method key, e.g. {@code "iqr"}
     * @param reason  explanation when flagged, otherwise {@code null}
     */
    public OutlierResult(boolean outlier, double score, String method, String reason) {
        this.outlier = outlier;
        this.score = score;
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.reason = reason;
    }

    static OutlierResult inlier(double score, OutlierMethod method) {
        return new OutlierResult(false, score, method.getKey(), null);
    }

    public boolean isOutlier() {
        return outlier;
    }

    public double getScore() {
        return score;
    }

    public String getMethod() {
        return method;
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OutlierResult that))
            return false;
        return outlier == that.outlier
                && Double.compare(score, that.score) == 0
                && method.equals(that.method)
                && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outlier, score, method, reason);
    }

    @Override
    public String toString() {
        return "OutlierResult{" +
                "outlier=" + outlier +
                ", score=" + score +
                ", method='" + method + '\'' +
                (reason != null ? ", reason='" + reason + '\'' : "") +
                '}';
    }
}

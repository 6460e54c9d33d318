package com.traininginsight.core.loop;

import java.io.Serializable;

/**
 * Roll-up metrics of a run: regression fit quality plus the ensemble's
 * confidence.
 *
 * @since 1.0.0
 */
public final class PerformanceSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    static final PerformanceSummary NONE = new PerformanceSummary(0, 0, 0, 0);

    private final double mae;
    private final double mse;
    private final double r2;
    private final double confidence;

    public PerformanceSummary(double mae, double mse, double r2, double confidence) {
        this.mae = mae;
        this.mse = mse;
        this.r2 = r2;
        this.confidence = confidence;
    }

    public double getMae() {
        return mae;
    }

    public double getMse() {
        return mse;
    }

    public double getR2() {
        return r2;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return "PerformanceSummary{mae=" + mae + ", mse=" + mse + ", r2=" + r2
                + ", confidence=" + confidence + '}';
    }
}

package com.traininginsight.core.ensemble;

import java.io.Serializable;

/**
 * Fit metrics attached to an ensemble member.
 *
 * @since 1.0.0
 */
public final class ModelPerformance implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double mae;
    private final double mse;
    private final double r2;
    private final double recentAccuracy;

    public ModelPerformance(double mae, double mse, double r2, double recentAccuracy) {
        this.mae = mae;
        this.mse = mse;
        this.r2 = r2;
        this.recentAccuracy = recentAccuracy;
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

    public double getRecentAccuracy() {
        return recentAccuracy;
    }

    @Override
    public String toString() {
        return "ModelPerformance{mae=" + mae + ", mse=" + mse + ", r2=" + r2
                + ", recentAccuracy=" + recentAccuracy + '}';
    }
}

package com.traininginsight.core.bayesian;

import com.traininginsight.core.model.Interval;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Sequential conjugate posterior over linear-regression coefficients.
 *
 * <p>
 * An immutable value: {@link BayesianUpdater#update} returns a new model and
 * never touches the one passed in, so a fit is a plain fold over the
 * observations.
 * </p>
 *
 * @since 1.0.0
 */
public final class BayesianModel implements Serializable {

    private static final long serialVersionUID = 1L;

    private final NormalGamma prior;
    private final NormalGamma posterior;
    private final double[] uncertainty;
    private final List<Interval> credibleIntervals;
    private final int observations;

    BayesianModel(NormalGamma prior, NormalGamma posterior, double[] uncertainty,
                  List<Interval> credibleIntervals, int observations) {
        this.prior = Objects.requireNonNull(prior, "prior must not be null");
        this.posterior = Objects.requireNonNull(posterior, "posterior must not be null");
        this.uncertainty = uncertainty.clone();
        this.credibleIntervals = List.copyOf(credibleIntervals);
        this.observations = observations;
    }

    public NormalGamma getPrior() {
        return prior;
    }

    public NormalGamma getPosterior() {
        return posterior;
    }

    /** @return posterior mean of the coefficients */
    public double[] getCoefficients() {
        return posterior.getMean();
    }

    /** @return per-coefficient posterior standard deviation */
    public double[] getUncertainty() {
        return uncertainty.clone();
    }

    /** @return 95% credible interval per coefficient */
    public List<Interval> getCredibleIntervals() {
        return credibleIntervals;
    }

    /** @return number of updates folded into this posterior */
    public int getObservations() {
        return observations;
    }

    public int getFeatureCount() {
        return posterior.dimension();
    }

    double meanUncertainty() {
        double sum = 0;
        for (double u : uncertainty) {
            sum += u;
        }
        return uncertainty.length == 0 ? 0 : sum / uncertainty.length;
    }

    @Override
    public String toString() {
        return "BayesianModel{" +
                "features=" + getFeatureCount() +
                ", observations=" + observations +
                ", alpha=" + posterior.getAlpha() +
                ", beta=" + posterior.getBeta() +
                '}';
    }
}

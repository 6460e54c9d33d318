package com.traininginsight.core.feature;

import com.traininginsight.core.model.DataPoint;
import com.traininginsight.core.model.Observation;
import com.traininginsight.core.model.TargetVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derives a fixed-width feature vector per observation.
 *
 * <p>
 * Feature order (see {@link #FEATURE_NAMES}):
 * </p>
 * <pre>
 *   0 distance          4 avgHR (150)          8 sin(2π·dow/7)
 *   1 duration          5 perceivedEffort (5)  9 cos(2π·dow/7)
 *   2 elevation         6 sleepQuality (7)    10 rolling 3-session distance
 *   3 pace (km/h)       7 readiness (75)
 * </pre>
 * <p>
 * Values in parentheses replace missing readings. The day of week counts
 * from Sunday = 0 in the configured zone. Each point carries a recency
 * weight {@code exp(-daysAgo / decayDays)} relative to the reference
 * instant.
 * </p>
 *
 * @since 1.0.0
 */
public class FeatureEngineer {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureEngineer.class);

    /** Column names, index-aligned with the feature vector. */
    public static final List<String> FEATURE_NAMES = List.of(
            "distance", "duration", "elevation", "pace", "avgHR", "perceivedEffort",
            "sleepQuality", "readiness", "dayOfWeekSin", "dayOfWeekCos", "rollingDistance3");

    public static final int FEATURE_COUNT = 11;

    static final double DEFAULT_HEART_RATE = 150;
    static final double DEFAULT_EFFORT = 5;
    static final double DEFAULT_SLEEP_QUALITY = 7;
    static final double DEFAULT_READINESS = 75;
    static final double DEFAULT_DECAY_DAYS = 30;

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final ZoneId zone;
    private final double decayDays;

    public FeatureEngineer() {
        this(ZoneId.of("UTC"), DEFAULT_DECAY_DAYS);
    }

    /**
     * @param zone      zone used to derive the day of week
     * @param decayDays recency weight scale in days; must be positive
     */
    public FeatureEngineer(ZoneId zone, double decayDays) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        if (decayDays <= 0) {
            throw new IllegalArgumentException("decayDays must be > 0, got: " + decayDays);
        }
        this.decayDays = decayDays;
    }

    /**
     * Featurize observations, one output per input, in input order.
     *
     * @param observations the (already cleaned) sessions
     * @param target       variable placed in {@link DataPoint#getTarget()}
     * @param now          reference instant for recency weights
     * @return data points
     */
    public List<DataPoint> engineer(List<Observation> observations, TargetVariable target, Instant now) {
        Objects.requireNonNull(observations, "observations must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(now, "reference instant must not be null");

        List<DataPoint> points = new ArrayList<>(observations.size());
        for (int idx = 0; idx < observations.size(); idx++) {
            Observation o = observations.get(idx);
            double[] features = new double[FEATURE_COUNT];

            features[0] = o.getDistance();
            features[1] = o.getDuration();
            features[2] = o.getElevation();
            features[3] = o.getDuration() > 0 ? o.getDistance() / (o.getDuration() / 60) : 0;

            features[4] = orDefault(o.getAvgHeartRate(), DEFAULT_HEART_RATE);
            features[5] = orDefault(o.getPerceivedEffort(), DEFAULT_EFFORT);
            features[6] = orDefault(o.getSleepQuality(), DEFAULT_SLEEP_QUALITY);
            features[7] = orDefault(o.getReadiness(), DEFAULT_READINESS);

            // Sunday = 0
            int dayOfWeek = o.getTimestamp().atZone(zone).getDayOfWeek().getValue() % 7;
            features[8] = Math.sin(2 * Math.PI * dayOfWeek / 7);
            features[9] = Math.cos(2 * Math.PI * dayOfWeek / 7);

            features[10] = idx >= 2
                    ? (observations.get(idx - 2).getDistance()
                            + observations.get(idx - 1).getDistance()
                            + o.getDistance()) / 3
                    : o.getDistance();

            double daysAgo = daysBetween(o.getTimestamp(), now);
            double weight = Math.exp(-daysAgo / decayDays);

            points.add(new DataPoint(features, target.valueOf(o), weight, o.getTimestamp()));
        }
        LOG.debug("Engineered {} data point(s) x {} features for target '{}'",
                points.size(), FEATURE_COUNT, target.getKey());
        return points;
    }

    /**
     * @return fractional days from {@code from} to {@code to}
     */
    public static double daysBetween(Instant from, Instant to) {
        return (to.toEpochMilli() - from.toEpochMilli()) / MILLIS_PER_DAY;
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}

package com.riskplatform.common.backtest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskplatform.common.model.TrafficLight;

/**
 * Basel-style traffic light for 99% VaR.
 *
 * <p>At the 250-day reference the zones are green 0–4, yellow 5–9, red 10+. Other
 * sample sizes scale both bounds linearly ({@code round(4n/250)}, {@code round(9n/250)},
 * half-to-even). The scaling is a heuristic, not the regulatory binomial table.
 */
public final class BaselTrafficLight {

    public static final double CONFIDENCE = 0.99;
    public static final int MIN_OBSERVATIONS = 80;
    static final double REFERENCE_DAYS = 250.0;

    private BaselTrafficLight() {}

    /** Zone upper bounds; both null when the sample is too small or the level is not 99%. */
    public record Thresholds(
        @JsonProperty("greenMax") Integer greenMax,
        @JsonProperty("yellowMax") Integer yellowMax
    ) {
        static final Thresholds NONE = new Thresholds(null, null);

        public boolean isDefined() {
            return greenMax != null;
        }
    }

    public static Thresholds thresholds(int observations) {
        if (observations < MIN_OBSERVATIONS) return Thresholds.NONE;
        int green = Math.max((int) Math.rint(4.0 * observations / REFERENCE_DAYS), 0);
        int yellow = Math.max((int) Math.rint(9.0 * observations / REFERENCE_DAYS), green);
        return new Thresholds(green, yellow);
    }

    public static Thresholds thresholds(int observations, double confidence) {
        return confidence == CONFIDENCE ? thresholds(observations) : Thresholds.NONE;
    }

    public static TrafficLight classify(int observations, int exceptions, double confidence) {
        if (confidence != CONFIDENCE) return TrafficLight.NOT_APPLICABLE;
        Thresholds t = thresholds(observations);
        if (!t.isDefined()) return TrafficLight.UNDEFINED;
        if (exceptions <= t.greenMax()) return TrafficLight.GREEN;
        if (exceptions <= t.yellowMax()) return TrafficLight.YELLOW;
        return TrafficLight.RED;
    }
}

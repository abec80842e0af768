package com.riskplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Date-ordered VaR estimates as signed loss thresholds (negative = loss).
 *
 * <p>Entries produced before a lookback window has filled are {@code NaN}, never zero;
 * use {@link #isDefined(int)} before comparing a value against a realized return.
 *
 * @param dates      one entry per value
 * @param values     VaR thresholds, NaN where undefined
 * @param confidence VaR confidence level, e.g. 0.99
 */
public record VaRSeries(
    @JsonProperty("dates") List<LocalDate> dates,
    @JsonProperty("values") double[] values,
    @JsonProperty("confidence") double confidence
) {
    public VaRSeries {
        if (dates.size() != values.length) {
            throw new IllegalArgumentException("dates and values differ in length: "
                + dates.size() + " vs " + values.length);
        }
        dates = List.copyOf(dates);
        values = values.clone();
    }

    @Override
    public double[] values() { return values.clone(); }

    public boolean isDefined(int i) {
        return !Double.isNaN(values[i]);
    }

    public double value(int i) {
        return values[i];
    }

    @JsonIgnore
    public int size() {
        return values.length;
    }

    @JsonIgnore
    public int definedCount() {
        int count = 0;
        for (double v : values) if (!Double.isNaN(v)) count++;
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VaRSeries other)) return false;
        return dates.equals(other.dates) && Arrays.equals(values, other.values)
            && Double.compare(confidence, other.confidence) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dates, Arrays.hashCode(values), confidence);
    }
}

package com.riskplatform.common.backtest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskplatform.common.model.TrafficLight;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Historical-VaR backtests of one return series across several lookback windows.
 * Windows that leave no testable observations are skipped.
 */
public final class BacktestSweep {

    public static final List<Integer> DEFAULT_WINDOWS = List.of(20, 30, 60, 90, 120);

    private BacktestSweep() {}

    public record Row(
        @JsonProperty("window") int window,
        @JsonProperty("observations") int observations,
        @JsonProperty("exceptionCount") int exceptionCount,
        @JsonProperty("exceptionRate") double exceptionRate,
        @JsonProperty("expectedExceptions") double expectedExceptions,
        @JsonProperty("kupiecPValue") double kupiecPValue,
        @JsonProperty("independencePValue") double independencePValue,
        @JsonProperty("conditionalCoveragePValue") double conditionalCoveragePValue,
        @JsonProperty("zone") TrafficLight zone
    ) {
        static Row of(int window, BacktestResult r) {
            return new Row(window, r.observations(), r.exceptionCount(), r.exceptionRate(),
                r.expectedExceptions(), r.kupiec().pValue(), r.independence().pValue(),
                r.conditionalCoverage().pValue(), r.zone());
        }
    }

    public static List<Row> run(List<LocalDate> dates, double[] returns, double confidence, List<Integer> windows) {
        List<Row> rows = new ArrayList<>(windows.size());
        for (int window : windows) {
            if (window >= returns.length) continue;
            rows.add(Row.of(window, VarBacktester.backtestHistorical(dates, returns, confidence, window)));
        }
        return rows;
    }
}

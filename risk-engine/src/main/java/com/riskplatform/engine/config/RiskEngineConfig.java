package com.riskplatform.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.riskplatform.common.dependence.CorrelationRegularizer;
import com.riskplatform.common.marginal.DegreesOfFreedomSearch;
import com.riskplatform.common.marginal.GarchTEstimator;
import com.riskplatform.common.marginal.StaticStudentTEstimator;
import com.riskplatform.common.montecarlo.TCopulaSimulator;
import com.riskplatform.common.portfolio.GarchTPortfolioAggregator;
import com.riskplatform.common.portfolio.HistoricalAggregator;
import com.riskplatform.common.portfolio.StaticTPortfolioAggregator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class RiskEngineConfig {

    @Value("${risk.seed:42}")
    private long seed;

    @Value("${risk.ks.min-df:3}")
    private int minDf;

    @Value("${risk.ks.max-df:99}")
    private int maxDf;

    @Value("${risk.garch.min-observations:50}")
    private int garchMinObservations;

    @Value("${risk.garch.fallback-nu:30}")
    private double garchFallbackNu;

    @Value("${risk.garch.max-evaluations:20000}")
    private int garchMaxEvaluations;

    @Value("${risk.garch.correlation:ewma}")
    private String garchCorrelation;

    @Value("${risk.ewma.lambda:0.94}")
    private double ewmaLambda;

    @Value("${risk.montecarlo.notional:1000000}")
    private double notional;

    @Value("${risk.montecarlo.scenarios:100000}")
    private int scenarios;

    @Value("${risk.montecarlo.horizons:1,10}")
    private List<Integer> horizons;

    @Value("${risk.montecarlo.nu-copula:5}")
    private double nuCopula;

    @Value("${risk.montecarlo.nu-marginal:5}")
    private double nuMarginal;

    @Value("${risk.montecarlo.shrinkage:0.0}")
    private double shrinkage;

    @Value("${risk.backtest.confidence:0.99}")
    private double backtestConfidence;

    @Value("${risk.backtest.window:250}")
    private int backtestWindow;

    @Value("${risk.backtest.sweep-windows:20,30,60,90,120}")
    private List<Integer> sweepWindows;

    @Bean
    public RiskSettings riskSettings() {
        return new RiskSettings(seed, minDf, maxDf, garchMinObservations, garchFallbackNu, ewmaLambda,
            CorrelationSource.valueOf(garchCorrelation.trim().toUpperCase()),
            notional, scenarios, horizons, nuCopula, nuMarginal,
            backtestConfidence, backtestWindow, sweepWindows);
    }

    @Bean
    public DegreesOfFreedomSearch degreesOfFreedomSearch() {
        return new DegreesOfFreedomSearch(minDf, maxDf);
    }

    @Bean
    public StaticStudentTEstimator staticStudentTEstimator(DegreesOfFreedomSearch search) {
        return new StaticStudentTEstimator(search);
    }

    @Bean
    public GarchTEstimator garchTEstimator() {
        return new GarchTEstimator(garchMinObservations, garchFallbackNu, garchMaxEvaluations);
    }

    @Bean
    public StaticTPortfolioAggregator staticTPortfolioAggregator(DegreesOfFreedomSearch search) {
        return new StaticTPortfolioAggregator(search);
    }

    @Bean
    public GarchTPortfolioAggregator garchTPortfolioAggregator() {
        return new GarchTPortfolioAggregator();
    }

    @Bean
    public HistoricalAggregator historicalAggregator() {
        return new HistoricalAggregator();
    }

    @Bean
    public TCopulaSimulator tCopulaSimulator() {
        return new TCopulaSimulator(shrinkage > 0.0
            ? CorrelationRegularizer.shrinkTowardIdentity(shrinkage)
            : CorrelationRegularizer.NONE);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}

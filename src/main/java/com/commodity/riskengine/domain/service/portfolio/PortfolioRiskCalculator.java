package com.commodity.riskengine.domain.service.portfolio;

import com.commodity.riskengine.domain.model.Greeks;
import com.commodity.riskengine.domain.model.MarketData;
import com.commodity.riskengine.domain.model.Position;
import com.commodity.riskengine.domain.model.RiskResult;
import com.commodity.riskengine.domain.model.RiskMetrics;
import com.commodity.riskengine.domain.model.StressTestResult;
import com.commodity.riskengine.domain.model.VarEsEstimate;
import com.commodity.riskengine.domain.service.montecarlo.MonteCarloEngine;
import com.commodity.riskengine.domain.service.montecarlo.MonteCarloProperties;
import com.commodity.riskengine.domain.service.pricing.BlackScholesModel;
import com.commodity.riskengine.domain.service.report.ReportPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.ToDoubleFunction;

@Slf4j
public class PortfolioRiskCalculator {

    static final double[] STANDARD_CONFIDENCE_LEVELS = {0.95, 0.99, 0.999};

    private final BlackScholesModel blackScholesModel;
    private final MonteCarloEngine monteCarloEngine;
    private final MonteCarloProperties monteCarloProperties;
    private final RiskProperties riskProperties;
    private final Executor asyncExecutor;
    private final ReportPublisher reportPublisher;

    private final Timer calcTimer;
    private final Counter calculationCounter;
    private final Counter droppedCounter;

    public PortfolioRiskCalculator(BlackScholesModel blackScholesModel,
                                   MonteCarloEngine monteCarloEngine,
                                   MonteCarloProperties monteCarloProperties,
                                   RiskProperties riskProperties,
                                   MeterRegistry meterRegistry,
                                   Executor asyncExecutor,
                                   ReportPublisher reportPublisher) {
        this.blackScholesModel = blackScholesModel;
        this.monteCarloEngine = monteCarloEngine;
        this.monteCarloProperties = monteCarloProperties;
        this.riskProperties = riskProperties;
        this.asyncExecutor = asyncExecutor;
        this.reportPublisher = reportPublisher;

        this.calcTimer = Timer.builder("risk.portfolio.calc_duration")
                .description("Portfolio risk calculation duration (Greeks + Monte Carlo VaR/ES)")
                .register(meterRegistry);
        this.calculationCounter = Counter.builder("risk.portfolio.calculations")
                .description("Completed portfolio risk calculations")
                .register(meterRegistry);
        this.droppedCounter = Counter.builder("risk.positions.dropped")
                .description("Positions excluded for invalid terms or missing market data")
                .register(meterRegistry);
    }

    public CompletableFuture<RiskMetrics> calculatePortfolioRiskAsync(List<Position> positions,
                                                                       MarketData marketData) {
        List<Position> snapshot = new ArrayList<>(positions);
        return CompletableFuture.supplyAsync(() -> calculatePortfolioRisk(snapshot, marketData), asyncExecutor);
    }

    public RiskMetrics calculatePortfolioRisk(List<Position> positions, MarketData marketData) {
        long startNano = System.nanoTime();

        List<Position> valid = filterValidPositions(positions, marketData);
        List<PositionAnalytics> analytics = analysePositions(valid, marketData);
        int dropped = positions.size() - analytics.size();
        if (dropped > 0) {
            droppedCounter.increment(dropped);
            log.warn("[Portfolio] {} of {} positions excluded (invalid terms, missing market data or unpriceable)",
                    dropped, positions.size());
        }

        if (analytics.isEmpty()) {
            long micros = elapsedMicros(startNano);
            calcTimer.record(micros, TimeUnit.MICROSECONDS);
            return RiskMetrics.empty(dropped, micros);
        }

        Map<String, Greeks> greeksByUnderlying = aggregateGreeks(analytics);
        double portfolioValue = analytics.stream().mapToDouble(PositionAnalytics::value).sum();

        int simulations = monteCarloProperties.getSimulations();
        double[] portfolioReturns = simulatePortfolioReturns(analytics, marketData, simulations);

        double[] levels = confidenceLevels();
        List<VarEsEstimate> tailRisk = monteCarloEngine.calculateVarEsBatch(portfolioReturns, levels);

        if (reportPublisher.hasSinks()) {
            reportPublisher.publish("portfolio_returns.json", "Simulated 1-day portfolio returns", portfolioReturns);
        }

        long micros = elapsedMicros(startNano);
        calcTimer.record(micros, TimeUnit.MICROSECONDS);
        calculationCounter.increment();

        RiskMetrics metrics = RiskMetrics.builder()
                .portfolioValue(portfolioValue)
                .deltaByUnderlying(project(greeksByUnderlying, Greeks::delta))
                .gammaByUnderlying(project(greeksByUnderlying, Greeks::gamma))
                .vegaByUnderlying(project(greeksByUnderlying, Greeks::vega))
                .thetaByUnderlying(project(greeksByUnderlying, Greeks::theta))
                .var95(find(tailRisk, 0.95).valueAtRisk())
                .es95(find(tailRisk, 0.95).expectedShortfall())
                .var99(find(tailRisk, 0.99).valueAtRisk())
                .es99(find(tailRisk, 0.99).expectedShortfall())
                .var999(find(tailRisk, 0.999).valueAtRisk())
                .es999(find(tailRisk, 0.999).expectedShortfall())
                .tailRisk(List.copyOf(tailRisk))
                .validPositions(analytics.size())
                .droppedPositions(dropped)
                .monteCarloSimulations(simulations)
                .calcDurationMicros(micros)
                .build();

        log.info("[Portfolio] risk calculated: positions={}, dropped={}, value={}, var99={}, es99={}, sims={}, elapsed={}μs",
                analytics.size(), dropped, portfolioValue, metrics.getVar99(), metrics.getEs99(), simulations, micros);

        return metrics;
    }

    public List<StressTestResult> stressTestPortfolio(List<Position> positions, MarketData marketData) {
        return stressTestPortfolio(positions, marketData, riskProperties.getStressScenarios());
    }

    public List<StressTestResult> stressTestPortfolio(List<Position> positions, MarketData marketData,
                                                      Map<String, Double> scenarios) {
        for (Map.Entry<String, Double> scenario : scenarios.entrySet()) {
            Double shock = scenario.getValue();
            if (shock == null || !Double.isFinite(shock)) {
                throw new IllegalArgumentException("shock must be a finite number: " + scenario.getKey());
            }
        }
        double basePv = calculatePortfolioValue(positions, marketData);

        List<StressTestResult> results = new ArrayList<>(scenarios.size());
        for (Map.Entry<String, Double> scenario : scenarios.entrySet()) {
            double shock = scenario.getValue();
            double stressedPv = calculatePortfolioValue(positions, marketData.withShockedSpots(shock));
            results.add(new StressTestResult(scenario.getKey(), shock, stressedPv - basePv));
        }

        log.info("[Portfolio] stress test: scenarios={}, basePv={}", results.size(), basePv);
        return results;
    }

    public double calculatePortfolioValue(List<Position> positions, MarketData marketData) {
        double total = 0.0;
        for (Position position : filterValidPositions(positions, marketData)) {
            String underlying = position.getUnderlying();
            total += blackScholesModel.price(marketData.spotOf(underlying), position.getStrike(),
                            position.getMaturity(), marketData.getRiskFreeRate(),
                            marketData.volatilityOf(underlying), position.isCall())
                    .orElse(0.0) * position.getNotional();
        }
        return total;
    }

    List<Position> filterValidPositions(List<Position> positions, MarketData marketData) {
        List<Position> valid = new ArrayList<>(positions.size());
        for (Position position : positions) {
            if (position != null && position.isValid() && hasUsableMarketData(position, marketData)) {
                valid.add(position);
            }
        }
        return valid;
    }

    private boolean hasUsableMarketData(Position position, MarketData marketData) {
        if (!marketData.isCompleteFor(position)) return false;
        double spot = marketData.spotOf(position.getUnderlying());
        double vol = marketData.volatilityOf(position.getUnderlying());
        return spot > 0 && Double.isFinite(spot) && vol > 0 && Double.isFinite(vol);
    }

    private List<PositionAnalytics> analysePositions(List<Position> positions, MarketData marketData) {
        double rate = marketData.getRiskFreeRate();
        List<PositionAnalytics> analytics = new ArrayList<>(positions.size());
        for (Position position : positions) {
            double spot = marketData.spotOf(position.getUnderlying());
            double vol = marketData.volatilityOf(position.getUnderlying());

            RiskResult<Double> unitPrice = blackScholesModel.price(spot, position.getStrike(),
                    position.getMaturity(), rate, vol, position.isCall());
            if (!unitPrice.isSuccess()) {
                log.warn("[Portfolio] position {} skipped: pricing failed ({})",
                        position.getInstrumentId(), unitPrice.getError());
                continue;
            }
            Greeks unitGreeks = blackScholesModel.calculateAllGreeks(spot, position.getStrike(),
                    position.getMaturity(), rate, vol, position.isCall());

            analytics.add(new PositionAnalytics(position, spot, vol,
                    unitPrice.getValue() * position.getNotional(),
                    unitGreeks.scale(position.getNotional())));
        }
        return analytics;
    }

    private Map<String, Greeks> aggregateGreeks(List<PositionAnalytics> analytics) {
        Map<String, Greeks> byUnderlying = new TreeMap<>();
        for (PositionAnalytics a : analytics) {
            byUnderlying.merge(a.position().getUnderlying(), a.greeks(), Greeks::plus);
        }
        return byUnderlying;
    }

    private double[] simulatePortfolioReturns(List<PositionAnalytics> analytics, MarketData marketData,
                                              int simulations) {
        double horizon = monteCarloProperties.riskHorizonYears();
        double rate = marketData.getRiskFreeRate();

        // one independent return series per underlying, no cross-asset correlation
        Map<String, double[]> returnsByUnderlying = new LinkedHashMap<>();
        for (String underlying : new TreeSet<>(analytics.stream().map(a -> a.position().getUnderlying()).toList())) {
            double[] returns = new double[simulations];
            monteCarloEngine.simulateSingleStepReturns(returns, rate, marketData.volatilityOf(underlying), horizon);
            returnsByUnderlying.put(underlying, returns);
        }

        double basePv = analytics.stream().mapToDouble(PositionAnalytics::value).sum();
        double[] portfolioReturns = new double[simulations];
        if (basePv == 0.0) {
            log.warn("[Portfolio] base portfolio value is zero, relative returns undefined; reporting zero VaR/ES");
            return portfolioReturns;
        }
        double denominator = Math.abs(basePv);

        monteCarloEngine.forEachSample(simulations, sim -> {
            double shockedPv = 0.0;
            for (PositionAnalytics a : analytics) {
                Position position = a.position();
                double shockedSpot = a.spot() * (1.0 + returnsByUnderlying.get(position.getUnderlying())[sim]);
                shockedPv += blackScholesModel.priceUncached(shockedSpot, position.getStrike(),
                                position.getMaturity(), rate, a.volatility(), position.isCall())
                        .orElse(0.0) * position.getNotional();
            }
            portfolioReturns[sim] = (shockedPv - basePv) / denominator;
        });

        log.debug("[Portfolio] simulated {} scenarios over {} underlyings", simulations, returnsByUnderlying.size());
        return portfolioReturns;
    }

    private double[] confidenceLevels() {
        TreeSet<Double> levels = new TreeSet<>(monteCarloProperties.getConfidenceLevels());
        for (double standard : STANDARD_CONFIDENCE_LEVELS) {
            levels.add(standard);
        }
        return levels.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static VarEsEstimate find(List<VarEsEstimate> estimates, double confidence) {
        return estimates.stream()
                .filter(e -> Double.compare(e.confidence(), confidence) == 0)
                .findFirst()
                .orElse(VarEsEstimate.zero(confidence));
    }

    private static Map<String, Double> project(Map<String, Greeks> greeks, ToDoubleFunction<Greeks> field) {
        Map<String, Double> projected = new TreeMap<>();
        greeks.forEach((underlying, g) -> projected.put(underlying, field.applyAsDouble(g)));
        return Collections.unmodifiableMap(projected);
    }

    private static long elapsedMicros(long startNano) {
        return (System.nanoTime() - startNano) / 1_000;
    }

    private record PositionAnalytics(Position position, double spot, double volatility, double value, Greeks greeks) {
    }
}

package com.commodity.riskengine.domain.service.pricing;

import com.commodity.riskengine.domain.model.OptionType;
import com.commodity.riskengine.domain.model.PricingMetrics;
import com.commodity.riskengine.domain.model.RiskError;
import com.commodity.riskengine.domain.model.RiskResult;
import com.commodity.riskengine.domain.service.montecarlo.MonteCarloEngine;
import com.commodity.riskengine.domain.service.montecarlo.MonteCarloProperties;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class PricingCalculator {

    static final int STEPS_PER_YEAR = 252;

    private final MonteCarloEngine monteCarloEngine;
    private final int maxSimulations;
    private final long maxPathPoints;

    public PricingCalculator(MonteCarloEngine monteCarloEngine) {
        this(monteCarloEngine, new MonteCarloProperties());
    }

    public PricingCalculator(MonteCarloEngine monteCarloEngine, MonteCarloProperties properties) {
        this(monteCarloEngine, properties.getMaxPricingSimulations(), properties.getMaxPricingPathPoints());
    }

    public PricingCalculator(MonteCarloEngine monteCarloEngine, int maxSimulations, long maxPathPoints) {
        this.monteCarloEngine = monteCarloEngine;
        this.maxSimulations = maxSimulations;
        this.maxPathPoints = maxPathPoints;
    }

    public RiskResult<PricingMetrics> calculateOptionPrice(OptionType optionType, double spot, double strike,
                                                           double maturity, double rate, double volatility,
                                                           int simulations) {
        return calculateOptionPrice(optionType, spot, strike, maturity, rate, volatility, simulations,
                0.0, PayoffModel.DEFAULT_PAYOUT);
    }

    public RiskResult<PricingMetrics> calculateOptionPrice(OptionType optionType, double spot, double strike,
                                                           double maturity, double rate, double volatility,
                                                           int simulations, double barrier, double payoutAmount) {
        long startNano = System.nanoTime();

        if (!(volatility > 0)) return RiskResult.failure(RiskError.INVALID_VOLATILITY);
        if (!(maturity >= 0)) return RiskResult.failure(RiskError.NEGATIVE_TIME);
        if (!(strike > 0) || !(spot > 0)) return RiskResult.failure(RiskError.INVALID_STRIKE);
        if (optionType == null || simulations <= 0) return RiskResult.failure(RiskError.COMPUTATION_FAILED);
        if (simulations > maxSimulations || Double.isInfinite(maturity)) {
            log.warn("[Pricing] request exceeds simulation limits: sims={}, max={}, T={}",
                    simulations, maxSimulations, maturity);
            return RiskResult.failure(RiskError.COMPUTATION_FAILED);
        }

        if (maturity == 0.0) {
            double payoff = PayoffModel.calculatePayoff(optionType, spot, strike,
                    new double[]{spot}, barrier, payoutAmount);
            return RiskResult.success(PricingMetrics.builder()
                    .optionType(optionType)
                    .optionValue(payoff)
                    .monteCarloSimulations(simulations)
                    .calcDurationMicros(elapsedMicros(startNano))
                    .build());
        }

        PayoffStats stats;
        int steps;
        if (optionType.requiresPath()) {
            long requiredSteps = Math.max(1L, (long) Math.floor(maturity * STEPS_PER_YEAR));
            if (requiredSteps >= Integer.MAX_VALUE || requiredSteps > maxPathPoints / simulations) {
                log.warn("[Pricing] path grid too large: sims={}, steps={}, maxPoints={}",
                        simulations, requiredSteps, maxPathPoints);
                return RiskResult.failure(RiskError.COMPUTATION_FAILED);
            }
            steps = (int) requiredSteps;
            stats = pricePathDependent(optionType, spot, strike, maturity, rate, volatility,
                    simulations, steps, barrier, payoutAmount);
        } else {
            steps = 1;
            stats = priceTerminal(optionType, spot, strike, maturity, rate, volatility, simulations, payoutAmount);
        }

        double discount = Math.exp(-rate * maturity);
        double value = discount * stats.mean();
        if (!Double.isFinite(value)) {
            return RiskResult.failure(RiskError.COMPUTATION_FAILED);
        }

        long micros = elapsedMicros(startNano);
        log.debug("[Pricing] {} priced: value={}, sims={}, steps={}, elapsed={}μs",
                optionType, value, simulations, steps, micros);

        return RiskResult.success(PricingMetrics.builder()
                .optionType(optionType)
                .optionValue(value)
                .standardError(discount * stats.standardError())
                .monteCarloSimulations(simulations)
                .timeSteps(steps)
                .calcDurationMicros(micros)
                .build());
    }

    private PayoffStats priceTerminal(OptionType optionType, double spot, double strike, double maturity,
                                      double rate, double volatility, int simulations, double payoutAmount) {
        double[] finalPrices = new double[simulations];
        monteCarloEngine.simulateFinalPrices(finalPrices, spot, rate, volatility, maturity);

        PayoffStats stats = new PayoffStats();
        for (double finalPrice : finalPrices) {
            stats.add(PayoffModel.calculatePayoff(optionType, finalPrice, strike,
                    null, 0.0, payoutAmount));
        }
        return stats;
    }

    private PayoffStats pricePathDependent(OptionType optionType, double spot, double strike, double maturity,
                                           double rate, double volatility, int simulations, int steps,
                                           double barrier, double payoutAmount) {
        double[] payoffs = new double[simulations];
        monteCarloEngine.simulatePathPayoffs(payoffs, spot, rate, volatility, maturity, steps,
                (path, length) -> PayoffModel.calculatePayoff(optionType, path[length - 1], strike,
                        path, 0, length, barrier, payoutAmount));

        PayoffStats stats = new PayoffStats();
        for (double payoff : payoffs) {
            stats.add(payoff);
        }
        return stats;
    }

    private static long elapsedMicros(long startNano) {
        return (System.nanoTime() - startNano) / 1_000;
    }

    private static final class PayoffStats {
        private long count;
        private double mean;
        private double m2;

        void add(double payoff) {
            count++;
            double delta = payoff - mean;
            mean += delta / count;
            m2 += delta * (payoff - mean);
        }

        double mean() {
            return mean;
        }

        double standardError() {
            if (count < 2) return 0.0;
            return Math.sqrt(m2 / (count - 1) / count);
        }
    }
}

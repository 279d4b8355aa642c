package com.commodity.riskengine.domain.service.montecarlo;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "montecarlo")
public class MonteCarloProperties {

    private long seed = 42L;
    private int workerCount = 0;
    private int simulations = 10_000;
    private int tradingDaysPerYear = 252;
    private List<Double> confidenceLevels = List.of(0.95, 0.99, 0.999);
    private int pricingSimulations = 100_000;
    private int maxPricingSimulations = 10_000_000;
    private long maxPricingPathPoints = 200_000_000L;

    public int resolvedWorkerCount() {
        return workerCount > 0 ? workerCount : Runtime.getRuntime().availableProcessors();
    }

    public double riskHorizonYears() {
        return 1.0 / tradingDaysPerYear;
    }

    public double[] confidenceLevelsArray() {
        return confidenceLevels.stream().mapToDouble(Double::doubleValue).toArray();
    }
}

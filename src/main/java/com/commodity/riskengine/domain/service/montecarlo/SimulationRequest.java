package com.commodity.riskengine.domain.service.montecarlo;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class SimulationRequest {

    private final double startPrice;
    private final double sigma;

    @Builder.Default
    private final double mu = 0.0;

    @Builder.Default
    private final double maturity = 1.0;

    @Builder.Default
    private final int steps = 252;

    @Builder.Default
    private final int pathCount = 10_000;

    public int pointsPerPath() {
        return steps + 1;
    }
}

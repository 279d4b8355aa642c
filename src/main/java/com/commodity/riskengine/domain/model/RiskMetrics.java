package com.commodity.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RiskMetrics {

    private double portfolioValue;

    @Builder.Default
    private Map<String, Double> deltaByUnderlying = Collections.emptyMap();
    @Builder.Default
    private Map<String, Double> gammaByUnderlying = Collections.emptyMap();
    @Builder.Default
    private Map<String, Double> vegaByUnderlying = Collections.emptyMap();
    @Builder.Default
    private Map<String, Double> thetaByUnderlying = Collections.emptyMap();

    private double var95;
    private double es95;
    private double var99;
    private double es99;
    private double var999;
    private double es999;

    @Builder.Default
    private List<VarEsEstimate> tailRisk = Collections.emptyList();

    private int validPositions;
    private int droppedPositions;
    private int monteCarloSimulations;
    private long calcDurationMicros;

    public static RiskMetrics empty(int droppedPositions, long calcDurationMicros) {
        return RiskMetrics.builder()
                .droppedPositions(droppedPositions)
                .calcDurationMicros(calcDurationMicros)
                .build();
    }
}

package com.commodity.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PricingMetrics {

    private OptionType optionType;
    private double optionValue;
    private double standardError;
    private int monteCarloSimulations;
    private int timeSteps;
    private long calcDurationMicros;
}

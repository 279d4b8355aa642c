package com.commodity.riskengine.api.dto;

import com.commodity.riskengine.domain.model.OptionType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MonteCarloPricingRequest {

    @NotNull
    private OptionType optionType;

    private double spot;
    private double strike;
    private double maturity;
    private double rate;
    private double volatility;

    @Positive
    private Integer simulations;

    private double barrier;

    @Builder.Default
    private double payoutAmount = 1.0;
}

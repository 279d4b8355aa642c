package com.commodity.riskengine.api.dto;

import com.commodity.riskengine.domain.model.Greeks;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlackScholesQuote {

    private double spot;
    private double strike;
    private double maturity;
    private double rate;
    private double volatility;
    private boolean call;
    private double price;
    private Greeks greeks;
}

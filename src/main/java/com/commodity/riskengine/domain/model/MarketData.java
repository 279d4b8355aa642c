package com.commodity.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Builder(toBuilder = true)
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MarketData {

    @Builder.Default
    private Map<String, Double> spotPrices = Collections.emptyMap();

    @Builder.Default
    private Map<String, Double> volatilities = Collections.emptyMap();

    @Builder.Default
    private double riskFreeRate = 0.05;

    public boolean isCompleteFor(Position position) {
        if (position == null || position.getUnderlying() == null) return false;
        return spotPrices != null && volatilities != null
                && spotPrices.get(position.getUnderlying()) != null
                && volatilities.get(position.getUnderlying()) != null;
    }

    public double spotOf(String underlying) {
        return spotPrices.get(underlying);
    }

    public double volatilityOf(String underlying) {
        return volatilities.get(underlying);
    }

    public MarketData withShockedSpots(double shock) {
        Map<String, Double> shocked = new LinkedHashMap<>();
        spotPrices.forEach((underlying, spot) ->
                shocked.put(underlying, spot == null ? null : spot * (1.0 + shock)));
        return toBuilder()
                .spotPrices(Collections.unmodifiableMap(shocked))
                .build();
    }
}

package com.commodity.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Position {

    private String instrumentId;
    private String underlying;
    private double notional;
    private double strike;
    private double maturity;
    private boolean call;

    @JsonIgnore
    public boolean isValid() {
        return underlying != null && !underlying.isEmpty()
                && Double.isFinite(notional) && notional != 0.0
                && Double.isFinite(strike) && strike > 0.0
                && Double.isFinite(maturity) && maturity >= 0.0;
    }
}

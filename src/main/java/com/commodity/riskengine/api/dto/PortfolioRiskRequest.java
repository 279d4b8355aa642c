package com.commodity.riskengine.api.dto;

import com.commodity.riskengine.domain.model.MarketData;
import com.commodity.riskengine.domain.model.Position;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PortfolioRiskRequest {

    @NotNull
    private List<Position> positions;

    @NotNull
    private MarketData marketData;

    private Map<String, @NotNull Double> scenarios;
}

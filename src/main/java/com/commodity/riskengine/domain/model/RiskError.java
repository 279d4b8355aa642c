package com.commodity.riskengine.domain.model;

public enum RiskError {
    INVALID_VOLATILITY("volatility must be positive"),
    NEGATIVE_TIME("time to maturity must not be negative"),
    INVALID_STRIKE("strike and spot must be positive"),
    COMPUTATION_FAILED("computation failed"),
    MISSING_MARKET_DATA("market data is missing for the underlying");

    private final String description;

    RiskError(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}

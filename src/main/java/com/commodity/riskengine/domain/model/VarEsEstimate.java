package com.commodity.riskengine.domain.model;

public record VarEsEstimate(double confidence, double valueAtRisk, double expectedShortfall) {

    public static VarEsEstimate zero(double confidence) {
        return new VarEsEstimate(confidence, 0.0, 0.0);
    }
}

package com.commodity.riskengine.domain.model;

public record StressTestResult(String scenarioName, double shock, double pnlImpact) {
}

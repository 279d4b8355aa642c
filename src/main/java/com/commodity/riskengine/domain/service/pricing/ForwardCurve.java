package com.commodity.riskengine.domain.service.pricing;

@FunctionalInterface
public interface ForwardCurve {

    double getForward(double maturity);
}

package com.commodity.riskengine.domain.service.montecarlo;

@FunctionalInterface
public interface PathPayoff {

    double evaluate(double[] path, int length);
}

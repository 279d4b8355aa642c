package com.commodity.riskengine.domain.service.pricing;

record PricingCacheKey(double spot, double strike, double maturity, double rate, double volatility, boolean call) {

    // -0.0 and 0.0 must hit the same entry
    static PricingCacheKey of(double spot, double strike, double maturity, double rate, double volatility,
                              boolean call) {
        return new PricingCacheKey(spot + 0.0, strike + 0.0, maturity + 0.0, rate + 0.0, volatility + 0.0, call);
    }
}

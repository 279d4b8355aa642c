package com.commodity.riskengine.domain.service.pricing;

import com.commodity.riskengine.domain.model.Greeks;
import com.commodity.riskengine.domain.model.RiskError;
import com.commodity.riskengine.domain.model.RiskResult;
import com.commodity.riskengine.domain.service.math.FastMath;
import com.commodity.riskengine.domain.service.math.FastMath.D1D2;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class BlackScholesModel {

    static final long DEFAULT_CACHE_SIZE = 100_000;
    static final double DEFAULT_THETA_DAY_COUNT = 365.0;
    static final double DEFAULT_VEGA_SCALE = 100.0;
    static final double CURVE_BUMP = 1.0001;

    private final Cache<PricingCacheKey, Double> cache;
    private final double thetaDayCount;
    private final double vegaScale;

    public BlackScholesModel() {
        this(DEFAULT_CACHE_SIZE, DEFAULT_THETA_DAY_COUNT, DEFAULT_VEGA_SCALE);
    }

    public BlackScholesModel(PricingProperties properties) {
        this(properties.getCacheMaxSize(), properties.getThetaDayCount(), properties.getVegaScale());
    }

    public BlackScholesModel(long cacheMaxSize, double thetaDayCount, double vegaScale) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheMaxSize)
                .executor(Runnable::run)
                .recordStats()
                .build();
        this.thetaDayCount = thetaDayCount;
        this.vegaScale = vegaScale;
    }

    public void bindMetrics(MeterRegistry meterRegistry) {
        CaffeineCacheMetrics.monitor(meterRegistry, cache, "black-scholes-price");
    }

    public RiskResult<Double> price(double spot, double strike, double maturity, double rate,
                                    double volatility, boolean call) {
        RiskError invalid = validate(spot, strike, maturity, volatility);
        if (invalid != null) return RiskResult.failure(invalid);

        if (maturity == 0.0) {
            return RiskResult.success(intrinsic(spot, strike, call));
        }

        PricingCacheKey key = PricingCacheKey.of(spot, strike, maturity, rate, volatility, call);
        Double cached = cache.getIfPresent(key);
        if (cached != null) {
            return RiskResult.success(cached);
        }

        double price = closedForm(spot, strike, maturity, rate, volatility, call);
        if (!Double.isFinite(price)) {
            log.warn("[BS] non-finite price: S={}, K={}, T={}, r={}, vol={}", spot, strike, maturity, rate, volatility);
            return RiskResult.failure(RiskError.COMPUTATION_FAILED);
        }
        cache.put(key, price);
        return RiskResult.success(price);
    }

    public RiskResult<Double> priceUncached(double spot, double strike, double maturity, double rate,
                                            double volatility, boolean call) {
        RiskError invalid = validate(spot, strike, maturity, volatility);
        if (invalid != null) return RiskResult.failure(invalid);

        if (maturity == 0.0) {
            return RiskResult.success(intrinsic(spot, strike, call));
        }

        double price = closedForm(spot, strike, maturity, rate, volatility, call);
        return Double.isFinite(price)
                ? RiskResult.success(price)
                : RiskResult.failure(RiskError.COMPUTATION_FAILED);
    }

    public double delta(double spot, double strike, double maturity, double rate, double volatility, boolean call) {
        if (maturity <= 0 || volatility <= 0) {
            return expiryDelta(spot, strike, call);
        }
        D1D2 d = FastMath.blackScholesD1D2(spot, strike, maturity, rate, volatility);
        return call ? FastMath.normCdf(d.d1()) : FastMath.normCdf(d.d1()) - 1.0;
    }

    public double gamma(double spot, double strike, double maturity, double rate, double volatility) {
        if (maturity <= 0 || volatility <= 0) return 0.0;
        D1D2 d = FastMath.blackScholesD1D2(spot, strike, maturity, rate, volatility);
        return FastMath.normPdf(d.d1()) / (spot * volatility * Math.sqrt(maturity));
    }

    public double vega(double spot, double strike, double maturity, double rate, double volatility) {
        if (maturity <= 0 || volatility <= 0) return 0.0;
        D1D2 d = FastMath.blackScholesD1D2(spot, strike, maturity, rate, volatility);
        return spot * FastMath.normPdf(d.d1()) * Math.sqrt(maturity) / vegaScale;
    }

    public double theta(double spot, double strike, double maturity, double rate, double volatility, boolean call) {
        if (maturity <= 0 || volatility <= 0) return 0.0;
        D1D2 d = FastMath.blackScholesD1D2(spot, strike, maturity, rate, volatility);
        return thetaFrom(spot, strike, maturity, rate, volatility, call, d, FastMath.normPdf(d.d1()));
    }

    public Greeks calculateAllGreeks(double spot, double strike, double maturity, double rate,
                                     double volatility, boolean call) {
        if (maturity <= 0 || volatility <= 0) {
            return new Greeks(expiryDelta(spot, strike, call), 0.0, 0.0, 0.0);
        }

        D1D2 d = FastMath.blackScholesD1D2(spot, strike, maturity, rate, volatility);
        double sqrtT = Math.sqrt(maturity);
        double pdfD1 = FastMath.normPdf(d.d1());

        double delta = call ? FastMath.normCdf(d.d1()) : FastMath.normCdf(d.d1()) - 1.0;
        double gamma = pdfD1 / (spot * volatility * sqrtT);
        double vega = spot * pdfD1 * sqrtT / vegaScale;
        double theta = thetaFrom(spot, strike, maturity, rate, volatility, call, d, pdfD1);

        return new Greeks(delta, gamma, vega, theta);
    }

    public RiskResult<Double> priceFromCurve(ForwardCurve curve, double strike, double maturity, double rate,
                                             double volatility, boolean call) {
        if (!(volatility > 0)) return RiskResult.failure(RiskError.INVALID_VOLATILITY);
        if (!(maturity >= 0)) return RiskResult.failure(RiskError.NEGATIVE_TIME);
        if (!(strike > 0)) return RiskResult.failure(RiskError.INVALID_STRIKE);

        double forward = curve.getForward(maturity);
        if (!(forward > 0) || Double.isInfinite(forward)) {
            log.warn("[BS] unusable forward: T={}, F={}", maturity, forward);
            return RiskResult.failure(RiskError.COMPUTATION_FAILED);
        }

        if (maturity == 0.0) {
            return RiskResult.success(intrinsic(forward, strike, call));
        }

        D1D2 d = FastMath.blackScholesD1D2(forward, strike, maturity, 0.0, volatility);
        double discount = Math.exp(-rate * maturity);
        double price = call
                ? discount * (forward * FastMath.normCdf(d.d1()) - strike * FastMath.normCdf(d.d2()))
                : discount * (strike * FastMath.normCdf(-d.d2()) - forward * FastMath.normCdf(-d.d1()));

        return Double.isFinite(price)
                ? RiskResult.success(price)
                : RiskResult.failure(RiskError.COMPUTATION_FAILED);
    }

    public double deltaFromCurve(ForwardCurve curve, double strike, double maturity, double rate,
                                 double volatility, boolean call) {
        double forward = curve.getForward(maturity);
        if (maturity <= 0 || volatility <= 0) {
            return expiryDelta(forward, strike, call);
        }
        D1D2 d = FastMath.blackScholesD1D2(forward, strike, maturity, 0.0, volatility);
        double nd1 = FastMath.normCdf(d.d1());
        return Math.exp(-rate * maturity) * (call ? nd1 : nd1 - 1.0);
    }

    // entry i: price change when only the forward at bumpTenors[i] is lifted by 0.01%
    public double[] calculateCurveSensitivities(ForwardCurve curve, double strike, double maturity, double rate,
                                                double volatility, boolean call, double[] bumpTenors) {
        double[] sensitivities = new double[bumpTenors.length];
        RiskResult<Double> base = priceFromCurve(curve, strike, maturity, rate, volatility, call);
        if (!base.isSuccess()) {
            log.warn("[BS] curve sensitivities skipped: base price failed ({})", base.getError());
            return sensitivities;
        }

        for (int i = 0; i < bumpTenors.length; i++) {
            double tenor = bumpTenors[i];
            ForwardCurve bumped = t -> t == tenor ? curve.getForward(t) * CURVE_BUMP : curve.getForward(t);
            RiskResult<Double> shifted = priceFromCurve(bumped, strike, maturity, rate, volatility, call);
            sensitivities[i] = shifted.isSuccess() ? shifted.getValue() - base.getValue() : 0.0;
        }
        return sensitivities;
    }

    public void clearCache() {
        cache.invalidateAll();
        log.debug("[BS] price cache cleared");
    }

    public long cacheSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private RiskError validate(double spot, double strike, double maturity, double volatility) {
        if (!(volatility > 0)) return RiskError.INVALID_VOLATILITY;
        if (!(maturity >= 0)) return RiskError.NEGATIVE_TIME;
        if (!(strike > 0) || !(spot > 0)) return RiskError.INVALID_STRIKE;
        return null;
    }

    private double closedForm(double spot, double strike, double maturity, double rate,
                              double volatility, boolean call) {
        D1D2 d = FastMath.blackScholesD1D2(spot, strike, maturity, rate, volatility);
        double discountedStrike = strike * Math.exp(-rate * maturity);
        return call
                ? spot * FastMath.normCdf(d.d1()) - discountedStrike * FastMath.normCdf(d.d2())
                : discountedStrike * FastMath.normCdf(-d.d2()) - spot * FastMath.normCdf(-d.d1());
    }

    private double thetaFrom(double spot, double strike, double maturity, double rate, double volatility,
                             boolean call, D1D2 d, double pdfD1) {
        double decay = -spot * pdfD1 * volatility / (2 * Math.sqrt(maturity));
        double carry = rate * strike * Math.exp(-rate * maturity);
        return call
                ? (decay - carry * FastMath.normCdf(d.d2())) / thetaDayCount
                : (decay + carry * FastMath.normCdf(-d.d2())) / thetaDayCount;
    }

    private static double intrinsic(double underlying, double strike, boolean call) {
        return call ? Math.max(underlying - strike, 0.0) : Math.max(strike - underlying, 0.0);
    }

    private static double expiryDelta(double underlying, double strike, boolean call) {
        if (call) return underlying > strike ? 1.0 : 0.0;
        return underlying < strike ? -1.0 : 0.0;
    }
}

package com.commodity.riskengine.domain.service.pricing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.commodity.riskengine.domain.model.Greeks;
import com.commodity.riskengine.domain.model.RiskError;
import com.commodity.riskengine.domain.model.RiskResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BlackScholesModelTest {

    private static final double S = 100.0;
    private static final double K = 105.0;
    private static final double T = 0.25;
    private static final double R = 0.05;
    private static final double VOL = 0.20;

    private BlackScholesModel model;

    @BeforeEach
    void setUp() {
        model = new BlackScholesModel();
    }

    private double price(double spot, double strike, double maturity, double rate, double vol, boolean call) {
        return model.price(spot, strike, maturity, rate, vol, call).getValue();
    }

    @Nested
    @DisplayName("Pricing")
    class Pricing {

        @Test
        @DisplayName("matches closed-form reference values")
        void referenceValues() {
            assertThat(price(S, K, T, R, VOL, true)).isCloseTo(2.477902, within(1e-4));
            assertThat(price(S, K, T, R, VOL, false)).isCloseTo(6.173571, within(1e-4));
            assertThat(price(100, 100, 1.0, 0.05, 0.2, true)).isCloseTo(10.450584, within(1e-4));
        }

        @Test
        @DisplayName("put-call parity holds")
        void putCallParity() {
            double[][] cases = {{S, K, T, R, VOL}, {80, 60, 2.0, 0.01, 0.5}, {50, 75, 0.1, 0.08, 0.9}};
            for (double[] c : cases) {
                double call = price(c[0], c[1], c[2], c[3], c[4], true);
                double put = price(c[0], c[1], c[2], c[3], c[4], false);

                assertThat(call - put).isCloseTo(c[0] - c[1] * Math.exp(-c[3] * c[2]), within(1e-9));
            }
        }

        @Test
        void expiryReturnsIntrinsicValue() {
            assertThat(price(110, 100, 0.0, R, VOL, true)).isEqualTo(10.0);
            assertThat(price(110, 100, 0.0, R, VOL, false)).isEqualTo(0.0);
            assertThat(price(90, 100, 0.0, R, VOL, false)).isEqualTo(10.0);
            assertThat(model.cacheSize()).isZero();
        }

        @Test
        void deepInAndOutOfTheMoneyLimits() {
            assertThat(price(200, 50, 0.1, R, 0.2, true))
                    .isCloseTo(200 - 50 * Math.exp(-R * 0.1), within(1e-9));
            assertThat(price(50, 200, 0.1, R, 0.2, true)).isCloseTo(0.0, within(1e-12));
        }

        @Test
        void uncachedMatchesCachedWithoutFillingCache() {
            double uncached = model.priceUncached(S, K, T, R, VOL, true).getValue();

            assertThat(model.cacheSize()).isZero();
            assertThat(uncached).isEqualTo(price(S, K, T, R, VOL, true));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void rejectsInvalidInputsInOrder() {
            assertThat(model.price(S, K, T, R, 0.0, true)).isEqualTo(RiskResult.failure(RiskError.INVALID_VOLATILITY));
            assertThat(model.price(S, K, T, R, Double.NaN, true).getError()).isEqualTo(RiskError.INVALID_VOLATILITY);
            assertThat(model.price(S, K, -0.1, R, VOL, true).getError()).isEqualTo(RiskError.NEGATIVE_TIME);
            assertThat(model.price(S, 0.0, T, R, VOL, true).getError()).isEqualTo(RiskError.INVALID_STRIKE);
            assertThat(model.price(-1.0, K, T, R, VOL, false).getError()).isEqualTo(RiskError.INVALID_STRIKE);
            assertThat(model.price(-1.0, -1.0, -1.0, R, -1.0, true).getError()).isEqualTo(RiskError.INVALID_VOLATILITY);
            assertThat(model.price(-1.0, -1.0, -1.0, R, VOL, true).getError()).isEqualTo(RiskError.NEGATIVE_TIME);
        }

        @Test
        void failuresAreNotCached() {
            model.price(S, K, T, R, 0.0, true);
            model.price(S, K, -1.0, R, VOL, true);

            assertThat(model.cacheSize()).isZero();
        }
    }

    @Nested
    @DisplayName("Greeks")
    class GreekSensitivities {

        @Test
        void individualGreeksAgreeWithBatch() {
            for (boolean call : new boolean[]{true, false}) {
                Greeks all = model.calculateAllGreeks(S, K, T, R, VOL, call);

                assertThat(all.delta()).isEqualTo(model.delta(S, K, T, R, VOL, call));
                assertThat(all.gamma()).isEqualTo(model.gamma(S, K, T, R, VOL));
                assertThat(all.vega()).isEqualTo(model.vega(S, K, T, R, VOL));
                assertThat(all.theta()).isEqualTo(model.theta(S, K, T, R, VOL, call));
            }
        }

        @Test
        void referenceDelta() {
            assertThat(model.delta(S, K, T, R, VOL, true)).isCloseTo(0.377184, within(1e-5));
            assertThat(model.delta(S, K, T, R, VOL, false))
                    .isEqualTo(model.delta(S, K, T, R, VOL, true) - 1.0);
        }

        @Test
        void matchFiniteDifferences() {
            double deltaFd = (price(S + 1, K, T, R, VOL, true) - price(S - 1, K, T, R, VOL, true)) / 2.0;
            double vegaFd = (price(S, K, T, R, VOL + 0.01, true) - price(S, K, T, R, VOL - 0.01, true)) / 2.0;
            double thetaFd = price(S, K, T - 1.0 / 365.0, R, VOL, true) - price(S, K, T, R, VOL, true);

            assertThat(model.delta(S, K, T, R, VOL, true)).isCloseTo(deltaFd, within(1e-3));
            assertThat(model.vega(S, K, T, R, VOL)).isCloseTo(vegaFd, within(1e-3));
            assertThat(model.theta(S, K, T, R, VOL, true)).isCloseTo(thetaFd, within(5e-4));
        }

        @Test
        void signs() {
            Greeks call = model.calculateAllGreeks(S, K, T, R, VOL, true);
            Greeks put = model.calculateAllGreeks(S, K, T, R, VOL, false);

            assertThat(call.delta()).isBetween(0.0, 1.0);
            assertThat(put.delta()).isBetween(-1.0, 0.0);
            assertThat(call.gamma()).isPositive().isEqualTo(put.gamma());
            assertThat(call.vega()).isPositive().isEqualTo(put.vega());
            assertThat(call.theta()).isNegative();
        }

        @Test
        @DisplayName("expired or zero-vol options keep only the step delta")
        void degenerateInputs() {
            assertThat(model.calculateAllGreeks(110, 100, 0.0, R, VOL, true)).isEqualTo(new Greeks(1.0, 0.0, 0.0, 0.0));
            assertThat(model.calculateAllGreeks(90, 100, 0.0, R, VOL, false)).isEqualTo(new Greeks(-1.0, 0.0, 0.0, 0.0));
            assertThat(model.calculateAllGreeks(90, 100, 0.5, R, 0.0, true)).isEqualTo(Greeks.ZERO);
            assertThat(model.gamma(S, K, 0.0, R, VOL)).isZero();
            assertThat(model.vega(S, K, T, R, 0.0)).isZero();
            assertThat(model.theta(S, K, -1.0, R, VOL, true)).isZero();
        }

        @Test
        void scalingFollowsProperties() {
            PricingProperties properties = new PricingProperties();
            properties.setVegaScale(1.0);
            properties.setThetaDayCount(1.0);
            BlackScholesModel annual = new BlackScholesModel(properties);

            assertThat(annual.vega(S, K, T, R, VOL)).isCloseTo(model.vega(S, K, T, R, VOL) * 100.0, within(1e-12));
            assertThat(annual.theta(S, K, T, R, VOL, true))
                    .isCloseTo(model.theta(S, K, T, R, VOL, true) * 365.0, within(1e-10));
        }
    }

    @Nested
    @DisplayName("Price cache")
    class PriceCache {

        @Test
        void repeatedCallsReturnSameValue() {
            RiskResult<Double> first = model.price(S, K, T, R, VOL, true);
            RiskResult<Double> second = model.price(S, K, T, R, VOL, true);

            assertThat(second).isEqualTo(first);
            assertThat(model.cacheSize()).isEqualTo(1);
        }

        @Test
        void callAndPutAreCachedSeparately() {
            model.price(S, K, T, R, VOL, true);
            model.price(S, K, T, R, VOL, false);

            assertThat(model.cacheSize()).isEqualTo(2);
        }

        @Test
        void clearCacheEmptiesAndRecomputesIdentically() {
            double before = price(S, K, T, R, VOL, true);

            model.clearCache();

            assertThat(model.cacheSize()).isZero();
            assertThat(price(S, K, T, R, VOL, true)).isEqualTo(before);
        }

        @Test
        void staysWithinMaximumSize() {
            BlackScholesModel small = new BlackScholesModel(10, 365.0, 100.0);

            for (int i = 0; i < 200; i++) {
                small.price(50.0 + i * 0.5, K, T, R, VOL, true);
            }

            assertThat(small.cacheSize()).isLessThanOrEqualTo(10);
        }

        @Test
        void concurrentPricingIsConsistent() {
            List<Double> parallel = IntStream.range(0, 2_000).parallel()
                    .mapToObj(i -> price(80.0 + (i % 40), K, T, R, VOL, i % 2 == 0))
                    .collect(Collectors.toList());

            model.clearCache();
            for (int i = 0; i < 2_000; i++) {
                assertThat(parallel.get(i)).isEqualTo(price(80.0 + (i % 40), K, T, R, VOL, i % 2 == 0));
            }
        }

        @Test
        void exposesCacheMetrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            model.bindMetrics(registry);

            model.price(S, K, T, R, VOL, true);
            model.price(S, K, T, R, VOL, true);

            assertThat(registry.get("cache.gets").tag("cache", "black-scholes-price").tag("result", "hit")
                    .functionCounter().count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Black-76 on a forward curve")
    class ForwardCurvePricing {

        @Test
        void matchesBlackScholesOnCarryForward() {
            ForwardCurve curve = t -> S * Math.exp(R * t);

            for (boolean call : new boolean[]{true, false}) {
                assertThat(model.priceFromCurve(curve, K, T, R, VOL, call).getValue())
                        .isCloseTo(price(S, K, T, R, VOL, call), within(1e-10));
            }
            assertThat(model.deltaFromCurve(curve, K, T, R, VOL, true))
                    .isCloseTo(Math.exp(-R * T) * model.delta(S, K, T, R, VOL, true), within(1e-12));
        }

        @Test
        void backwardatedCurveLowersCallValue() {
            ForwardCurve contango = t -> 100.0 + 8.0 * t;
            ForwardCurve backwardation = t -> 100.0 - 8.0 * t;

            assertThat(model.priceFromCurve(backwardation, 100.0, 1.0, R, 0.3, true).getValue())
                    .isLessThan(model.priceFromCurve(contango, 100.0, 1.0, R, 0.3, true).getValue());
        }

        @Test
        void expiryReturnsIntrinsicOnForward() {
            assertThat(model.priceFromCurve(t -> 95.0, 90.0, 0.0, R, VOL, true).getValue()).isEqualTo(5.0);
        }

        @Test
        void unusableForwardFails() {
            assertThat(model.priceFromCurve(t -> 0.0, K, T, R, VOL, true).getError())
                    .isEqualTo(RiskError.COMPUTATION_FAILED);
            assertThat(model.priceFromCurve(t -> -5.0, K, T, R, VOL, false).getError())
                    .isEqualTo(RiskError.COMPUTATION_FAILED);
            assertThat(model.priceFromCurve(t -> Double.NaN, K, T, R, VOL, true).getError())
                    .isEqualTo(RiskError.COMPUTATION_FAILED);
            assertThat(model.priceFromCurve(t -> Double.POSITIVE_INFINITY, K, T, R, VOL, true).getError())
                    .isEqualTo(RiskError.COMPUTATION_FAILED);
        }

        @Test
        @DisplayName("only a bump at the option maturity moves the curve price")
        void curveSensitivityAtMaturity() {
            ForwardCurve curve = t -> S * Math.exp(R * t);
            double base = model.priceFromCurve(curve, K, T, R, VOL, true).getValue();
            double bumped = model.priceFromCurve(t -> curve.getForward(t) * 1.0001, K, T, R, VOL, true).getValue();

            double[] sensitivities = model.calculateCurveSensitivities(curve, K, T, R, VOL, true,
                    new double[]{0.1, T, 1.0});

            assertThat(sensitivities).hasSize(3);
            assertThat(sensitivities[0]).isZero();
            assertThat(sensitivities[1]).isCloseTo(bumped - base, within(1e-15));
            assertThat(sensitivities[2]).isZero();
        }

        @Test
        void curveSensitivityMatchesForwardDelta() {
            ForwardCurve curve = t -> 100.0 - 8.0 * t;
            double forward = curve.getForward(T);

            for (boolean call : new boolean[]{true, false}) {
                double sensitivity = model.calculateCurveSensitivities(curve, K, T, R, VOL, call, new double[]{T})[0];

                assertThat(sensitivity)
                        .isCloseTo(model.deltaFromCurve(curve, K, T, R, VOL, call) * forward * 1e-4, within(1e-5));
            }
        }

        @Test
        void curveSensitivitiesAreZeroWhenBasePriceFails() {
            assertThat(model.calculateCurveSensitivities(t -> -1.0, K, T, R, VOL, true, new double[]{T, 1.0}))
                    .containsExactly(0.0, 0.0);
            assertThat(model.calculateCurveSensitivities(t -> S, K, T, R, 0.0, true, new double[]{T}))
                    .containsExactly(0.0);
            assertThat(model.calculateCurveSensitivities(t -> S, K, T, R, VOL, true, new double[0])).isEmpty();
        }

        @Test
        void validatesBeforeReadingCurve() {
            ForwardCurve failing = t -> {
                throw new AssertionError("curve should not be read");
            };

            assertThat(model.priceFromCurve(failing, K, T, R, 0.0, true).getError())
                    .isEqualTo(RiskError.INVALID_VOLATILITY);
            assertThat(model.priceFromCurve(failing, K, -1.0, R, VOL, true).getError())
                    .isEqualTo(RiskError.NEGATIVE_TIME);
            assertThat(model.priceFromCurve(failing, 0.0, T, R, VOL, true).getError())
                    .isEqualTo(RiskError.INVALID_STRIKE);
        }
    }
}

package com.commodity.riskengine.domain.service.pricing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.commodity.riskengine.domain.model.OptionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class PayoffModelTest {

    @Nested
    @DisplayName("Terminal payoffs")
    class Terminal {

        @Test
        void europeanCallAndPut() {
            assertThat(PayoffModel.calculatePayoff(OptionType.EUROPEAN_CALL, 110.0, 105.0)).isEqualTo(5.0);
            assertThat(PayoffModel.calculatePayoff(OptionType.EUROPEAN_CALL, 100.0, 105.0)).isEqualTo(0.0);
            assertThat(PayoffModel.calculatePayoff(OptionType.EUROPEAN_PUT, 100.0, 105.0)).isEqualTo(5.0);
            assertThat(PayoffModel.calculatePayoff(OptionType.EUROPEAN_PUT, 110.0, 105.0)).isEqualTo(0.0);
        }

        @Test
        void digitalCallPaysFixedAmountOnlyStrictlyAboveStrike() {
            assertThat(PayoffModel.calculatePayoff(OptionType.DIGITAL_CALL, 110.0, 105.0, null, 0.0, 1000.0))
                    .isEqualTo(1000.0);
            assertThat(PayoffModel.calculatePayoff(OptionType.DIGITAL_CALL, 105.0, 105.0, null, 0.0, 1000.0))
                    .isEqualTo(0.0);
            assertThat(PayoffModel.calculatePayoff(OptionType.DIGITAL_CALL, 106.0, 105.0))
                    .isEqualTo(PayoffModel.DEFAULT_PAYOUT);
        }
    }

    @Nested
    @DisplayName("Path-dependent payoffs")
    class PathDependent {

        @Test
        void asianUsesArithmeticMean() {
            double[] path = {100, 105, 110, 108, 112};

            assertThat(PayoffModel.calculatePayoff(OptionType.ASIAN_CALL, 0.0, 105.0, path))
                    .isCloseTo(2.0, within(1e-12));
            assertThat(PayoffModel.calculatePayoff(OptionType.ASIAN_PUT, 0.0, 110.0, path))
                    .isCloseTo(3.0, within(1e-12));
            assertThat(PayoffModel.calculatePayoff(OptionType.ASIAN_PUT, 0.0, 100.0, path)).isEqualTo(0.0);
        }

        @Test
        void lookbackUsesPathMaximum() {
            double[] path = {100, 125, 90, 101};

            assertThat(PayoffModel.calculatePayoff(OptionType.LOOKBACK_CALL, 101.0, 105.0, path)).isEqualTo(20.0);
        }

        @Test
        @DisplayName("barrier touched at any step extinguishes the option")
        void barrierTouchKnocksOut() {
            double[] touchedThenRecovered = {100, 105, 94, 150};
            double[] touchedExactly = {100, 95, 130};

            assertThat(PayoffModel.calculatePayoff(OptionType.BARRIER_CALL_KNOCKOUT, 150.0, 100.0,
                    touchedThenRecovered, 95.0, 1.0)).isEqualTo(0.0);
            assertThat(PayoffModel.calculatePayoff(OptionType.BARRIER_CALL_KNOCKOUT, 130.0, 100.0,
                    touchedExactly, 95.0, 1.0)).isEqualTo(0.0);
        }

        @Test
        @DisplayName("barrier never touched reduces to the European call")
        void untouchedBarrierMatchesEuropean() {
            double[] path = {100, 97, 104, 118};

            double barrier = PayoffModel.calculatePayoff(OptionType.BARRIER_CALL_KNOCKOUT, 118.0, 100.0,
                    path, 95.0, 1.0);

            assertThat(barrier).isEqualTo(PayoffModel.calculatePayoff(OptionType.EUROPEAN_CALL, 118.0, 100.0));
        }

        @Test
        void readsSliceOfFlatBuffer() {
            double[] flat = {100, 80, 120, /* path 2 */ 100, 110, 130};

            assertThat(PayoffModel.calculatePayoff(OptionType.LOOKBACK_CALL, 130.0, 100.0, flat, 3, 3, 0.0, 1.0))
                    .isEqualTo(30.0);
            assertThat(PayoffModel.calculatePayoff(OptionType.BARRIER_CALL_KNOCKOUT, 130.0, 100.0, flat, 3, 3, 95.0, 1.0))
                    .isEqualTo(30.0);
            assertThat(PayoffModel.calculatePayoff(OptionType.BARRIER_CALL_KNOCKOUT, 120.0, 100.0, flat, 0, 3, 95.0, 1.0))
                    .isEqualTo(0.0);
        }

        @ParameterizedTest
        @EnumSource(value = OptionType.class, names = {"ASIAN_CALL", "ASIAN_PUT", "BARRIER_CALL_KNOCKOUT", "LOOKBACK_CALL"})
        void emptyOrMissingPathPaysNothing(OptionType type) {
            assertThat(PayoffModel.calculatePayoff(type, 150.0, 100.0, new double[0])).isEqualTo(0.0);
            assertThat(PayoffModel.calculatePayoff(type, 150.0, 100.0, null, 0.0, 1.0)).isEqualTo(0.0);
        }
    }

    @Test
    void requiresPathFlagsPathDependentTypes() {
        assertThat(OptionType.EUROPEAN_CALL.requiresPath()).isFalse();
        assertThat(OptionType.DIGITAL_CALL.requiresPath()).isFalse();
        assertThat(OptionType.ASIAN_PUT.requiresPath()).isTrue();
        assertThat(OptionType.BARRIER_CALL_KNOCKOUT.requiresPath()).isTrue();
        assertThat(OptionType.LOOKBACK_CALL.requiresPath()).isTrue();
    }
}

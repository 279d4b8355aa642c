package com.commodity.riskengine.domain.service.math;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.commodity.riskengine.domain.service.math.FastMath.D1D2;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FastMathTest {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    @Nested
    @DisplayName("normCdf")
    class NormCdf {

        @Test
        @DisplayName("stays within the Abramowitz-Stegun error bound across [-8, 8]")
        void matchesReferenceDistribution() {
            for (double x = -7.95; x <= 7.95; x += 0.05) {
                assertThat(FastMath.normCdf(x))
                        .as("normCdf(%s)", x)
                        .isCloseTo(STANDARD_NORMAL.cumulativeProbability(x), within(1.5e-7));
            }
        }

        @Test
        void saturatesOutsideBounds() {
            assertThat(FastMath.normCdf(-8.0001)).isEqualTo(0.0);
            assertThat(FastMath.normCdf(-50.0)).isEqualTo(0.0);
            assertThat(FastMath.normCdf(8.0001)).isEqualTo(1.0);
            assertThat(FastMath.normCdf(Double.MAX_VALUE)).isEqualTo(1.0);
        }

        @Test
        void isSymmetricAroundZero() {
            assertThat(FastMath.normCdf(0.0)).isCloseTo(0.5, within(1e-9));
            for (double x = 0.1; x < 5.0; x += 0.37) {
                assertThat(FastMath.normCdf(x) + FastMath.normCdf(-x)).isCloseTo(1.0, within(1e-15));
            }
        }

        @Test
        void isMonotone() {
            double previous = FastMath.normCdf(-8.0);
            for (double x = -7.9; x <= 8.0; x += 0.1) {
                double current = FastMath.normCdf(x);
                assertThat(current).isGreaterThanOrEqualTo(previous);
                previous = current;
            }
        }

        @Test
        void batchMatchesScalar() {
            double[] inputs = {-9.0, -1.0, 0.0, 0.5, 2.0, 9.0};
            double[] outputs = new double[inputs.length];

            FastMath.normCdfBatch(inputs, outputs);

            for (int i = 0; i < inputs.length; i++) {
                assertThat(outputs[i]).isEqualTo(FastMath.normCdf(inputs[i]));
            }
        }

        @Test
        void batchRejectsShortOutput() {
            assertThatThrownBy(() -> FastMath.normCdfBatch(new double[3], new double[2]))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void normPdfMatchesClosedForm() {
        assertThat(FastMath.normPdf(0.0)).isEqualTo(FastMath.INV_SQRT_2PI);
        assertThat(FastMath.normPdf(1.3)).isCloseTo(STANDARD_NORMAL.density(1.3), within(1e-15));
        assertThat(FastMath.normPdf(-2.1)).isEqualTo(FastMath.normPdf(2.1));
        assertThat(FastMath.SQRT_2PI * FastMath.INV_SQRT_2PI).isCloseTo(1.0, within(1e-15));
    }

    @Nested
    @DisplayName("blackScholesD1D2")
    class D1D2Terms {

        @Test
        void computesStandardTerms() {
            D1D2 d = FastMath.blackScholesD1D2(100.0, 105.0, 0.25, 0.05, 0.20);

            assertThat(d.d1()).isCloseTo(-0.3129016417, within(1e-9));
            assertThat(d.d2()).isCloseTo(d.d1() - 0.20 * 0.5, within(1e-15));
        }

        @Test
        void degenerateInputsReturnZeros() {
            assertThat(FastMath.blackScholesD1D2(100, 105, 0.0, 0.05, 0.2)).isEqualTo(new D1D2(0.0, 0.0));
            assertThat(FastMath.blackScholesD1D2(100, 105, -1.0, 0.05, 0.2)).isEqualTo(new D1D2(0.0, 0.0));
            assertThat(FastMath.blackScholesD1D2(100, 105, 0.5, 0.05, 0.0)).isEqualTo(new D1D2(0.0, 0.0));
            assertThat(FastMath.blackScholesD1D2(100, 105, 0.5, 0.05, -0.3)).isEqualTo(new D1D2(0.0, 0.0));
        }
    }
}

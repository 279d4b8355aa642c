package com.commodity.riskengine.domain.service.math;

public final class FastMath {

    public static final double SQRT_2PI = 2.506628274631000502415765284811;
    public static final double INV_SQRT_2PI = 0.3989422804014326779399460599344;

    static final double CDF_LOWER_BOUND = -8.0;
    static final double CDF_UPPER_BOUND = 8.0;

    private static final double SQRT_2 = Math.sqrt(2.0);

    private static final double A1 = 0.254829592;
    private static final double A2 = -0.284496736;
    private static final double A3 = 1.421413741;
    private static final double A4 = -1.453152027;
    private static final double A5 = 1.061405429;
    private static final double P = 0.3275911;

    private FastMath() {
    }

    public static double normCdf(double x) {
        if (x < CDF_LOWER_BOUND) return 0.0;
        if (x > CDF_UPPER_BOUND) return 1.0;

        double sign = x >= 0 ? 1.0 : -1.0;
        double z = Math.abs(x) / SQRT_2;

        double t = 1.0 / (1.0 + P * z);
        double y = 1.0 - (((((A5 * t + A4) * t) + A3) * t + A2) * t + A1) * t * Math.exp(-z * z);

        return 0.5 * (1.0 + sign * y);
    }

    public static double normPdf(double x) {
        return Math.exp(-0.5 * x * x) * INV_SQRT_2PI;
    }

    public static void normCdfBatch(double[] inputs, double[] outputs) {
        if (outputs.length < inputs.length) {
            throw new IllegalArgumentException("output buffer is shorter than inputs: "
                    + outputs.length + " < " + inputs.length);
        }
        for (int i = 0; i < inputs.length; i++) {
            outputs[i] = normCdf(inputs[i]);
        }
    }

    public static D1D2 blackScholesD1D2(double spot, double strike, double t, double rate, double vol) {
        if (t <= 0 || vol <= 0) return D1D2.DEGENERATE;

        double sqrtT = Math.sqrt(t);
        double d1 = (Math.log(spot / strike) + (rate + 0.5 * vol * vol) * t) / (vol * sqrtT);
        double d2 = d1 - vol * sqrtT;
        return new D1D2(d1, d2);
    }

    public record D1D2(double d1, double d2) {
        static final D1D2 DEGENERATE = new D1D2(0.0, 0.0);
    }
}

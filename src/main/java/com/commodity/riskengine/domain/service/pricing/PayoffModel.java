package com.commodity.riskengine.domain.service.pricing;

import com.commodity.riskengine.domain.model.OptionType;

public final class PayoffModel {

    public static final double DEFAULT_PAYOUT = 1.0;

    private static final double[] NO_PATH = new double[0];

    private PayoffModel() {
    }

    public static double calculatePayoff(OptionType optionType, double finalPrice, double strike) {
        return calculatePayoff(optionType, finalPrice, strike, NO_PATH, 0.0, DEFAULT_PAYOUT);
    }

    public static double calculatePayoff(OptionType optionType, double finalPrice, double strike,
                                         double[] pricePath) {
        return calculatePayoff(optionType, finalPrice, strike, pricePath, 0.0, DEFAULT_PAYOUT);
    }

    public static double calculatePayoff(OptionType optionType, double finalPrice, double strike,
                                         double[] pricePath, double barrier, double payoutAmount) {
        double[] path = pricePath == null ? NO_PATH : pricePath;
        return calculatePayoff(optionType, finalPrice, strike, path, 0, path.length, barrier, payoutAmount);
    }

    public static double calculatePayoff(OptionType optionType, double finalPrice, double strike,
                                         double[] path, int from, int length,
                                         double barrier, double payoutAmount) {
        if (optionType == null) return 0.0;

        return switch (optionType) {
            case EUROPEAN_CALL -> Math.max(finalPrice - strike, 0.0);
            case EUROPEAN_PUT -> Math.max(strike - finalPrice, 0.0);
            case ASIAN_CALL -> length == 0 ? 0.0 : Math.max(average(path, from, length) - strike, 0.0);
            case ASIAN_PUT -> length == 0 ? 0.0 : Math.max(strike - average(path, from, length), 0.0);
            case BARRIER_CALL_KNOCKOUT -> barrierKnockout(path, from, length, finalPrice, strike, barrier);
            case LOOKBACK_CALL -> length == 0 ? 0.0 : Math.max(max(path, from, length) - strike, 0.0);
            case DIGITAL_CALL -> finalPrice > strike ? payoutAmount : 0.0;
        };
    }

    private static double barrierKnockout(double[] path, int from, int length,
                                          double finalPrice, double strike, double barrier) {
        if (length == 0) return 0.0;

        for (int i = from; i < from + length; i++) {
            if (path[i] <= barrier) {
                return 0.0;
            }
        }
        return Math.max(finalPrice - strike, 0.0);
    }

    private static double average(double[] path, int from, int length) {
        double sum = 0.0;
        for (int i = from; i < from + length; i++) {
            sum += path[i];
        }
        return sum / length;
    }

    private static double max(double[] path, int from, int length) {
        double max = path[from];
        for (int i = from + 1; i < from + length; i++) {
            if (path[i] > max) max = path[i];
        }
        return max;
    }
}

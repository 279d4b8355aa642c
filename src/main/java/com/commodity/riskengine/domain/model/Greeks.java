package com.commodity.riskengine.domain.model;

public record Greeks(double delta, double gamma, double vega, double theta) {

    public static final Greeks ZERO = new Greeks(0.0, 0.0, 0.0, 0.0);

    public Greeks plus(Greeks other) {
        return new Greeks(delta + other.delta, gamma + other.gamma, vega + other.vega, theta + other.theta);
    }

    public Greeks scale(double factor) {
        return new Greeks(delta * factor, gamma * factor, vega * factor, theta * factor);
    }
}

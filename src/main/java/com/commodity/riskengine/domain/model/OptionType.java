package com.commodity.riskengine.domain.model;

public enum OptionType {
    EUROPEAN_CALL(false),
    EUROPEAN_PUT(false),
    ASIAN_CALL(true),
    ASIAN_PUT(true),
    BARRIER_CALL_KNOCKOUT(true),
    LOOKBACK_CALL(true),
    DIGITAL_CALL(false);

    private final boolean pathDependent;

    OptionType(boolean pathDependent) {
        this.pathDependent = pathDependent;
    }

    public boolean requiresPath() {
        return pathDependent;
    }
}

package com.commodity.riskengine.domain.model;

public enum ResamplingMethod {
    IID,
    BLOCK,
    STATIONARY
}

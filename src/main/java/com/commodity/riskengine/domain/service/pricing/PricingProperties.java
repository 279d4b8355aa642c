package com.commodity.riskengine.domain.service.pricing;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "pricing")
public class PricingProperties {

    private long cacheMaxSize = 100_000;
    private double thetaDayCount = 365.0;
    private double vegaScale = 100.0;
}

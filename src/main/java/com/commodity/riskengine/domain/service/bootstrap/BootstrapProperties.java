package com.commodity.riskengine.domain.service.bootstrap;

import com.commodity.riskengine.domain.model.ResamplingMethod;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "bootstrap")
public class BootstrapProperties {

    private long seed = 7L;
    private int iterations = 1_000;
    private int blockSize = 20;
    private double meanBlockLength = 20.0;
    private double confidence = 0.95;
    private ResamplingMethod method = ResamplingMethod.IID;
}

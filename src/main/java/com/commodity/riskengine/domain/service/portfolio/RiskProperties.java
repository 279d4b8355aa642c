package com.commodity.riskengine.domain.service.portfolio;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "risk")
public class RiskProperties {

    private Map<String, Double> stressScenarios = defaultScenarios();
    private int asyncPoolSize = 4;

    private static Map<String, Double> defaultScenarios() {
        Map<String, Double> scenarios = new LinkedHashMap<>();
        scenarios.put("crash-30", -0.30);
        scenarios.put("selloff-10", -0.10);
        scenarios.put("rally-10", 0.10);
        scenarios.put("spike-30", 0.30);
        return scenarios;
    }
}

package com.commodity.riskengine.infra.report;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "report")
public class ReportProperties {

    private boolean enabled = false;
    private String directory = "reports";
}

package com.commodity.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

@Getter
@Builder
@ToString(exclude = "resampledEs")
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BootstrapResult {

    private double confidence;
    private ResamplingMethod method;
    private int iterations;

    private double originalVar;
    private double originalEs;
    private double ciLower95;
    private double ciUpper95;

    @Builder.Default
    private List<Double> resampledEs = Collections.emptyList();
}

package com.commodity.riskengine.api.dto;

import com.commodity.riskengine.domain.model.ResamplingMethod;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BootstrapRequest {

    @NotEmpty
    private List<Double> returns;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private Double confidence;

    @Positive
    private Integer iterations;

    private ResamplingMethod method;

    public double[] returnsArray() {
        return returns.stream().mapToDouble(Double::doubleValue).toArray();
    }
}

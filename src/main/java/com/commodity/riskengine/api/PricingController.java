package com.commodity.riskengine.api;

import com.commodity.riskengine.api.dto.BlackScholesQuote;
import com.commodity.riskengine.api.dto.MonteCarloPricingRequest;
import com.commodity.riskengine.domain.model.PricingMetrics;
import com.commodity.riskengine.domain.model.RiskError;
import com.commodity.riskengine.domain.model.RiskResult;
import com.commodity.riskengine.domain.service.montecarlo.MonteCarloProperties;
import com.commodity.riskengine.domain.service.pricing.BlackScholesModel;
import com.commodity.riskengine.domain.service.pricing.PricingCalculator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/pricing")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class PricingController {

    private final BlackScholesModel blackScholesModel;
    private final PricingCalculator pricingCalculator;
    private final MonteCarloProperties monteCarloProperties;

    @GetMapping("/black-scholes")
    public ResponseEntity<Object> blackScholes(@RequestParam double spot,
                                               @RequestParam double strike,
                                               @RequestParam double maturity,
                                               @RequestParam double rate,
                                               @RequestParam double volatility,
                                               @RequestParam(defaultValue = "true") boolean call) {
        RiskResult<Double> price = blackScholesModel.price(spot, strike, maturity, rate, volatility, call);
        if (!price.isSuccess()) {
            return failure(price.getError());
        }

        return ResponseEntity.ok(BlackScholesQuote.builder()
                .spot(spot)
                .strike(strike)
                .maturity(maturity)
                .rate(rate)
                .volatility(volatility)
                .call(call)
                .price(price.getValue())
                .greeks(blackScholesModel.calculateAllGreeks(spot, strike, maturity, rate, volatility, call))
                .build());
    }

    @PostMapping("/monte-carlo")
    public ResponseEntity<Object> monteCarlo(@Valid @RequestBody MonteCarloPricingRequest request) {
        int simulations = request.getSimulations() != null
                ? request.getSimulations() : monteCarloProperties.getPricingSimulations();

        log.info("[Pricing API] Monte Carlo pricing requested: type={}, sims={}", request.getOptionType(), simulations);

        RiskResult<PricingMetrics> result = pricingCalculator.calculateOptionPrice(
                request.getOptionType(), request.getSpot(), request.getStrike(), request.getMaturity(),
                request.getRate(), request.getVolatility(), simulations,
                request.getBarrier(), request.getPayoutAmount());

        return result.isSuccess()
                ? ResponseEntity.ok(result.getValue())
                : failure(result.getError());
    }

    private ResponseEntity<Object> failure(RiskError error) {
        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "error", error.name(),
                "message", error.getDescription()));
    }
}

package com.commodity.riskengine.api;

import com.commodity.riskengine.api.dto.BootstrapRequest;
import com.commodity.riskengine.api.dto.PortfolioRiskRequest;
import com.commodity.riskengine.domain.model.BootstrapResult;
import com.commodity.riskengine.domain.model.RiskMetrics;
import com.commodity.riskengine.domain.model.StressTestResult;
import com.commodity.riskengine.domain.service.bootstrap.BootstrapProperties;
import com.commodity.riskengine.domain.service.bootstrap.SimpleBootstrap;
import com.commodity.riskengine.domain.service.portfolio.PortfolioRiskCalculator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@Slf4j
@RestController
@RequestMapping("/api/risk")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class RiskController {

    private final PortfolioRiskCalculator portfolioRiskCalculator;
    private final SimpleBootstrap simpleBootstrap;
    private final BootstrapProperties bootstrapProperties;

    @PostMapping("/portfolio")
    public ResponseEntity<RiskMetrics> portfolio(@Valid @RequestBody PortfolioRiskRequest request) {
        log.info("[Risk API] portfolio risk requested: positions={}", request.getPositions().size());
        return ResponseEntity.ok(portfolioRiskCalculator.calculatePortfolioRisk(
                request.getPositions(), request.getMarketData()));
    }

    @PostMapping("/portfolio/async")
    public CompletableFuture<ResponseEntity<RiskMetrics>> portfolioAsync(@Valid @RequestBody PortfolioRiskRequest request) {
        log.info("[Risk API] async portfolio risk requested: positions={}", request.getPositions().size());
        return portfolioRiskCalculator.calculatePortfolioRiskAsync(request.getPositions(), request.getMarketData())
                .thenApply(ResponseEntity::ok);
    }

    @PostMapping("/stress")
    public ResponseEntity<List<StressTestResult>> stress(@Valid @RequestBody PortfolioRiskRequest request) {
        List<StressTestResult> results = request.getScenarios() == null || request.getScenarios().isEmpty()
                ? portfolioRiskCalculator.stressTestPortfolio(request.getPositions(), request.getMarketData())
                : portfolioRiskCalculator.stressTestPortfolio(request.getPositions(), request.getMarketData(),
                        request.getScenarios());
        return ResponseEntity.ok(results);
    }

    @PostMapping("/bootstrap")
    public ResponseEntity<BootstrapResult> bootstrap(@Valid @RequestBody BootstrapRequest request) {
        double confidence = request.getConfidence() != null
                ? request.getConfidence() : bootstrapProperties.getConfidence();
        int iterations = request.getIterations() != null
                ? request.getIterations() : bootstrapProperties.getIterations();

        log.info("[Risk API] bootstrap requested: n={}, confidence={}, iterations={}, method={}",
                request.getReturns().size(), confidence, iterations, request.getMethod());

        return ResponseEntity.ok(simpleBootstrap.bootstrapEs(request.returnsArray(), confidence, iterations,
                request.getMethod() != null ? request.getMethod() : bootstrapProperties.getMethod()));
    }
}

package com.commodity.riskengine.infra.config;

import com.commodity.riskengine.domain.service.bootstrap.BootstrapProperties;
import com.commodity.riskengine.domain.service.bootstrap.SimpleBootstrap;
import com.commodity.riskengine.domain.service.montecarlo.MonteCarloEngine;
import com.commodity.riskengine.domain.service.montecarlo.MonteCarloProperties;
import com.commodity.riskengine.domain.service.portfolio.PortfolioRiskCalculator;
import com.commodity.riskengine.domain.service.portfolio.RiskProperties;
import com.commodity.riskengine.domain.service.pricing.BlackScholesModel;
import com.commodity.riskengine.domain.service.pricing.PricingCalculator;
import com.commodity.riskengine.domain.service.pricing.PricingProperties;
import com.commodity.riskengine.domain.service.report.ReportPublisher;
import com.commodity.riskengine.domain.service.report.ReportSink;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class RiskEngineConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService monteCarloWorkerExecutor(MonteCarloProperties properties) {
        int workers = properties.resolvedWorkerCount();
        log.info("[Config] Monte Carlo worker pool: workers={}, seed={}", workers, properties.getSeed());
        return Executors.newFixedThreadPool(workers, namedThreadFactory("mc-worker"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService riskAsyncExecutor(RiskProperties properties) {
        return Executors.newFixedThreadPool(properties.getAsyncPoolSize(), namedThreadFactory("risk-async"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService reportExecutor() {
        return Executors.newSingleThreadExecutor(namedThreadFactory("report"));
    }

    @Bean
    public MonteCarloEngine monteCarloEngine(MonteCarloProperties properties,
                                             @Qualifier("monteCarloWorkerExecutor") ExecutorService workerExecutor) {
        return new MonteCarloEngine(properties.getSeed(), properties.resolvedWorkerCount(), workerExecutor);
    }

    @Bean
    public BlackScholesModel blackScholesModel(PricingProperties properties, MeterRegistry meterRegistry) {
        BlackScholesModel model = new BlackScholesModel(properties);
        model.bindMetrics(meterRegistry);
        return model;
    }

    @Bean
    public PricingCalculator pricingCalculator(MonteCarloEngine monteCarloEngine, MonteCarloProperties properties) {
        return new PricingCalculator(monteCarloEngine, properties);
    }

    @Bean
    public SimpleBootstrap simpleBootstrap(MonteCarloEngine monteCarloEngine, BootstrapProperties properties) {
        return new SimpleBootstrap(monteCarloEngine, properties);
    }

    @Bean
    public ReportPublisher reportPublisher(ObjectProvider<ReportSink> sinks,
                                           @Qualifier("reportExecutor") ExecutorService reportExecutor) {
        return new ReportPublisher(sinks.orderedStream().toList(), reportExecutor);
    }

    @Bean
    public PortfolioRiskCalculator portfolioRiskCalculator(BlackScholesModel blackScholesModel,
                                                           MonteCarloEngine monteCarloEngine,
                                                           MonteCarloProperties monteCarloProperties,
                                                           RiskProperties riskProperties,
                                                           MeterRegistry meterRegistry,
                                                           @Qualifier("riskAsyncExecutor") ExecutorService asyncExecutor,
                                                           ReportPublisher reportPublisher) {
        return new PortfolioRiskCalculator(blackScholesModel, monteCarloEngine, monteCarloProperties,
                riskProperties, meterRegistry, asyncExecutor, reportPublisher);
    }

    private ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

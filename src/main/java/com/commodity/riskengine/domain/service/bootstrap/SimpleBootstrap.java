package com.commodity.riskengine.domain.service.bootstrap;

import com.commodity.riskengine.domain.model.BootstrapResult;
import com.commodity.riskengine.domain.model.ResamplingMethod;
import com.commodity.riskengine.domain.model.VarEsEstimate;
import com.commodity.riskengine.domain.service.montecarlo.MonteCarloEngine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.SplittableRandom;

@Slf4j
public class SimpleBootstrap {

    private final MonteCarloEngine monteCarloEngine;
    private final BootstrapProperties properties;
    private final SplittableRandom rng;

    public SimpleBootstrap(MonteCarloEngine monteCarloEngine, BootstrapProperties properties) {
        this.monteCarloEngine = monteCarloEngine;
        this.properties = properties;
        this.rng = new SplittableRandom(properties.getSeed());
    }

    public BootstrapResult bootstrapEs(double[] returns) {
        return bootstrapEs(returns, properties.getConfidence(), properties.getIterations(), properties.getMethod());
    }

    public BootstrapResult bootstrapEs(double[] returns, double confidence, int iterations, ResamplingMethod method) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive: " + iterations);
        }
        ResamplingMethod resampling = method == null ? ResamplingMethod.IID : method;

        VarEsEstimate original = monteCarloEngine.calculateVarEs(returns, confidence);
        if (returns.length == 0) {
            return BootstrapResult.builder()
                    .confidence(confidence)
                    .method(resampling)
                    .iterations(iterations)
                    .build();
        }

        long startNano = System.nanoTime();
        double[] esValues = new double[iterations];
        double[] sample = new double[returns.length];

        synchronized (rng) {
            for (int b = 0; b < iterations; b++) {
                resample(returns, sample, resampling);
                esValues[b] = monteCarloEngine.calculateVarEs(sample, confidence).expectedShortfall();
            }
        }

        Arrays.sort(esValues);
        int lowerIndex = Math.min((int) (0.025 * iterations), iterations - 1);
        int upperIndex = Math.min((int) (0.975 * iterations), iterations - 1);

        List<Double> resampled = new ArrayList<>(iterations);
        for (double es : esValues) {
            resampled.add(es);
        }

        log.info("[Bootstrap] ES band: method={}, n={}, iterations={}, es={}, ci=[{}, {}], elapsed={}μs",
                resampling, returns.length, iterations, original.expectedShortfall(),
                esValues[lowerIndex], esValues[upperIndex], (System.nanoTime() - startNano) / 1_000);

        return BootstrapResult.builder()
                .confidence(confidence)
                .method(resampling)
                .iterations(iterations)
                .originalVar(original.valueAtRisk())
                .originalEs(original.expectedShortfall())
                .ciLower95(esValues[lowerIndex])
                .ciUpper95(esValues[upperIndex])
                .resampledEs(List.copyOf(resampled))
                .build();
    }

    void resample(double[] source, double[] target, ResamplingMethod method) {
        switch (method) {
            case IID -> resampleIid(source, target);
            case BLOCK -> resampleBlocks(source, target);
            case STATIONARY -> resampleStationary(source, target);
        }
    }

    private void resampleIid(double[] source, double[] target) {
        int n = source.length;
        for (int i = 0; i < target.length; i++) {
            target[i] = source[rng.nextInt(n)];
        }
    }

    private void resampleBlocks(double[] source, double[] target) {
        int n = source.length;
        int blockSize = Math.max(1, Math.min(properties.getBlockSize(), n));
        int filled = 0;
        while (filled < target.length) {
            int start = rng.nextInt(n);
            for (int k = 0; k < blockSize && filled < target.length; k++) {
                target[filled++] = source[(start + k) % n];
            }
        }
    }

    private void resampleStationary(double[] source, double[] target) {
        int n = source.length;
        double restartProbability = 1.0 / Math.max(1.0, properties.getMeanBlockLength());
        int position = rng.nextInt(n);
        for (int i = 0; i < target.length; i++) {
            if (i > 0) {
                position = rng.nextDouble() < restartProbability ? rng.nextInt(n) : (position + 1) % n;
            }
            target[i] = source[position];
        }
    }
}

package com.commodity.riskengine.domain.service.montecarlo;

import com.commodity.riskengine.domain.model.VarEsEstimate;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntConsumer;

@Slf4j
public class MonteCarloEngine {

    static final int PARALLEL_THRESHOLD = 2_048;

    private final RandomStreamPool streams;
    private final Executor executor;
    private final Object simulationLock = new Object();

    public MonteCarloEngine(long seed) {
        this(seed, Runtime.getRuntime().availableProcessors(), ForkJoinPool.commonPool());
    }

    public MonteCarloEngine(long seed, int workerCount, Executor executor) {
        this.streams = new RandomStreamPool(seed, workerCount);
        this.executor = executor;
    }

    public int getWorkerCount() {
        return streams.size();
    }

    public double[] simulatePaths(SimulationRequest request) {
        validateRequest(request);
        double[] paths = new double[Math.multiplyExact(request.getPathCount(), request.pointsPerPath())];
        simulateGbmPaths(paths, request.getStartPrice(), request.getMu(), request.getSigma(),
                request.getMaturity(), request.getSteps(), request.getPathCount());
        return paths;
    }

    // row-major: pathCount rows of steps + 1 prices
    public void simulateGbmPaths(double[] paths, double s0, double mu, double sigma,
                                 double maturity, int steps, int pathCount) {
        if (steps <= 0) {
            throw new IllegalArgumentException("steps must be positive: " + steps);
        }
        if (pathCount < 0) {
            throw new IllegalArgumentException("pathCount must not be negative: " + pathCount);
        }
        int width = steps + 1;
        requireCapacity(paths, (long) pathCount * width);

        double dt = maturity / steps;
        double drift = (mu - 0.5 * sigma * sigma) * dt;
        double volSqrtDt = sigma * Math.sqrt(dt);

        long startNano = System.nanoTime();
        synchronized (simulationLock) {
            runPartitioned(pathCount, (pathIndex, rng) -> {
                int base = pathIndex * width;
                paths[base] = s0;
                for (int step = 1; step <= steps; step++) {
                    double dW = rng.nextGaussian();
                    paths[base + step] = paths[base + step - 1] * Math.exp(drift + volSqrtDt * dW);
                }
            });
        }

        log.debug("[MC] paths generated: paths={}, steps={}, sigma={}, workers={}, elapsed={}μs",
                pathCount, steps, sigma, streams.size(), (System.nanoTime() - startNano) / 1_000);
    }

    // Same draws as simulateGbmPaths, but each worker reuses one path buffer and keeps only the payoff.
    public void simulatePathPayoffs(double[] payoffs, double s0, double mu, double sigma,
                                    double maturity, int steps, PathPayoff payoff) {
        if (steps <= 0) {
            throw new IllegalArgumentException("steps must be positive: " + steps);
        }
        requireCapacity(payoffs, 0);
        int width = Math.addExact(steps, 1);
        int workers = streams.size();

        double dt = maturity / steps;
        double drift = (mu - 0.5 * sigma * sigma) * dt;
        double volSqrtDt = sigma * Math.sqrt(dt);
        double[][] scratch = new double[workers][width];

        long startNano = System.nanoTime();
        synchronized (simulationLock) {
            runPartitioned(payoffs.length, (pathIndex, rng) -> {
                double[] path = scratch[pathIndex % workers];
                path[0] = s0;
                for (int step = 1; step <= steps; step++) {
                    path[step] = path[step - 1] * Math.exp(drift + volSqrtDt * rng.nextGaussian());
                }
                payoffs[pathIndex] = payoff.evaluate(path, width);
            });
        }

        log.debug("[MC] path payoffs evaluated: paths={}, steps={}, workers={}, elapsed={}μs",
                payoffs.length, steps, workers, (System.nanoTime() - startNano) / 1_000);
    }

    public void simulateSingleStepReturns(double[] returns, double mu, double sigma, double dt) {
        requireCapacity(returns, 0);
        double drift = (mu - 0.5 * sigma * sigma) * dt;
        double volSqrtDt = sigma * Math.sqrt(dt);

        synchronized (simulationLock) {
            runPartitioned(returns.length, (i, rng) ->
                    returns[i] = Math.exp(drift + volSqrtDt * rng.nextGaussian()) - 1.0);
        }
    }

    public void simulateFinalPrices(double[] finalPrices, double s0, double mu, double sigma, double maturity) {
        requireCapacity(finalPrices, 0);
        double drift = (mu - 0.5 * sigma * sigma) * maturity;
        double volSqrtT = sigma * Math.sqrt(maturity);

        synchronized (simulationLock) {
            runPartitioned(finalPrices.length, (i, rng) ->
                    finalPrices[i] = s0 * Math.exp(drift + volSqrtT * rng.nextGaussian()));
        }
    }

    public VarEsEstimate calculateVarEs(double[] returns, double confidence) {
        double[] sorted = returns.clone();
        Arrays.sort(sorted);
        return varEsFromSorted(sorted, confidence);
    }

    public List<VarEsEstimate> calculateVarEsBatch(double[] returns, double[] confidenceLevels) {
        double[] sorted = returns.clone();
        Arrays.sort(sorted);

        List<VarEsEstimate> results = new ArrayList<>(confidenceLevels.length);
        for (double confidence : confidenceLevels) {
            results.add(varEsFromSorted(sorted, confidence));
        }
        return results;
    }

    static VarEsEstimate varEsFromSorted(double[] sorted, double confidence) {
        int n = sorted.length;
        long index = (long) Math.floor((1.0 - confidence) * n);
        if (index < 0 || index >= n) {
            return VarEsEstimate.zero(confidence);
        }

        int varIndex = (int) index;
        double valueAtRisk = -sorted[varIndex];

        double es = 0.0;
        if (varIndex > 0) {
            double tailSum = 0.0;
            for (int i = 0; i < varIndex; i++) {
                tailSum += sorted[i];
            }
            es = -tailSum / varIndex;
        }
        return new VarEsEstimate(confidence, valueAtRisk, es);
    }

    // Runs body over [0, count) on the worker executor, striped the same way as the simulations.
    public void forEachSample(int count, IntConsumer body) {
        int workers = streams.size();
        if (count < PARALLEL_THRESHOLD || workers == 1) {
            for (int w = 0; w < workers; w++) {
                runStripe(w, workers, count, body);
            }
            return;
        }

        CompletableFuture<?>[] futures = new CompletableFuture<?>[workers];
        for (int w = 0; w < workers; w++) {
            int worker = w;
            futures[w] = CompletableFuture.runAsync(() -> runStripe(worker, workers, count, body), executor);
        }
        CompletableFuture.allOf(futures).join();
    }

    private void runPartitioned(int count, SampleTask task) {
        int workers = streams.size();
        forEachSample(count, i -> task.run(i, streams.stream(i % workers)));
    }

    private static void runStripe(int worker, int workers, int count, IntConsumer body) {
        for (int i = worker; i < count; i += workers) {
            body.accept(i);
        }
    }

    private void requireCapacity(double[] buffer, long required) {
        if (buffer == null) {
            throw new IllegalArgumentException("buffer must not be null");
        }
        if (buffer.length < required) {
            throw new IllegalArgumentException("buffer too small: length=" + buffer.length + ", required=" + required);
        }
    }

    private void validateRequest(SimulationRequest request) {
        if (request.getStartPrice() <= 0) {
            throw new IllegalArgumentException("start price must be positive");
        }
        if (request.getSigma() <= 0) {
            throw new IllegalArgumentException("sigma must be positive");
        }
        if (request.getPathCount() <= 0) {
            throw new IllegalArgumentException("pathCount must be positive");
        }
        if (request.getSteps() <= 0) {
            throw new IllegalArgumentException("steps must be positive");
        }
        if (request.getMaturity() <= 0) {
            throw new IllegalArgumentException("maturity must be positive");
        }
    }

    @FunctionalInterface
    private interface SampleTask {
        void run(int sampleIndex, SplittableRandom rng);
    }
}

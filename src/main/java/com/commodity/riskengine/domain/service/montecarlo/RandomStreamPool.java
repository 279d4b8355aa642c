package com.commodity.riskengine.domain.service.montecarlo;

import java.util.SplittableRandom;

public class RandomStreamPool {

    private final long baseSeed;
    private final SplittableRandom[] streams;

    public RandomStreamPool(long baseSeed, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("stream count must be positive: " + size);
        }
        this.baseSeed = baseSeed;
        this.streams = new SplittableRandom[size];
        for (int i = 0; i < size; i++) {
            streams[i] = new SplittableRandom(baseSeed + i);
        }
    }

    public int size() {
        return streams.length;
    }

    public long getBaseSeed() {
        return baseSeed;
    }

    public int assign(long sampleIndex) {
        return (int) (sampleIndex % streams.length);
    }

    public SplittableRandom stream(int worker) {
        return streams[worker];
    }
}

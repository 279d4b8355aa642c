package com.commodity.riskengine.domain.service.report;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Slf4j
public class ReportPublisher {

    private final List<ReportSink> sinks;
    private final Executor executor;

    public ReportPublisher(List<ReportSink> sinks, Executor executor) {
        this.sinks = List.copyOf(sinks);
        this.executor = executor;
    }

    public static ReportPublisher noop() {
        return new ReportPublisher(List.of(), Runnable::run);
    }

    public boolean hasSinks() {
        return !sinks.isEmpty();
    }

    public void publish(String filename, String label, double[] values) {
        if (sinks.isEmpty()) return;

        double[] snapshot = values.clone();
        for (ReportSink sink : sinks) {
            CompletableFuture.runAsync(() -> deliver(sink, filename, label, snapshot), executor);
        }
    }

    private void deliver(ReportSink sink, String filename, String label, double[] values) {
        try {
            sink.publish(filename, label, values);
            log.debug("[Report] published: sink={}, file={}, points={}",
                    sink.getClass().getSimpleName(), filename, values.length);
        } catch (Exception e) {
            log.error("[Report] publish failed: sink={}, file={}", sink.getClass().getSimpleName(), filename, e);
        }
    }
}

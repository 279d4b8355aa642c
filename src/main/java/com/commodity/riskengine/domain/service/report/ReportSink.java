package com.commodity.riskengine.domain.service.report;

public interface ReportSink {

    void publish(String filename, String label, double[] values) throws Exception;
}

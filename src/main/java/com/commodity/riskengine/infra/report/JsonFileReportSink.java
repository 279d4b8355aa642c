package com.commodity.riskengine.infra.report;

import com.commodity.riskengine.domain.service.report.ReportSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "report", name = "enabled", havingValue = "true")
public class JsonFileReportSink implements ReportSink {

    private final ObjectMapper objectMapper;
    private final ReportProperties properties;

    @Override
    public void publish(String filename, String label, double[] values) throws IOException {
        Path directory = Path.of(properties.getDirectory());
        Files.createDirectories(directory);
        Path target = directory.resolve(filename).normalize();
        if (!target.startsWith(directory.normalize())) {
            throw new IOException("report file escapes report directory: " + filename);
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("label", label);
        document.put("generatedAt", Instant.now().toString());
        document.put("count", values.length);
        document.put("values", values);

        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), document);
        log.info("[Report] written: file={}, points={}", target, values.length);
    }
}

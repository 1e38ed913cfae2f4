package com.dcruver.docvalidator.reporting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Structured (JSON) form of the report.
 */
@Component
@Slf4j
public class JsonReportWriter {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    public String toJson(ValidationReport report) throws JsonProcessingException {
        return objectMapper.writeValueAsString(report);
    }

    /**
     * Write the report to disk, creating parent directories as needed
     */
    public Path write(ValidationReport report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, toJson(report) + "\n", StandardCharsets.UTF_8);
        log.info("Wrote JSON report to {}", target);
        return target;
    }
}

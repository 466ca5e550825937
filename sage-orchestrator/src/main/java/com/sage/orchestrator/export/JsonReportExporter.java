package com.sage.orchestrator.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sage.model.ResearchReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes each report as pretty-printed JSON to {@code <directory>/<sessionId>.json}.
 */
public final class JsonReportExporter implements ReportExporter {

    private static final Logger log = LoggerFactory.getLogger(JsonReportExporter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path directory;

    public JsonReportExporter(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public String export(ResearchReport report) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(fileName(report));
        Files.writeString(target, render(report), StandardCharsets.UTF_8);
        log.info("Exported report for session {} to {}", report.getSessionId(), target);
        return target.toString();
    }

    public static String render(ResearchReport report) throws JsonProcessingException {
        return MAPPER.writeValueAsString(report);
    }

    static String fileName(ResearchReport report) {
        String id = report.getSessionId() != null ? report.getSessionId() : "report";
        return id.replaceAll("[^A-Za-z0-9._-]", "_") + ".json";
    }
}

package com.logicloop.evaluation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logicloop.orchestrator.dto.RefinementTrace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes one JSON file per session trace, plus the batch summary, into
 * logicloop.evaluation.output-dir. A blank directory disables writing.
 */
@Component
public class TraceWriter {

    private static final Logger log = LoggerFactory.getLogger(TraceWriter.class);

    static final String SUMMARY_FILE = "summary.json";

    private final ObjectMapper mapper;
    private final Path         outputDir;

    public TraceWriter(
            ObjectMapper mapper,
            @Value("${logicloop.evaluation.output-dir:}") String outputDir
    ) {
        this.mapper    = mapper;
        this.outputDir = outputDir == null || outputDir.isBlank() ? null : Paths.get(outputDir);
    }

    public boolean isEnabled() {
        return outputDir != null;
    }

    public Path writeTrace(RefinementTrace trace) throws IOException {
        return write(fileNameFor(trace.getStatementId()), trace);
    }

    public Path writeReport(EvaluationReport report) throws IOException {
        return write(SUMMARY_FILE, report);
    }

    private Path write(String fileName, Object value) throws IOException {
        if (!isEnabled()) {
            throw new IllegalStateException("Trace output directory is not configured");
        }
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(fileName);
        mapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), value);
        log.debug("[Trace] Wrote {}", target);
        return target;
    }

    static String fileNameFor(String statementId) {
        String base = statementId == null || statementId.isBlank() ? "unknown" : statementId;
        return base.replaceAll("[^A-Za-z0-9._-]", "_") + ".json";
    }
}

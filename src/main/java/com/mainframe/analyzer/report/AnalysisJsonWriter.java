package com.mainframe.analyzer.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes analysis results (batches, impact reports) as indented JSON with sorted map keys.
 */
public class AnalysisJsonWriter {
    private static final Logger log = LoggerFactory.getLogger(AnalysisJsonWriter.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ReportGenerationException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public Path write(Object value, Path target) {
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, toJson(value));
        } catch (IOException e) {
            throw new ReportGenerationException("Could not write " + target, e);
        }
        log.info("Wrote {}", target.toAbsolutePath());
        return target;
    }
}

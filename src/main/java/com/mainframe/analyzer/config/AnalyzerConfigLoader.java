package com.mainframe.analyzer.config;

import com.mainframe.analyzer.parser.SourceFormat;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Reads {@code cobol-analyzer.yml}. A missing or unreadable file yields the defaults, and each
 * absent or invalid value falls back to its default individually.
 */
public class AnalyzerConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(AnalyzerConfigLoader.class);

    public static final String CONFIG_FILE_NAME = "cobol-analyzer.yml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public AnalyzerConfig load() {
        return load(Path.of(CONFIG_FILE_NAME));
    }

    public AnalyzerConfig load(Path configPath) {
        AnalyzerConfig defaults = AnalyzerConfig.defaults();
        if (configPath == null || !Files.isRegularFile(configPath)) {
            return defaults;
        }

        YamlConfig yaml;
        try {
            yaml = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
        } catch (IOException e) {
            log.warn("Ignoring unreadable config {}: {}", configPath, e.getMessage());
            return defaults;
        }
        if (yaml == null) {
            return defaults;
        }

        AnalyzerConfig.AnalyzerConfigBuilder config = defaults.toBuilder();
        if (yaml.sourceFormat != null) {
            try {
                config.sourceFormat(SourceFormat.valueOf(yaml.sourceFormat.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("Unknown sourceFormat '{}' in {}, using {}", yaml.sourceFormat, configPath,
                        defaults.getSourceFormat());
            }
        }
        if (yaml.parallelism != null && yaml.parallelism > 0) {
            config.parallelism(yaml.parallelism);
        }
        if (yaml.defaultMaxDepth != null && yaml.defaultMaxDepth >= 0) {
            config.defaultMaxDepth(yaml.defaultMaxDepth);
        }
        if (yaml.queryTimeoutSeconds != null && yaml.queryTimeoutSeconds > 0) {
            config.queryTimeout(Duration.ofSeconds(yaml.queryTimeoutSeconds));
        }
        if (yaml.includeCopybookPrograms != null) {
            config.includeCopybookPrograms(yaml.includeCopybookPrograms);
        }
        if (yaml.sourceExtensions != null && !yaml.sourceExtensions.isEmpty()) {
            config.sourceExtensions(List.copyOf(yaml.sourceExtensions));
        }
        if (yaml.copybookExtensions != null && !yaml.copybookExtensions.isEmpty()) {
            config.copybookExtensions(List.copyOf(yaml.copybookExtensions));
        }
        log.debug("Loaded configuration from {}", configPath);
        return config.build();
    }

    private static class YamlConfig {
        public String sourceFormat;
        public Integer parallelism;
        public Integer defaultMaxDepth;
        public Long queryTimeoutSeconds;
        public Boolean includeCopybookPrograms;
        public List<String> sourceExtensions;
        public List<String> copybookExtensions;
    }
}

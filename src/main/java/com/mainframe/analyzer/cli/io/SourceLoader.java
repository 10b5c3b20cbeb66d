package com.mainframe.analyzer.cli.io;

import com.mainframe.analyzer.config.AnalyzerConfig;
import com.mainframe.analyzer.pipeline.SourceUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Collects program and copybook sources below a directory, in path order.
 *
 * Files are read as UTF-8; files that are not valid UTF-8 are read as ISO-8859-1.
 */
public class SourceLoader {
    private static final Logger log = LoggerFactory.getLogger(SourceLoader.class);

    private final List<String> extensions;

    public SourceLoader(AnalyzerConfig config) {
        List<String> all = new ArrayList<>(config.getSourceExtensions());
        if (config.isIncludeCopybookPrograms()) {
            all.addAll(config.getCopybookExtensions());
        }
        this.extensions = all.stream().map(e -> e.toLowerCase(Locale.ROOT)).collect(Collectors.toList());
    }

    public List<SourceUnit> load(Path directory) {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile).filter(this::hasSourceExtension).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list sources in " + directory, e);
        }

        List<SourceUnit> units = new ArrayList<>();
        for (Path file : files) {
            units.add(new SourceUnit(directory.relativize(file).toString().replace('\\', '/'), read(file)));
        }
        log.info("Loaded {} source files from {}", units.size(), directory);
        return units;
    }

    private boolean hasSourceExtension(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(name::endsWith);
    }

    private static String read(Path file) {
        try {
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (CharacterCodingException e) {
                log.debug("{} is not UTF-8, reading as ISO-8859-1", file);
                return Files.readString(file, StandardCharsets.ISO_8859_1);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file, e);
        }
    }
}

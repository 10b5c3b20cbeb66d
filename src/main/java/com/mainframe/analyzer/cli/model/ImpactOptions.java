package com.mainframe.analyzer.cli.model;

import com.mainframe.analyzer.impact.EntityKind;

import lombok.Getter;
import picocli.CommandLine.Option;

import java.nio.file.Path;

@Getter
public class ImpactOptions {

    @Option(names = {"--kind", "-k"}, defaultValue = "PROGRAM",
            description = "Kind of the changed entity: ${COMPLETION-CANDIDATES}")
    private EntityKind kind;

    @Option(names = {"--id", "-i"}, required = true, description = "Name of the changed entity")
    private String id;

    @Option(names = {"--max-depth", "-d"}, description = "Traversal depth (default from config, 3)")
    private Integer maxDepth;

    @Option(names = {"--instant"}, description = "Only count direct and indirect dependents")
    private boolean instant;

    @Option(names = {"--field-detail"}, description = "For --kind FIELD, also list usages and propagation chains")
    private boolean fieldDetail;

    @Option(names = {"--timeout-ms"}, description = "Query deadline in milliseconds (overrides the config file)")
    private Long timeoutMillis;

    @Option(names = {"--json"}, description = "Also write the impact report as JSON to this file")
    private Path jsonOutput;
}

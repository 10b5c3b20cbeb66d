package com.mainframe.analyzer.cli.io;

import com.mainframe.analyzer.config.AnalyzerConfig;
import com.mainframe.analyzer.pipeline.SourceUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SourceLoader.
 */
class SourceLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void createSources() throws IOException {
        Files.createDirectories(tempDir.resolve("copy"));
        Files.writeString(tempDir.resolve("MAINPGM.CBL"), "       PROGRAM-ID. MAINPGM.\n");
        Files.writeString(tempDir.resolve("batch.cob"), "       PROGRAM-ID. BATCH.\n");
        Files.writeString(tempDir.resolve("copy/CUSTREC.cpy"), "       01  CUST-REC PIC X.\n");
        Files.writeString(tempDir.resolve("README.md"), "not cobol");
        Files.write(tempDir.resolve("LEGACY.cbl"), "      * CAFÉ\n".getBytes(StandardCharsets.ISO_8859_1));
    }

    @Test
    void testLoadsProgramsAndCopybooksInPathOrder() {
        List<SourceUnit> units = new SourceLoader(AnalyzerConfig.defaults()).load(tempDir);

        assertThat(units).extracting(SourceUnit::getFileName)
                .containsExactly("LEGACY.cbl", "MAINPGM.CBL", "batch.cob", "copy/CUSTREC.cpy");
        assertThat(units.get(1).getContent()).contains("PROGRAM-ID. MAINPGM.");
    }

    @Test
    void testCopybooksLeftOutWhenDisabled() {
        AnalyzerConfig config = AnalyzerConfig.builder().includeCopybookPrograms(false).build();

        List<SourceUnit> units = new SourceLoader(config).load(tempDir);

        assertThat(units).extracting(SourceUnit::getFileName).doesNotContain("copy/CUSTREC.cpy").hasSize(3);
    }

    @Test
    void testLatin1FallBack() {
        List<SourceUnit> units = new SourceLoader(AnalyzerConfig.defaults()).load(tempDir);

        assertThat(units.get(0).getContent()).contains("CAFÉ");
    }

    @Test
    void testEmptyDirectory() throws IOException {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));

        assertThat(new SourceLoader(AnalyzerConfig.defaults()).load(empty)).isEmpty();
    }
}

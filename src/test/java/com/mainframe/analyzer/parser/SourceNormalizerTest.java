package com.mainframe.analyzer.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SourceNormalizer.
 */
class SourceNormalizerTest {

    @Test
    void testFixedFormatDropsSequenceAndIdentificationAreas() {
        String source = String.format("%-72s%s%n", "000100 IDENTIFICATION DIVISION.", "CHG00001")
                + "000200 PROGRAM-ID. DEMO.\n";

        NormalizedSource normalized = new SourceNormalizer(SourceFormat.FIXED).normalize(source, "DEMO.cbl");

        assertThat(normalized.getLines()).extracting(NormalizedLine::getText)
                .containsExactly("IDENTIFICATION DIVISION.", "PROGRAM-ID. DEMO.");
        assertThat(normalized.getLines()).extracting(NormalizedLine::getLineNumber).containsExactly(1, 2);
    }

    @Test
    void testFixedFormatCommentAndDebugLines() {
        String source = """
                000100 IDENTIFICATION DIVISION.
                000200* a comment line
                000300/ page eject
                000400D    DISPLAY 'DEBUG'.
                000500
                000600 PROGRAM-ID. DEMO.
                """;

        NormalizedSource normalized = new SourceNormalizer(SourceFormat.FIXED).normalize(source, "DEMO.cbl");

        assertThat(normalized.getLines()).hasSize(2);
        assertThat(normalized.getMetrics().getTotalLines()).isEqualTo(6);
        assertThat(normalized.getMetrics().getCodeLines()).isEqualTo(2);
        assertThat(normalized.getMetrics().getCommentLines()).isEqualTo(3);
        assertThat(normalized.getMetrics().getBlankLines()).isEqualTo(1);
    }

    @Test
    void testContinuationLineJoinsOpenLiteral() {
        String source = """
                000100 01  WS-MSG PIC X(40) VALUE 'HELLO
                000200-    'WORLD'.
                000300 01  WS-NEXT PIC X.
                """;

        NormalizedSource normalized = new SourceNormalizer(SourceFormat.FIXED).normalize(source, "MSG.cpy");

        List<NormalizedLine> lines = normalized.getLines();
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0).getText()).isEqualTo("01  WS-MSG PIC X(40) VALUE 'HELLOWORLD'.");
        assertThat(lines.get(0).isContinued()).isTrue();
        assertThat(lines.get(0).getLineNumber()).isEqualTo(1);
        assertThat(lines.get(1).isContinued()).isFalse();
        assertThat(lines.get(1).getLineNumber()).isEqualTo(3);
    }

    @Test
    void testUpperCasesOutsideLiteralsOnly() {
        String source = "000100     display 'Hello World' ws-name.\n";

        NormalizedSource normalized = new SourceNormalizer(SourceFormat.FIXED).normalize(source, "LOWER.cbl");

        assertThat(normalized.getLines().get(0).getText()).isEqualTo("    DISPLAY 'Hello World' WS-NAME.");
    }

    @Test
    void testFreeFormatInlineComments() {
        String source = """
                IDENTIFICATION DIVISION.
                PROGRAM-ID. FREEPGM. *> the program id
                * whole line comment
                DISPLAY '*> not a comment'.
                """;

        NormalizedSource normalized = new SourceNormalizer(SourceFormat.FREE).normalize(source, "FREEPGM.cob");

        assertThat(normalized.getLines()).extracting(NormalizedLine::getText).containsExactly(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. FREEPGM.",
                "DISPLAY '*> not a comment'.");
        assertThat(normalized.getMetrics().getCommentLines()).isEqualTo(1);
    }

    @Test
    void testAutoDetectsFormat() {
        String fixed = """
                000100 IDENTIFICATION DIVISION.
                000200 PROGRAM-ID. DEMO.
                """;
        String free = """
                IDENTIFICATION DIVISION.
                PROGRAM-ID. DEMO.
                """;

        SourceNormalizer normalizer = new SourceNormalizer(SourceFormat.AUTO);

        assertThat(normalizer.normalize(fixed, "A.cbl").getFormat()).isEqualTo(SourceFormat.FIXED);
        assertThat(normalizer.normalize(free, "B.cbl").getFormat()).isEqualTo(SourceFormat.FREE);
    }

    @Test
    void testEmptyInput() {
        NormalizedSource normalized = new SourceNormalizer().normalize("", "EMPTY.cbl");

        assertThat(normalized.getLines()).isEmpty();
        assertThat(normalized.getMetrics().getTotalLines()).isZero();
    }
}

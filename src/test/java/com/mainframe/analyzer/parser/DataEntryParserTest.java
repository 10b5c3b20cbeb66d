package com.mainframe.analyzer.parser;

import com.mainframe.analyzer.model.AnalysisDiagnostics;
import com.mainframe.analyzer.model.DataSection;
import com.mainframe.analyzer.model.DiagnosticKind;
import com.mainframe.analyzer.model.UsageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DataEntryTokenizer and DataEntryParser.
 */
class DataEntryParserTest {

    private AnalysisDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new AnalysisDiagnostics("TEST.cbl");
    }

    @Test
    void testParseElementaryItem() {
        RawDataEntry entry = parse("05  CUST-NAME           PIC X(30).");

        assertThat(entry.getLevel()).isEqualTo(5);
        assertThat(entry.getName()).isEqualTo("CUST-NAME");
        assertThat(entry.getPicture()).isEqualTo("X(30)");
        assertThat(entry.getUsage()).isEqualTo(UsageType.DISPLAY);
        assertThat(entry.getSection()).isEqualTo(DataSection.WORKING_STORAGE);
    }

    @Test
    void testParsePackedDecimalWithValue() {
        RawDataEntry entry = parse("05  BALANCE PIC S9(9)V99 USAGE IS COMP-3 VALUE ZERO.");

        assertThat(entry.getPicture()).isEqualTo("S9(9)V99");
        assertThat(entry.getUsage()).isEqualTo(UsageType.PACKED_DECIMAL);
        assertThat(entry.getValues()).containsExactly("ZERO");
    }

    @Test
    void testParseOccursDependingOn() {
        RawDataEntry entry = parse("05  LINE-ITEM OCCURS 1 TO 50 TIMES DEPENDING ON ITEM-COUNT PIC X(20).");

        assertThat(entry.getOccurs()).isEqualTo(50);
        assertThat(entry.getOccursMin()).isEqualTo(1);
        assertThat(entry.getOccursDependingOn()).isEqualTo("ITEM-COUNT");
    }

    @Test
    void testParseRedefinesAndFiller() {
        RawDataEntry redefines = parse("05  DATE-PARTS REDEFINES DATE-TEXT.");
        RawDataEntry filler = parse("05  FILLER PIC X(4).");

        assertThat(redefines.getRedefines()).isEqualTo("DATE-TEXT");
        assertThat(filler.isFiller()).isTrue();
        assertThat(filler.getName()).isEqualTo("FILLER");
    }

    @Test
    void testParseConditionNameValues() {
        RawDataEntry entry = parse("88  VALID-CODE VALUES 'A' 'B' 'X' THRU 'Z'.");

        assertThat(entry.getLevel()).isEqualTo(88);
        assertThat(entry.getValues()).containsExactly("A", "B", "X THRU Z");
    }

    @Test
    void testConditionNameWithoutValueIsRejected() {
        Optional<RawDataEntry> entry = DataEntryParser.parse("88  BROKEN-FLAG.", 12, DataSection.WORKING_STORAGE,
                null, diagnostics);

        assertThat(entry).isEmpty();
        assertThat(diagnostics.warningsOf(DiagnosticKind.MALFORMED_DATA_ITEM_WARNING))
                .singleElement()
                .satisfies(d -> assertThat(d.getLineNumber()).isEqualTo(12));
    }

    @Test
    void testLevelOutOfRangeIsRejected() {
        Optional<RawDataEntry> entry = DataEntryParser.parse("55  TOO-DEEP PIC X.", 3, DataSection.WORKING_STORAGE,
                null, diagnostics);

        assertThat(entry).isEmpty();
        assertThat(diagnostics.getWarnings()).hasSize(1);
    }

    @Test
    void testTextAfterTerminatorIsReported() {
        RawDataEntry entry = parse("05  CUST-CODE PIC X(2). 05 CUST-TYPE PIC X.");

        assertThat(entry.getName()).isEqualTo("CUST-CODE");
        assertThat(entry.getPicture()).isEqualTo("X(2)");
        assertThat(diagnostics.warningsOf(DiagnosticKind.MALFORMED_DATA_ITEM_WARNING))
                .singleElement()
                .satisfies(d -> assertThat(d.getMessage()).contains("CUST-CODE"));
    }

    @Test
    void testSingleEntryHasNoWarnings() {
        parse("05  CUST-CODE PIC X(2).");

        assertThat(diagnostics.getWarnings()).isEmpty();
    }

    private RawDataEntry parse(String text) {
        return DataEntryParser.parse(text, 1, DataSection.WORKING_STORAGE, null, diagnostics).orElseThrow();
    }
}

package com.mainframe.analyzer.hierarchy;

import com.mainframe.analyzer.TestSources;
import com.mainframe.analyzer.model.Program;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DataSectionSummarizer.
 */
class DataSectionSummarizerTest {

    private final DataSectionSummarizer summarizer = new DataSectionSummarizer();

    @Test
    void testWorkingStorageConstantsAndFlags() {
        Program program = TestSources.parse(TestSources.CUSTMAIN);

        WorkingStorageSummary summary = summarizer.summarizeWorkingStorage(program);

        assertThat(summary.getItemCount()).isEqualTo(9);
        assertThat(summary.getConstants())
                .extracting(WorkingStorageSummary.Constant::getName)
                .containsExactly("WS-EOF-FLAG", "WS-COUNT", "WS-TOTAL-BALANCE");
        assertThat(summary.getConstants().get(0).getValue()).isEqualTo("N");
        assertThat(summary.getFlags())
                .extracting(WorkingStorageSummary.Flag::getName)
                .containsExactly("WS-EOF-FLAG", "EOF-REACHED");

        WorkingStorageSummary.Flag eof = summary.getFlags().get(1);
        assertThat(eof.getField()).isEqualTo("WS-EOF-FLAG");
        assertThat(eof.getValues()).containsExactly("Y");
        assertThat(eof.getPurpose()).isEqualTo("End of file");
    }

    @Test
    void testConditionNamesWithSeveralValues() {
        Program program = TestSources.parse(TestSources.PAYCALC);

        WorkingStorageSummary summary = summarizer.summarizeWorkingStorage(program);

        assertThat(summary.getFlags())
                .extracting(WorkingStorageSummary.Flag::getName)
                .containsExactly("EMP-HOURLY", "EMP-SALARIED");
        assertThat(summary.getFlags().get(1).getField()).isEqualTo("WS-EMP-TYPE");
        assertThat(summary.getFlags().get(1).getValues()).containsExactly("S", "E");
        assertThat(summary.getConstants())
                .extracting(WorkingStorageSummary.Constant::getName)
                .containsExactly("WS-CALL-TARGET");
    }

    @Test
    void testLinkageParameters() {
        Program program = TestSources.parse(TestSources.PAYCALC);

        LinkageSummary linkage = summarizer.summarizeLinkage(program);

        assertThat(linkage.getParameters()).containsExactly("LK-EMPLOYEE-ID", "LK-NET-PAY");
        assertThat(linkage.getProcedureUsing()).containsExactly("LK-EMPLOYEE-ID", "LK-NET-PAY");
        assertThat(linkage.getTotalLength()).isEqualTo(15);
    }

    @Test
    void testProgramWithoutLinkage() {
        LinkageSummary linkage = summarizer.summarizeLinkage(TestSources.parse(TestSources.CUSTMAIN));

        assertThat(linkage.getParameters()).isEmpty();
        assertThat(linkage.getTotalLength()).isZero();
    }

    @ParameterizedTest
    @CsvSource({
        "WS-ERROR-SW, Error handling",
        "WS-EOF, End of file",
        "RECORD-FOUND, Record existence",
        "INPUT-VALID, Validation"
    })
    void testInferFlagPurpose(String name, String purpose) {
        assertThat(DataSectionSummarizer.inferFlagPurpose(name)).isEqualTo(purpose);
    }

    @Test
    void testInferFlagPurposeWithoutMatch() {
        assertThat(DataSectionSummarizer.inferFlagPurpose("WS-MODE")).isNull();
    }
}

package com.mainframe.analyzer.parser;

import com.mainframe.analyzer.model.Statement;
import com.mainframe.analyzer.model.StatementKind;
import com.mainframe.analyzer.model.payload.ArithmeticPayload;
import com.mainframe.analyzer.model.payload.CallPayload;
import com.mainframe.analyzer.model.payload.ConditionPayload;
import com.mainframe.analyzer.model.payload.ExecPayload;
import com.mainframe.analyzer.model.payload.FileIoPayload;
import com.mainframe.analyzer.model.payload.GoToPayload;
import com.mainframe.analyzer.model.payload.InspectPayload;
import com.mainframe.analyzer.model.payload.LogicalOperator;
import com.mainframe.analyzer.model.payload.MovePayload;
import com.mainframe.analyzer.model.payload.PerformPayload;
import com.mainframe.analyzer.model.payload.StringPayload;
import com.mainframe.analyzer.model.payload.UnstringPayload;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StatementClassifier.
 */
class StatementClassifierTest {

    private final StatementClassifier classifier = new StatementClassifier();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "MOVE A TO B.                  | MOVE",
        "COMPUTE X = Y + 1             | COMPUTE",
        "GO TO EXIT-PARA.              | GO_TO",
        "STOP RUN.                     | STOP_RUN",
        "END-IF                        | END_IF",
        "EXEC SQL COMMIT END-EXEC      | EXEC",
        "GOBACK                        | GOBACK"
    })
    void testKindByLeadingVerb(String content, String expected) {
        assertThat(classify(content).getKind()).isEqualTo(StatementKind.valueOf(expected));
    }

    @Test
    void testUnknownVerbHasReducedConfidence() {
        Statement statement = classify("RELEASE SORT-REC FROM WS-REC");

        assertThat(statement.getKind()).isEqualTo(StatementKind.OTHER);
        assertThat(statement.getConfidence()).isEqualTo(Statement.UNRECOGNIZED_CONFIDENCE);
        assertThat(statement.getDataReferences()).containsExactly("SORT-REC", "WS-REC");
    }

    @Test
    void testMoveWithReferenceModification() {
        Statement statement = classify("MOVE WS-DATE(1:4) TO WS-YEAR WS-YEAR-COPY.");

        MovePayload move = statement.payloadAs(MovePayload.class);
        assertThat(move.getSources()).containsExactly("WS-DATE");
        assertThat(move.getTargets()).containsExactly("WS-YEAR", "WS-YEAR-COPY");
        assertThat(move.isReferenceModified()).isTrue();
    }

    @Test
    void testMoveLiteral() {
        MovePayload move = classify("MOVE 'N' TO WS-FLAG").payloadAs(MovePayload.class);

        assertThat(move.getSources()).isEmpty();
        assertThat(move.getLiterals()).containsExactly("'N'");
        assertThat(move.getTargets()).containsExactly("WS-FLAG");
    }

    @Test
    void testComputeFormula() {
        ArithmeticPayload compute = classify("COMPUTE WS-TOTAL ROUNDED = WS-PRICE * WS-QTY ON SIZE ERROR DISPLAY 'X'")
                .payloadAs(ArithmeticPayload.class);

        assertThat(compute.getResults()).containsExactly("WS-TOTAL");
        assertThat(compute.getOperands()).containsExactly("WS-PRICE", "WS-QTY");
        assertThat(compute.getFormula()).isEqualTo("WS-PRICE * WS-QTY");
        assertThat(compute.isRounded()).isTrue();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "ADD WS-A TO WS-B                        | WS-B = WS-B + WS-A",
        "SUBTRACT WS-TAX FROM WS-GROSS GIVING WS-NET | WS-NET = WS-GROSS - WS-TAX",
        "MULTIPLY WS-RATE BY WS-AMOUNT           | WS-AMOUNT = WS-RATE * WS-AMOUNT",
        "DIVIDE WS-COUNT INTO WS-TOTAL GIVING WS-AVG | WS-AVG = WS-TOTAL / WS-COUNT"
    })
    void testArithmeticFormulas(String content, String formula) {
        assertThat(classify(content).payloadAs(ArithmeticPayload.class).getFormula()).isEqualTo(formula);
    }

    @Test
    void testIfWithInlineAction() {
        ConditionPayload condition = classify("IF WS-A > 10 AND WS-B = 'Y' MOVE 1 TO WS-C")
                .payloadAs(ConditionPayload.class);

        assertThat(condition.getConditions()).containsExactly("WS-A > 10", "WS-B = 'Y'");
        assertThat(condition.getOperator()).isEqualTo(LogicalOperator.AND);
        assertThat(condition.getTruthPath()).isEqualTo("MOVE 1 TO WS-C");
    }

    @Test
    void testOrConditionsAndEvaluateSubject() {
        ConditionPayload or = classify("IF WS-CODE = 'A' OR WS-CODE = 'B'").payloadAs(ConditionPayload.class);
        ConditionPayload evaluate = classify("EVALUATE WS-CODE").payloadAs(ConditionPayload.class);

        assertThat(or.getOperator()).isEqualTo(LogicalOperator.OR);
        assertThat(evaluate.getSubject()).isEqualTo("WS-CODE");
    }

    @Test
    void testPerformVariants() {
        PerformPayload thru = classify("PERFORM 100-INIT THRU 100-EXIT").payloadAs(PerformPayload.class);
        PerformPayload until = classify("PERFORM 200-LOOP UNTIL WS-EOF = 'Y'").payloadAs(PerformPayload.class);
        PerformPayload inline = classify("PERFORM VARYING WS-I FROM 1 BY 1 UNTIL WS-I > 10")
                .payloadAs(PerformPayload.class);
        Statement times = classify("PERFORM 300-STEP 5 TIMES");

        assertThat(thru.getTarget()).isEqualTo("100-INIT");
        assertThat(thru.getThruTarget()).isEqualTo("100-EXIT");
        assertThat(until.getUntil()).isEqualTo("WS-EOF = 'Y'");
        assertThat(inline.isInline()).isTrue();
        assertThat(inline.getTarget()).isNull();
        assertThat(inline.getVarying()).isEqualTo("WS-I FROM 1 BY 1");
        assertThat(times.payloadAs(PerformPayload.class).getTimes()).isEqualTo("5");
        assertThat(times.getDataReferences()).doesNotContain("300-STEP");
    }

    @Test
    void testGoToDependingOn() {
        GoToPayload goTo = classify("GO TO PARA-A PARA-B DEPENDING ON WS-IDX").payloadAs(GoToPayload.class);

        assertThat(goTo.getTargets()).containsExactly("PARA-A", "PARA-B");
        assertThat(goTo.getDependingOn()).isEqualTo("WS-IDX");
    }

    @Test
    void testStaticAndDynamicCalls() {
        CallPayload literal = classify("CALL 'subpgm' USING WS-A BY CONTENT WS-B").payloadAs(CallPayload.class);
        CallPayload variable = classify("CALL WS-PROGRAM USING WS-A").payloadAs(CallPayload.class);

        assertThat(literal.getTarget()).isEqualTo("SUBPGM");
        assertThat(literal.isDynamic()).isFalse();
        assertThat(literal.getUsing()).containsExactly("WS-A", "WS-B");
        assertThat(variable.getTarget()).isEqualTo("WS-PROGRAM");
        assertThat(variable.isDynamic()).isTrue();
    }

    @Test
    void testFileOperations() {
        FileIoPayload open = classify("OPEN INPUT IN-FILE OUTPUT OUT-FILE ERR-FILE").payloadAs(FileIoPayload.class);
        FileIoPayload read = classify("READ IN-FILE INTO WS-REC KEY IS WS-KEY INVALID KEY DISPLAY 'NF'")
                .payloadAs(FileIoPayload.class);
        FileIoPayload write = classify("WRITE OUT-REC FROM WS-LINE").payloadAs(FileIoPayload.class);

        assertThat(open.getFileNames()).containsExactly("IN-FILE", "OUT-FILE", "ERR-FILE");
        assertThat(open.getOpenModes()).containsExactly("INPUT", "OUTPUT", "OUTPUT");
        assertThat(read.getFileNames()).containsExactly("IN-FILE");
        assertThat(read.getIntoField()).isEqualTo("WS-REC");
        assertThat(read.getKeyField()).isEqualTo("WS-KEY");
        assertThat(write.getRecordName()).isEqualTo("OUT-REC");
        assertThat(write.getFromField()).isEqualTo("WS-LINE");
    }

    @Test
    void testStringUnstringInspect() {
        StringPayload string = classify("STRING WS-FIRST DELIMITED BY SPACE WS-LAST DELIMITED BY SIZE INTO WS-NAME")
                .payloadAs(StringPayload.class);
        UnstringPayload unstring = classify("UNSTRING WS-CSV DELIMITED BY ',' INTO WS-F1 WS-F2 COUNT IN WS-N")
                .payloadAs(UnstringPayload.class);
        InspectPayload inspect = classify("INSPECT WS-TEXT TALLYING WS-CNT FOR ALL 'A'")
                .payloadAs(InspectPayload.class);

        assertThat(string.getSources()).containsExactly("WS-FIRST", "WS-LAST");
        assertThat(string.getTarget()).isEqualTo("WS-NAME");
        assertThat(string.getDelimiter()).isEqualTo("SPACE");
        assertThat(unstring.getSource()).isEqualTo("WS-CSV");
        assertThat(unstring.getTargets()).containsExactly("WS-F1", "WS-F2");
        assertThat(inspect.getMode()).isEqualTo(InspectPayload.Mode.TALLYING);
        assertThat(inspect.getTallyingField()).isEqualTo("WS-CNT");
    }

    @Test
    void testExecSqlTablesAndHostVariables() {
        Statement statement = classify(
                "EXEC SQL SELECT NAME INTO :WS-NAME FROM CUSTOMER WHERE ID = :WS-ID END-EXEC");

        ExecPayload exec = statement.payloadAs(ExecPayload.class);
        assertThat(exec.getLanguage()).isEqualTo("SQL");
        assertThat(exec.getTables()).containsExactly("CUSTOMER");
        assertThat(exec.getHostVariables()).containsExactly("WS-NAME", "WS-ID");
        assertThat(statement.getDataReferences()).containsExactly("WS-NAME", "WS-ID");
    }

    private Statement classify(String content) {
        return classifier.classify(content, 1);
    }
}

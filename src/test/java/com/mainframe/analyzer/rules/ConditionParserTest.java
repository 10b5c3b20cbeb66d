package com.mainframe.analyzer.rules;

import com.mainframe.analyzer.model.payload.LogicalOperator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConditionParser.
 */
class ConditionParserTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
        "WS-A > 10                                | WS-A          | >                        | 10",
        "WS-CODE NOT = 'X'                        | WS-CODE       | NOT =                    | 'X'",
        "WS-HOURS NOT NUMERIC                     | WS-HOURS      | NOT                      | NUMERIC",
        "WS-AMT GREATER THAN OR EQUAL TO 100      | WS-AMT        | GREATER THAN OR EQUAL TO | 100",
        "WS-NOT-FOUND = 'Y'                       | WS-NOT-FOUND  | =                        | 'Y'",
        "WS-COUNT <= WS-MAX.                      | WS-COUNT      | <=                       | WS-MAX",
        "CUST-ACTIVE                              | CUST-ACTIVE   | =                        | \"\"",
        "NOT WS-EOF                               | WS-EOF        | NOT                      | \"\""
    })
    void testParse(String text, String field, String operator, String value) {
        Condition condition = ConditionParser.parse(text, null);

        assertThat(condition.getField()).isEqualTo(field);
        assertThat(condition.getOperator()).isEqualTo(operator);
        assertThat(condition.getValue()).isEqualTo(value);
        assertThat(condition.getLogicalOperator()).isNull();
    }

    @Test
    void testParseAllJoinsWithStatementOperator() {
        List<Condition> conditions = ConditionParser.parseAll(
                List.of("WS-TYPE = 'A'", "WS-TYPE = 'B'", "WS-TYPE = 'C'"), LogicalOperator.OR);

        assertThat(conditions).extracting(Condition::getLogicalOperator)
                .containsExactly(null, LogicalOperator.OR, LogicalOperator.OR);
        assertThat(conditions).extracting(Condition::getValue).containsExactly("'A'", "'B'", "'C'");
    }

    @Test
    void testParseAllEmpty() {
        assertThat(ConditionParser.parseAll(List.of(), LogicalOperator.AND)).isEmpty();
    }
}

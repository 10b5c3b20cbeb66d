package com.mainframe.analyzer.rules;

import com.mainframe.analyzer.model.payload.LogicalOperator;
import com.mainframe.analyzer.parser.CobolText;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits simple COBOL conditions into field, relational operator and value.
 */
@UtilityClass
public class ConditionParser {

    // word operators must not match inside hyphenated names such as WS-NOT-FOUND
    private static final String B = "(?<![A-Z0-9-])";
    private static final String E = "(?![A-Z0-9-])";

    private static final Pattern OPERATOR = Pattern.compile(
            "\\s*(>=|<=|" + B + "NOT\\s*=|" + B + "NOT\\s+EQUAL(?:\\s+TO)?" + E + "|=|>|<|" + B + "EQUAL(?:\\s+TO)?" + E
                    + "|" + B + "GREATER\\s+THAN(?:\\s+OR\\s+EQUAL(?:\\s+TO)?)?" + E
                    + "|" + B + "LESS\\s+THAN(?:\\s+OR\\s+EQUAL(?:\\s+TO)?)?" + E
                    + "|" + B + "IS\\s+NOT" + E + "|" + B + "IS" + E + "|" + B + "NOT" + E + ")\\s*");

    /**
     * A condition without an operator is a condition-name or class test on its own; it is
     * returned with operator {@code =} and an empty value.
     */
    public static Condition parse(String text, LogicalOperator logicalOperator) {
        String trimmed = CobolText.stripTerminator(text.trim());
        Matcher m = OPERATOR.matcher(trimmed);
        while (m.find()) {
            if (m.start() == 0 && !m.group(1).startsWith("NOT")) {
                continue;
            }
            String field = trimmed.substring(0, m.start()).trim();
            String operator = m.group(1).replaceAll("\\s+", " ");
            String value = trimmed.substring(m.end()).trim();
            if (field.isEmpty() && operator.equals("NOT")) {
                return new Condition(value, "NOT", "", logicalOperator);
            }
            return new Condition(field, operator, value, logicalOperator);
        }
        return new Condition(trimmed, "=", "", logicalOperator);
    }

    /**
     * The first condition has no logical operator; the rest carry the statement's AND / OR.
     */
    public static List<Condition> parseAll(List<String> conditions, LogicalOperator operator) {
        List<Condition> parsed = new ArrayList<>();
        for (int i = 0; i < conditions.size(); i++) {
            parsed.add(parse(conditions.get(i), i == 0 ? null : operator));
        }
        return parsed;
    }
}

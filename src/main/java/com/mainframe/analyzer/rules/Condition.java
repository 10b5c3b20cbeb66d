package com.mainframe.analyzer.rules;

import com.mainframe.analyzer.model.payload.LogicalOperator;

import lombok.Value;

/**
 * {@code field operator value}, joined to the previous condition by {@code logicalOperator}
 * (null for the first one).
 */
@Value
public class Condition {
    String field;
    String operator;
    String value;
    LogicalOperator logicalOperator;
}

package com.mainframe.analyzer.model.payload;

import com.mainframe.analyzer.model.StatementKind;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * COMPUTE, ADD, SUBTRACT, MULTIPLY and DIVIDE.
 */
@Value
@Builder
public class ArithmeticPayload implements StatementPayload {

    @NonNull
    StatementKind operation;

    @Singular("operand")
    List<String> operands;

    @Singular("result")
    List<String> results;

    String formula;

    boolean rounded;
}

package com.mainframe.analyzer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A PROCEDURE DIVISION paragraph and the statements attached to it.
 */
@Value
@Builder(toBuilder = true)
public class Paragraph {

    @NonNull
    String name;

    /**
     * Owning PROCEDURE section, null when the paragraph is not inside a section.
     */
    String section;

    int lineNumber;

    @Singular("statement")
    List<Statement> statements;

    /**
     * Paragraph names targeted by PERFORM statements, in statement order.
     */
    @Singular("perform")
    List<String> performs;

    /**
     * Paragraph names targeted by GO TO statements, in statement order.
     */
    @Singular("goTo")
    List<String> gotos;
}

package com.mainframe.analyzer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class Diagnostic {

    @NonNull
    DiagnosticKind kind;

    @NonNull
    String message;

    String fileName;

    /**
     * 1-based source line, 0 when the diagnostic is not tied to a line.
     */
    int lineNumber;

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind).append(": ");
        if (fileName != null) {
            sb.append(fileName);
            if (lineNumber > 0) {
                sb.append(':').append(lineNumber);
            }
            sb.append(' ');
        }
        return sb.append(message).toString();
    }
}

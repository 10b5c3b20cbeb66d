package com.mainframe.analyzer.model.payload;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Kind-specific detail extracted from a statement.
 *
 * The set of implementations is closed: each {@link com.mainframe.analyzer.model.StatementKind}
 * maps to exactly one payload type in {@code StatementClassifier}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "payloadType")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NoPayload.class, name = "NONE"),
        @JsonSubTypes.Type(value = MovePayload.class, name = "MOVE"),
        @JsonSubTypes.Type(value = ArithmeticPayload.class, name = "ARITHMETIC"),
        @JsonSubTypes.Type(value = ConditionPayload.class, name = "CONDITION"),
        @JsonSubTypes.Type(value = PerformPayload.class, name = "PERFORM"),
        @JsonSubTypes.Type(value = GoToPayload.class, name = "GO_TO"),
        @JsonSubTypes.Type(value = CallPayload.class, name = "CALL"),
        @JsonSubTypes.Type(value = FileIoPayload.class, name = "FILE_IO"),
        @JsonSubTypes.Type(value = StringPayload.class, name = "STRING"),
        @JsonSubTypes.Type(value = UnstringPayload.class, name = "UNSTRING"),
        @JsonSubTypes.Type(value = InspectPayload.class, name = "INSPECT"),
        @JsonSubTypes.Type(value = ExecPayload.class, name = "EXEC")
})
public interface StatementPayload {
}

package com.mainframe.analyzer.hierarchy;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LinkageSummary {

    /**
     * Top-level LINKAGE records (levels 01 and 77) in declaration order.
     */
    @Singular
    List<String> parameters;

    /**
     * Parameters named on PROCEDURE DIVISION USING, in order.
     */
    @Singular("usingParameter")
    List<String> procedureUsing;

    int totalLength;
}

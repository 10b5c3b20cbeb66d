package com.mainframe.analyzer.lineage;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CopybookDependency {

    @NonNull
    String copybookName;

    @Singular("user")
    List<String> usedBy;

    /**
     * Data items the copybook declares; empty when its source was not part of the batch.
     */
    @Singular("definedItem")
    List<String> defines;

    /**
     * Copybooks the copybook itself includes.
     */
    @Singular("dependency")
    List<String> dependencies;

    @Builder.Default
    int level = 1;

    boolean resolved;

    @NonNull
    String fingerprint;
}

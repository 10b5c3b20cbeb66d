package com.mainframe.analyzer.impact;

import lombok.NonNull;
import lombok.Value;

import java.util.Comparator;
import java.util.Locale;

/**
 * Node identity in the analysis graph. Paragraph ids are qualified as {@code PROGRAM.PARAGRAPH};
 * every other id is the upper-case COBOL name.
 */
@Value
public class EntityRef implements Comparable<EntityRef> {

    private static final Comparator<EntityRef> ORDER =
            Comparator.comparing(EntityRef::getKind).thenComparing(EntityRef::getId);

    @NonNull
    EntityKind kind;

    @NonNull
    String id;

    public static EntityRef of(EntityKind kind, String id) {
        return new EntityRef(kind, id.toUpperCase(Locale.ROOT));
    }

    public static EntityRef paragraph(String programId, String paragraph) {
        return of(EntityKind.PARAGRAPH, programId + "." + paragraph);
    }

    @Override
    public int compareTo(EntityRef other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}

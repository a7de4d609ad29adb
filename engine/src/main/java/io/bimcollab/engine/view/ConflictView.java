package io.bimcollab.engine.view;

import io.bimcollab.core.Change;
import io.bimcollab.core.Conflict;

import java.time.Instant;

/** Unresolved conflict as shown to polling clients. */
public record ConflictView(
        String conflictId,
        String elementId,
        String userId1,
        String userId2,
        String conflictType,
        double severity,
        ChangeRef change1,
        ChangeRef change2
) {
    public record ChangeRef(String changeId, String description, Instant timestamp) {
        static ChangeRef of(Change c) {
            return new ChangeRef(c.changeId(), c.description(), c.timestamp());
        }
    }

    public static ConflictView of(Conflict c) {
        return new ConflictView(
                c.conflictId(),
                c.elementId(),
                c.userId1(),
                c.userId2(),
                c.conflictType(),
                c.severity(),
                ChangeRef.of(c.change1()),
                ChangeRef.of(c.change2())
        );
    }
}

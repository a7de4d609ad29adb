package io.bimcollab.engine.view;

import io.bimcollab.core.Change;
import io.bimcollab.core.ChangeStatus;
import io.bimcollab.core.ChangeType;

import java.time.Instant;

/** A journaled change together with its processing status. */
public record ChangeView(
        String changeId,
        String userId,
        Instant timestamp,
        ChangeType changeType,
        String elementId,
        String elementType,
        String description,
        ChangeStatus status
) {
    public static ChangeView of(Change c, ChangeStatus status) {
        return new ChangeView(
                c.changeId(),
                c.userId(),
                c.timestamp(),
                c.changeType(),
                c.elementId(),
                c.elementType(),
                c.description(),
                status
        );
    }
}

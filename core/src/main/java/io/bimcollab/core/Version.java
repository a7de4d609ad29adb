package io.bimcollab.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable numbered snapshot of the changes folded out of a session journal.
 * <p>
 * versionNumber is 1-based per session; parentVersion is the id of the
 * previous version, or null for the first one.
 */
public record Version(
        String versionId,
        int versionNumber,
        Instant timestamp,
        String userId,
        String description,
        List<Change> changes,
        String parentVersion,
        List<String> tags
) {
    public Version {
        Objects.requireNonNull(versionId, "versionId");
        Objects.requireNonNull(timestamp, "timestamp");
        if (versionNumber < 1) throw new IllegalArgumentException("versionNumber must be >= 1");
        description = description == null ? "" : description;
        changes = List.copyOf(changes);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public int changeCount() {
        return changes.size();
    }
}

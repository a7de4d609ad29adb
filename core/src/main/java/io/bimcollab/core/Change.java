// file: core/src/main/java/io/bimcollab/core/Change.java
package io.bimcollab.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One proposed mutation of one model element, authored by one user.
 * <p>
 * Fields:
 *  - oldValue: optional snapshot of the prior element state (null when absent).
 *  - newValue: proposed state; opaque key/value map, never interpreted beyond
 *              a shallow merge.
 *  - metadata: free-form annotations supplied by the caller.
 * <p>
 * Immutable: maps are copied on construction and exposed read-only. Map
 * values may be null, so copies go through LinkedHashMap rather than Map.copyOf.
 */
public record Change(
        String changeId,
        String userId,
        Instant timestamp,
        ChangeType changeType,
        String elementId,
        String elementType,
        Map<String, Object> oldValue,
        Map<String, Object> newValue,
        String description,
        Map<String, Object> metadata
) {
    public Change {
        Objects.requireNonNull(changeId, "changeId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(changeType, "changeType");
        Objects.requireNonNull(elementId, "elementId");
        if (elementId.isBlank()) throw new IllegalArgumentException("elementId must not be blank");
        oldValue = oldValue == null ? null : readOnlyCopy(oldValue);
        newValue = newValue == null ? Map.of() : readOnlyCopy(newValue);
        description = description == null ? "" : description;
        metadata = metadata == null ? Map.of() : readOnlyCopy(metadata);
    }

    public boolean sameElement(Change other) {
        return elementId.equals(other.elementId);
    }

    private static Map<String, Object> readOnlyCopy(Map<String, Object> in) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(in));
    }
}

// file: engine/src/main/java/io/bimcollab/engine/AuditLogger.java
package io.bimcollab.engine;

import io.bimcollab.core.Change;
import io.bimcollab.core.ChangeStatus;
import io.bimcollab.core.Conflict;
import io.bimcollab.core.ResolutionStrategy;
import io.bimcollab.core.Version;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central logging hook for engine events.
 *
 * Levels:
 *  - INFO:    session lifecycle, versions, resolutions, merges.
 *  - WARNING: detected conflicts and queue items the worker had to drop.
 *  - FINE:    per-change processing detail.
 *
 * Callers log after releasing the session store lock.
 */
public final class AuditLogger {
    private static final Logger log = Logger.getLogger(AuditLogger.class.getName());

    private AuditLogger() {
        // utility
    }

    /** Log a completed caller-facing operation. */
    public static void logOperation(String operation, String sessionId, String userId, String detail) {
        log.log(Level.INFO, String.format(
                "%s session=%s user=%s%s",
                operation,
                sessionId,
                userId,
                detail == null || detail.isEmpty() ? "" : " " + detail
        ));
    }

    public static void logConflict(String sessionId, Conflict conflict) {
        log.log(Level.WARNING, String.format(
                "conflict %s detected in session=%s element=%s users=%s/%s changes=%s/%s",
                conflict.conflictId(),
                sessionId,
                conflict.elementId(),
                conflict.userId1(),
                conflict.userId2(),
                conflict.change1().changeId(),
                conflict.change2().changeId()
        ));
    }

    public static void logResolution(String sessionId, Conflict conflict, ResolutionStrategy strategy) {
        log.log(Level.INFO, String.format(
                "conflict %s resolved in session=%s with %s by %s",
                conflict.conflictId(),
                sessionId,
                strategy.wireName(),
                conflict.resolvedBy()
        ));
    }

    public static void logVersion(String sessionId, Version version) {
        log.log(Level.INFO, String.format(
                "version %s (v%d) created in session=%s by %s with %d changes: %s",
                version.versionId(),
                version.versionNumber(),
                sessionId,
                version.userId(),
                version.changeCount(),
                version.description()
        ));
    }

    public static void logProcessed(String sessionId, Change change, ChangeStatus status) {
        if (!log.isLoggable(Level.FINE)) {
            return;
        }
        log.log(Level.FINE, String.format(
                "change %s by %s on element %s -> %s (session=%s)",
                change.changeId(),
                change.userId(),
                change.elementId(),
                status,
                sessionId
        ));
    }

    public static void logSkipped(String sessionId, Change change, String reason) {
        log.log(Level.FINE, String.format(
                "change %s skipped in session=%s: %s", change.changeId(), sessionId, reason));
    }

    /** A queue item failed unexpectedly and was dropped. */
    public static void logDropped(String sessionId, Change change, Throwable error) {
        log.log(Level.WARNING, String.format(
                "dropping change %s of session=%s after processing error",
                change == null ? "?" : change.changeId(),
                sessionId
        ), error);
    }
}

package io.bimcollab.engine.export;

import io.bimcollab.core.Change;
import io.bimcollab.core.ChangeStatus;
import io.bimcollab.core.Conflict;
import io.bimcollab.core.Permission;
import io.bimcollab.core.User;
import io.bimcollab.core.Version;
import io.bimcollab.storage.Session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Full collaboration record of one session: participants, active journal,
 * every conflict with its resolution, and the version history with folded
 * changes. Enum values use their lower-case wire names.
 */
public record SessionExport(
        String sessionId,
        String modelId,
        String parentSessionId,
        String branchName,
        String branchDescription,
        Instant createdAt,
        Instant lastActivity,
        Instant exportedAt,
        List<UserEntry> users,
        List<ChangeEntry> changes,
        List<ConflictEntry> conflicts,
        List<VersionEntry> versions
) {

    public record UserEntry(String userId, String username, String email, String role,
                            List<String> permissions, Instant lastActive) {
        static UserEntry of(User u) {
            List<String> perms = new ArrayList<>();
            // declaration order
            for (Permission p : Permission.values()) {
                if (u.can(p)) perms.add(p.wireName());
            }
            return new UserEntry(u.userId(), u.username(), u.email(), u.role().wireName(), perms, u.lastActive());
        }
    }

    public record ChangeEntry(String changeId, String userId, Instant timestamp, String changeType,
                              String elementId, String elementType,
                              Map<String, Object> oldValue, Map<String, Object> newValue,
                              String description, Map<String, Object> metadata, String status) {
        static ChangeEntry of(Change c, ChangeStatus status) {
            return new ChangeEntry(c.changeId(), c.userId(), c.timestamp(), c.changeType().wireName(),
                    c.elementId(), c.elementType(), c.oldValue(), c.newValue(),
                    c.description(), c.metadata(),
                    status == null ? null : status.name().toLowerCase(Locale.ROOT));
        }
    }

    public record ConflictEntry(String conflictId, String elementId, String userId1, String userId2,
                                String change1, String change2, String conflictType, double severity,
                                String resolution, String resolvedBy, Instant resolvedAt) {
        static ConflictEntry of(Conflict c) {
            return new ConflictEntry(c.conflictId(), c.elementId(), c.userId1(), c.userId2(),
                    c.change1().changeId(), c.change2().changeId(), c.conflictType(), c.severity(),
                    c.resolution() == null ? null : c.resolution().wireName(),
                    c.resolvedBy(), c.resolvedAt());
        }
    }

    public record VersionEntry(String versionId, int versionNumber, Instant timestamp, String userId,
                               String description, String parentVersion, List<String> tags,
                               List<ChangeEntry> changes) {
        static VersionEntry of(Version v) {
            return new VersionEntry(v.versionId(), v.versionNumber(), v.timestamp(), v.userId(),
                    v.description(), v.parentVersion(), v.tags(),
                    v.changes().stream().map(c -> ChangeEntry.of(c, null)).toList());
        }
    }

    /** Snapshot a session. Caller holds the store lock. */
    public static SessionExport of(Session s, Instant exportedAt) {
        return new SessionExport(
                s.sessionId(),
                s.modelId(),
                s.parentSessionId().orElse(null),
                s.branchName().orElse(null),
                s.branchDescription().orElse(null),
                s.createdAt(),
                s.lastActivity(),
                exportedAt,
                s.users().stream().map(UserEntry::of).toList(),
                s.journal().stream()
                        .map(c -> ChangeEntry.of(c, s.statusOf(c.changeId()).orElse(null)))
                        .toList(),
                s.conflicts().stream().map(ConflictEntry::of).toList(),
                s.versions().stream().map(VersionEntry::of).toList()
        );
    }
}

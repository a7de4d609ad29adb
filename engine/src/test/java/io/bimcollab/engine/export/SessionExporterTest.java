package io.bimcollab.engine.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.bimcollab.core.ChangeType;
import io.bimcollab.core.PermissionDeniedException;
import io.bimcollab.core.ResolutionStrategy;
import io.bimcollab.core.UserRole;
import io.bimcollab.engine.CollaborationEngine;
import io.bimcollab.engine.EngineConfig;
import io.bimcollab.storage.SessionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionExporterTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private CollaborationEngine engine;
    private String session;

    @BeforeEach
    void setUp() throws Exception {
        // fixed clock: both changes share a timestamp, so they conflict
        engine = new CollaborationEngine(EngineConfig.defaults(), new SessionStore(),
                Clock.fixed(T0, ZoneOffset.UTC)).start();
        session = engine.createSession("tower-b", "alice", "Alice", "alice@example.com");
        engine.joinSession(session, "bob", "Bob", "bob@example.com", UserRole.EDITOR);
        engine.makeChange(session, "alice", ChangeType.UPDATE, "window_9", "window",
                Map.of("glazing", "double"), Map.of("glazing", "single"), "upgrade glazing");
        assertTrue(engine.awaitIdle(Duration.ofSeconds(5)));
        engine.makeChange(session, "bob", ChangeType.UPDATE, "window_9", "window", Map.of("frame", "alu"));
        assertTrue(engine.awaitIdle(Duration.ofSeconds(5)));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void export_contains_users_journal_and_resolutions() throws Exception {
        String conflictId = engine.getConflicts(session, "alice").get(0).conflictId();
        engine.resolveConflict(session, conflictId, ResolutionStrategy.MANUAL, "bob");
        engine.createVersion(session, "alice", "glazing round");

        var tree = new ObjectMapper().readTree(engine.exportSessionJson(session, "bob"));

        assertEquals(session, tree.get("sessionId").asText());
        assertEquals("tower-b", tree.get("modelId").asText());
        assertEquals("2026-03-02T09:00:00Z", tree.get("createdAt").asText());
        assertEquals(2, tree.get("users").size());
        assertEquals("editor", tree.get("users").get(1).get("role").asText());
        assertEquals(0, tree.get("changes").size());

        var conflict = tree.get("conflicts").get(0);
        assertEquals("element_modification", conflict.get("conflictType").asText());
        assertEquals("manual", conflict.get("resolution").asText());
        assertEquals("bob", conflict.get("resolvedBy").asText());

        var folded = tree.get("versions").get(0).get("changes");
        assertEquals(2, folded.size());
        assertEquals("single", folded.get(0).get("oldValue").get("glazing").asText());
        assertEquals("upgrade glazing", folded.get(0).get("description").asText());
        assertTrue(folded.get(1).get("oldValue").isNull());
    }

    @Test
    void journal_entries_carry_their_status() {
        var export = engine.exportSession(session, "alice");

        assertEquals(2, export.changes().size());
        assertEquals("applied", export.changes().get(0).status());
        assertEquals("conflicted", export.changes().get(1).status());
        assertEquals("update", export.changes().get(0).changeType());
        assertNull(export.conflicts().get(0).resolution());
        assertEquals(T0, export.exportedAt());
    }

    @Test
    void written_file_reads_back(@TempDir Path dir) throws Exception {
        var exporter = new SessionExporter();
        var export = engine.exportSession(session, "alice");
        Path file = dir.resolve("session.json");

        exporter.writeTo(export, file);
        var back = exporter.read(Files.readString(file));

        assertEquals(export.sessionId(), back.sessionId());
        assertEquals(export.createdAt(), back.createdAt());
        assertEquals(export.users(), back.users());
        assertEquals(export.changes().get(1).changeId(), back.changes().get(1).changeId());
    }

    @Test
    void branch_export_carries_lineage() {
        String branch = engine.createBranch(session, "alice", "facade-study", "alternative glazing");

        var export = engine.exportSession(branch, "alice");

        assertEquals(session, export.parentSessionId());
        assertEquals("facade-study", export.branchName());
        assertEquals("alternative glazing", export.branchDescription());
        assertNull(engine.exportSession(session, "alice").branchDescription());
    }

    @Test
    void outsiders_cannot_export() {
        assertThrows(PermissionDeniedException.class, () -> engine.exportSession(session, "mallory"));
    }
}

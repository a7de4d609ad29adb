package io.bimcollab.engine.view;

import io.bimcollab.core.Version;

import java.time.Instant;
import java.util.List;

/** Version metadata without the folded change payloads. */
public record VersionView(
        String versionId,
        int versionNumber,
        Instant timestamp,
        String userId,
        String description,
        int changeCount,
        String parentVersion,
        List<String> tags
) {
    public static VersionView of(Version v) {
        return new VersionView(
                v.versionId(),
                v.versionNumber(),
                v.timestamp(),
                v.userId(),
                v.description(),
                v.changeCount(),
                v.parentVersion(),
                v.tags()
        );
    }
}

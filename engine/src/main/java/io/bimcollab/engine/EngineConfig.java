// file: engine/src/main/java/io/bimcollab/engine/EngineConfig.java
package io.bimcollab.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.bimcollab.engine.dto.JsonEngineConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Engine tuning knobs.
 *
 * Supports:
 *  - conflictWindow:       max timestamp distance for two changes to conflict (default 300s)
 *  - versionEvery:         auto-version cadence in applied changes (default 10)
 *  - detectAcrossVersions: also compare incoming changes against the latest
 *                          version's changes, not only the journal (default false)
 *  - workerThreadName:     name of the change-processor thread
 */
public record EngineConfig(
        Duration conflictWindow,
        int versionEvery,
        boolean detectAcrossVersions,
        String workerThreadName
) {

    public static final String DEFAULT_WORKER_THREAD_NAME = "change-processor";

    public EngineConfig {
        Objects.requireNonNull(conflictWindow, "conflictWindow");
        Objects.requireNonNull(workerThreadName, "workerThreadName");
        if (conflictWindow.isNegative() || conflictWindow.isZero()) {
            throw new IllegalArgumentException("conflictWindow must be positive");
        }
        if (versionEvery <= 0) throw new IllegalArgumentException("versionEvery must be > 0");
        if (workerThreadName.isBlank()) throw new IllegalArgumentException("workerThreadName must not be blank");
    }

    public static EngineConfig defaults() {
        return new EngineConfig(Duration.ofSeconds(300), 10, false, DEFAULT_WORKER_THREAD_NAME);
    }

    public EngineConfig withVersionEvery(int every) {
        return new EngineConfig(conflictWindow, every, detectAcrossVersions, workerThreadName);
    }

    public EngineConfig withDetectAcrossVersions(boolean enabled) {
        return new EngineConfig(conflictWindow, versionEvery, enabled, workerThreadName);
    }

    /**
     * Very small flag parser.
     *
     * Supported flags:
     *   --config, -c <path>             JSON file, applied first; later flags override it
     *   --conflict-window-seconds <s>
     *   --version-every <n>
     *   --detect-across-versions        (no value)
     *   --worker-thread-name <name>
     *
     * Unrecognised flags are left for the caller; malformed values raise
     * IllegalArgumentException.
     */
    public static EngineConfig fromArgs(String[] args) {
        EngineConfig cfg = defaults();
        for (int i = 0; i < args.length; i++) {
            if (("--config".equals(args[i]) || "-c".equals(args[i]))) {
                ensureValue(args, i);
                cfg = fromJsonFile(Path.of(args[i + 1]));
            }
        }

        Duration window = cfg.conflictWindow();
        int every = cfg.versionEvery();
        boolean across = cfg.detectAcrossVersions();
        String threadName = cfg.workerThreadName();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config", "-c" -> i++;

                case "--conflict-window-seconds" -> {
                    ensureValue(args, i);
                    window = Duration.ofSeconds(parseLong(args[i], args[++i]));
                }

                case "--version-every" -> {
                    ensureValue(args, i);
                    every = (int) parseLong(args[i], args[++i]);
                }

                case "--detect-across-versions" -> across = true;

                case "--worker-thread-name" -> {
                    ensureValue(args, i);
                    threadName = args[++i];
                }

                default -> {
                    // not ours
                }
            }
        }
        return new EngineConfig(window, every, across, threadName);
    }

    /** Load a config file. Fields absent from the file keep their defaults. */
    public static EngineConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonEngineConfig json = mapper.readValue(path.toFile(), JsonEngineConfig.class);
            EngineConfig d = defaults();
            return new EngineConfig(
                    json.conflictWindowSeconds != null
                            ? Duration.ofSeconds(json.conflictWindowSeconds)
                            : d.conflictWindow(),
                    json.versionEvery != null ? json.versionEvery : d.versionEvery(),
                    json.detectAcrossVersions != null ? json.detectAcrossVersions : d.detectAcrossVersions(),
                    json.workerThreadName != null ? json.workerThreadName : d.workerThreadName()
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load EngineConfig from " + path, e);
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    private static long parseLong(String flag, String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag.substring(2) + ": " + raw, e);
        }
    }
}

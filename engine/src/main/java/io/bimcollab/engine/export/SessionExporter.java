package io.bimcollab.engine.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * JSON rendering of {@link SessionExport}. Instants are written as ISO-8601
 * strings.
 */
public final class SessionExporter {

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(SessionExport export) {
        try {
            return mapper.writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize export of session " + export.sessionId(), e);
        }
    }

    public void writeTo(SessionExport export, Path file) {
        try {
            mapper.writeValue(file.toFile(), export);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write export of session " + export.sessionId() + " to " + file, e);
        }
    }

    /** Read back a previously written export. */
    public SessionExport read(String json) {
        try {
            return mapper.readValue(json, SessionExport.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a session export", e);
        }
    }
}

package io.courier.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.courier.security.SensitiveDataMasker;
import io.courier.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Appends one compact JSON row per diagnostic event. Details are masked before they are written.
 */
public final class JsonLinesDiagnostics implements DiagnosticsSink {
    private final Path file;
    private final String source;
    private final Clock clock;
    private final AtomicLong writeFailures;

    public JsonLinesDiagnostics(Path file, String source) {
        this(file, source, Clock.systemUTC());
    }

    public JsonLinesDiagnostics(Path file, String source, Clock clock) {
        this.file = Objects.requireNonNull(file, "file");
        this.source = source == null || source.isBlank() ? "courier" : source.trim();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.writeFailures = new AtomicLong(0L);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(file)) {
                try {
                    Files.createFile(file);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize diagnostics file: " + file, e);
        }
    }

    @Override
    public synchronized void record(DiagnosticEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("source", source);
        row.put("category", event.category());
        row.put("message", event.message());
        row.put("details", maskDetails(event.details()));
        try {
            String line = Jsons.mapper().writeValueAsString(row) + System.lineSeparator();
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (JsonProcessingException e) {
            writeFailures.incrementAndGet();
        } catch (IOException e) {
            // Dispatch continues when the file cannot be written.
            writeFailures.incrementAndGet();
        }
    }

    public long writeFailures() {
        return writeFailures.get();
    }

    public Path file() {
        return file;
    }

    private JsonNode maskDetails(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return Jsons.mapper().createObjectNode();
        }
        return SensitiveDataMasker.masked(Jsons.mapper().valueToTree(details));
    }
}

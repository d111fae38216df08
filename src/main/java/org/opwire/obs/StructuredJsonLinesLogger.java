package org.opwire.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

/**
 * JSON-lines logger for connection diagnostics. Events below the configured minimum level are dropped.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private static final List<String> LEVELS = List.of("DEBUG", "INFO", "ERROR");
    private static final JsonWriterSettings JSON_SETTINGS = JsonWriterSettings.builder()
        .outputMode(JsonMode.RELAXED)
        .build();

    private final Writer writer;
    private final Clock clock;
    private final boolean autoFlush;
    private final int minimumLevel;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(outputStream, "INFO");
    }

    public StructuredJsonLinesLogger(OutputStream outputStream, String minimumLevel) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), Clock.systemUTC(), true, minimumLevel);
    }

    public StructuredJsonLinesLogger(Writer writer, Clock clock, boolean autoFlush, String minimumLevel) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.autoFlush = autoFlush;
        this.minimumLevel = rank(normalizeLevel(minimumLevel));
        this.closed = false;
    }

    @Override
    public boolean isEnabled(String level) {
        return rank(normalizeLevel(level)) >= minimumLevel;
    }

    @Override
    public synchronized void log(
        String level,
        String message,
        CorrelationContext correlationContext,
        Map<String, ?> fields
    ) {
        ensureOpen();
        String safeLevel = normalizeLevel(level);
        if (rank(safeLevel) < minimumLevel) {
            return;
        }
        CorrelationContext safeCorrelation = Objects.requireNonNull(correlationContext, "correlationContext");
        Map<String, ?> safeFields = fields == null ? Map.of() : fields;

        // Correlation and reserved keys win over caller fields; the rest is emitted in key order.
        Map<String, Object> extra = new TreeMap<>();
        for (Map.Entry<String, ?> entry : safeFields.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank()) {
                continue;
            }
            extra.put(key, entry.getValue());
        }

        BsonDocument event = new BsonDocument();
        event.put("timestamp", new BsonString(Instant.now(clock).toString()));
        event.put("level", new BsonString(safeLevel));
        event.put("message", new BsonString(message == null ? "" : message));
        for (Map.Entry<String, Object> entry : safeCorrelation.asFields().entrySet()) {
            event.put(entry.getKey(), toBsonValue(entry.getValue()));
        }
        for (Map.Entry<String, Object> entry : extra.entrySet()) {
            if (!event.containsKey(entry.getKey())) {
                event.put(entry.getKey(), toBsonValue(entry.getValue()));
            }
        }

        writeLine(event.toJson(JSON_SETTINGS));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.flush();
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close logger writer", e);
        }
    }

    private void writeLine(String encoded) {
        try {
            writer.write(encoded);
            writer.write('\n');
            if (autoFlush) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log event", e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
    }

    private static BsonValue toBsonValue(Object value) {
        if (value == null) {
            return BsonNull.VALUE;
        }
        if (value instanceof Integer i) {
            return new BsonInt32(i);
        }
        if (value instanceof Long l) {
            return new BsonInt64(l);
        }
        if (value instanceof Double || value instanceof Float) {
            return new BsonDouble(((Number) value).doubleValue());
        }
        if (value instanceof Boolean b) {
            return BsonBoolean.valueOf(b);
        }
        return new BsonString(String.valueOf(value));
    }

    private static int rank(String level) {
        int index = LEVELS.indexOf(level);
        if (index < 0) {
            throw new IllegalArgumentException("unsupported log level: " + level);
        }
        return index;
    }

    private static String normalizeLevel(String level) {
        if (level == null || level.isBlank()) {
            return "INFO";
        }
        return level.trim().toUpperCase();
    }
}

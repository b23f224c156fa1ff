package im.arun.outline.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates structured trace entries for a single conversion call.
 * Passed explicitly through the call chain; every entry is also echoed at DEBUG level.
 * Not thread-safe: one instance per invocation.
 */
public class TraceLog {
    private static final Logger logger = LoggerFactory.getLogger(TraceLog.class);
    private final String source;
    private final List<Map<String, Object>> entries = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public TraceLog(String source) {
        this.source = source;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void info(String message) {
        info(message, Map.of());
    }

    public void info(String message, Map<String, ?> details) {
        log("INFO", message, details);
    }

    public void warn(String message, Map<String, ?> details) {
        log("WARNING", message, details);
    }

    private void log(String level, String message, Map<String, ?> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", level);
        entry.put("message", message);
        if (details != null && !details.isEmpty()) {
            entry.putAll(details);
        }
        entries.add(entry);
        logger.debug("[{}] {} {}", source, message, details);
    }

    public List<Map<String, Object>> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public String getSource() {
        return source;
    }

    /**
     * Write all entries collected so far as an indented JSON array.
     */
    public void writeTo(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(path.toFile(), entries);
    }

    /**
     * Null-safe helper so call sites can trace without checking whether tracing is on.
     */
    public static void info(TraceLog trace, String message, Map<String, ?> details) {
        if (trace != null) {
            trace.info(message, details);
        }
    }

    public static void warn(TraceLog trace, String message, Map<String, ?> details) {
        if (trace != null) {
            trace.warn(message, details);
        }
    }
}

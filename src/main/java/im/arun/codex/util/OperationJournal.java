package im.arun.codex.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured record of one operation run. Entries are kept in memory and, when a
 * journal directory is configured, the whole journal is rewritten as a JSON array
 * after every entry.
 */
public class OperationJournal {
    private static final Logger systemLogger = LoggerFactory.getLogger(OperationJournal.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path journalPath;
    private final List<Map<String, Object>> entries = new ArrayList<>();
    private final ObjectMapper objectMapper;

    /**
     * In-memory journal.
     */
    public OperationJournal() {
        this(null, null);
    }

    public OperationJournal(Path journalDir, Path documentPath) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);

        if (journalDir == null) {
            this.journalPath = null;
            return;
        }

        String docName = extractDocumentName(documentPath);
        String timestamp = LocalDateTime.now().format(FILE_STAMP);
        Path target = journalDir.resolve(String.format("%s_%s.json", docName, timestamp));

        try {
            Files.createDirectories(journalDir);
        } catch (IOException e) {
            systemLogger.error("Failed to create journal directory {}, journal stays in memory", journalDir, e);
            target = null;
        }
        this.journalPath = target;
    }

    private String extractDocumentName(Path documentPath) {
        if (documentPath == null || documentPath.getFileName() == null) {
            return "codex";
        }

        String filename = documentPath.getFileName().toString();
        int dotIndex = filename.indexOf('.');
        if (dotIndex > 0) {
            filename = filename.substring(0, dotIndex);
        }
        return filename.replaceAll("[/\\\\]", "-");
    }

    public void info(String message, Map<String, ?> details) {
        log("INFO", message, details);
    }

    public void info(String message) {
        log("INFO", message, null);
    }

    public void warn(String message) {
        log("WARNING", message, null);
    }

    public void error(String message) {
        log("ERROR", message, null);
    }

    private void log(String level, String message, Map<String, ?> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("time", Instant.now().toString());
        entry.put("level", level);
        entry.put("message", message);
        if (details != null && !details.isEmpty()) {
            entry.put("details", details);
        }
        entries.add(entry);

        writeToFile();
    }

    private void writeToFile() {
        if (journalPath == null) {
            return;
        }
        try {
            objectMapper.writeValue(journalPath.toFile(), entries);
        } catch (IOException e) {
            systemLogger.error("Failed to write journal file: {}", journalPath, e);
        }
    }

    public List<Map<String, Object>> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public Path getJournalPath() {
        return journalPath;
    }
}

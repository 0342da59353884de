package com.phillippitts.webpbatch.service.history;

import com.phillippitts.webpbatch.config.properties.HistoryProperties;
import com.phillippitts.webpbatch.domain.ArchiveFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link RunHistoryStore} keeping a JSON array in a single file, newest entry first.
 *
 * <p>Writes go to a sibling temporary file that is then moved over the history file. Malformed
 * entries are skipped on read; an unreadable file reads as empty.
 */
@Component
public class JsonFileRunHistoryStore implements RunHistoryStore {

    private static final Logger LOG = LogManager.getLogger(JsonFileRunHistoryStore.class);

    private final Path file;
    private final int maxEntries;

    @Autowired
    public JsonFileRunHistoryStore(HistoryProperties properties) {
        this(Path.of(properties.file()), properties.maxEntries());
    }

    JsonFileRunHistoryStore(Path file, int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got: " + maxEntries);
        }
        this.file = file;
        this.maxEntries = maxEntries;
    }

    @Override
    public synchronized void append(HistoryEntry entry) {
        List<HistoryEntry> entries = new ArrayList<>(list());
        entries.add(0, entry);
        if (entries.size() > maxEntries) {
            entries = entries.subList(0, maxEntries);
        }
        write(entries);
    }

    @Override
    public synchronized List<HistoryEntry> list() {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("Could not read run history {}: {}", file, e.toString());
            return List.of();
        }
        if (json.isBlank()) {
            return List.of();
        }
        try {
            JSONArray array = new JSONArray(json);
            List<HistoryEntry> entries = new ArrayList<>();
            for (int i = 0; i < array.length() && entries.size() < maxEntries; i++) {
                JSONObject obj = array.optJSONObject(i);
                if (obj == null) {
                    continue;
                }
                try {
                    entries.add(fromJson(obj));
                } catch (JSONException | IllegalArgumentException | DateTimeParseException e) {
                    LOG.debug("Skipping malformed history entry {}: {}", i, e.getMessage());
                }
            }
            return List.copyOf(entries);
        } catch (JSONException e) {
            LOG.warn("Run history {} is not a JSON array: {}", file, e.getMessage());
            return List.of();
        }
    }

    @Override
    public synchronized void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not clear run history {}: {}", file, e.toString());
        }
    }

    private void write(List<HistoryEntry> entries) {
        JSONArray array = new JSONArray();
        for (HistoryEntry e : entries) {
            array.put(toJson(e));
        }
        Path parent = file.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, array.toString(2), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            LOG.warn("Could not write run history {}: {}", file, e.toString());
        }
    }

    static JSONObject toJson(HistoryEntry e) {
        JSONObject obj = new JSONObject();
        obj.put("timestamp", e.timestamp().toString());
        obj.put("folders", new JSONArray(e.folders()));
        obj.put("quality", e.quality());
        obj.put("archive_format", e.archiveFormat().name());
        obj.put("replace", e.replace());
        obj.put("skip_webp", e.skipWebp());
        obj.put("cancelled", e.cancelled());
        obj.put("converted", e.converted());
        obj.put("errors", e.errors());
        obj.put("bytes_saved", e.bytesSaved());
        obj.put("duration_seconds", e.durationSeconds());
        return obj;
    }

    static HistoryEntry fromJson(JSONObject obj) {
        List<String> folders = new ArrayList<>();
        JSONArray arr = obj.optJSONArray("folders");
        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                folders.add(arr.getString(i));
            }
        }
        return new HistoryEntry(
                Instant.parse(obj.getString("timestamp")),
                folders,
                obj.getInt("quality"),
                ArchiveFormat.valueOf(obj.optString("archive_format", ArchiveFormat.ZIP.name())),
                obj.optBoolean("replace", false),
                obj.optBoolean("skip_webp", true),
                obj.optBoolean("cancelled", false),
                obj.optInt("converted", 0),
                obj.optInt("errors", 0),
                obj.optLong("bytes_saved", 0L),
                obj.optDouble("duration_seconds", 0.0));
    }
}

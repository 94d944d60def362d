package com.phillippitts.streamwatch.service.persistence;

import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stores all channels in a single JSON document:
 * <pre>{@code { "version": 1, "channels": { "<id>": { ... } } } }</pre>
 *
 * <p>Writes go to a temporary file in the same directory that is then moved over the target, atomically where
 * the file system supports it. A top-level JSON array is read as the older list layout, whose weekday keys count
 * from Monday. Records that fail to decode are skipped with a warning.
 */
public class JsonFileChannelStore implements ChannelStore {

    private static final Logger LOG = LogManager.getLogger(JsonFileChannelStore.class);
    static final int FORMAT_VERSION = 1;

    private final Path file;
    private final ChannelRecordCodec codec;

    public JsonFileChannelStore(Path file, ZoneId zone) {
        this.file = file;
        this.codec = new ChannelRecordCodec(zone);
    }

    @Override
    public synchronized void saveAll(List<ChannelState> channels) {
        JSONObject records = new JSONObject();
        for (ChannelState channel : channels) {
            records.put(channel.getId(), codec.encode(channel));
        }
        JSONObject document = new JSONObject()
                .put("version", FORMAT_VERSION)
                .put("channels", records);

        Path tmp = null;
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                writer.write(document.toString(2));
            }
            moveIntoPlace(tmp);
            LOG.debug("Saved {} channel(s) to {}", channels.size(), file);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException(file, "Failed to save channels", e);
        }
    }

    @Override
    public synchronized List<ChannelState> loadAll() {
        if (!Files.exists(file)) {
            LOG.info("No channel store at {}; starting empty", file);
            return List.of();
        }
        Object root;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JSONTokener tokener = new JSONTokener(reader);
            if (!tokener.more()) {
                return List.of();
            }
            root = tokener.nextValue();
        } catch (IOException | JSONException e) {
            throw new PersistenceException(file, "Failed to read channels", e);
        }

        List<ChannelState> loaded = new ArrayList<>();
        if (root instanceof JSONArray legacy) {
            for (int i = 0; i < legacy.length(); i++) {
                decodeInto(loaded, legacy.optJSONObject(i), true);
            }
        } else if (root instanceof JSONObject document) {
            int version = document.optInt("version", FORMAT_VERSION);
            if (version > FORMAT_VERSION) {
                LOG.warn("Channel store {} has newer format version {}; reading known fields only", file, version);
            }
            JSONObject records = document.optJSONObject("channels");
            if (records != null) {
                for (String id : records.keySet()) {
                    JSONObject record = records.optJSONObject(id);
                    if (record != null && !record.has("id") && !record.has("rec_id")) {
                        record.put("id", id);
                    }
                    decodeInto(loaded, record, false);
                }
            }
        } else {
            throw new PersistenceException(file, "Unexpected channel store layout", null);
        }

        loaded.sort(Comparator
                .comparing(ChannelState::getAddedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
                .thenComparing(ChannelState::getId));
        LOG.info("Loaded {} channel(s) from {}", loaded.size(), file);
        return loaded;
    }

    public Path getFile() {
        return file;
    }

    private void decodeInto(List<ChannelState> target, JSONObject record, boolean mondayFirstDays) {
        if (record == null) {
            LOG.warn("Skipping non-object channel record in {}", file);
            return;
        }
        try {
            ChannelState channel = codec.decode(record, mondayFirstDays);
            boolean duplicate = target.stream().anyMatch(c -> c.getId().equals(channel.getId()));
            if (duplicate) {
                LOG.warn("Skipping duplicate channel id {} in {}", channel.getId(), file);
                return;
            }
            target.add(channel);
        } catch (RuntimeException e) {
            LOG.warn("Skipping unreadable channel record in {}: {}", file, e.getMessage());
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}; falling back to replace", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.debug("Could not delete temporary file {}: {}", tmp, e.getMessage());
        }
    }
}

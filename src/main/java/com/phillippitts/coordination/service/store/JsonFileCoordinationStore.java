package com.phillippitts.coordination.service.store;

import com.phillippitts.coordination.domain.CoordinationEvent;
import com.phillippitts.coordination.domain.Insight;
import com.phillippitts.coordination.domain.Pattern;
import com.phillippitts.coordination.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Stores each collection as a JSON document in a data directory:
 * {@code events.json}, {@code patterns.json} and {@code insights.json}.
 *
 * <p>Writes go to a temporary sibling file that is then moved over the target, so a failed
 * write never leaves a half-written document behind. Missing files load as empty collections;
 * corrupt files are logged and load as empty.
 *
 * @since 1.0
 */
public class JsonFileCoordinationStore implements CoordinationStore {

    private static final Logger LOG = LogManager.getLogger(JsonFileCoordinationStore.class);

    private final Path dataDir;

    public JsonFileCoordinationStore(Path dataDir) {
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
    }

    public Path getDataDir() {
        return dataDir;
    }

    @Override
    public List<CoordinationEvent> loadEvents() {
        return read(EVENTS, CoordinationJsonCodec::eventsFromJson, List.of());
    }

    @Override
    public void saveEvents(List<CoordinationEvent> events) {
        write(EVENTS, CoordinationJsonCodec.eventsToJson(events));
    }

    @Override
    public Map<String, Pattern> loadPatterns() {
        return read(PATTERNS, CoordinationJsonCodec::patternsFromJson, new LinkedHashMap<>());
    }

    @Override
    public void savePatterns(Map<String, Pattern> patterns) {
        write(PATTERNS, CoordinationJsonCodec.patternsToJson(patterns));
    }

    @Override
    public List<Insight> loadInsights() {
        return read(INSIGHTS, CoordinationJsonCodec::insightsFromJson, List.of());
    }

    @Override
    public void saveInsights(List<Insight> insights) {
        write(INSIGHTS, CoordinationJsonCodec.insightsToJson(insights));
    }

    Path fileFor(String collection) {
        return dataDir.resolve(collection + ".json");
    }

    private <T> T read(String collection, Function<String, T> parser, T empty) {
        Path file = fileFor(collection);
        if (!Files.isRegularFile(file)) {
            LOG.debug("No stored {} at {}; starting empty", collection, file);
            return empty;
        }
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                return empty;
            }
            return parser.apply(json);
        } catch (IOException e) {
            LOG.warn("Unable to read {} from {}; starting empty: {}", collection, file, e.toString());
            return empty;
        } catch (JSONException | IllegalArgumentException | DateTimeException e) {
            LOG.warn("Corrupt {} document at {}; starting empty: {}", collection, file, e.getMessage());
            return empty;
        }
    }

    private void write(String collection, String json) {
        Path target = fileFor(collection);
        Path tmp = dataDir.resolve(collection + ".json.tmp");
        try {
            Files.createDirectories(dataDir);
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            moveIntoPlace(tmp, target);
        } catch (IOException e) {
            throw new PersistenceException(collection, e.toString(), e);
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}

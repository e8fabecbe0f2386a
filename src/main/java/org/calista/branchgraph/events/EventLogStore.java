package org.calista.branchgraph.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.branchgraph.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * EventLogStore: журнал событий графа в JSONL (один {@link GraphEvent} на строку).
 *
 * <p>Чтение: битые строки пропускаются с warn, загрузку не валят.
 * События с неожиданным индексом (дыра или повтор) тоже пропускаются.</p>
 */
public final class EventLogStore {
    private static final Logger log = LogManager.getLogger(EventLogStore.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventLogStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    public void append(GraphEvent e) throws IOException {
        Objects.requireNonNull(e, "e");
        io.appendJsonl(file, mapper.writeValueAsString(e));
    }

    public void appendAll(List<GraphEvent> events) throws IOException {
        for (GraphEvent e : events) append(e);
    }

    /**
     * Reads the log in order. Returns an empty list when the file does not exist.
     */
    public List<GraphEvent> readAll() throws IOException {
        if (!io.exists(file)) return List.of();

        List<GraphEvent> out = new ArrayList<>();
        int skipped = 0;
        try (Stream<String> lines = io.jsonlStream(file)) {
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                String line = it.next();
                try {
                    GraphEvent e = mapper.readValue(line, GraphEvent.class);
                    if (e == null || e.kind == null) {
                        skipped++;
                        continue;
                    }
                    if (e.index != out.size()) {
                        log.warn("Event log {}: unexpected index {} (expected {}), skipping", file, e.index, out.size());
                        skipped++;
                        continue;
                    }
                    out.add(e);
                } catch (JsonProcessingException rowErr) {
                    skipped++;
                    log.warn("Event log {}: skip broken row: {}", file, rowErr.getOriginalMessage());
                }
            }
        }
        log.debug("Read {} events from {} (skipped={})", out.size(), file, skipped);
        return out;
    }

    public void clear() throws IOException {
        io.deleteIfExists(file);
    }
}

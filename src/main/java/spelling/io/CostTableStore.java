package spelling.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spelling.alignment.EditCounts;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Saves and loads learned {@link EditCounts} as JSON, so a corrector can be built without retraining.
 * <p>
 * The document is an object of objects, {@code {"observed": {"intended": count}}}, with the empty symbol written as the
 * key {@code ""}. Keys are sorted and the output is indented so the table can be inspected by hand.
 */
public final class CostTableStore {

    private static final Logger log = LoggerFactory.getLogger(CostTableStore.class);

    private static final TypeReference<TreeMap<String, TreeMap<String, Integer>>> TABLE_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public CostTableStore() {
        this.mapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public void write(EditCounts counts, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(counts, writer);
        }
        log.debug("Wrote cost table with {} symbols to {}", counts.alphabet().size(), path);
    }

    public void write(EditCounts counts, Writer writer) throws IOException {
        mapper.writeValue(writer, counts.asMap());
    }

    public EditCounts read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        }
    }

    /**
     * @throws MalformedRecordException if the document is not valid JSON, or not a square table of non-negative counts
     *                                  over an alphabet that includes the empty symbol
     */
    public EditCounts read(Reader reader, String sourceName) throws IOException {
        Map<String, TreeMap<String, Integer>> rows;
        try {
            rows = mapper.readValue(reader, TABLE_TYPE);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException(sourceName, "not a cost table", e);
        }
        if (rows == null) {
            throw new MalformedRecordException(sourceName, 1, "empty document");
        }
        try {
            EditCounts counts = EditCounts.fromMap(rows);
            log.debug("Loaded cost table with {} symbols from {}", counts.alphabet().size(), sourceName);
            return counts;
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException(sourceName, e.getMessage(), e);
        }
    }
}

package spelling.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spelling.alignment.TrainingPair;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads (misspelling, correct word) pairs, one {@code misspelling<TAB>correct} record per line. Both words are
 * lower-cased. Blank lines hold no record and are skipped; any other line must have exactly two non-empty fields.
 */
public final class TrainingPairReader {

    private static final Logger log = LoggerFactory.getLogger(TrainingPairReader.class);

    private TrainingPairReader() {
    }

    public static List<TrainingPair> read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        }
    }

    public static List<TrainingPair> read(Reader input, String sourceName) throws IOException {
        BufferedReader reader = input instanceof BufferedReader ? (BufferedReader) input : new BufferedReader(input);
        List<TrainingPair> pairs = new ArrayList<>();
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            String[] fields = line.split("\t", -1);
            if (fields.length != 2) {
                throw new MalformedRecordException(sourceName, lineNumber,
                        "expected 2 tab-separated fields, found " + fields.length);
            }
            String misspelling = fields[0].strip();
            String correct = fields[1].strip();
            if (misspelling.isEmpty() || correct.isEmpty()) {
                throw new MalformedRecordException(sourceName, lineNumber, "empty field");
            }
            pairs.add(new TrainingPair(misspelling, correct).lowerCase());
        }
        log.debug("Read {} training pairs from {}", pairs.size(), sourceName);
        return pairs;
    }
}

// # Reading the vocabulary
//
// The vocabulary is a whitespace-separated word list. We run it through a small Lucene `Analyzer`: a
// `WhitespaceTokenizer` splits on whitespace and a `LowerCaseFilter` folds case, so lexicon words and training pairs
// share one lower-case alphabet.
package spelling.io;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class VocabularyReader {

    private static final Logger log = LoggerFactory.getLogger(VocabularyReader.class);

    private static final String FIELD = "word";

    private VocabularyReader() {
    }

    /**
     * Splits on whitespace and lower-cases, nothing else.
     */
    static final class WordListAnalyzer extends Analyzer {
        @Override
        protected TokenStreamComponents createComponents(String fieldName) {
            Tokenizer tokenizer = new WhitespaceTokenizer();
            return new TokenStreamComponents(tokenizer, new LowerCaseFilter(tokenizer));
        }
    }

    public static List<String> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static List<String> read(String text) throws IOException {
        return read(new StringReader(text));
    }

    /**
     * Returns the distinct words of {@code input} in order of first appearance.
     */
    public static List<String> read(Reader input) throws IOException {
        Set<String> words = new LinkedHashSet<>();
        try (Analyzer analyzer = new WordListAnalyzer();
             TokenStream tokenStream = analyzer.tokenStream(FIELD, input)) {
            CharTermAttribute term = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                words.add(term.toString());
            }
            tokenStream.end();
        }
        log.debug("Read {} distinct vocabulary words", words.size());
        return new ArrayList<>(words);
    }
}

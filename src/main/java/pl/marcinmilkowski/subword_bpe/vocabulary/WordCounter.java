package pl.marcinmilkowski.subword_bpe.vocabulary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Counts whitespace-separated tokens of a plain-text corpus.
 */
public final class WordCounter {

    private static final Logger logger = LoggerFactory.getLogger(WordCounter.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private WordCounter() {
    }

    public static Vocabulary count(Path corpus) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(corpus, StandardCharsets.UTF_8)) {
            Vocabulary vocabulary = count(reader);
            logger.info("Counted {} distinct words in {}", vocabulary.size(), corpus);
            return vocabulary;
        }
    }

    public static Vocabulary count(BufferedReader reader) throws IOException {
        Vocabulary vocabulary = new Vocabulary();
        String line;
        while ((line = reader.readLine()) != null) {
            countLine(line, vocabulary);
        }
        return vocabulary;
    }

    public static void countLine(String line, Vocabulary vocabulary) {
        for (String word : WHITESPACE.split(line.strip())) {
            if (!word.isEmpty()) {
                vocabulary.increment(word);
            }
        }
    }
}

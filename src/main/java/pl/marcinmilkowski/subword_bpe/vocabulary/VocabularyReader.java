package pl.marcinmilkowski.subword_bpe.vocabulary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads vocabulary files: one {@code WORD FREQUENCY} pair per line, UTF-8.
 *
 * Entries below the threshold are dropped while reading.
 */
public final class VocabularyReader {

    private static final Logger logger = LoggerFactory.getLogger(VocabularyReader.class);

    private VocabularyReader() {
    }

    public static Vocabulary read(Path path) throws IOException {
        return read(path, 1);
    }

    public static Vocabulary read(Path path, long threshold) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Vocabulary file not found: " + path);
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Vocabulary vocabulary = read(reader, threshold, path.toString());
            logger.info("Loaded {} vocabulary entries (threshold {}) from {}", vocabulary.size(), threshold, path);
            return vocabulary;
        }
    }

    public static Vocabulary read(BufferedReader reader, long threshold) throws IOException {
        return read(reader, threshold, "<stream>");
    }

    private static Vocabulary read(BufferedReader reader, long threshold, String source) throws IOException {
        Vocabulary vocabulary = new Vocabulary();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] fields = trimmed.split("\\s+");
            if (fields.length != 2) {
                throw new IOException(source + ":" + lineNumber + ": expected 'WORD FREQUENCY', got: " + line);
            }
            long frequency;
            try {
                frequency = Long.parseLong(fields[1]);
            } catch (NumberFormatException e) {
                throw new IOException(source + ":" + lineNumber + ": invalid frequency: " + fields[1], e);
            }
            if (frequency < 0) {
                throw new IOException(source + ":" + lineNumber + ": negative frequency: " + frequency);
            }
            if (frequency >= threshold) {
                vocabulary.add(fields[0], frequency);
            }
        }
        return vocabulary;
    }
}

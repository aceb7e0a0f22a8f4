package pl.marcinmilkowski.subword_bpe.vocabulary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes a vocabulary as {@code WORD FREQUENCY} lines, most frequent first.
 */
public final class VocabularyWriter {

    private static final Logger logger = LoggerFactory.getLogger(VocabularyWriter.class);

    private VocabularyWriter() {
    }

    public static void write(Vocabulary vocabulary, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(vocabulary, writer);
        }
        logger.info("Vocabulary written: {} entries to {}", vocabulary.size(), path);
    }

    public static void write(Vocabulary vocabulary, Writer writer) throws IOException {
        for (Map.Entry<String, Long> entry : vocabulary.sortedByFrequency()) {
            writer.write(entry.getKey());
            writer.write(' ');
            writer.write(Long.toString(entry.getValue()));
            writer.write('\n');
        }
        writer.flush();
    }
}

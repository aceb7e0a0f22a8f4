package pl.marcinmilkowski.subword_bpe.codes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads merge tables written by {@link MergeTableWriter}.
 *
 * Format (UTF-8, one merge per line, line order = rank):
 * <pre>
 * #version: 0.2
 * e s
 * es t&lt;/w&gt;
 * </pre>
 * A missing header means version 0.1; the first line is then a merge.
 */
public final class MergeTableReader {

    private static final Logger logger = LoggerFactory.getLogger(MergeTableReader.class);

    public static final String VERSION_HEADER = "#version: ";

    private MergeTableReader() {
    }

    public static MergeTable read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Merge table not found: " + path);
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            MergeTable table = read(reader, path.toString());
            logger.info("Loaded {} merges (version {}) from {}", table.size(), table.version(), path);
            return table;
        }
    }

    public static MergeTable read(Reader reader) throws IOException {
        BufferedReader buffered = reader instanceof BufferedReader
            ? (BufferedReader) reader
            : new BufferedReader(reader);
        return read(buffered, "<stream>");
    }

    public static MergeTable parse(String text) throws IOException {
        return read(new StringReader(text));
    }

    private static MergeTable read(BufferedReader reader, String source) throws IOException {
        List<SymbolPair> merges = new ArrayList<>();
        BpeVersion version;

        String line = reader.readLine();
        int lineNumber = 1;
        if (line != null && line.startsWith(VERSION_HEADER)) {
            try {
                version = BpeVersion.parse(line.substring(VERSION_HEADER.length()));
            } catch (IllegalArgumentException e) {
                throw new IOException(source + ":1: " + e.getMessage(), e);
            }
            line = reader.readLine();
            lineNumber++;
        } else {
            logger.info("No version header in {}, assuming version {}", source, BpeVersion.V0_1);
            version = BpeVersion.V0_1;
        }

        for (; line != null; line = reader.readLine(), lineNumber++) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] fields = trimmed.split("\\s+");
            if (fields.length != 2) {
                throw new IOException(source + ":" + lineNumber
                    + ": expected two symbols per merge line, got: " + line);
            }
            merges.add(new SymbolPair(fields[0], fields[1]));
        }
        return new MergeTable(version, merges);
    }
}

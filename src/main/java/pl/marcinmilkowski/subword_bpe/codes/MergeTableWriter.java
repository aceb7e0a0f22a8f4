package pl.marcinmilkowski.subword_bpe.codes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a merge table in the text format read by {@link MergeTableReader}.
 */
public final class MergeTableWriter {

    private static final Logger logger = LoggerFactory.getLogger(MergeTableWriter.class);

    private MergeTableWriter() {
    }

    public static void write(MergeTable table, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(table, writer);
        }
        logger.info("Merge table written: {} merges to {}", table.size(), path);
    }

    public static void write(MergeTable table, Writer writer) throws IOException {
        writeHeader(table.version(), writer);
        for (SymbolPair pair : table.merges()) {
            writeMerge(pair, writer);
        }
        writer.flush();
    }

    public static String toText(MergeTable table) {
        StringWriter out = new StringWriter();
        try {
            write(table, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    static void writeHeader(BpeVersion version, Writer writer) throws IOException {
        writer.write(MergeTableReader.VERSION_HEADER + version + "\n");
    }

    static void writeMerge(SymbolPair pair, Writer writer) throws IOException {
        writer.write(pair.first() + " " + pair.second() + "\n");
    }
}

package pl.marcinmilkowski.subword_bpe.codes;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MergeTableReaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Version header selects the end-of-word convention")
    void readsHeader() throws IOException {
        MergeTable table = MergeTableReader.parse("#version: 0.2\ne s\nes t</w>\n");

        assertEquals(BpeVersion.V0_2, table.version());
        assertEquals(List.of(SymbolPair.of("e", "s"), SymbolPair.of("es", "t</w>")), table.merges());
        assertEquals(1, table.rank(SymbolPair.of("es", "t</w>")));
    }

    @Test
    @DisplayName("Missing header means version 0.1 and the first line is a merge")
    void missingHeader() throws IOException {
        MergeTable table = MergeTableReader.parse("t </w>\ns t</w>\n");

        assertEquals(BpeVersion.V0_1, table.version());
        assertEquals(2, table.size());
        assertEquals(0, table.rank(SymbolPair.of("t", "</w>")));
    }

    @Test
    @DisplayName("Unsupported version is rejected")
    void unsupportedVersion() {
        IOException e = assertThrows(IOException.class, () -> MergeTableReader.parse("#version: 0.3\na b\n"));
        assertTrue(e.getMessage().contains("0.3"));
    }

    @Test
    @DisplayName("Duplicate lines keep the rank of their first occurrence")
    void duplicates() throws IOException {
        MergeTable table = MergeTableReader.parse("#version: 0.2\na b\nc d\na b\n");

        assertEquals(3, table.size());
        assertEquals(0, table.rank(SymbolPair.of("a", "b")));
        assertEquals(1, table.rank(SymbolPair.of("c", "d")));
        assertEquals(List.of(SymbolPair.of("a", "b"), SymbolPair.of("c", "d")), table.orderedMerges());
    }

    @Test
    @DisplayName("Malformed merge lines report their line number")
    void malformedLine() {
        IOException e = assertThrows(IOException.class, () -> MergeTableReader.parse("#version: 0.2\na b\na b c\n"));
        assertTrue(e.getMessage().contains(":3:"), e.getMessage());
    }

    @Test
    @DisplayName("Blank lines are skipped")
    void blankLines() throws IOException {
        assertEquals(2, MergeTableReader.parse("#version: 0.2\na b\n\nc d\n").size());
    }

    @Test
    @DisplayName("Empty input is an empty version 0.1 table")
    void emptyInput() throws IOException {
        MergeTable table = MergeTableReader.parse("");
        assertTrue(table.isEmpty());
        assertEquals(BpeVersion.V0_1, table.version());
    }

    @Test
    @DisplayName("Written tables read back unchanged")
    void fileRoundTrip() throws IOException {
        MergeTable table = new MergeTable(BpeVersion.V0_2,
            List.of(SymbolPair.of("ł", "ó"), SymbolPair.of("łó", "d</w>"), SymbolPair.of("ł", "ó")));
        Path path = tempDir.resolve("nested/codes.txt");

        MergeTableWriter.write(table, path);

        assertEquals(table, MergeTableReader.read(path));
        assertEquals("#version: 0.2\nł ó\nłó d</w>\nł ó\n", MergeTableWriter.toText(table));
    }

    @Test
    void missingFile() {
        assertThrows(FileNotFoundException.class, () -> MergeTableReader.read(tempDir.resolve("absent.txt")));
    }
}

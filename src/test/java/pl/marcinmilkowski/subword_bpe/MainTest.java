package pl.marcinmilkowski.subword_bpe;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.subword_bpe.vocabulary.Vocabulary;
import pl.marcinmilkowski.subword_bpe.vocabulary.VocabularyReader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    private Path corpus;

    @BeforeEach
    void setUp() throws IOException {
        corpus = tempDir.resolve("corpus.txt");
        String text = String.join(" ", Collections.nCopies(5, "low")) + "\n"
            + String.join(" ", Collections.nCopies(2, "lower")) + "\n"
            + String.join(" ", Collections.nCopies(6, "newest")) + "\n"
            + String.join(" ", Collections.nCopies(3, "widest")) + "\n";
        Files.writeString(corpus, text, StandardCharsets.UTF_8);
    }

    private static String read(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    private static int run(String... args) {
        return Main.run(args);
    }

    @Test
    @DisplayName("get-vocab writes counts, most frequent first")
    void getVocab() throws IOException {
        Path vocab = tempDir.resolve("vocab.txt");

        assertEquals(0, run("get-vocab", "--input", corpus.toString(), "--output", vocab.toString()));

        assertEquals("newest 6\nlow 5\nwidest 3\nlower 2\n", read(vocab));
    }

    @Test
    @DisplayName("learn from text and from a vocabulary file give the same codes")
    void learn() throws IOException {
        Path vocab = tempDir.resolve("vocab.txt");
        Path fromText = tempDir.resolve("codes-text.txt");
        Path fromVocab = tempDir.resolve("codes-vocab.txt");
        run("get-vocab", "-i", corpus.toString(), "-o", vocab.toString());

        assertEquals(0, run("learn", "--input", corpus.toString(), "--output", fromText.toString(), "-s", "2"));
        assertEquals(0, run("learn", "--input", vocab.toString(), "--dict-input",
            "--output", fromVocab.toString(), "--symbols", "2"));

        assertEquals("#version: 0.2\ns t</w>\ne st</w>\n", read(fromText));
        assertEquals(read(fromText), read(fromVocab));
    }

    @Test
    @DisplayName("learn --version01 writes a version 0.1 table")
    void learnVersion01() throws IOException {
        Path codes = tempDir.resolve("codes.txt");

        assertEquals(0, run("learn", "-i", corpus.toString(), "-o", codes.toString(), "-s", "2", "--version01"));

        assertEquals("#version: 0.1\nt </w>\ns t</w>\n", read(codes));
    }

    @Test
    @DisplayName("learn --forcecodes applies the given merges first")
    void learnForceCodes() throws IOException {
        Path forced = tempDir.resolve("forced.txt");
        Path codes = tempDir.resolve("codes.txt");
        Files.writeString(forced, "#version: 0.2\nl o\nw i\n", StandardCharsets.UTF_8);

        assertEquals(0, run("learn", "-i", corpus.toString(), "-o", codes.toString(), "-s", "1",
            "--forcecodes", forced.toString(), "--grepforcecodes", "[lo]"));

        assertEquals("#version: 0.2\nl o\ns t</w>\n", read(codes));
    }

    @Test
    @DisplayName("learn --write-vocabulary writes the subword vocabulary")
    void learnWritesSubwordVocabulary() throws IOException {
        Path codes = tempDir.resolve("codes.txt");
        Path subwords = tempDir.resolve("subwords.txt");

        assertEquals(0, run("learn", "-i", corpus.toString(), "-o", codes.toString(), "-s", "2",
            "--write-vocabulary", subwords.toString()));

        Vocabulary vocabulary = VocabularyReader.read(subwords);
        assertEquals(9, vocabulary.frequency("est"));
        assertEquals(11, vocabulary.frequency("w@@"));
        assertEquals(5, vocabulary.frequency("w"));
        assertEquals(2, vocabulary.frequency("r"));
    }

    @Test
    @DisplayName("--write-vocabulary counts every input word, including those below --min-count")
    void subwordVocabularyIgnoresMinCount() throws IOException {
        Path codes = tempDir.resolve("codes.txt");
        Path subwords = tempDir.resolve("subwords.txt");

        assertEquals(0, run("learn", "-i", corpus.toString(), "-o", codes.toString(), "-s", "2",
            "--min-count", "3", "--write-vocabulary", subwords.toString()));

        assertEquals("#version: 0.2\ns t</w>\ne st</w>\n", read(codes));
        Vocabulary vocabulary = VocabularyReader.read(subwords);
        assertEquals(9, vocabulary.frequency("est"));
        assertEquals(2, vocabulary.frequency("r"));
        assertEquals(8, vocabulary.frequency("e@@"));
    }

    @Test
    @DisplayName("apply segments text line by line")
    void apply() throws IOException {
        Path codes = tempDir.resolve("codes.txt");
        Path input = tempDir.resolve("input.txt");
        Path output = tempDir.resolve("out/output.txt");
        Files.writeString(codes, "#version: 0.2\ns t</w>\ne st</w>\n", StandardCharsets.UTF_8);
        Files.writeString(input, "newest widest\nlow\n", StandardCharsets.UTF_8);

        assertEquals(0, run("apply", "--codes", codes.toString(), "--input", input.toString(),
            "--output", output.toString()));

        assertEquals("n@@ e@@ w@@ est w@@ i@@ d@@ est\nl@@ o@@ w\n", read(output));
    }

    @Test
    @DisplayName("apply honours glossaries, vocabulary restriction and config files")
    void applyOptions() throws IOException {
        Path codes = tempDir.resolve("codes.txt");
        Path input = tempDir.resolve("input.txt");
        Files.writeString(codes, "#version: 0.2\ns t</w>\ne st</w>\n", StandardCharsets.UTF_8);
        Files.writeString(input, "newest\n", StandardCharsets.UTF_8);

        Path glossary = tempDir.resolve("glossary.txt");
        assertEquals(0, run("apply", "-c", codes.toString(), "-i", input.toString(), "-o", glossary.toString(),
            "--glossaries", "new", "wide"));
        assertEquals("new@@ est\n", read(glossary));

        Path vocab = tempDir.resolve("vocab.txt");
        Path restricted = tempDir.resolve("restricted.txt");
        Files.writeString(vocab, "n@@ 5\ne@@ 5\nw@@ 5\ns@@ 5\nt 5\nest 1\n", StandardCharsets.UTF_8);
        assertEquals(0, run("apply", "-c", codes.toString(), "-i", input.toString(), "-o", restricted.toString(),
            "--vocabulary", vocab.toString(), "--vocabulary-threshold", "2"));
        assertEquals("n@@ e@@ w@@ e@@ s@@ t\n", read(restricted));

        Path config = tempDir.resolve("bpe.json");
        Path configured = tempDir.resolve("configured.txt");
        Files.writeString(config, "{\"apply\": {\"separator\": \"##\"}}", StandardCharsets.UTF_8);
        assertEquals(0, run("apply", "--config", config.toString(), "-c", codes.toString(),
            "-i", input.toString(), "-o", configured.toString()));
        assertEquals("n## e## w## est\n", read(configured));
    }

    @Test
    @DisplayName("learn-joint learns one table and writes one vocabulary per input")
    void learnJoint() throws IOException {
        Path first = tempDir.resolve("a.txt");
        Path second = tempDir.resolve("b.txt");
        Files.writeString(first, "low low lower\n", StandardCharsets.UTF_8);
        Files.writeString(second, "newest newest widest\n", StandardCharsets.UTF_8);
        Path codes = tempDir.resolve("codes.txt");
        Path firstVocab = tempDir.resolve("a.vocab");
        Path secondVocab = tempDir.resolve("b.vocab");

        assertEquals(0, run("learn-joint", "--input", first.toString(), second.toString(),
            "--output", codes.toString(), "-s", "3",
            "--write-vocabulary", firstVocab.toString(), secondVocab.toString()));

        assertTrue(read(codes).startsWith("#version: 0.2\n"));
        Vocabulary a = VocabularyReader.read(firstVocab);
        Vocabulary b = VocabularyReader.read(secondVocab);
        assertTrue(a.words().stream().noneMatch(piece -> piece.contains("d")));
        assertTrue(b.words().stream().anyMatch(piece -> piece.contains("d")));
    }

    @Test
    @DisplayName("learn-joint needs one vocabulary file per input")
    void learnJointMismatch() throws IOException {
        Path codes = tempDir.resolve("codes.txt");
        assertEquals(1, run("learn-joint", "--input", corpus.toString(), corpus.toString(),
            "--output", codes.toString(), "--write-vocabulary", tempDir.resolve("only.vocab").toString()));
    }

    @Test
    @DisplayName("subset writes the subword vocabulary and the merges it needs")
    void subset() throws IOException {
        Path codes = tempDir.resolve("codes.txt");
        Path vocab = tempDir.resolve("vocab.txt");
        Path outCodes = tempDir.resolve("subset.txt");
        Path bpeVocab = tempDir.resolve("bpe.vocab");
        Files.writeString(codes, "#version: 0.2\ns t</w>\nl o\ne st</w>\n", StandardCharsets.UTF_8);
        Files.writeString(vocab, "low 5\nnewest 6\n", StandardCharsets.UTF_8);

        assertEquals(0, run("subset", "--codes", codes.toString(), "--input", vocab.toString(),
            "--min-count", "6", "--outcodes", outCodes.toString(), "--bpevocab", bpeVocab.toString()));

        assertEquals("#version: 0.2\ns t</w>\ne st</w>\n", read(outCodes));
        assertEquals("n@@ 6\ne@@ 6\nw@@ 6\nest 6\n", read(bpeVocab));
    }

    @Test
    @DisplayName("Errors and unknown commands return a non-zero status")
    void errors() throws IOException {
        assertEquals(1, run());
        assertEquals(1, run("frobnicate"));
        assertEquals(1, run("apply", "--input", corpus.toString()));
        assertEquals(1, run("apply", "--codes", tempDir.resolve("absent.txt").toString()));
        assertEquals(1, run("learn", "--symbols"));
        assertEquals(1, run("get-vocab", "--bogus"));
        assertEquals(0, run("help"));
    }
}

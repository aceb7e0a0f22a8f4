package pl.marcinmilkowski.subword_bpe.apply;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GlossaryIsolatorTest {

    private static List<String> texts(List<GlossaryIsolator.Segment> segments) {
        return segments.stream().map(GlossaryIsolator.Segment::text).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Every occurrence of a glossary word is isolated")
    void isolatesEveryOccurrence() {
        GlossaryIsolator isolator = new GlossaryIsolator(List.of("USA"), List.of());
        List<GlossaryIsolator.Segment> segments = isolator.isolate("1934USABUSA");

        assertEquals(List.of("1934", "USA", "B", "USA"), texts(segments));
        assertEquals(List.of(false, true, false, true),
            segments.stream().map(GlossaryIsolator.Segment::isolated).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Several glossaries in one word")
    void multipleGlossaries() {
        GlossaryIsolator isolator = new GlossaryIsolator(List.of("like", "Manuel", "USA"), List.of());

        assertEquals(List.of("word", "like", "word"), texts(isolator.isolate("wordlikeword")));
        assertEquals(List.of("like", "Manuel", "word"), texts(isolator.isolate("likeManuelword")));
        assertEquals(List.of("USA"), texts(isolator.isolate("USA")));
        assertEquals(List.of("US"), texts(isolator.isolate("US")));
    }

    @Test
    @DisplayName("Literal glossaries are quoted, regex glossaries are not")
    void literalAndRegex() {
        GlossaryIsolator literal = new GlossaryIsolator(List.of("a.b"), List.of());
        assertEquals(List.of("a.b", "x"), texts(literal.isolate("a.bx")));
        assertEquals(List.of("axbx"), texts(literal.isolate("axbx")));

        GlossaryIsolator regex = new GlossaryIsolator(List.of(), List.of("[0-9]+"));
        assertEquals(List.of("abc", "1234", "def", "5"), texts(regex.isolate("abc1234def5")));
    }

    @Test
    @DisplayName("At the same position the earlier glossary wins")
    void earlierAlternativeWins() {
        GlossaryIsolator isolator = new GlossaryIsolator(List.of("ab", "abc"), List.of());
        assertEquals(List.of("ab", "c"), texts(isolator.isolate("abc")));
    }

    @Test
    @DisplayName("Empty regex matches protect nothing")
    void emptyMatches() {
        GlossaryIsolator isolator = new GlossaryIsolator(List.of(), List.of("x*"));
        assertEquals(List.of("ab", "xx", "c"), texts(isolator.isolate("abxxc")));
    }

    @Test
    @DisplayName("No glossaries: the word is one segment")
    void noGlossaries() {
        GlossaryIsolator isolator = new GlossaryIsolator(List.of(), List.of());
        assertTrue(isolator.isEmpty());
        assertEquals(List.of("word"), texts(isolator.isolate("word")));
        assertTrue(isolator.isolate("").isEmpty());
    }
}

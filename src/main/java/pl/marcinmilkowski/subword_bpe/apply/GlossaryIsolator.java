package pl.marcinmilkowski.subword_bpe.apply;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a word around glossary matches so the matches can bypass BPE.
 *
 * Literal glossaries (quoted) come first, then raw regex glossaries, joined
 * into one alternation. The earliest match in the word wins; at the same
 * position the earliest alternative wins.
 *
 * For glossary {@code USA}, {@code 1934USABUSA} becomes
 * {@code 1934 | [USA] | B | [USA]}.
 */
public final class GlossaryIsolator {

    /**
     * A piece of a word; {@code isolated} pieces are glossary matches.
     */
    public record Segment(String text, boolean isolated) {
    }

    private final Pattern pattern;

    public GlossaryIsolator(List<String> glossaries, List<String> regexGlossaries) {
        List<String> alternatives = new ArrayList<>();
        for (String glossary : glossaries) {
            alternatives.add(Pattern.quote(glossary));
        }
        alternatives.addAll(regexGlossaries);
        this.pattern = alternatives.isEmpty()
            ? null
            : Pattern.compile("(?:" + String.join("|", alternatives) + ")");
    }

    public boolean isEmpty() {
        return pattern == null;
    }

    /**
     * The combined pattern, or null when there are no glossaries.
     */
    public Pattern pattern() {
        return pattern;
    }

    /**
     * Returns the non-empty pieces of {@code word} in order.
     */
    public List<Segment> isolate(String word) {
        List<Segment> segments = new ArrayList<>();
        if (pattern == null) {
            if (!word.isEmpty()) {
                segments.add(new Segment(word, false));
            }
            return segments;
        }
        Matcher matcher = pattern.matcher(word);
        int last = 0;
        while (matcher.find()) {
            if (matcher.start() == matcher.end()) {
                // empty regex match: nothing to protect
                continue;
            }
            if (matcher.start() > last) {
                segments.add(new Segment(word.substring(last, matcher.start()), false));
            }
            segments.add(new Segment(matcher.group(), true));
            last = matcher.end();
        }
        if (last < word.length()) {
            segments.add(new Segment(word.substring(last), false));
        }
        return segments;
    }
}

package pl.marcinmilkowski.subword_bpe.codes;

import java.util.ArrayList;
import java.util.List;

/**
 * End-of-word conventions of a merge table.
 *
 * <ul>
 *   <li>0.1: the end-of-word marker is a separate trailing symbol ({@code l o w </w>})</li>
 *   <li>0.2: the marker is fused onto the last character ({@code l o w</w>})</li>
 * </ul>
 *
 * Learning and encoding must use the same convention.
 */
public enum BpeVersion {

    V0_1(0, 1),
    V0_2(0, 2);

    public static final String END_OF_WORD = "</w>";

    private final int major;
    private final int minor;

    BpeVersion(int major, int minor) {
        this.major = major;
        this.minor = minor;
    }

    public int major() {
        return major;
    }

    public int minor() {
        return minor;
    }

    /**
     * Parses "MAJOR.MINOR".
     *
     * @throws IllegalArgumentException for anything other than 0.1 or 0.2
     */
    public static BpeVersion parse(String text) {
        String[] parts = text.trim().split("\\.");
        if (parts.length == 2) {
            try {
                int major = Integer.parseInt(parts[0]);
                int minor = Integer.parseInt(parts[1]);
                for (BpeVersion version : values()) {
                    if (version.major == major && version.minor == minor) {
                        return version;
                    }
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed BPE version: " + text, e);
            }
        }
        throw new IllegalArgumentException("Unsupported BPE version: " + text);
    }

    /**
     * Splits a word into its initial symbols: one per code point, with the
     * end-of-word marker attached the way this version prescribes.
     * An empty word yields an empty list.
     */
    public List<String> initialSymbols(String word) {
        List<String> symbols = new ArrayList<>(word.length() + 1);
        word.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        if (symbols.isEmpty()) {
            return symbols;
        }
        if (this == V0_1) {
            symbols.add(END_OF_WORD);
        } else {
            int last = symbols.size() - 1;
            symbols.set(last, symbols.get(last) + END_OF_WORD);
        }
        return symbols;
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}

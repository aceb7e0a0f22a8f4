package pl.marcinmilkowski.subword_bpe.learn;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns compact integer IDs to symbols during learning.
 *
 * IDs are stable for the lifetime of one learning run. Two pair IDs are packed
 * into a single long key, see {@link #pairKey(int, int)}.
 */
public final class SymbolTable {

    private final Map<String, Integer> symbolToId = new HashMap<>();
    private final List<String> idToSymbol = new ArrayList<>();

    /**
     * Returns the ID for the symbol, assigning a new one if necessary.
     */
    public int intern(String symbol) {
        Integer existing = symbolToId.get(symbol);
        if (existing != null) {
            return existing;
        }
        int id = idToSymbol.size();
        symbolToId.put(symbol, id);
        idToSymbol.add(symbol);
        return id;
    }

    /**
     * Returns the ID of a known symbol, or -1.
     */
    public int idOf(String symbol) {
        Integer id = symbolToId.get(symbol);
        return id != null ? id : -1;
    }

    public String symbol(int id) {
        return idToSymbol.get(id);
    }

    public int size() {
        return idToSymbol.size();
    }

    public int[] internAll(List<String> symbols) {
        int[] ids = new int[symbols.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = intern(symbols.get(i));
        }
        return ids;
    }

    public static long pairKey(int first, int second) {
        return ((long) first << 32) | (second & 0xFFFFFFFFL);
    }

    public static int first(long pairKey) {
        return (int) (pairKey >>> 32);
    }

    public static int second(long pairKey) {
        return (int) pairKey;
    }
}

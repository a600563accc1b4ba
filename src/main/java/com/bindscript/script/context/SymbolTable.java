package com.bindscript.script.context;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Interning service: spelling to canonical {@link Symbol}.
 *
 * Each casing of a word interns to its own symbol, all of them pointing to the
 * lower-case canon symbol for non-strict comparison.
 */
public final class SymbolTable {

    private final Map<String, Symbol> symbols = new ConcurrentHashMap<>();

    public Symbol intern(String spelling) {
        if (spelling == null || spelling.isEmpty()) {
            throw new IllegalArgumentException("Symbol spelling must be non-empty");
        }
        Symbol existing = symbols.get(spelling);
        if (existing != null) return existing;

        String folded = spelling.toLowerCase(Locale.ROOT);
        Symbol canon = symbols.computeIfAbsent(folded, s -> {
            Symbol c = new Symbol(s);
            c.setCanon(c);
            return c;
        });
        if (folded.equals(spelling)) return canon;

        return symbols.computeIfAbsent(spelling, s -> {
            Symbol sym = new Symbol(s);
            sym.setCanon(canon);
            return sym;
        });
    }

    /** Interns a UTF-8 byte spelling. */
    public Symbol intern(byte[] utf8) {
        if (utf8 == null) throw new IllegalArgumentException("Symbol spelling must be non-empty");
        return intern(new String(utf8, StandardCharsets.UTF_8));
    }

    public Symbol lookup(String spelling) {
        return symbols.get(spelling);
    }

    public int size() {
        return symbols.size();
    }
}

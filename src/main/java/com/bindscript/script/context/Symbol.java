package com.bindscript.script.context;

/**
 * Interned identity for a name. Two symbols are the same word only if they
 * are the same instance; the non-strict comparison folds case through the
 * shared canon symbol.
 *
 * Instances are created by {@link SymbolTable} only.
 */
public final class Symbol {

    private final String spelling;
    private Symbol canon;

    Symbol(String spelling) {
        this.spelling = spelling;
    }

    void setCanon(Symbol canon) {
        this.canon = canon;
    }

    public String spelling() {
        return spelling;
    }

    /** The lower-case-folded symbol shared by every casing of this word. */
    public Symbol canon() {
        return canon;
    }

    public boolean sameAs(Symbol other, boolean strict) {
        if (other == null) return false;
        if (strict) return this == other;
        return canon == other.canon;
    }

    @Override
    public String toString() {
        return spelling;
    }
}

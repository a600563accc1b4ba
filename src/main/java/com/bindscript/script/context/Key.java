package com.bindscript.script.context;

/**
 * One entry of a {@link KeyList}: the symbol plus visibility flags. Immutable;
 * flag changes produce a new key and must go through the owning context so a
 * shared key list is unshared first.
 */
public final class Key {

    public static final int HIDDEN = 1;
    public static final int SEALED = 1 << 1;
    public static final int PROTECTED = 1 << 2;

    private final Symbol symbol;
    private final int flags;

    public Key(Symbol symbol) {
        this(symbol, 0);
    }

    public Key(Symbol symbol, int flags) {
        if (symbol == null) throw new IllegalArgumentException("Key symbol must not be null");
        this.symbol = symbol;
        this.flags = flags;
    }

    public Symbol symbol() { return symbol; }

    public int flags() { return flags; }

    public boolean has(int flag) { return (flags & flag) != 0; }

    public boolean isHidden() { return has(HIDDEN); }

    public boolean isSealed() { return has(SEALED); }

    public boolean isProtected() { return has(PROTECTED); }

    public Key with(int flag, boolean on) {
        int f = on ? (flags | flag) : (flags & ~flag);
        return (f == flags) ? this : new Key(symbol, f);
    }

    @Override
    public String toString() {
        return symbol.spelling();
    }
}

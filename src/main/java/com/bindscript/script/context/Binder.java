package com.bindscript.script.context;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scoped symbol to index map used while collecting or binding words.
 *
 * One binder per pass. Always open it in a try-with-resources block: the
 * entries must be gone on every exit path, including errors and thrown
 * signals. Negative indices are legal and are used as "selected, but not
 * located yet" marks.
 */
public final class Binder implements AutoCloseable {

    private final Map<Symbol, Integer> indices = new IdentityHashMap<>();

    // insertion order, so nested users can unwind to a mark
    private final List<Symbol> order = new ArrayList<>();

    private boolean closed;

    public boolean tryAdd(Symbol symbol, int index) {
        ensureOpen();
        if (index == 0) throw new IllegalArgumentException("Binder index 0 means 'absent'");
        if (indices.containsKey(symbol)) return false;
        indices.put(symbol, index);
        order.add(symbol);
        return true;
    }

    public void add(Symbol symbol, int index) {
        if (!tryAdd(symbol, index)) {
            throw new IllegalStateException("Symbol already in binder: " + symbol);
        }
    }

    /** Index for the symbol, or 0 if not present. */
    public int get(Symbol symbol) {
        Integer i = indices.get(symbol);
        return (i == null) ? 0 : i;
    }

    public int remove(Symbol symbol) {
        int i = removeElse0(symbol);
        if (i == 0) throw new IllegalStateException("Symbol not in binder: " + symbol);
        return i;
    }

    public int removeElse0(Symbol symbol) {
        ensureOpen();
        Integer i = indices.remove(symbol);
        if (i == null) return 0;
        order.remove(symbol);
        return i;
    }

    public int size() {
        return indices.size();
    }

    public int mark() {
        return order.size();
    }

    /** Drops every entry added after {@code mark}. */
    public void unwindTo(int mark) {
        ensureOpen();
        while (order.size() > mark) {
            Symbol s = order.remove(order.size() - 1);
            indices.remove(s);
        }
    }

    @Override
    public void close() {
        indices.clear();
        order.clear();
        closed = true;
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Binder used after close()");
    }
}

package com.bindscript.script.path;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import com.bindscript.script.context.Symbol;
import com.bindscript.script.runtime.Slot;
import com.bindscript.script.runtime.Value;

/**
 * Stack-local state of one path walk.
 */
public final class PathState {

    private final Value setValue;
    private final int flags;

    private Value out = Value.nulled();
    private Slot ref;
    private Symbol label;
    private int peeled; // quote levels removed during the current step

    // most recent first
    private final Deque<Symbol> marks = new ArrayDeque<>();

    PathState(Value setValue, int flags) {
        this.setValue = setValue;
        this.flags = flags;
    }

    /** The accumulated value. */
    public Value out() { return out; }

    public void setOut(Value v) { this.out = (v == null) ? Value.nulled() : v; }

    /** Writable location {@link #out()} was read from; null for temporaries. */
    public Slot ref() { return ref; }

    void setRef(Slot ref) { this.ref = ref; }

    /** Drops one quote level from {@link #out()}; restored on deferred write-back. */
    public void peelQuote() {
        this.out = out.asQuoted();
        peeled++;
    }

    int takePeeled() {
        int n = peeled;
        peeled = 0;
        return n;
    }

    public boolean isSet() { return setValue != null; }

    Value setValue() { return setValue; }

    public int flags() { return flags; }

    public Symbol label() { return label; }

    void setLabel(Symbol label) { this.label = label; }

    public void pushRefinement(Symbol name) {
        marks.push(name);
    }

    public boolean hasRefinements() {
        return !marks.isEmpty();
    }

    /** Marks in the order they were applied. */
    List<Symbol> refinementsInOrder() {
        List<Symbol> list = new ArrayList<>(marks.size());
        Iterator<Symbol> it = marks.descendingIterator();
        while (it.hasNext()) list.add(it.next());
        return list;
    }
}

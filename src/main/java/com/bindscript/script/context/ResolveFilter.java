package com.bindscript.script.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Which target keys {@link Contexts#resolve} copies values for. */
public final class ResolveFilter {

    private static final ResolveFilter ALL = new ResolveFilter(0, null);

    private final int cut;
    private final List<Symbol> only;

    private ResolveFilter(int cut, List<Symbol> only) {
        this.cut = cut;
        this.only = only;
    }

    /** Every target key. */
    public static ResolveFilter all() {
        return ALL;
    }

    /** Target keys from 1-based position {@code cut} onward; 0 is treated as 1. */
    public static ResolveFilter from(int cut) {
        if (cut < 0) throw new IllegalArgumentException("Negative cut position: " + cut);
        return new ResolveFilter(Math.max(cut, 1), null);
    }

    /** Only the named keys. */
    public static ResolveFilter only(List<Symbol> symbols) {
        return new ResolveFilter(0, Collections.unmodifiableList(new ArrayList<>(symbols)));
    }

    public static ResolveFilter only(Symbol... symbols) {
        return only(List.of(symbols));
    }

    public boolean isAll() { return cut == 0 && only == null; }

    public boolean isCut() { return cut != 0; }

    public boolean isOnly() { return only != null; }

    public int cut() { return cut; }

    public List<Symbol> symbols() { return only; }
}

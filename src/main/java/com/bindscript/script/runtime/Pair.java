package com.bindscript.script.runtime;

/**
 * Immutable x/y pair. It has no addressable components, so writing
 * {@code p/x} produces a new pair that path dispatch writes back to wherever
 * {@code p} came from.
 */
public final class Pair {

    public final Value x;
    public final Value y;

    public Pair(Value x, Value y) {
        this.x = x;
        this.y = y;
    }

    public Pair withX(Value nx) { return new Pair(nx, y); }

    public Pair withY(Value ny) { return new Pair(x, ny); }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Pair)) return false;
        Pair p = (Pair) o;
        return x.equals(p.x) && y.equals(p.y);
    }

    @Override
    public int hashCode() {
        return 31 * x.hashCode() + y.hashCode();
    }

    @Override
    public String toString() {
        return x + "x" + y;
    }
}

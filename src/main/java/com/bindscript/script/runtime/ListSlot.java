package com.bindscript.script.runtime;

import java.util.List;

/** Slot addressing one element of a mutable list (0-based). */
public final class ListSlot implements Slot {

    private final List<Value> list;
    private final int index;

    public ListSlot(List<Value> list, int index) {
        this.list = list;
        this.index = index;
    }

    @Override
    public Value get() {
        return list.get(index);
    }

    @Override
    public void set(Value value) {
        list.set(index, value == null ? Value.nulled() : value);
    }

    @Override
    public String toString() {
        return "#" + (index + 1);
    }
}

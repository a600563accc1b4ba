package com.bindscript.script.context;

import java.util.ArrayList;
import java.util.List;

import com.bindscript.script.runtime.Value;

/**
 * Value slots of exactly one context. Slot 0 holds the root value naming the
 * context's kind and identity; slot n holds the variable for key n.
 */
public final class VarList {

    private final ArrayList<Value> slots;

    VarList(int capacity) {
        this.slots = new ArrayList<>(capacity + 1);
    }

    public int length() {
        return slots.size();
    }

    public Value get(int n) {
        return slots.get(n);
    }

    void set(int n, Value v) {
        slots.set(n, v);
    }

    void append(Value v) {
        slots.add(v);
    }

    void reserve(int extra) {
        slots.ensureCapacity(slots.size() + extra);
    }

    /** Live view of slots 1..n, writable for deep rebinding. */
    List<Value> variables() {
        return slots.subList(1, slots.size());
    }
}

package com.bindscript.script.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered keys of one or more contexts.
 *
 * A key list is either unique to one context or shared by several; a shared
 * list is never mutated, growth goes through a private copy (see
 * {@link Contexts#expandKeylist}). The ancestor link only answers "was this
 * derived from that" and is never used for storage.
 */
public final class KeyList {

    private final ArrayList<Key> keys;
    private KeyList ancestor;
    private boolean shared;

    KeyList(int capacity) {
        this.keys = new ArrayList<>(Math.max(capacity, 0));
        this.ancestor = this;
    }

    /** Keys are taken as given, flags included. */
    KeyList(List<Key> collected) {
        this(collected.size());
        keys.addAll(collected);
    }

    public int size() {
        return keys.size();
    }

    /** 1-based, matching variable slot numbering. */
    public Key key(int n) {
        return keys.get(n - 1);
    }

    public List<Key> keys() {
        return Collections.unmodifiableList(keys);
    }

    public boolean isShared() {
        return shared;
    }

    void markShared() {
        this.shared = true;
    }

    public KeyList ancestor() {
        return ancestor;
    }

    void setAncestor(KeyList ancestor) {
        this.ancestor = (ancestor == null) ? this : ancestor;
    }

    /** O(1) derivation check. */
    public boolean isDerivedFrom(KeyList other) {
        return other != null && (this == other || ancestor == other);
    }

    void add(Key key) {
        if (shared) throw new IllegalStateException("Shared key list mutated in place");
        keys.add(key);
    }

    void set(int n, Key key) {
        if (shared) throw new IllegalStateException("Shared key list mutated in place");
        keys.set(n - 1, key);
    }

    void reserve(int extra) {
        keys.ensureCapacity(keys.size() + extra);
    }

    /**
     * Unique copy with room for {@code extra} more keys. A self-ancestor maps to
     * the copy itself, otherwise the ancestor is carried over.
     */
    KeyList copyWithExtra(int extra) {
        KeyList copy = new KeyList(keys.size() + extra);
        copy.keys.addAll(keys);
        copy.ancestor = (ancestor == this) ? copy : ancestor;
        return copy;
    }

    @Override
    public String toString() {
        return keys.toString();
    }
}

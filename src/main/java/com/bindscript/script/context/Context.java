package com.bindscript.script.context;

import java.util.List;

import com.bindscript.script.errors.ReadOnlyException;
import com.bindscript.script.runtime.Slot;
import com.bindscript.script.runtime.Value;

/**
 * A named-variable collection: a {@link KeyList} paired with a {@link VarList}.
 *
 * The var list always holds one more slot than there are keys (the root slot).
 * The key list may be swapped for a private copy by any growing operation, so
 * never hold on to {@link #keyList()} across a call that may append.
 */
public final class Context {

    private final Value.Type kind;
    private final VarList varlist;
    private KeyList keylist;

    private boolean readOnly;
    private boolean phased;
    private boolean spent;

    Context(Value.Type kind, KeyList keylist, int capacity) {
        if (!Value.isContextType(kind)) {
            throw new IllegalArgumentException("Not a context kind: " + kind);
        }
        this.kind = kind;
        this.keylist = keylist;
        this.varlist = new VarList(capacity);
        this.varlist.append(new Value(kind, this));
    }

    public Value.Type kind() {
        return kind;
    }

    public KeyList keyList() {
        return keylist;
    }

    void setKeyList(KeyList keylist) {
        this.keylist = keylist;
    }

    VarList varList() {
        return varlist;
    }

    /** Number of variables (keys), not counting the root slot. */
    public int length() {
        return keylist.size();
    }

    public Key key(int n) {
        return keylist.key(n);
    }

    public Symbol symbol(int n) {
        return keylist.key(n).symbol();
    }

    /** The root value: this context seen as a value of its kind. */
    public Value archetype() {
        return varlist.get(0);
    }

    public Value get(int n) {
        checkIndex(n);
        return varlist.get(n);
    }

    /** User-facing write: refuses read-only contexts and protected keys. */
    public void put(int n, Value value) {
        checkIndex(n);
        ensureMutable();
        if (keylist.key(n).isProtected()) {
            throw new ReadOnlyException("variable '" + keylist.key(n).symbol() + "'");
        }
        varlist.set(n, value == null ? Value.nulled() : value);
    }

    /** Raw write used by context construction; no protection checks. */
    void init(int n, Value value) {
        varlist.set(n, value == null ? Value.nulled() : value);
    }

    public Slot slot(int n) {
        checkIndex(n);
        return new VarSlot(this, n);
    }

    List<Value> variables() {
        return varlist.variables();
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public Context freeze() {
        this.readOnly = true;
        return this;
    }

    public void ensureMutable() {
        if (readOnly) throw new ReadOnlyException(describe());
    }

    /** Phased (internal) view: hidden and sealed keys are visible. */
    public boolean isPhased() {
        return phased;
    }

    public void setPhased(boolean phased) {
        this.phased = phased;
    }

    /** A FRAME whose invocation has returned. */
    public boolean isSpent() {
        return spent;
    }

    public void markSpent() {
        this.spent = true;
    }

    /**
     * Changes a key flag. The key list is unshared first so other contexts
     * keep seeing the old flags.
     */
    public void setKeyFlag(int n, int flag, boolean on) {
        checkIndex(n);
        Contexts.expandKeylist(this, 0);
        keylist.set(n, keylist.key(n).with(flag, on));
    }

    private void checkIndex(int n) {
        if (n < 1 || n > keylist.size()) {
            throw new IndexOutOfBoundsException("Context index " + n + " outside 1.." + keylist.size());
        }
    }

    String describe() {
        return kind.name().toLowerCase(java.util.Locale.ROOT) + " " + keylist;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("make ");
        sb.append(kind.name().toLowerCase(java.util.Locale.ROOT)).append(" [");
        for (int n = 1; n <= keylist.size(); n++) {
            if (n > 1) sb.append(' ');
            Value v = varlist.get(n);
            sb.append(keylist.key(n).symbol()).append(": ");
            // avoid recursing through self references
            sb.append(v.isContext() ? "make " + v.type.name().toLowerCase(java.util.Locale.ROOT) + " [...]" : v.toString());
        }
        return sb.append(']').toString();
    }

    private static final class VarSlot implements Slot {
        private final Context context;
        private final int index;

        VarSlot(Context context, int index) {
            this.context = context;
            this.index = index;
        }

        @Override
        public Value get() {
            return context.get(index);
        }

        @Override
        public void set(Value value) {
            context.put(index, value);
        }

        @Override
        public String toString() {
            return context.symbol(index).spelling();
        }
    }
}

package com.bindscript.script.path;

import com.bindscript.script.runtime.Slot;
import com.bindscript.script.runtime.Value;

/** What a {@link PathHook} did with a selector. */
public final class HookResult {

    public enum Outcome {
        /** A new accumulated value with no writable location behind it. */
        VALUE,
        /** The selector means nothing for this value. */
        UNHANDLED,
        /** A writable location; the engine reads or writes through it. */
        REFERENCE,
        /** The hook rebuilt {@code out}; it must be written back where it came from. */
        DEFERRED,
        /** {@code out} was replaced; run the same selector again. */
        REDO,
        /** The write already happened inside the hook. */
        APPLIED,
        /** Abort the walk with the carried exception. */
        THROWN
    }

    private static final HookResult UNHANDLED = new HookResult(Outcome.UNHANDLED, null, null, null);
    private static final HookResult DEFERRED = new HookResult(Outcome.DEFERRED, null, null, null);
    private static final HookResult REDO = new HookResult(Outcome.REDO, null, null, null);
    private static final HookResult APPLIED = new HookResult(Outcome.APPLIED, null, null, null);

    private final Outcome outcome;
    private final Value value;
    private final Slot slot;
    private final RuntimeException error;

    private HookResult(Outcome outcome, Value value, Slot slot, RuntimeException error) {
        this.outcome = outcome;
        this.value = value;
        this.slot = slot;
        this.error = error;
    }

    public static HookResult value(Value v) {
        return new HookResult(Outcome.VALUE, v == null ? Value.nulled() : v, null, null);
    }

    public static HookResult unhandled() { return UNHANDLED; }

    public static HookResult reference(Slot slot) {
        if (slot == null) throw new IllegalArgumentException("reference result needs a slot");
        return new HookResult(Outcome.REFERENCE, null, slot, null);
    }

    public static HookResult deferred() { return DEFERRED; }

    public static HookResult redo() { return REDO; }

    public static HookResult applied() { return APPLIED; }

    public static HookResult thrown(RuntimeException error) {
        if (error == null) throw new IllegalArgumentException("thrown result needs an exception");
        return new HookResult(Outcome.THROWN, null, null, error);
    }

    public Outcome outcome() { return outcome; }

    public Value value() { return value; }

    public Slot slot() { return slot; }

    public RuntimeException error() { return error; }

    @Override
    public String toString() {
        return outcome.name();
    }
}

package com.bindscript.script.runtime;

import com.bindscript.script.context.Symbol;

/**
 * Non-error early exit ({@code throw}, {@code return}, loop breaks). Carries
 * no stack trace and is never wrapped: every layer lets it pass untouched.
 */
public final class ThrowSignal extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient Value value;
    private final transient Symbol name;

    public ThrowSignal(Value value, Symbol name) {
        super(null, null, false, false);
        this.value = (value == null) ? Value.nulled() : value;
        this.name = name;
    }

    public Value value() { return value; }

    /** Optional name given with {@code throw/name}; null for anonymous throws. */
    public Symbol name() { return name; }

    @Override
    public String getMessage() {
        return "throw " + value + (name == null ? "" : " /name " + name);
    }
}

package com.bindscript.script.runtime;

import com.bindscript.script.context.Context;
import com.bindscript.script.context.Contexts;
import com.bindscript.script.context.Symbol;
import com.bindscript.script.errors.NotFoundException;

/**
 * Payload of the word kinds (WORD, SET_WORD, GET_WORD, REFINEMENT).
 *
 * The binding is mutable: binding a word, appending it to a context or
 * rebinding derived material updates the instance in place. Deep clones copy
 * words so that rebinding a clone leaves the original alone.
 */
public final class Word {

    private final Symbol symbol;
    private Context binding;
    private int index;

    public Word(Symbol symbol) {
        this(symbol, null, 0);
    }

    public Word(Symbol symbol, Context binding, int index) {
        if (symbol == null) throw new IllegalArgumentException("Word symbol must not be null");
        this.symbol = symbol;
        this.binding = binding;
        this.index = index;
    }

    public Symbol symbol() { return symbol; }

    public Context binding() { return binding; }

    /** Cached 1-based position in the binding; 0 when unknown. */
    public int index() { return index; }

    public boolean isBound() { return binding != null; }

    public void bind(Context context, int index) {
        this.binding = context;
        this.index = index;
    }

    public void unbind() {
        this.binding = null;
        this.index = 0;
    }

    public Word copy() {
        return new Word(symbol, binding, index);
    }

    /**
     * Slot of the variable this word refers to. A stale cached index is
     * recomputed from the binding's keys.
     */
    public Slot lookup() {
        if (binding == null) {
            throw new NotFoundException("'" + symbol + "' word is not bound to a context");
        }
        Contexts.ensureAccessible(binding);
        if (index < 1 || index > binding.length() || !binding.symbol(index).sameAs(symbol, false)) {
            int n = Contexts.findSymbol(binding, symbol, false);
            if (n == 0) {
                throw new NotFoundException("'" + symbol + "' is not in its bound context");
            }
            index = n;
        }
        return binding.slot(index);
    }

    @Override
    public String toString() {
        return symbol.spelling();
    }
}

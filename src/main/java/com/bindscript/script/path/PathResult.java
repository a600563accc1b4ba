package com.bindscript.script.path;

import java.util.Collections;
import java.util.List;

import com.bindscript.script.context.Symbol;
import com.bindscript.script.runtime.Value;

/** Outcome of a full path walk. */
public final class PathResult {

    private final Value value;
    private final List<Symbol> refinements;
    private final Symbol label;

    PathResult(Value value, List<Symbol> refinements, Symbol label) {
        this.value = value;
        this.refinements = Collections.unmodifiableList(refinements);
        this.label = label;
    }

    public Value value() { return value; }

    /**
     * Raw refinement marks in first-applied order; empty unless
     * {@link PathFlags#PUSH_REFINEMENTS} was given.
     */
    public List<Symbol> refinements() { return refinements; }

    /** Word an action result was fetched through, or null. */
    public Symbol label() { return label; }
}

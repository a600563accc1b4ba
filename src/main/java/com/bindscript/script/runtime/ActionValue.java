package com.bindscript.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.bindscript.script.context.Context;
import com.bindscript.script.context.Contexts;
import com.bindscript.script.context.Symbol;
import com.bindscript.script.errors.BadSelectorException;
import com.bindscript.script.errors.BindScriptException;

/**
 * A callable. Parameters are either positional arguments or argument-less
 * refinements (named options). Specializing with refinements fixes them as
 * "in use" for every later invocation; the instance itself is immutable, every
 * change yields a copy.
 */
public final class ActionValue {

    /** Native implementation, handed the call frame holding the arguments. */
    @FunctionalInterface
    public interface Body {
        Value invoke(Context frame, Evaluator evaluator);
    }

    public static final class Param {
        public final Symbol name;
        public final boolean refinement;

        public Param(Symbol name, boolean refinement) {
            this.name = name;
            this.refinement = refinement;
        }

        @Override
        public String toString() {
            return refinement ? "/" + name : name.spelling();
        }
    }

    private final List<Param> params;
    private final Body body;
    private final Symbol label;
    private final List<Symbol> specialized;
    private final Context binding;

    public ActionValue(List<Param> params, Body body) {
        this(params, body, null, Collections.emptyList(), null);
    }

    private ActionValue(List<Param> params, Body body, Symbol label, List<Symbol> specialized, Context binding) {
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.body = body;
        this.label = label;
        this.specialized = Collections.unmodifiableList(new ArrayList<>(specialized));
        this.binding = binding;
    }

    public List<Param> params() { return params; }

    public Body body() { return body; }

    /** Name the action was last fetched through, for error messages; may be null. */
    public Symbol label() { return label; }

    /** Refinements fixed in use by specialization, first-applied order. */
    public List<Symbol> specialized() { return specialized; }

    /** Context the body's code belongs to; may be null. */
    public Context binding() { return binding; }

    public ActionValue withLabel(Symbol newLabel) {
        return new ActionValue(params, body, newLabel, specialized, binding);
    }

    public ActionValue withBinding(Context newBinding) {
        return new ActionValue(params, body, label, specialized, newBinding);
    }

    /** Number of positional arguments consumed at a call site. */
    public int arity() {
        int n = 0;
        for (Param p : params) if (!p.refinement) n++;
        return n;
    }

    public Param findRefinement(Symbol name) {
        for (Param p : params) {
            if (p.refinement && p.name.sameAs(name, false)) return p;
        }
        return null;
    }

    /**
     * Partial specialization: the given refinements (first-applied order) are
     * fixed in use.
     */
    public ActionValue refine(List<Symbol> refinements) {
        List<Symbol> all = new ArrayList<>(specialized);
        for (Symbol r : refinements) {
            Param p = findRefinement(r);
            if (p == null) {
                throw new BadSelectorException("/" + r, describe() + " has no refinement /" + r);
            }
            boolean dup = false;
            for (Symbol s : all) if (s.sameAs(p.name, false)) dup = true;
            if (dup) {
                throw new BadSelectorException("/" + r, "Refinement /" + r + " used more than once with " + describe());
            }
            all.add(p.name);
        }
        return new ActionValue(params, body, label, all, binding);
    }

    /**
     * Binds arguments into a fresh FRAME context: one variable per parameter in
     * declaration order, refinements set to {@code true} when in use and null
     * otherwise.
     */
    public Context makeFrame(List<Value> args, List<Symbol> refinements) {
        if (args.size() != arity()) {
            throw new BindScriptException(describe() + " expects " + arity() + " arguments, got " + args.size());
        }
        List<Symbol> inUse = new ArrayList<>(specialized);
        if (refinements != null) {
            for (Symbol r : refinements) {
                Param p = findRefinement(r);
                if (p == null) {
                    throw new BadSelectorException("/" + r, describe() + " has no refinement /" + r);
                }
                inUse.add(p.name);
            }
        }

        Context frame = Contexts.allocate(Value.Type.FRAME, params.size());
        int argIndex = 0;
        for (Param p : params) {
            int n = Contexts.append(frame, p.name);
            if (p.refinement) {
                boolean used = false;
                for (Symbol s : inUse) if (s.sameAs(p.name, false)) used = true;
                frame.put(n, used ? Value.logic(true) : Value.nulled());
            } else {
                frame.put(n, args.get(argIndex++));
            }
        }
        return frame;
    }

    private String describe() {
        return (label == null) ? "action" : label.spelling();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("#[action! ");
        if (label != null) sb.append(label).append(' ');
        sb.append(params);
        for (Symbol s : specialized) sb.append(" /").append(s);
        return sb.append(']').toString();
    }
}

package com.bindscript.script.path;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.bindscript.script.context.Symbol;
import com.bindscript.script.errors.BadSelectorException;
import com.bindscript.script.errors.BadWriteException;
import com.bindscript.script.errors.NotFoundException;
import com.bindscript.script.errors.PathPolicyException;
import com.bindscript.script.runtime.Evaluator;
import com.bindscript.script.runtime.Slot;
import com.bindscript.script.runtime.Value;

/**
 * Walks selector chains (paths) through contexts and other containers.
 *
 * The first element seeds the walk, each later element is one step handed to
 * the hook registered for the type of the value accumulated so far. A GET walk
 * returns the last value; a SET walk writes through the location the last step
 * reports, or writes a rebuilt immutable value back to where it was read from.
 *
 * Walk state lives on the Java stack, so an exception or {@code ThrowSignal}
 * out of a group selector or a hook leaves nothing behind.
 */
public final class PathDispatcher {

    private final HookRegistry hooks;
    private final Evaluator evaluator;

    public PathDispatcher(HookRegistry hooks, Evaluator evaluator) {
        this.hooks = hooks;
        this.evaluator = evaluator;
    }

    public HookRegistry hooks() {
        return hooks;
    }

    // -------------------------
    // Entry points
    // -------------------------

    public Value get(List<Value> path) {
        return evaluate(path, null, PathFlags.NONE).value();
    }

    /** GET from {@code root} through {@code selectors}. A word root is looked up like any path head. */
    public Value get(Value root, Value... selectors) {
        return evaluate(rooted(root, List.of(selectors)), null, PathFlags.NONE).value();
    }

    public Value set(List<Value> path, Value value) {
        return evaluate(path, value, PathFlags.NONE).value();
    }

    public Value set(Value root, List<Value> selectors, Value value) {
        return evaluate(rooted(root, selectors), value, PathFlags.NONE).value();
    }

    /**
     * Full walk.
     *
     * @param setValue null for GET; otherwise the value to store
     */
    public PathResult evaluate(List<Value> path, Value setValue, int flags) {
        if (path == null || path.isEmpty()) {
            throw new BadSelectorException("", "Empty path");
        }

        PathState state = new PathState(setValue, flags);

        int i = 0;
        while (i < path.size() && path.get(i).isBlank()) i++;
        if (i == path.size()) {
            throw new BadSelectorException(describe(path), "Path has no selectors: " + describe(path));
        }

        seed(state, path.get(i));
        i++;

        if (i == path.size()) {
            if (setValue != null) {
                Slot ref = state.ref();
                if (ref == null) {
                    throw new BadWriteException("Cannot set " + describe(path) + ": not a variable");
                }
                ref.set(setValue);
                return new PathResult(setValue, Collections.emptyList(), state.label());
            }
            return finish(state, path);
        }

        for (; i < path.size(); i++) {
            Value selector = path.get(i);
            if (state.out().isNull()) {
                throw new NotFoundException("'" + describe(path) + "' has no value before " + selector);
            }

            boolean last = (i == path.size() - 1);
            Value picker = concretize(selector, flags);
            step(state, picker, (last && setValue != null) ? setValue : null, selector);
        }

        if (setValue != null) {
            return new PathResult(setValue, Collections.emptyList(), state.label());
        }
        return finish(state, path);
    }

    /** One GET step on {@code location}. */
    public Value pick(Value location, Value picker) {
        PathState state = new PathState(null, PathFlags.NONE);
        state.setOut(location);

        while (true) {
            HookResult r = hooks.hookFor(state.out()).handle(state, picker, null);
            switch (r.outcome()) {
                case VALUE:
                    return r.value();
                case REFERENCE:
                    return r.slot().get();
                case REDO:
                    continue;
                case UNHANDLED:
                    throw unhandled(picker, false);
                case THROWN:
                    throw r.error();
                default:
                    throw new IllegalStateException("Hook returned " + r + " for a read");
            }
        }
    }

    /** One SET step on {@code location}. Returns {@code value}. */
    public Value poke(Value location, Value picker, Value value) {
        PathState state = new PathState(value, PathFlags.NONE);
        state.setOut(location);

        while (true) {
            HookResult r = hooks.hookFor(state.out()).handle(state, picker, value);
            switch (r.outcome()) {
                case REFERENCE:
                    r.slot().set(value);
                    return value;
                case APPLIED:
                    return value;
                case DEFERRED:
                    throw new BadWriteException("Cannot poke " + picker + " into an immutable "
                            + location.getType() + "; use a set-path");
                case VALUE:
                    throw new BadWriteException("Cannot poke " + picker + ": selection produced a temporary value");
                case REDO:
                    continue;
                case UNHANDLED:
                    throw unhandled(picker, true);
                case THROWN:
                    throw r.error();
                default:
                    throw new IllegalStateException("Unexpected hook result " + r);
            }
        }
    }

    // -------------------------
    // Walk
    // -------------------------

    private void seed(PathState state, Value head) {
        switch (head.getType()) {
            case WORD: {
                Slot slot = head.asWord().lookup();
                state.setRef(slot);
                state.setOut(slot.get());
                labelAction(state, head);
                return;
            }

            case GET_WORD: {
                Value target = head.asWord().lookup().get();
                if (!target.isWord()) {
                    throw new BadSelectorException(head.toString(),
                            "Indirect path head " + head + " must hold a word, got " + target.getType());
                }
                Slot slot = target.asWord().lookup();
                state.setRef(slot);
                state.setOut(slot.get());
                labelAction(state, target);
                return;
            }

            case GROUP:
                state.setRef(null);
                state.setOut(requireEvaluator().evaluate(head.asList()));
                return;

            default:
                state.setRef(null);
                state.setOut(head);
        }
    }

    private Value concretize(Value selector, int flags) {
        switch (selector.getType()) {
            case GET_WORD:
                return selector.asWord().lookup().get();

            case GROUP:
                if (PathFlags.has(flags, PathFlags.NO_PATH_GROUPS)) {
                    throw new BadSelectorException(selector.toString(), "Group selectors are not allowed here: " + selector);
                }
                if (PathFlags.has(flags, PathFlags.HARD_QUOTE)) return selector;
                return requireEvaluator().evaluate(selector.asList());

            default:
                return selector;
        }
    }

    private void step(PathState state, Value picker, Value setValue, Value selector) {
        // location the current value was read from, target of deferred writes
        Slot prior = state.ref();
        state.takePeeled();

        while (true) {
            HookResult r = hooks.hookFor(state.out()).handle(state, picker, setValue);

            switch (r.outcome()) {
                case VALUE:
                    if (setValue != null) {
                        throw new BadWriteException("Cannot set " + selector + ": path evaluation produced temporary value");
                    }
                    state.setRef(null);
                    state.setOut(r.value());
                    labelAction(state, picker);
                    return;

                case REFERENCE:
                    state.setRef(r.slot());
                    if (setValue != null) {
                        r.slot().set(setValue);
                        state.setOut(setValue);
                    } else {
                        state.setOut(r.slot().get());
                        labelAction(state, picker);
                    }
                    return;

                case DEFERRED:
                    if (prior == null) {
                        throw new BadWriteException("Cannot set " + selector + " in a " + state.out().getType()
                                + " that is not stored anywhere");
                    }
                    Value stored = state.out();
                    for (int q = state.takePeeled(); q > 0; q--) stored = Value.quoted(stored);
                    prior.set(stored);
                    state.setOut(stored);
                    state.setRef(prior);
                    return;

                case REDO:
                    continue;

                case APPLIED:
                    if (setValue == null) {
                        throw new IllegalStateException("Hook applied a write during a read of " + selector);
                    }
                    state.setRef(null);
                    state.setOut(setValue);
                    return;

                case UNHANDLED:
                    throw unhandled(picker, setValue != null);

                case THROWN:
                    throw r.error();

                default:
                    throw new IllegalStateException("Unexpected hook result " + r);
            }
        }
    }

    private PathResult finish(PathState state, List<Value> path) {
        Value out = state.out();
        List<Symbol> raw = Collections.emptyList();

        if (state.hasRefinements()) {
            List<Symbol> marks = state.refinementsInOrder();
            if (PathFlags.has(state.flags(), PathFlags.PUSH_REFINEMENTS)) {
                raw = marks;
            } else {
                out = Value.action(out.asAction().refine(marks));
            }
        }

        if (PathFlags.has(state.flags(), PathFlags.FORBID_ACTIVATION) && out.isAction()) {
            throw new PathPolicyException("'" + describe(path) + "' is an action; dotted access cannot run it");
        }
        if (PathFlags.has(state.flags(), PathFlags.REQUIRE_ACTIVATION) && !out.isAction()) {
            throw new PathPolicyException("'" + describe(path) + "' is not an action, got " + out.getType());
        }

        return new PathResult(out, raw, state.label());
    }

    // Keeps the fetching word's name on an action, for error messages and call traces.
    private static void labelAction(PathState state, Value picker) {
        Value out = state.out();
        if (!out.isAction() || picker.getType() != Value.Type.WORD || state.label() != null) return;

        Symbol name = picker.asSymbol();
        state.setLabel(name);
        state.setOut(Value.action(out.asAction().withLabel(name)));
    }

    private Evaluator requireEvaluator() {
        if (evaluator == null) {
            throw new IllegalStateException("Group selectors need an evaluator");
        }
        return evaluator;
    }

    private static BadSelectorException unhandled(Value picker, boolean write) {
        if (picker.isNull()) {
            return new BadSelectorException("null", "Path selector evaluated to null");
        }
        return write ? BadSelectorException.poke(picker.toString()) : BadSelectorException.pick(picker.toString());
    }

    private static List<Value> rooted(Value root, List<Value> selectors) {
        List<Value> path = new ArrayList<>(selectors.size() + 1);
        path.add(root);
        path.addAll(selectors);
        return path;
    }

    private static String describe(List<Value> path) {
        return Value.path(path).toString();
    }
}

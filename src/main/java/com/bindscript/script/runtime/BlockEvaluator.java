package com.bindscript.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.bindscript.debug.Debug;
import com.bindscript.script.context.Context;
import com.bindscript.script.context.Symbol;
import com.bindscript.script.errors.BindScriptException;
import com.bindscript.script.errors.NotFoundException;
import com.bindscript.script.path.HookRegistry;
import com.bindscript.script.path.PathDispatcher;
import com.bindscript.script.path.PathFlags;
import com.bindscript.script.path.PathResult;

/**
 * Minimal left-to-right evaluator over value blocks.
 *
 * Words fetch their variable (running it when it holds an action, with as many
 * following expressions as the action takes), set-words assign, groups nest,
 * paths go through the {@link PathDispatcher}. Everything else is a literal.
 */
public final class BlockEvaluator implements Evaluator {

    private static final String TAG = "bindscript.eval";

    private final PathDispatcher paths;
    private final int pathFlags;

    private int maxDepth = 64;
    private int depth;

    public BlockEvaluator(HookRegistry hooks) {
        this(hooks, 64, PathFlags.NONE);
    }

    public BlockEvaluator(HookRegistry hooks, int maxDepth, int pathFlags) {
        this.paths = new PathDispatcher(hooks, this);
        this.maxDepth = maxDepth;
        this.pathFlags = pathFlags;
    }

    public PathDispatcher paths() {
        return paths;
    }

    public void setMaxDepth(int depth) {
        this.maxDepth = depth;
    }

    public int depth() {
        return depth;
    }

    private static final class Cursor {
        final List<Value> code;
        int pos;

        Cursor(List<Value> code) {
            this.code = code;
        }

        boolean atEnd() {
            return pos >= code.size();
        }
    }

    @Override
    public Value evaluate(List<Value> code) {
        Cursor c = new Cursor(code);
        Value last = Value.nulled();
        while (!c.atEnd()) last = next(c);
        return last;
    }

    private Value next(Cursor c) {
        Value v = c.code.get(c.pos++);

        switch (v.getType()) {
            case WORD: {
                Value x = v.asWord().lookup().get();
                if (x.isUnset()) {
                    throw new NotFoundException("'" + v + "' has no value");
                }
                if (x.isAction()) {
                    ActionValue action = x.asAction();
                    if (action.label() == null) action = action.withLabel(v.asSymbol());
                    return apply(action, gather(c, action), Collections.emptyList());
                }
                return x;
            }

            case SET_WORD: {
                if (c.atEnd()) throw new BindScriptException("'" + v + "' needs a value");
                Value val = next(c);
                v.asWord().lookup().set(val);
                return val;
            }

            case GET_WORD:
                return v.asWord().lookup().get();

            case GROUP:
                return evaluate(v.asList());

            case PATH: {
                PathResult r = paths.evaluate(v.asList(), null, pathFlags | PathFlags.PUSH_REFINEMENTS);
                Value x = r.value();
                if (x.isAction()) {
                    return apply(x.asAction(), gather(c, x.asAction()), r.refinements());
                }
                return x;
            }

            case SET_PATH: {
                if (c.atEnd()) throw new BindScriptException("'" + v + "' needs a value");
                Value val = next(c);
                return paths.evaluate(v.asList(), val, pathFlags).value();
            }

            case QUOTED:
                return v.asQuoted();

            default:
                return v;
        }
    }

    private List<Value> gather(Cursor c, ActionValue action) {
        int n = action.arity();
        List<Value> args = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            if (c.atEnd()) {
                throw new BindScriptException((action.label() == null ? "action" : action.label().spelling())
                        + " is missing its argument " + (i + 1) + " of " + n);
            }
            args.add(next(c));
        }
        return args;
    }

    /**
     * Runs {@code action} in a fresh frame. The frame is marked spent once the
     * call returns, by any route.
     */
    @Override
    public Value apply(ActionValue action, List<Value> args, List<Symbol> refinements) {
        if (depth >= maxDepth) {
            Debug.get().w(TAG, "call depth limit " + maxDepth + " hit in " + action);
            throw new BindScriptException("Max call depth exceeded");
        }

        Context frame = action.makeFrame(args, refinements);
        depth++;
        try {
            Value result = action.body().invoke(frame, this);
            return (result == null) ? Value.nulled() : result;
        } finally {
            depth--;
            frame.markSpent();
        }
    }
}

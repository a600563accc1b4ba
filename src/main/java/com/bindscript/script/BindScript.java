package com.bindscript.script;

import java.util.ArrayList;
import java.util.List;

import com.bindscript.debug.Debug;
import com.bindscript.script.context.Binding;
import com.bindscript.script.context.Context;
import com.bindscript.script.context.Contexts;
import com.bindscript.script.context.Symbol;
import com.bindscript.script.context.SymbolTable;
import com.bindscript.script.errors.BindScriptException;
import com.bindscript.script.hooks.CoreHooks;
import com.bindscript.script.path.HookRegistry;
import com.bindscript.script.path.HookSet;
import com.bindscript.script.path.PathDispatcher;
import com.bindscript.script.path.PathFlags;
import com.bindscript.script.path.PathResult;
import com.bindscript.script.runtime.ActionValue;
import com.bindscript.script.runtime.BlockEvaluator;
import com.bindscript.script.runtime.ThrowSignal;
import com.bindscript.script.runtime.Value;

/**
 * BindScript engine.
 *
 * - Symbols interned per engine
 * - Path hooks: built-in containers, plus hook sets loaded at runtime
 * - Natives live in the {@link #lib()} module; code is bound to it before it runs
 * - Objects are made from code blocks: set-words become variables
 */
public class BindScript {

    private static final String TAG = "bindscript.engine";

    private final RuntimeConfig config;
    private final SymbolTable symbols = new SymbolTable();
    private final HookRegistry hooks;
    private final BlockEvaluator evaluator;
    private final Context lib;

    public BindScript() {
        this(RuntimeConfig.load());
    }

    public BindScript(RuntimeConfig config) {
        this.config = config;
        Debug.get().setLevel(config.debugLevel());

        this.hooks = CoreHooks.registry(config.strictLookup());
        this.evaluator = new BlockEvaluator(hooks, config.maxCallDepth(), pathFlags());
        this.lib = Contexts.allocate(Value.Type.MODULE, 16);

        registerCoreNatives();
    }

    public RuntimeConfig config() { return config; }

    public SymbolTable symbols() { return symbols; }

    public HookRegistry hooks() { return hooks; }

    public BlockEvaluator evaluator() { return evaluator; }

    public PathDispatcher paths() { return evaluator.paths(); }

    /** Module holding the natives. */
    public Context lib() { return lib; }

    public void loadHooks(HookSet set) {
        hooks.load(set);
    }

    /** Flags applied to path walks made through this engine. */
    public int pathFlags() {
        int flags = PathFlags.NONE;
        if (!config.allowPathGroups()) flags |= PathFlags.NO_PATH_GROUPS;
        return flags;
    }

    // -------------------------
    // Value helpers
    // -------------------------

    public Symbol intern(String spelling) { return symbols.intern(spelling); }

    public Value word(String s) { return Value.word(symbols.intern(s)); }

    public Value setWord(String s) { return Value.setWord(symbols.intern(s)); }

    public Value getWord(String s) { return Value.getWord(symbols.intern(s)); }

    public Value refinement(String s) { return Value.refinement(symbols.intern(s)); }

    public Value path(Value... items) { return Value.path(new ArrayList<>(List.of(items))); }

    public Value setPath(Value... items) { return Value.setPath(new ArrayList<>(List.of(items))); }

    // -------------------------
    // Natives
    // -------------------------

    /**
     * Adds a native to {@link #lib()}. Parameter names starting with {@code /}
     * are refinements.
     */
    public void registerNative(String name, List<String> params, ActionValue.Body body) {
        List<ActionValue.Param> ps = new ArrayList<>(params.size());
        for (String p : params) {
            boolean refinement = p.startsWith("/");
            ps.add(new ActionValue.Param(symbols.intern(refinement ? p.substring(1) : p), refinement));
        }

        Symbol sym = symbols.intern(name);
        ActionValue action = new ActionValue(ps, body).withLabel(sym).withBinding(lib);

        int n = Contexts.findSymbol(lib, sym, true);
        if (n == 0) n = Contexts.append(lib, sym);
        lib.put(n, Value.action(action));
    }

    private void registerCoreNatives() {
        registerNative("add", List.of("a", "b"), (frame, ev) -> arithmetic(frame.get(1), frame.get(2), false));
        registerNative("subtract", List.of("a", "b"), (frame, ev) -> arithmetic(frame.get(1), frame.get(2), true));

        registerNative("negate", List.of("n"), (frame, ev) -> {
            Value n = frame.get(1);
            if (n.getType() == Value.Type.INTEGER) return Value.integer(-n.asInteger());
            return Value.decimal(-n.asNumber());
        });

        registerNative("join", List.of("a", "b", "/spaced"), (frame, ev) -> {
            boolean spaced = frame.get(3).getType() == Value.Type.LOGIC;
            return Value.text(form(frame.get(1)) + (spaced ? " " : "") + form(frame.get(2)));
        });

        registerNative("throw", List.of("value"), (frame, ev) -> {
            throw new ThrowSignal(frame.get(1), null);
        });

        registerNative("pick", List.of("location", "picker"),
                (frame, ev) -> paths().pick(frame.get(1), frame.get(2)));

        registerNative("poke", List.of("location", "picker", "value"),
                (frame, ev) -> paths().poke(frame.get(1), frame.get(2), frame.get(3)));
    }

    private static Value arithmetic(Value a, Value b, boolean subtract) {
        if (a.getType() == Value.Type.INTEGER && b.getType() == Value.Type.INTEGER) {
            long x = a.asInteger();
            long y = b.asInteger();
            return Value.integer(subtract ? x - y : x + y);
        }
        double x = a.asNumber();
        double y = b.asNumber();
        return Value.decimal(subtract ? x - y : x + y);
    }

    private static String form(Value v) {
        return (v.getType() == Value.Type.TEXT) ? v.asText() : v.toString();
    }

    // -------------------------
    // Running code
    // -------------------------

    /** Binds {@code code} to the natives and evaluates it. */
    public Value evaluate(List<Value> code) {
        Binding.bindDeep(code, lib);
        return evaluator.evaluate(code);
    }

    /**
     * Makes an OBJECT from {@code body}: one variable per set-word (plus
     * {@code parent}'s), then runs the body inside it.
     */
    public Context makeObject(List<Value> body, Context parent) {
        Context object = Contexts.makeFromDetected(Value.Type.OBJECT, body, parent);
        Binding.bindDeep(body, lib);
        Binding.bindDeep(body, object);
        evaluator.evaluate(body);
        return object;
    }

    public Value get(Value path) {
        return walk(path, null).value();
    }

    public Value set(Value path, Value value) {
        return walk(path, value).value();
    }

    private PathResult walk(Value path, Value value) {
        if (!path.isList()) throw new IllegalArgumentException("Expected a path, got " + path.getType());
        int flags = pathFlags();
        if (config.pushRefinements()) flags |= PathFlags.PUSH_REFINEMENTS;
        return evaluator.paths().evaluate(path.asList(), value, flags);
    }

    /**
     * Runs {@code body} once per group of items in {@code series}. {@code vars}
     * is a word or a block of words; each pass assigns them the next items
     * (null past the end). The loop variables live in a context of their own,
     * so the caller's bindings are not disturbed.
     *
     * @return the value of the last pass, or null if there was none
     */
    public Value forEach(Value vars, List<Value> series, List<Value> body) {
        List<Symbol> names = new ArrayList<>();
        if (vars.isWord()) {
            names.add(vars.asSymbol());
        } else if (vars.getType() == Value.Type.BLOCK) {
            for (Value v : vars.asList()) {
                if (!v.isWord()) throw new BindScriptException("for-each variables must be words, got " + v);
                names.add(v.asSymbol());
            }
        } else {
            throw new BindScriptException("for-each needs a word or a block of words, got " + vars.getType());
        }
        if (names.isEmpty()) throw new BindScriptException("for-each needs at least one variable");

        Context loop = Contexts.allocate(Value.Type.OBJECT, names.size());
        for (Symbol s : names) Contexts.append(loop, s);

        List<Value> code = Value.block(body).cloneDeep().asList();
        Binding.bindDeep(code, lib);
        Binding.bindDeep(code, loop);

        Value last = Value.nulled();
        for (int i = 0; i < series.size(); i += names.size()) {
            for (int k = 0; k < names.size(); k++) {
                int at = i + k;
                loop.put(k + 1, at < series.size() ? series.get(at) : Value.nulled());
            }
            last = evaluator.evaluate(code);
        }
        Debug.get().t(TAG, "for-each ran " + ((series.size() + names.size() - 1) / names.size()) + " passes");
        return last;
    }
}

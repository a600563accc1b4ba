package com.bindscript.script.context;

import java.util.ArrayList;
import java.util.List;

import com.bindscript.debug.Debug;
import com.bindscript.script.errors.BadWriteException;
import com.bindscript.script.errors.BindScriptException;
import com.bindscript.script.errors.DuplicateKeyException;
import com.bindscript.script.errors.StaleFrameException;
import com.bindscript.script.runtime.Value;
import com.bindscript.script.runtime.Word;

/**
 * Construction and mutation of contexts.
 *
 * Every operation that gathers words runs its {@link Binder} in a
 * try-with-resources block, so binder entries are gone by the time any error
 * (a {@link DuplicateKeyException} included) reaches the caller.
 */
public final class Contexts {

    private static final String TAG = "bindscript.context";

    /** Collect only set-words (the default). */
    public static final int COLLECT_ONLY_SET_WORDS = 0;
    /** Collect every kind of word. */
    public static final int COLLECT_ANY_WORD = 1;
    /** Recurse into nested blocks and groups. */
    public static final int COLLECT_DEEP = 1 << 1;
    /** Fail on a repeated word instead of tolerating it. */
    public static final int COLLECT_NO_DUP = 1 << 2;

    private static volatile Visibility visibility = Visibility.DEFAULT;

    private Contexts() {}

    public static void setVisibility(Visibility v) {
        visibility = (v == null) ? Visibility.DEFAULT : v;
    }

    public static Visibility visibility() {
        return visibility;
    }

    // -------------------------
    // Allocation and growth
    // -------------------------

    /** Empty key list and a var list holding only the root slot. */
    public static Context allocate(Value.Type kind, int capacity) {
        return new Context(kind, new KeyList(capacity), capacity);
    }

    /**
     * Makes room for {@code delta} more keys. A shared key list is replaced by a
     * private copy, which is reported by returning true: any key list reference
     * the caller held is stale from then on.
     */
    public static boolean expandKeylist(Context context, int delta) {
        KeyList keylist = context.keyList();

        if (keylist.isShared()) {
            KeyList copy = keylist.copyWithExtra(delta);
            context.setKeyList(copy);
            Debug.get().t(TAG, "unshared key list of " + keylist.size() + " keys");
            return true;
        }

        if (delta == 0) return false;

        keylist.reserve(delta);
        return false;
    }

    /** Reserves room in both lists. */
    public static void expand(Context context, int delta) {
        context.varList().reserve(delta);
        expandKeylist(context, delta);
    }

    /**
     * Adds a variable for {@code symbol}, initially unset. Returns its index.
     */
    public static int append(Context context, Symbol symbol) {
        context.ensureMutable();
        expandKeylist(context, 1);
        context.keyList().add(new Key(symbol));
        context.varList().append(Value.unset());
        return context.length();
    }

    /**
     * Adds a variable named by a word value and rebinds that word in place to
     * the new variable.
     */
    public static int append(Context context, Value word) {
        if (!word.isWord()) throw new IllegalArgumentException("Expected a word, got " + word.getType());
        Word w = word.asWord();
        int n = append(context, w.symbol());
        w.bind(context, n);
        return n;
    }

    // -------------------------
    // Collection
    // -------------------------

    private static final class Collector {
        final Binder binder;
        final int flags;
        final List<Key> collected = new ArrayList<>();

        Collector(Binder binder, int flags) {
            this.binder = binder;
            this.flags = flags;
        }

        int nextIndex() {
            return collected.size() + 1;
        }
    }

    // Keys are carried over whole, so HIDDEN, SEALED and PROTECTED survive.
    private static void collectContextKeys(Collector cl, Context context, boolean checkDups) {
        KeyList keys = context.keyList();
        for (int n = 1; n <= keys.size(); n++) {
            Key key = keys.key(n);
            if (checkDups) {
                if (!cl.binder.tryAdd(key.symbol().canon(), cl.nextIndex())) continue;
                cl.collected.add(key);
            } else {
                // a context's keys are already unique
                cl.binder.tryAdd(key.symbol().canon(), cl.nextIndex());
                cl.collected.add(key);
            }
        }
    }

    private static void collectInner(Collector cl, List<Value> items) {
        for (Value item : items) {
            Value cell = item;
            while (cell.getType() == Value.Type.QUOTED) cell = cell.asQuoted();

            if (cell.isWord()) {
                if (cell.getType() != Value.Type.SET_WORD && (cl.flags & COLLECT_ANY_WORD) == 0) continue;

                Symbol symbol = cell.asSymbol();
                if (!cl.binder.tryAdd(symbol.canon(), cl.nextIndex())) {
                    if (cl.binder.get(symbol.canon()) < 0) continue; // ignored word
                    if ((cl.flags & COLLECT_NO_DUP) != 0) {
                        throw new DuplicateKeyException(symbol.spelling());
                    }
                    continue;
                }
                cl.collected.add(new Key(symbol));
                continue;
            }

            if ((cl.flags & COLLECT_DEEP) == 0) continue;

            if (cell.getType() == Value.Type.BLOCK || cell.getType() == Value.Type.GROUP) {
                collectInner(cl, cell.asList());
            }
        }
    }

    /**
     * Keys for a context built from {@code body}, seeded with the keys of
     * {@code prior} when given. If the body adds nothing new, {@code prior}'s
     * own key list instance is returned.
     */
    public static KeyList collectKeys(List<Value> body, Context prior, int flags) {
        try (Binder binder = new Binder()) {
            Collector cl = new Collector(binder, flags);

            if (prior != null) collectContextKeys(cl, prior, false);

            collectInner(cl, body);

            if (prior != null && cl.collected.size() == prior.length()) {
                return prior.keyList();
            }
            return new KeyList(cl.collected);
        }
    }

    /** Unique words of {@code body}, skipping the {@code ignore} words. */
    public static List<Symbol> collectUniqueWords(List<Value> body, int flags, List<Symbol> ignore) {
        try (Binder binder = new Binder()) {
            if (ignore != null) {
                for (Symbol s : ignore) binder.tryAdd(s.canon(), -1);
            }
            Collector cl = new Collector(binder, flags);
            collectInner(cl, body);
            List<Symbol> words = new ArrayList<>(cl.collected.size());
            for (Key k : cl.collected) words.add(k.symbol());
            return words;
        }
    }

    /** Unique words of {@code body} that are not already keys of {@code ignore}. */
    public static List<Symbol> collectUniqueWords(List<Value> body, int flags, Context ignore) {
        List<Symbol> keys = new ArrayList<>();
        if (ignore != null) {
            for (int n = 1; n <= ignore.length(); n++) keys.add(ignore.symbol(n));
        }
        return collectUniqueWords(body, flags, keys);
    }

    // -------------------------
    // Derivation
    // -------------------------

    public static Context makeFromDetected(Value.Type kind, List<Value> body, Context parent) {
        return makeFromDetected(kind, body, parent, Cloner.DEEP);
    }

    /**
     * Context with one variable per set-word of {@code body}, plus the keys of
     * {@code parent}. Without new keys the parent's key list is shared.
     * Inherited values are cloned and then rebound from the parent to the
     * new context.
     */
    public static Context makeFromDetected(Value.Type kind, List<Value> body, Context parent, Cloner cloner) {
        KeyList keylist = collectKeys(body, parent, COLLECT_ONLY_SET_WORDS);

        if (parent != null) {
            if (keylist == parent.keyList()) {
                // ancestor link stays whatever the parent had
                keylist.markShared();
            } else {
                keylist.setAncestor(parent.keyList());
            }
        }

        Context context = new Context(kind, keylist, keylist.size());
        for (int n = 1; n <= keylist.size(); n++) context.varList().append(Value.unset());

        if (parent != null) {
            for (int n = 1; n <= parent.length(); n++) {
                context.init(n, cloner.cloneOf(parent.get(n)));
            }
            Binding.rebindDeep(context.variables(), parent, context, null);
        }
        return context;
    }

    /** Varargs form: anything but exactly two parents is refused. */
    public static Context merge(Context... parents) {
        if (parents == null || parents.length != 2) {
            throw new BindScriptException("Merging supports exactly two parent contexts, got "
                    + (parents == null ? 0 : parents.length));
        }
        return merge(parents[0], parents[1], Cloner.DEEP);
    }

    /**
     * Child of two parents. Values of {@code parent2} win on shared keys. Both
     * parents' values are cloned and their material deep-rebound to the child,
     * so neither parent is changed. Keys keep their flags; on a shared key the
     * flags of {@code parent1} stand.
     */
    public static Context merge(Context parent1, Context parent2, Cloner cloner) {
        if (parent1 == null && parent2 == null) {
            throw new IllegalArgumentException("merge needs at least one parent");
        }
        if (parent1 != null && parent2 != null && parent1.kind() != parent2.kind()) {
            throw new BindScriptException("Cannot merge " + parent1.kind() + " with " + parent2.kind());
        }
        Value.Type kind = (parent1 != null) ? parent1.kind() : parent2.kind();

        try (Binder binder = new Binder()) {
            Collector cl = new Collector(binder, COLLECT_ANY_WORD);
            if (parent1 != null) collectContextKeys(cl, parent1, false);
            if (parent2 != null) collectContextKeys(cl, parent2, true);

            KeyList keylist = new KeyList(cl.collected);
            keylist.setAncestor(parent1 == null ? keylist : parent1.keyList());

            Context merged = new Context(kind, keylist, keylist.size());
            for (int n = 1; n <= keylist.size(); n++) merged.varList().append(Value.unset());

            if (parent1 != null) {
                for (int n = 1; n <= parent1.length(); n++) {
                    merged.init(n, cloner.cloneOf(parent1.get(n)));
                }
            }
            if (parent2 != null) {
                for (int n = 1; n <= parent2.length(); n++) {
                    int m = binder.get(parent2.symbol(n).canon());
                    merged.init(m, cloner.cloneOf(parent2.get(n)));
                }
            }

            if (parent1 != null) Binding.rebindDeep(merged.variables(), parent1, merged, binder);
            if (parent2 != null) Binding.rebindDeep(merged.variables(), parent2, merged, binder);
            return merged;
        }
    }

    // -------------------------
    // Resolve
    // -------------------------

    /**
     * Copies values from {@code source} into {@code target} for the keys
     * selected by {@code filter}.
     *
     * @param all    overwrite variables that already hold a value
     * @param expand append selected source keys the target does not have
     */
    public static void resolve(Context target, Context source, ResolveFilter filter, boolean all, boolean expand) {
        target.ensureMutable();

        int start = 1;
        if (filter.isCut()) {
            start = filter.cut();
            if (start > target.length()) return;
        }

        try (Binder binder = new Binder()) {
            // mark the keys of interest
            if (filter.isCut()) {
                for (int k = start; k <= target.length(); k++) {
                    binder.tryAdd(target.symbol(k).canon(), -1);
                }
            } else if (filter.isOnly()) {
                for (Symbol s : filter.symbols()) binder.tryAdd(s.canon(), -1);
            }

            // map marked words to their source positions
            for (int k = 1; k <= source.length(); k++) {
                Symbol canon = source.symbol(k).canon();
                if (filter.isAll()) {
                    binder.tryAdd(canon, k);
                } else if (binder.get(canon) != 0) {
                    binder.remove(canon);
                    binder.add(canon, k);
                }
            }

            for (int k = start; k <= target.length(); k++) {
                int m = binder.removeElse0(target.symbol(k).canon());
                if (m == 0) continue;

                Key key = target.key(k);
                if (key.isProtected()) continue;
                if (all || target.get(k).isUnset()) {
                    target.init(k, (m < 0) ? Value.unset() : source.get(m));
                }
            }

            if (expand) {
                for (int k = 1; k <= source.length(); k++) {
                    Symbol symbol = source.symbol(k);
                    if (binder.removeElse0(symbol.canon()) > 0) {
                        int n = append(target, symbol);
                        target.init(n, source.get(k));
                    }
                }
            }
        }
    }

    // -------------------------
    // Lookup
    // -------------------------

    /** Spent frames are only reachable through the phased (internal) view. */
    public static void ensureAccessible(Context context) {
        if (context.kind() == Value.Type.FRAME && context.isSpent() && !context.isPhased()) {
            throw new StaleFrameException("Frame is no longer running; its variables cannot be accessed");
        }
    }

    public static int findSymbol(Context context, Symbol symbol, boolean strict) {
        return findSymbol(context, symbol, strict, visibility);
    }

    /** 1-based index of the first visible key matching {@code symbol}, or 0. */
    public static int findSymbol(Context context, Symbol symbol, boolean strict, Visibility vis) {
        ensureAccessible(context);

        for (int n = 1; n <= context.length(); n++) {
            Key key = context.key(n);
            if (!key.symbol().sameAs(symbol, strict)) continue;
            if (!vis.isVisible(context, key)) continue;
            return n;
        }
        return 0;
    }

    /** Value of the variable named {@code symbol} (case-folded), or null if absent. */
    public static Value select(Context context, Symbol symbol) {
        int n = findSymbol(context, symbol, false);
        return (n == 0) ? null : context.get(n);
    }

    /**
     * Words and/or values of the visible keys, in key order. With
     * {@link ListMode#WORDS_AND_VALUES} each variable yields a set-word
     * followed by its value.
     */
    public static List<Value> toList(Context context, ListMode mode) {
        ensureAccessible(context);

        List<Value> out = new ArrayList<>();
        for (int n = 1; n <= context.length(); n++) {
            Key key = context.key(n);
            if (!visibility.isVisible(context, key)) continue;

            if (mode.includesWords()) {
                Value.Type t = mode.includesValues() ? Value.Type.SET_WORD : Value.Type.WORD;
                out.add(Value.word(t, new Word(key.symbol(), context, n)));
            }
            if (mode.includesValues()) {
                Value v = context.get(n);
                if (v.isUnset()) {
                    throw new BadWriteException("'" + key.symbol() + "' is unset; cannot list its value");
                }
                out.add(v);
            }
        }
        return out;
    }
}

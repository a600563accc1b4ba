package com.bindscript.script.context;

import java.util.List;

import com.bindscript.script.runtime.ActionValue;
import com.bindscript.script.runtime.Value;
import com.bindscript.script.runtime.Word;

/**
 * Deep binding of code to contexts.
 *
 * Words are bound in place (a {@link Word} is mutable), so binding a body
 * changes every copy of the value that shares the word instance; bodies meant
 * to be reused should be cloned first.
 */
public final class Binding {

    private Binding() {}

    /**
     * Binds every word of {@code body} (nested blocks, groups, paths and quoted
     * values included) whose spelling names a key of {@code context}.
     *
     * @return number of words bound
     */
    public static int bindDeep(List<Value> body, Context context, boolean setWordsOnly) {
        try (Binder binder = new Binder()) {
            for (int n = 1; n <= context.length(); n++) {
                binder.tryAdd(context.symbol(n).canon(), n);
            }
            return bindInner(body, context, binder, setWordsOnly);
        }
    }

    public static int bindDeep(List<Value> body, Context context) {
        return bindDeep(body, context, false);
    }

    private static int bindInner(List<Value> body, Context context, Binder binder, boolean setWordsOnly) {
        int count = 0;
        for (Value item : body) {
            Value cell = item;
            while (cell.getType() == Value.Type.QUOTED) cell = cell.asQuoted();

            if (cell.isWord()) {
                if (setWordsOnly && cell.getType() != Value.Type.SET_WORD) continue;
                Word w = cell.asWord();
                int n = binder.get(w.symbol().canon());
                if (n > 0) {
                    w.bind(context, n);
                    count++;
                }
            } else if (cell.isList()) {
                count += bindInner(cell.asList(), context, binder, setWordsOnly);
            }
        }
        return count;
    }

    /**
     * Moves material derived from {@code from} over to {@code to}: words bound
     * to {@code from} are rebound (through {@code binder} when given, so a
     * differing key order is respected), and actions whose code belongs to
     * {@code from} get {@code to} as their binding. Values are replaced in
     * {@code values} where they cannot be changed in place.
     */
    public static void rebindDeep(List<Value> values, Context from, Context to, Binder binder) {
        for (int i = 0; i < values.size(); i++) {
            Value v = values.get(i);
            if (v == null) continue;
            while (v.getType() == Value.Type.QUOTED) v = v.asQuoted();

            switch (v.getType()) {
                case WORD:
                case SET_WORD:
                case GET_WORD:
                case REFINEMENT: {
                    Word w = v.asWord();
                    if (w.binding() != from) break;
                    int n = w.index();
                    if (binder != null) {
                        int m = binder.get(w.symbol().canon());
                        if (m > 0) n = m;
                    }
                    w.bind(to, n);
                    break;
                }

                case BLOCK:
                case GROUP:
                case PATH:
                case SET_PATH:
                    rebindDeep(v.asList(), from, to, binder);
                    break;

                case ACTION: {
                    ActionValue a = v.asAction();
                    Context b = a.binding();
                    if (b == null || b.kind() == Value.Type.FRAME) break;
                    if (b == from && values.get(i) == v) {
                        values.set(i, Value.action(a.withBinding(to)));
                    }
                    break;
                }

                default:
                    break;
            }
        }
    }
}

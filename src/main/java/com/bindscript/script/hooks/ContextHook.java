package com.bindscript.script.hooks;

import com.bindscript.script.context.Context;
import com.bindscript.script.context.Contexts;
import com.bindscript.script.errors.ReadOnlyException;
import com.bindscript.script.path.HookResult;
import com.bindscript.script.path.PathHook;
import com.bindscript.script.path.PathState;
import com.bindscript.script.runtime.Value;
import com.bindscript.script.runtime.Word;

/**
 * OBJECT, MODULE, ERROR and FRAME: a word selects the variable of that name.
 * Words already bound to the context reuse their cached index.
 */
public final class ContextHook implements PathHook {

    private final boolean strict;

    public ContextHook(boolean strict) {
        this.strict = strict;
    }

    @Override
    public HookResult handle(PathState state, Value picker, Value setValue) {
        if (picker.getType() != Value.Type.WORD) return HookResult.unhandled();

        Context context = state.out().asContext();
        Word word = picker.asWord();

        int n;
        if (word.binding() == context && word.index() >= 1 && word.index() <= context.length()
                && context.symbol(word.index()).sameAs(word.symbol(), strict)) {
            Contexts.ensureAccessible(context);
            n = word.index();
        } else {
            n = Contexts.findSymbol(context, word.symbol(), strict);
        }
        if (n == 0) return HookResult.unhandled();

        if (setValue != null) {
            context.ensureMutable();
            if (context.key(n).isProtected()) {
                throw new ReadOnlyException("variable '" + context.symbol(n) + "'");
            }
        }
        return HookResult.reference(context.slot(n));
    }
}

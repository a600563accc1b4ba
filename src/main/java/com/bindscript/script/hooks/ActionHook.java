package com.bindscript.script.hooks;

import com.bindscript.script.path.HookResult;
import com.bindscript.script.path.PathHook;
import com.bindscript.script.path.PathState;
import com.bindscript.script.runtime.Value;

/**
 * ACTION: each further word names a refinement to use. The marks are turned
 * into a specialization (or handed back raw) when the walk ends.
 */
public final class ActionHook implements PathHook {

    @Override
    public HookResult handle(PathState state, Value picker, Value setValue) {
        if (setValue != null) return HookResult.unhandled();

        switch (picker.getType()) {
            case BLANK:
            case NULL:
                return HookResult.value(state.out());

            case WORD:
            case REFINEMENT:
                state.pushRefinement(picker.asSymbol());
                return HookResult.value(state.out());

            default:
                return HookResult.unhandled();
        }
    }
}

package com.bindscript.script.hooks;

import com.bindscript.script.path.HookResult;
import com.bindscript.script.path.PathHook;
import com.bindscript.script.path.PathState;
import com.bindscript.script.runtime.Value;

/** QUOTED: peel one level and retry the selector on the payload. */
public final class QuotedHook implements PathHook {

    @Override
    public HookResult handle(PathState state, Value picker, Value setValue) {
        state.peelQuote();
        return HookResult.redo();
    }
}

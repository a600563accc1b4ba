package com.bindscript.script.hooks;

import com.bindscript.script.path.HookResult;
import com.bindscript.script.path.PathHook;
import com.bindscript.script.path.PathState;
import com.bindscript.script.runtime.Value;

/** BLANK: every read is a soft miss, nothing can be written. */
public final class BlankHook implements PathHook {

    @Override
    public HookResult handle(PathState state, Value picker, Value setValue) {
        return (setValue == null) ? HookResult.value(Value.nulled()) : HookResult.unhandled();
    }
}

package com.bindscript.script.hooks;

import com.bindscript.script.errors.BadWriteException;
import com.bindscript.script.path.HookResult;
import com.bindscript.script.path.PathHook;
import com.bindscript.script.path.PathState;
import com.bindscript.script.runtime.Value;

/** TEXT: 1-based character pick. Writes produce a new string. */
public final class TextHook implements PathHook {

    @Override
    public HookResult handle(PathState state, Value picker, Value setValue) {
        if (picker.getType() != Value.Type.INTEGER) return HookResult.unhandled();

        String s = state.out().asText();
        long i = picker.asInteger();
        boolean inRange = i >= 1 && i <= s.length();

        if (setValue == null) {
            if (!inRange) return HookResult.value(Value.nulled());
            return HookResult.value(Value.text(s.substring((int) i - 1, (int) i)));
        }

        if (!inRange) return HookResult.unhandled();
        if (setValue.getType() != Value.Type.TEXT || setValue.asText().length() != 1) {
            throw new BadWriteException("Text position " + i + " takes a single character, got " + setValue);
        }

        StringBuilder sb = new StringBuilder(s);
        sb.setCharAt((int) i - 1, setValue.asText().charAt(0));
        state.setOut(Value.text(sb.toString()));
        return HookResult.deferred();
    }
}

package com.bindscript.script.hooks;

import com.bindscript.script.errors.BadWriteException;
import com.bindscript.script.path.HookResult;
import com.bindscript.script.path.PathHook;
import com.bindscript.script.path.PathState;
import com.bindscript.script.runtime.Pair;
import com.bindscript.script.runtime.Value;

/**
 * PAIR: {@code x}/{@code y} or {@code 1}/{@code 2}. Pairs are immutable, so a
 * write rebuilds the pair and asks for it to be stored back.
 */
public final class PairHook implements PathHook {

    @Override
    public HookResult handle(PathState state, Value picker, Value setValue) {
        int axis = axis(picker);
        if (axis == 0) return HookResult.unhandled();

        Pair pair = state.out().asPair();

        if (setValue == null) {
            return HookResult.value(axis == 1 ? pair.x : pair.y);
        }

        if (setValue.getType() != Value.Type.INTEGER && setValue.getType() != Value.Type.DECIMAL) {
            throw new BadWriteException("Pair components must be numbers, got " + setValue.getType());
        }
        Pair updated = (axis == 1) ? pair.withX(setValue) : pair.withY(setValue);
        state.setOut(new Value(Value.Type.PAIR, updated));
        return HookResult.deferred();
    }

    private static int axis(Value picker) {
        if (picker.getType() == Value.Type.INTEGER) {
            long i = picker.asInteger();
            return (i == 1 || i == 2) ? (int) i : 0;
        }
        if (picker.getType() == Value.Type.WORD) {
            String s = picker.asSymbol().canon().spelling();
            if (s.equals("x")) return 1;
            if (s.equals("y")) return 2;
        }
        return 0;
    }
}

package com.bindscript.script.hooks;

import java.util.List;

import com.bindscript.script.path.HookResult;
import com.bindscript.script.path.PathHook;
import com.bindscript.script.path.PathState;
import com.bindscript.script.runtime.ListSlot;
import com.bindscript.script.runtime.Value;

/**
 * BLOCK, GROUP, PATH and SET_PATH.
 *
 * Integers index from 1. A word selects the item following the first
 * occurrence of that word. {@code true} and {@code false} pick the first and
 * second item. Reading past the end is a soft miss; writing there is not
 * handled.
 */
public final class ArrayHook implements PathHook {

    @Override
    public HookResult handle(PathState state, Value picker, Value setValue) {
        List<Value> list = state.out().asList();

        int index; // 0-based, may be out of range
        switch (picker.getType()) {
            case INTEGER: {
                long i = picker.asInteger();
                index = (i < 1 || i > list.size()) ? -1 : (int) (i - 1);
                break;
            }

            case LOGIC:
                index = picker.asLogic() ? 0 : 1;
                break;

            case WORD:
                index = afterWord(list, picker);
                break;

            default:
                return HookResult.unhandled();
        }

        if (index < 0 || index >= list.size()) {
            return (setValue == null) ? HookResult.value(Value.nulled()) : HookResult.unhandled();
        }
        return HookResult.reference(new ListSlot(list, index));
    }

    private static int afterWord(List<Value> list, Value picker) {
        for (int i = 0; i < list.size(); i++) {
            Value item = list.get(i);
            if (item.isWord() && item.asSymbol().sameAs(picker.asSymbol(), false)) return i + 1;
        }
        return -1;
    }
}

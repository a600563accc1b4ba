package com.bindscript.script.hooks;

import java.util.Map;

import com.bindscript.script.path.HookResult;
import com.bindscript.script.path.PathHook;
import com.bindscript.script.path.PathState;
import com.bindscript.script.runtime.Value;

/** MAP: text or word keys, matched without regard to case. */
public final class MapHook implements PathHook {

    @Override
    public HookResult handle(PathState state, Value picker, Value setValue) {
        String key;
        if (picker.getType() == Value.Type.TEXT) key = picker.asText();
        else if (picker.getType() == Value.Type.WORD) key = picker.asSymbol().spelling();
        else return HookResult.unhandled();

        Map<String, Value> map = state.out().asMap();
        String existing = findKey(map, key);

        if (setValue == null) {
            return HookResult.value(existing == null ? Value.nulled() : map.get(existing));
        }

        map.put(existing == null ? key : existing, setValue);
        return HookResult.applied();
    }

    private static String findKey(Map<String, Value> map, String key) {
        if (map.containsKey(key)) return key;
        for (String k : map.keySet()) {
            if (k.equalsIgnoreCase(key)) return k;
        }
        return null;
    }
}

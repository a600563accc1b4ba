package com.bindscript.script.hooks;

import com.bindscript.script.path.HookRegistry;
import com.bindscript.script.runtime.Value;

/** Installs the built-in container hooks. */
public final class CoreHooks {

    private CoreHooks() {}

    public static HookRegistry registry(boolean strictLookup) {
        HookRegistry registry = new HookRegistry();
        install(registry, strictLookup);
        return registry;
    }

    public static void install(HookRegistry registry, boolean strictLookup) {
        ContextHook contexts = new ContextHook(strictLookup);
        registry.register(Value.Type.OBJECT, contexts);
        registry.register(Value.Type.MODULE, contexts);
        registry.register(Value.Type.ERROR, contexts);
        registry.register(Value.Type.FRAME, contexts);

        ArrayHook arrays = new ArrayHook();
        registry.register(Value.Type.BLOCK, arrays);
        registry.register(Value.Type.GROUP, arrays);
        registry.register(Value.Type.PATH, arrays);
        registry.register(Value.Type.SET_PATH, arrays);

        registry.register(Value.Type.MAP, new MapHook());
        registry.register(Value.Type.PAIR, new PairHook());
        registry.register(Value.Type.TEXT, new TextHook());
        registry.register(Value.Type.ACTION, new ActionHook());
        registry.register(Value.Type.QUOTED, new QuotedHook());
        registry.register(Value.Type.BLANK, new BlankHook());
    }
}

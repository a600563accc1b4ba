package com.bindscript.script.context;

/**
 * Decides whether a key takes part in lookups and listings. Injected so that
 * callers with frame-phase knowledge can widen or narrow the default view.
 */
@FunctionalInterface
public interface Visibility {

    boolean isVisible(Context context, Key key);

    /** Hidden and sealed keys only show through a phased (internal) view. */
    Visibility DEFAULT = (context, key) -> context.isPhased() || !(key.isHidden() || key.isSealed());

    Visibility ALL = (context, key) -> true;
}

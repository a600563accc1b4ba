package com.bindscript.script.path;

/** Bit flags accepted by {@link PathDispatcher#evaluate}. */
public final class PathFlags {

    public static final int NONE = 0;

    /** Group selectors are an error instead of being evaluated. */
    public static final int NO_PATH_GROUPS = 1;

    /** Group selectors are passed to hooks literally. */
    public static final int HARD_QUOTE = 1 << 1;

    /** Return refinement marks instead of specializing the action. */
    public static final int PUSH_REFINEMENTS = 1 << 2;

    /** Dotted access: the result must not be an action. */
    public static final int FORBID_ACTIVATION = 1 << 3;

    /** Slashed access: the result must be an action. */
    public static final int REQUIRE_ACTIVATION = 1 << 4;

    private PathFlags() {}

    public static boolean has(int flags, int flag) {
        return (flags & flag) != 0;
    }
}

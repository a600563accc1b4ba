package com.bindscript.debug;

/** Pluggable debug output target (stdout, file, host logger, test capture). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}

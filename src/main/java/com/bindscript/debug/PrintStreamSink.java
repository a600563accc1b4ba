package com.bindscript.debug;

import java.io.PrintStream;

/**
 * Sink writing one line per record. WARN and ERROR go to the error stream.
 */
public final class PrintStreamSink implements DebugSink {

    private final PrintStream out;
    private final PrintStream err;

    public PrintStreamSink() {
        this(System.out, System.err);
    }

    public PrintStreamSink(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        PrintStream target = (level == DebugLevel.WARN || level == DebugLevel.ERROR) ? err : out;
        target.println("[" + level + "] " + tag + ": " + message);
        if (error != null) error.printStackTrace(target);
    }
}

package com.keiyaku.debug;

/** Pluggable debug output target (stderr, file, test collector). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}

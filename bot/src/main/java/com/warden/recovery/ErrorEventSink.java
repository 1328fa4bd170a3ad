package com.warden.recovery;

/**
 * Accepts error events from any thread.
 */
@FunctionalInterface
public interface ErrorEventSink {

    void report(ErrorEvent event);
}

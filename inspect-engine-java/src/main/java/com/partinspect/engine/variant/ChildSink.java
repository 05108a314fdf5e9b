package com.partinspect.engine.variant;

/**
 * Receives the children a container variant produces while it is expanded.
 */
public interface ChildSink {

    void child(String name, Object value);

    /** Reports a child whose value could not be read. */
    void failed(String name, Throwable error);
}

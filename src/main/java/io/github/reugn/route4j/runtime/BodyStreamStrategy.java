package io.github.reugn.route4j.runtime;

/**
 * How a request body is handled before the responder runs.
 */
public enum BodyStreamStrategy {
    /**
     * The whole body is collected into memory first.
     */
    COLLECT,
    /**
     * The body is streamed to the responder as it arrives.
     */
    STREAM
}

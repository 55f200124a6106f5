package com.agentloom.core.stream;

/**
 * Body of a generated {@link EventStream}: straight-line code that yields events
 * through the emitter.
 */
@FunctionalInterface
public interface Generator {

    void generate(Emitter emitter) throws Exception;
}

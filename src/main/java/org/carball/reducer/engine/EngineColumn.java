package org.carball.reducer.engine;

/**
 * A column exactly as the engine describes it.
 */
public record EngineColumn(String name, String type, boolean nullable) {}

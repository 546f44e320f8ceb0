package org.carball.reducer.model.analysis;

/**
 * One bucket of an analysis result: a time label, product, member or customer type and its value.
 */
public record AnalysisPoint(Object key, Object value) {}

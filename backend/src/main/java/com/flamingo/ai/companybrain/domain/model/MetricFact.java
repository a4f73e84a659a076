package com.flamingo.ai.companybrain.domain.model;

/**
 * A numeric value for a financial metric in a given year, mined from document content.
 *
 * @param metric canonical metric name (e.g. "revenue", "net income") regardless of the spelling
 *     used in the source
 * @param year four-digit year
 * @param value parsed value
 * @param source title of the document the value came from
 */
public record MetricFact(String metric, String year, double value, String source) {}

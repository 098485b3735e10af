package org.carball.tuner.model.plan;

/**
 * Statement-level execution statistics at the time a plan was captured. Times are in milliseconds.
 */
public record PlanMetrics(long callCount, double totalTime, double meanTime, long rows) {}

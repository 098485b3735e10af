package org.carball.tuner.analyzer;

import org.carball.tuner.model.recommendation.IndexAction;
import org.carball.tuner.model.recommendation.Recommendation;

import java.util.List;

/**
 * Result of one advisor invocation. {@code errors} names every pass that failed; the other passes still ran.
 */
public record IndexAdvice(List<Recommendation> recommendations, List<IndexAction> actions, List<String> errors) {}

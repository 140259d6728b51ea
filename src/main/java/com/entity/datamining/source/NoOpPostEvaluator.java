package com.entity.datamining.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluator used when no AI backend is configured. Every evaluation fails.
 */
public class NoOpPostEvaluator implements PostEvaluator {
    private static final Logger log = LoggerFactory.getLogger(NoOpPostEvaluator.class);

    @Override
    public FetchResult evaluate(String postText) {
        log.debug("NoOp post evaluator called for post of length {}", postText == null ? 0 : postText.length());
        return FetchResult.failure("Post evaluation not configured");
    }

    @Override
    public String getEvaluatorName() {
        return "NoOp";
    }
}

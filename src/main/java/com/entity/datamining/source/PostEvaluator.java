package com.entity.datamining.source;

/**
 * Analyzes the text of a social post.
 * A successful result carries a map with {@code sentiment_classification},
 * {@code sentiment_justification}, {@code main_topics} and {@code suggested_local_data}.
 */
public interface PostEvaluator {

    FetchResult evaluate(String postText);

    /**
     * Returns the name/identifier of this evaluator.
     */
    String getEvaluatorName();
}

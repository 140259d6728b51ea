package com.entity.datamining.enrichment;

/**
 * Producer side of the enrichment queue.
 */
public interface TaskQueue {

    /**
     * Adds a task without blocking.
     */
    void enqueue(FetchTask task);

    /**
     * Number of tasks waiting to be taken by the worker.
     */
    int size();
}

package com.entity.datamining.source;

/**
 * External tool that refreshes the raw vote files behind the voting record source.
 */
@FunctionalInterface
public interface RefreshTool {

    /**
     * Runs the tool.
     *
     * @param force re-download data even if the local copy is current
     * @return true if the tool completed successfully
     */
    boolean run(boolean force);
}

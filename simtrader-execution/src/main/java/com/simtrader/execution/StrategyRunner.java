package com.simtrader.execution;

/**
 * A trading strategy as seen by the {@link StrategyExecutor}. {@link #run} is
 * expected to loop until the context's shutdown signal is raised.
 */
public interface StrategyRunner {

    String name();

    void run(StrategyContext context) throws Exception;
}

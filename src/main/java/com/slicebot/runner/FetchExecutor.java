package com.slicebot.runner;

/**
 * External fetch collaborator. A thrown exception and a failed {@link FetchExecution} are handled alike.
 * Live implementations are discovered with {@link java.util.ServiceLoader}.
 */
public interface FetchExecutor {

    FetchExecution execute(FetchRequest request) throws Exception;
}

package eu.virtualparadox.priorart.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs the raw provider calls so the caller can stop waiting once the time budget is spent.
 */
public class EmbeddingCallExecutor extends ThreadPoolTaskExecutor {
}

package eu.virtualparadox.priorart.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Fixed-size pool running the per-chunk embedding tasks of an index build.
 * Its size is the embedding concurrency cap.
 */
public class EmbeddingWorkerExecutor extends ThreadPoolTaskExecutor {
}

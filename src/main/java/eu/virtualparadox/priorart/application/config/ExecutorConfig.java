package eu.virtualparadox.priorart.application.config;

import eu.virtualparadox.priorart.application.executor.EmbeddingCallExecutor;
import eu.virtualparadox.priorart.application.executor.EmbeddingWorkerExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public EmbeddingWorkerExecutor embeddingWorkerExecutor(final ApplicationConfig config) {
        final int concurrency = config.getEmbedding().getConcurrency();
        final EmbeddingWorkerExecutor executor = new EmbeddingWorkerExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);          // one chunk in progress per worker
        executor.setQueueCapacity(Integer.MAX_VALUE);  // chunks wait in the queue
        executor.setThreadNamePrefix("embed-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean
    public EmbeddingCallExecutor embeddingCallExecutor(final ApplicationConfig config) {
        final int concurrency = config.getEmbedding().getConcurrency();
        final EmbeddingCallExecutor executor = new EmbeddingCallExecutor();
        // a call abandoned on timeout keeps its thread until the provider returns,
        // so this pool and not the worker pool is what caps calls reaching the provider
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("embed-call-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}

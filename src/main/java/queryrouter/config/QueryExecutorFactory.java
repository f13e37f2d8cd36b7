package queryrouter.config;

import io.micronaut.context.annotation.Factory;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the executor that runs blocking engine calls off the event loop.
 */
@Factory
public class QueryExecutorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(QueryExecutorFactory.class);

    private ExecutorService executorService;

    /**
     * Creates a bounded platform thread pool. When the queue is full the
     * submitting thread runs the task itself, which pushes back on callers.
     */
    @Singleton
    @Named("queryExecutor")
    public ExecutorService queryExecutor(RouterProperties properties) {
        RouterProperties.ExecutorConfig config = properties.executor();
        int maxThreads = config.effectiveMaxThreads();
        LOG.info("Creating bounded query executor (max={})", maxThreads);

        AtomicInteger threadCount = new AtomicInteger();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                Math.min(10, maxThreads),
                maxThreads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(maxThreads * 2),
                r -> {
                    Thread t = new Thread(r);
                    t.setName(config.threadNamePrefix() + "-" + threadCount.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        executorService = executor;
        return executorService;
    }

    /**
     * Gracefully shuts down the executor on application shutdown.
     */
    @PreDestroy
    public void shutdown() {
        if (executorService != null && !executorService.isShutdown()) {
            LOG.info("Shutting down query executor");
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                    LOG.warn("Executor did not terminate gracefully, forcing shutdown");
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executorService.shutdownNow();
            }
        }
    }
}

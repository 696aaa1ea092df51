package dev.cuadrada.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Async execution configuration.
 *
 * <p>TRADEOFF: bounded pools. Reviewer calls are I/O-bound (waiting on the
 * Anthropic API), but the API is rate limited, so the reviewer pool size is the
 * real concurrency cap across all submissions. Extra tasks queue; the
 * submission timeout still counts from dispatch.
 *
 * <p>Finalization runs on its own small pool so that a saturated reviewer
 * pool can never block a submission from completing after its timeout.
 *
 * <p>Both pools propagate MDC (submissionId) so every reviewer log line
 * carries its submission context.
 */
@Configuration
public class AsyncConfig {

    /**
     * Runs reviewer tasks and paper text extraction.
     */
    @Bean(name = "reviewerExecutorService", destroyMethod = "shutdown")
    public ExecutorService reviewerExecutorService(ReviewProperties reviewProperties) {
        ExecutorService base = Executors.newFixedThreadPool(reviewProperties.reviewerThreads(),
                new CustomizableThreadFactory("reviewer-"));
        return new DelegatingExecutorService(base, new MdcPropagatingTaskDecorator());
    }

    /**
     * Runs submission finalization (timeout bookkeeping, aggregation, certificate, markComplete).
     */
    @Bean(name = "coordinatorExecutorService", destroyMethod = "shutdown")
    public ExecutorService coordinatorExecutorService(ReviewProperties reviewProperties) {
        ExecutorService base = Executors.newFixedThreadPool(reviewProperties.coordinatorThreads(),
                new CustomizableThreadFactory("coordinator-"));
        return new DelegatingExecutorService(base, new MdcPropagatingTaskDecorator());
    }

    /**
     * Propagates MDC context (submissionId) from the calling thread
     * to the pool thread. Critical for log correlation.
     */
    static class MdcPropagatingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }

    /**
     * Wraps an ExecutorService to apply MDC propagation to all submitted tasks.
     */
    static class DelegatingExecutorService extends AbstractExecutorService {
        private final ExecutorService delegate;
        private final MdcPropagatingTaskDecorator decorator;

        DelegatingExecutorService(ExecutorService delegate, MdcPropagatingTaskDecorator decorator) {
            this.delegate = delegate;
            this.decorator = decorator;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(decorator.decorate(command));
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit)
                throws InterruptedException { return delegate.awaitTermination(timeout, unit); }
    }
}

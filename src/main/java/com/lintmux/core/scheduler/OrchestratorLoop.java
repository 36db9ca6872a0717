package com.lintmux.core.scheduler;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * The orchestrator's single logical thread.
 *
 * <p>Store updates, link transitions, broadcast bookkeeping and relay dispatch
 * all run here. Work arriving from connection threads is handed over with
 * {@link #execute}; FIFO order keeps events of one child in emission order.
 */
@Component
public class OrchestratorLoop implements Executor {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorLoop.class);

    private final Executor executor;

    @Autowired
    public OrchestratorLoop() {
        this(Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "lintmux-loop");
            t.setDaemon(true);
            return t;
        }));
    }

    /**
     * Runs the loop on the given executor. Tests pass {@code Runnable::run} to
     * run everything on the calling thread.
     */
    public OrchestratorLoop(Executor executor) {
        this.executor = executor;
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Unhandled exception on orchestrator loop: {}", e.getMessage(), e);
            }
        });
    }

    /**
     * Starts an asynchronous operation on the loop and exposes its result.
     */
    public <T> CompletableFuture<T> submit(Supplier<CompletableFuture<T>> operation) {
        var result = new CompletableFuture<T>();
        executor.execute(() -> {
            try {
                operation.get().whenComplete((value, error) -> {
                    if (error != null) {
                        result.completeExceptionally(error);
                    } else {
                        result.complete(value);
                    }
                });
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    @PreDestroy
    public void shutdown() {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
            try {
                if (!service.awaitTermination(5, TimeUnit.SECONDS)) {
                    service.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                service.shutdownNow();
            }
            log.debug("Orchestrator loop stopped");
        }
    }
}

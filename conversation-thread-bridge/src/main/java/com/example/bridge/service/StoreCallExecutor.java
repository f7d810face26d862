package com.example.bridge.service;

import com.example.bridge.config.BridgeProperties;
import com.example.bridge.config.StoreExecutorConfig;
import com.example.bridge.service.exception.ServiceException;
import com.example.bridge.service.exception.StoreUnavailableException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Runs mapping store calls on a bounded pool and waits at most the configured store timeout.
 * Anything that prevents an answer (timeout, saturation, data access failure) surfaces as
 * {@link StoreUnavailableException}; domain exceptions raised by the store pass through unchanged.
 */
@Slf4j
@Component
public class StoreCallExecutor {

    private final Executor executor;
    private final Duration timeout;

    @Autowired
    public StoreCallExecutor(
            @Qualifier(StoreExecutorConfig.STORE_EXECUTOR) Executor executor, BridgeProperties bridgeProperties) {
        this(executor, bridgeProperties.getDatabase().getStoreTimeout());
    }

    public StoreCallExecutor(Executor executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    public <T> T call(String operation, Supplier<T> call) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(call, executor);
        } catch (RejectedExecutionException ex) {
            throw new StoreUnavailableException("Mapping store executor saturated during " + operation, ex);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new StoreUnavailableException(
                    "Mapping store did not answer " + operation + " within " + timeout, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new StoreUnavailableException("Interrupted while waiting for " + operation, ex);
        } catch (ExecutionException ex) {
            throw translate(operation, ex.getCause());
        }
    }

    public void run(String operation, Runnable call) {
        call(operation, () -> {
            call.run();
            return null;
        });
    }

    /**
     * Submits the call without waiting for it. Failures, timeouts included, are logged and
     * otherwise ignored.
     */
    public void fireAndForget(String operation, Runnable call) {
        try {
            CompletableFuture.runAsync(call, executor)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((ignored, ex) -> {
                        if (ex != null) {
                            log.warn("Background mapping store call {} failed: {}", operation, ex.toString());
                        }
                    });
        } catch (RejectedExecutionException ex) {
            log.warn("Mapping store executor saturated, dropping {}", operation);
        }
    }

    private RuntimeException translate(String operation, Throwable cause) {
        if (cause instanceof ServiceException serviceException) {
            return serviceException;
        }
        if (cause instanceof DataAccessException || cause instanceof TransactionException) {
            return new StoreUnavailableException("Mapping store failed during " + operation, cause);
        }
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new StoreUnavailableException("Mapping store failed during " + operation, cause);
    }
}

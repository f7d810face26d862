package com.example.bridge.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.bridge.service.exception.StoreConflictException;
import com.example.bridge.service.exception.StoreUnavailableException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.CannotCreateTransactionException;

class StoreCallExecutorTest {

    private final StoreCallExecutor inline = new StoreCallExecutor(Runnable::run, Duration.ofSeconds(1));

    @Test
    void returnsValueOfCall() {
        assertEquals("ok", inline.call("lookup", () -> "ok"));
    }

    @Test
    void dataAccessFailuresBecomeUnavailable() {
        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class,
                () -> inline.call("lookup", () -> {
                    throw new QueryTimeoutException("statement timeout");
                }));

        assertInstanceOf(QueryTimeoutException.class, ex.getCause());
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, ex.getStatus());
    }

    @Test
    void transactionFailuresBecomeUnavailable() {
        assertThrows(StoreUnavailableException.class, () -> inline.run("lookup", () -> {
            throw new CannotCreateTransactionException("pool exhausted");
        }));
    }

    @Test
    void domainExceptionsPassThrough() {
        StoreConflictException conflict = new StoreConflictException("scope", null);

        StoreConflictException thrown = assertThrows(StoreConflictException.class,
                () -> inline.call("create", () -> {
                    throw conflict;
                }));

        assertSame(conflict, thrown);
    }

    @Test
    void saturatedExecutorBecomesUnavailable() {
        StoreCallExecutor rejecting = new StoreCallExecutor(task -> {
            throw new RejectedExecutionException("queue full");
        }, Duration.ofSeconds(1));

        assertThrows(StoreUnavailableException.class, () -> rejecting.call("lookup", () -> "never"));
    }

    @Test
    void slowCallTimesOut() {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            StoreCallExecutor bounded = new StoreCallExecutor(pool, Duration.ofMillis(50));

            StoreUnavailableException ex = assertThrows(StoreUnavailableException.class,
                    () -> bounded.call("lookup", () -> {
                        try {
                            Thread.sleep(5_000);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return "late";
                    }));

            assertTrue(ex.getMessage().contains("lookup"));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void fireAndForgetSwallowsFailures() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);

        inline.fireAndForget("touch", () -> {
            ran.countDown();
            throw new QueryTimeoutException("statement timeout");
        });

        assertTrue(ran.await(1, TimeUnit.SECONDS));
    }

    @Test
    void fireAndForgetToleratesSaturation() {
        StoreCallExecutor rejecting = new StoreCallExecutor(task -> {
            throw new RejectedExecutionException("queue full");
        }, Duration.ofSeconds(1));

        rejecting.fireAndForget("touch", () -> { });
    }
}

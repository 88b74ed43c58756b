package com.recaprio.projection.sync;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Striped pool of single-thread executors. Work for one key always lands on the same
 * stripe and so runs in submission order; different keys spread across stripes.
 */
@Slf4j
public class KeyedExecutor {

    private final ExecutorService[] stripes;

    public KeyedExecutor(String threadNamePrefix, int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be positive, was " + stripeCount);
        }
        this.stripes = new ExecutorService[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(threadNamePrefix + i + "-");
            threadFactory.setDaemon(true);
            stripes[i] = Executors.newSingleThreadExecutor(threadFactory);
        }
    }

    public <T> CompletableFuture<T> submit(Long key, Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, stripes[stripeOf(key)]);
    }

    int stripeOf(Long key) {
        return Math.floorMod(key.hashCode(), stripes.length);
    }

    public int size() {
        return stripes.length;
    }

    public void shutdown() {
        for (ExecutorService stripe : stripes) {
            stripe.shutdown();
        }
        for (ExecutorService stripe : stripes) {
            try {
                if (!stripe.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("[SYNC] Worker stripe did not drain in time, interrupting");
                    stripe.shutdownNow();
                }
            } catch (InterruptedException ex) {
                stripe.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}

package com.rigwatch.core.processor;

import com.rigwatch.core.detection.ScoringModel;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Scoring model that holds the calling worker until released.
 */
class BlockingScoringModel implements ScoringModel {

    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch released = new CountDownLatch(1);

    @Override
    public double score(Map<String, Double> features) {
        entered.countDown();
        try {
            if (!released.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
        return 0.1;
    }

    void awaitEntered() throws InterruptedException {
        if (!entered.await(10, TimeUnit.SECONDS)) {
            throw new IllegalStateException("model was never called");
        }
    }

    void release() {
        released.countDown();
    }
}

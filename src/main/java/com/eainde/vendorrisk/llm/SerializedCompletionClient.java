package com.eainde.vendorrisk.llm;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Allows one in-flight completion at a time. One instance is created per assessment run, so
 * concurrent document analyses within the run queue behind each other while separate runs do not.
 */
public class SerializedCompletionClient implements CompletionClient {

    private final CompletionClient delegate;
    private final Semaphore permit = new Semaphore(1, true);
    private final Duration maxWait;

    public SerializedCompletionClient(CompletionClient delegate, Duration maxWait) {
        this.delegate = delegate;
        this.maxWait = maxWait;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        boolean acquired;
        try {
            acquired = permit.tryAcquire(maxWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException("Interrupted while waiting for completion slot", e);
        }
        if (!acquired) {
            throw new CompletionException("No completion slot within " + maxWait.toSeconds() + "s");
        }
        try {
            return delegate.complete(systemPrompt, userPrompt);
        } finally {
            permit.release();
        }
    }
}

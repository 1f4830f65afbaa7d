package com.eainde.vendorrisk.thread;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Run-scoped cancellation flag. Once cancelled, stages stop issuing new fetches and completions;
 * work already in flight finishes or times out, and partial results are still scored.
 */
public final class CancellationSignal implements BooleanSupplier {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public boolean getAsBoolean() {
        return cancelled.get();
    }
}

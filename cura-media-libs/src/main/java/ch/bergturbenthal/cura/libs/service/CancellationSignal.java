package ch.bergturbenthal.cura.libs.service;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation of a running scan or ingest.
 */
public class CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Sinks.One<Boolean> cancelSink = Sinks.one();

    public void cancel() {
        if (cancelled.compareAndSet(false, true))
            cancelSink.tryEmitValue(Boolean.TRUE);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Mono<Boolean> whenCancelled() {
        return cancelSink.asMono();
    }
}

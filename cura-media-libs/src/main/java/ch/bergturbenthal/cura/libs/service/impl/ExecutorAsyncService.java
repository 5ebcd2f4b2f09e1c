package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.service.AsyncService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
public class ExecutorAsyncService implements AsyncService, AutoCloseable {
    private final ExecutorService executorService;
    private final Optional<MeterRegistry> meterRegistryOptional;

    public ExecutorAsyncService(final ExecutorService executorService, Optional<MeterRegistry> meterRegistryOptional) {
        this.executorService = executorService;
        this.meterRegistryOptional = meterRegistryOptional;
    }

    @Override
    public <T> Mono<T> asyncMono(Callable<T> callable) {
        return Mono.<T> create(monoSink -> {
            final AtomicReference<Future<?>> runningFuture = new AtomicReference<>(null);
            final AtomicBoolean cancelled = new AtomicBoolean(false);
            monoSink.onRequest(count -> {
                if (count > 0) {
                    runningFuture.updateAndGet(existingFuture -> existingFuture != null ? existingFuture
                            : executorService.submit(meterRunnable(() -> {
                                if (cancelled.get())
                                    return;
                                final T result;
                                try {
                                    result = callable.call();
                                } catch (Throwable e) {
                                    if (!cancelled.get())
                                        monoSink.error(e);
                                    else
                                        log.debug("Exception on cancelled task", e);
                                    return;
                                }
                                monoSink.success(result);
                            })));
                }
            });
            monoSink.onCancel(() -> {
                cancelled.set(true);
                final Future<?> pendingFuture = runningFuture.getAndSet(null);
                if (pendingFuture != null)
                    pendingFuture.cancel(true);
            });
        });
    }

    private Runnable meterRunnable(final Runnable runnable) {
        return meterRegistryOptional.map(meterRegistry -> (Runnable) () -> meterRegistry
                .timer("cura.async.task.run").record(runnable)).orElse(runnable);
    }

    @Override
    public void close() {
        executorService.shutdownNow();
    }
}

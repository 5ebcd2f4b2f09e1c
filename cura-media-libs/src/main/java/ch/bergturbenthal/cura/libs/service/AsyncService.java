package ch.bergturbenthal.cura.libs.service;

import reactor.core.publisher.Mono;

import java.util.concurrent.Callable;

/**
 * Runs blocking work on the shared worker pool. Cancelling the returned {@link Mono} interrupts the running task.
 */
public interface AsyncService {
    <T> Mono<T> asyncMono(Callable<T> callable);
}

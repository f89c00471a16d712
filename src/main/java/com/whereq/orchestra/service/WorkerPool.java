package com.whereq.orchestra.service;

import com.whereq.orchestra.queue.TaskQueue;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed number of worker slots consuming one task queue.
 *
 * <p>Each slot polls, hands a delivery to the {@link JobWorker} and polls again; when the queue is
 * empty it sleeps for the poll interval. Slots never share a delivery.
 */
@Slf4j
public class WorkerPool {

    private final TaskQueue queue;
    private final JobWorker worker;
    private final int concurrency;
    private final Duration pollInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final List<Sinks.Empty<Void>> stopped = new ArrayList<>();

    public WorkerPool(TaskQueue queue, JobWorker worker, int concurrency, Duration pollInterval) {
        this.queue = queue;
        this.worker = worker;
        this.concurrency = concurrency;
        this.pollInterval = pollInterval;
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        stopped.clear();
        for (int slot = 0; slot < concurrency; slot++) {
            Sinks.Empty<Void> done = Sinks.empty();
            stopped.add(done);
            slotLoop(slot)
                .doFinally(signal -> done.tryEmitEmpty())
                .subscribe();
        }
        log.info("Started {} worker slot(s) on queue {}", concurrency, queue.name());
    }

    private Mono<Void> slotLoop(int slot) {
        return Mono.defer(this::pollOnce)
            .flatMap(handled -> handled ? Mono.just(true) : Mono.delay(pollInterval).thenReturn(false))
            .repeat(running::get)
            .doOnError(e -> log.error("Worker slot {} on {} crashed, restarting: {}",
                slot, queue.name(), e.getMessage(), e))
            .retry()
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }

    /**
     * @return true when a task was handled, false when the queue was empty or could not be polled
     */
    private Mono<Boolean> pollOnce() {
        if (!running.get()) {
            return Mono.just(false);
        }
        return queue.poll()
            .flatMap(task -> {
                inFlight.incrementAndGet();
                return worker.handle(task)
                    .doFinally(signal -> inFlight.decrementAndGet())
                    .thenReturn(true);
            })
            .defaultIfEmpty(false)
            .onErrorResume(e -> {
                log.error("Failed to poll queue {}: {}", queue.name(), e.getMessage());
                return Mono.just(false);
            });
    }

    /**
     * Stop taking new tasks. Tasks already handed to a slot keep running.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping worker pool on {}, {} task(s) in flight", queue.name(), inFlight.get());
        }
    }

    /**
     * Stop and wait until every slot has finished its current task. Tasks still running at the
     * timeout are left to finish on their own.
     *
     * @return true when the pool drained within the timeout
     */
    public Mono<Boolean> drain(Duration timeout) {
        stop();
        List<Mono<Void>> slotsDone = new ArrayList<>();
        synchronized (this) {
            for (Sinks.Empty<Void> done : stopped) {
                slotsDone.add(done.asMono());
            }
        }
        return Mono.when(slotsDone)
            .thenReturn(true)
            .timeout(timeout)
            .onErrorResume(TimeoutException.class, e -> {
                log.warn("Worker pool on {} did not drain within {}, {} task(s) still in flight",
                    queue.name(), timeout, inFlight.get());
                return Mono.just(false);
            });
    }

    public boolean isRunning() {
        return running.get();
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int concurrency() {
        return concurrency;
    }

    public TaskQueue queue() {
        return queue;
    }
}

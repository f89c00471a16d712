package com.whereq.orchestra.processor;

import reactor.core.publisher.Mono;

/**
 * Progress callback handed to processors. The worker persists the value, caps it below 100 and
 * publishes it; values lower than the current progress are ignored.
 */
@FunctionalInterface
public interface ProgressReporter {

    Mono<Void> report(int progress);
}

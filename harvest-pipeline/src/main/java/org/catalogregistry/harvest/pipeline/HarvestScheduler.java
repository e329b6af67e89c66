package org.catalogregistry.harvest.pipeline;

import java.util.List;

import org.catalogregistry.harvest.pipeline.ir.PassSummary;
import org.catalogregistry.harvest.pipeline.ir.SourceEndpoint;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs one pass per source, harvesting distinct sources concurrently.
 * Passes of the same source are serialized by the orchestrator's leases.
 */
@Slf4j
@RequiredArgsConstructor
public class HarvestScheduler {
    private final HarvestOrchestrator orchestrator;
    private final int maxConcurrentSources;

    /**
     * Emits one summary per endpoint as passes finish; a failing source never
     * stops the others.
     */
    public Flux<PassSummary> harvestAll(List<SourceEndpoint> endpoints) {
        return Flux.fromIterable(endpoints)
            .flatMap(endpoint -> Mono.fromCallable(() -> orchestrator.harvest(endpoint))
                    .subscribeOn(Schedulers.boundedElastic()),
                Math.max(1, maxConcurrentSources))
            .doOnNext(summary -> log.info("Source {} finished: {}", summary.source(), summary.outcome()));
    }

    /** 0 when every pass completed, 1 when any failed. */
    public static int exitCode(List<PassSummary> summaries) {
        return summaries.stream().allMatch(PassSummary::isCompleted) ? 0 : 1;
    }
}

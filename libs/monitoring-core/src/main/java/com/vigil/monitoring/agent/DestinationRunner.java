package com.vigil.monitoring.agent;

import com.vigil.observability.CorrelationContext;
import com.vigil.observability.CorrelationContextHolder;
import com.vigil.observability.SpanHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Gives every agent the same {@code run(destinationId)} entry point.
 * <p>
 * For a {@link DestinationAwareAgent}, {@code "all"} (or null) runs the agent once for each active
 * destination, sequentially, and any other value targets a single destination. Each destination
 * is isolated: a failure is recorded for that destination and the loop continues. A
 * {@link SharedAgent} ignores the id and executes once.
 * <p>
 * {@link #run(String)} never throws. Each invocation runs in its own span and MDC scope carrying
 * the agent key and destination.
 */
public final class DestinationRunner {

    private static final Logger log = LoggerFactory.getLogger(DestinationRunner.class);

    /** Destination id selecting every active destination. */
    public static final String ALL = "all";

    private final MonitoringAgent agent;
    private final DestinationDirectory directory;
    private final SpanHelper spanHelper;
    private final Clock clock;
    private final Consumer<AggregatedAgentRun> listener;

    public DestinationRunner(MonitoringAgent agent, DestinationDirectory directory, SpanHelper spanHelper,
                             Clock clock, Consumer<AggregatedAgentRun> listener) {
        if (agent == null) {
            throw new IllegalArgumentException("agent must not be null");
        }
        this.agent = agent;
        this.directory = directory;
        this.spanHelper = spanHelper;
        this.clock = clock;
        this.listener = listener;
    }

    public AgentDescriptor descriptor() {
        return agent.descriptor();
    }

    public MonitoringAgent agent() {
        return agent;
    }

    public AggregatedAgentRun run(String destinationId) {
        AgentDescriptor descriptor = agent.descriptor();
        long start = System.nanoTime();
        AggregatedAgentRun run;
        try {
            List<DestinationOutcome> outcomes;
            if (agent instanceof DestinationAwareAgent destinationAware) {
                Optional<List<Destination>> targets = resolve(destinationId);
                if (targets.isEmpty()) {
                    run = AggregatedAgentRun.failed(descriptor, "Unknown destination: " + destinationId,
                            elapsedMs(start), clock.instant());
                    return publish(run);
                }
                outcomes = new ArrayList<>();
                for (Destination destination : targets.get()) {
                    outcomes.add(invoke(destination.id(), () -> destinationAware.runForDestination(destination)));
                }
            } else {
                SharedAgent shared = (SharedAgent) agent;
                outcomes = List.of(invoke(null, shared::execute));
            }
            run = AggregatedAgentRun.of(descriptor, outcomes, elapsedMs(start), clock.instant());
        } catch (RuntimeException e) {
            log.error("Agent {} run failed outside its destinations", descriptor.key(), e);
            run = AggregatedAgentRun.failed(descriptor, e.getMessage(), elapsedMs(start), clock.instant());
        }
        log.info("Agent {} finished: success={} ({}/{} destinations) in {}ms", descriptor.key(), run.success(),
                run.destinationsSucceeded(), run.destinationsTotal(), run.durationMs());
        return publish(run);
    }

    private Optional<List<Destination>> resolve(String destinationId) {
        if (destinationId == null || destinationId.isBlank() || ALL.equalsIgnoreCase(destinationId)) {
            return Optional.of(directory.getActiveDestinations());
        }
        return directory.getDestinationById(destinationId).map(List::of);
    }

    @FunctionalInterface
    private interface Invocation {
        AgentOutcome call() throws Exception;
    }

    private DestinationOutcome invoke(String destinationId, Invocation invocation) {
        String agentKey = agent.descriptor().key();
        CorrelationContext context = CorrelationContextHolder.currentOrNew().forAgent(agentKey, destinationId);
        long start = System.nanoTime();
        return CorrelationContextHolder.callWithContext(context, () -> spanHelper.inSpan("agent.run",
                Map.of("vigil.agent.destination_aware", String.valueOf(agent instanceof DestinationAwareAgent)),
                () -> {
                    try {
                        AgentOutcome outcome = invocation.call();
                        return new DestinationOutcome(destinationId, outcome.success(), elapsedMs(start),
                                outcome.summary(), null, outcome.details());
                    } catch (Exception e) {
                        if (e instanceof InterruptedException) {
                            Thread.currentThread().interrupt();
                        }
                        log.warn("Agent {} failed for destination {}: {}", agentKey, destinationId, e.getMessage(), e);
                        return new DestinationOutcome(destinationId, false, elapsedMs(start), null,
                                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), Map.of());
                    }
                }));
    }

    private AggregatedAgentRun publish(AggregatedAgentRun run) {
        if (listener != null) {
            try {
                listener.accept(run);
            } catch (RuntimeException e) {
                log.warn("Agent run listener failed for {}: {}", run.agentKey(), e.getMessage());
            }
        }
        return run;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}

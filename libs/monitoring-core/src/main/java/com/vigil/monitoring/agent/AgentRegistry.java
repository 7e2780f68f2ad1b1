package com.vigil.monitoring.agent;

import com.vigil.observability.SpanHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Catalog of agents, each wrapped in a {@link DestinationRunner}. Registration order is kept.
 */
public final class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, DestinationRunner> runners = new LinkedHashMap<>();
    private final DestinationDirectory directory;
    private final SpanHelper spanHelper;
    private final Clock clock;
    private final Consumer<AggregatedAgentRun> listener;

    public AgentRegistry(DestinationDirectory directory, SpanHelper spanHelper, Clock clock,
                         Consumer<AggregatedAgentRun> listener) {
        this.directory = directory;
        this.spanHelper = spanHelper;
        this.clock = clock;
        this.listener = listener;
    }

    public AgentRegistry(DestinationDirectory directory, SpanHelper spanHelper, Clock clock,
                         Collection<? extends MonitoringAgent> agents, Consumer<AggregatedAgentRun> listener) {
        this(directory, spanHelper, clock, listener);
        agents.forEach(this::register);
    }

    public synchronized void register(MonitoringAgent agent) {
        String key = agent.descriptor().key();
        if (agent.descriptor().destinationAware() != agent instanceof DestinationAwareAgent) {
            throw new IllegalArgumentException("descriptor of " + key + " does not match the agent type");
        }
        if (runners.containsKey(key)) {
            throw new IllegalArgumentException("agent already registered: " + key);
        }
        runners.put(key, new DestinationRunner(agent, directory, spanHelper, clock, listener));
    }

    public synchronized Optional<DestinationRunner> get(String key) {
        return Optional.ofNullable(runners.get(key));
    }

    /**
     * @throws UnknownAgentException if no agent has this key
     */
    public DestinationRunner require(String key) {
        return get(key).orElseThrow(() -> new UnknownAgentException(key));
    }

    public synchronized List<AgentDescriptor> all() {
        return runners.values().stream().map(DestinationRunner::descriptor).toList();
    }

    public List<AgentDescriptor> destinationAwareAgents() {
        return all().stream().filter(AgentDescriptor::destinationAware).toList();
    }

    public List<AgentDescriptor> sharedAgents() {
        return all().stream().filter(descriptor -> !descriptor.destinationAware()).toList();
    }

    public AggregatedAgentRun runAgent(String key, String destinationId) {
        return require(key).run(destinationId);
    }

    /**
     * Runs every agent in registration order. A failing agent is reported and never stops the
     * remaining ones.
     */
    public List<AggregatedAgentRun> runAllAgents(String destinationId) {
        List<DestinationRunner> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(runners.values());
        }
        List<AggregatedAgentRun> runs = new ArrayList<>();
        for (DestinationRunner runner : snapshot) {
            runs.add(runner.run(destinationId));
        }
        long failed = runs.stream().filter(run -> !run.success()).count();
        log.info("Ran {} agents, {} failed", runs.size(), failed);
        return runs;
    }
}

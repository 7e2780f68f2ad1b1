package com.vigil.healthmonitor.api;

import com.vigil.monitoring.agent.AgentDescriptor;
import com.vigil.monitoring.agent.AgentRegistry;
import com.vigil.monitoring.agent.AggregatedAgentRun;
import com.vigil.monitoring.agent.DestinationRunner;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Agent catalog and run triggers, called by the scheduler. Runs are synchronous; the response is
 * the aggregated outcome. A failed run is still a 200 with {@code success=false}.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final AgentRegistry registry;

    public AgentController(AgentRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<AgentDescriptor> agents() {
        return registry.all();
    }

    @GetMapping("/{key}")
    public AgentDescriptor agent(@PathVariable String key) {
        return registry.require(key).descriptor();
    }

    @PostMapping("/{key}/run")
    public AggregatedAgentRun run(
            @PathVariable String key,
            @RequestParam(name = "destination", defaultValue = DestinationRunner.ALL) String destination) {
        return registry.runAgent(key, destination);
    }

    @PostMapping("/run-all")
    public List<AggregatedAgentRun> runAll(
            @RequestParam(name = "destination", defaultValue = DestinationRunner.ALL) String destination) {
        return registry.runAllAgents(destination);
    }
}

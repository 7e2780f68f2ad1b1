package com.vigil.monitoring.agent;

/**
 * Agent that runs once per destination.
 */
public non-sealed interface DestinationAwareAgent extends MonitoringAgent {

    AgentOutcome runForDestination(Destination destination) throws Exception;
}

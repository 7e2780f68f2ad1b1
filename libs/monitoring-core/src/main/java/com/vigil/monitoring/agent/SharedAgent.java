package com.vigil.monitoring.agent;

/**
 * Agent that runs once for the whole platform; destination ids are ignored.
 */
public non-sealed interface SharedAgent extends MonitoringAgent {

    AgentOutcome execute() throws Exception;
}

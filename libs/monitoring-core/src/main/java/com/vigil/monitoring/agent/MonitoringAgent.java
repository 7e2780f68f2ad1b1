package com.vigil.monitoring.agent;

/**
 * A monitoring agent. Exactly one of the two shapes applies: agents that run once per
 * destination, and agents that run once for the whole platform.
 */
public sealed interface MonitoringAgent permits DestinationAwareAgent, SharedAgent {

    AgentDescriptor descriptor();
}

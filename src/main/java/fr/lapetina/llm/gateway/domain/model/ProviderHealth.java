package fr.lapetina.llm.gateway.domain.model;

/**
 * Result of a proactive health check against a provider.
 *
 * HEALTHY: provider answers normally
 * DEGRADED: provider answers but with issues (slow, partial failures)
 * UNHEALTHY: provider does not answer or reports itself down
 */
public enum ProviderHealth {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}

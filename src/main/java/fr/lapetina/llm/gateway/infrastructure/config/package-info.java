/**
 * Configuration loading and hot-reload support.
 *
 * <p>YAML is parsed into {@link fr.lapetina.llm.gateway.infrastructure.config.GatewayConfig},
 * checked by {@link fr.lapetina.llm.gateway.infrastructure.config.ConfigValidator} and resolved into an
 * immutable {@link fr.lapetina.llm.gateway.infrastructure.config.GatewaySnapshot}. A configuration that
 * fails to parse or validate never replaces the active one.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code providers} - Provider pool, with optional per-provider retry and breaker overrides</li>
 *   <li>{@code routing} - Default strategy, default deadline and prioritized rules</li>
 *   <li>{@code retry} - Global retry policy</li>
 *   <li>{@code circuitBreaker} - Global breaker thresholds</li>
 *   <li>{@code healthCheck} - Proactive health monitoring</li>
 *   <li>{@code telemetry} - Ring buffer and wait strategy of the event bus</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.llm.gateway.infrastructure.config.ConfigLoader
 */
package fr.lapetina.llm.gateway.infrastructure.config;

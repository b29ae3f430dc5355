/**
 * LLM Gateway - routing core for chat/completion requests across heterogeneous LLM providers.
 *
 * <p>Given a provider-neutral request, the gateway decides which provider serves it:
 * routing rules, load balancing strategies, a per-provider circuit breaker, retries
 * with exponential backoff and fail-over, all under a single request deadline.
 * Provider wire protocols stay behind the
 * {@link fr.lapetina.llm.gateway.infrastructure.provider.ProviderClient} adapter.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.gateway.LlmGateway} - Main entry point, wires everything from YAML configuration</li>
 *   <li>{@link fr.lapetina.llm.gateway.routing.Router} - Candidate resolution and fail-over</li>
 *   <li>{@link fr.lapetina.llm.gateway.routing.RetryExecutor} - Retry loop against one provider</li>
 *   <li>{@link fr.lapetina.llm.gateway.domain.resilience.CircuitBreaker} - Per-provider breaker</li>
 *   <li>{@link fr.lapetina.llm.gateway.telemetry.TelemetryPipeline} - Asynchronous event bus</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * ProviderClients clients = new ProviderClients()
 *         .register("openai-compatible", openAiClient)
 *         .register("anthropic", anthropicClient);
 *
 * try (LlmGateway gateway = LlmGateway.create("gateway.yaml", clients).start()) {
 *     CanonicalResponse response = gateway.route(CanonicalRequest.of("gpt-4o", payload))
 *             .get(30, TimeUnit.SECONDS);
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Prioritized routing rules on model, tenant and tags</li>
 *   <li>Round-robin, least-latency, least-connections, cost-optimized and weighted-random strategies</li>
 *   <li>Circuit breaker with single-probe half-open recovery</li>
 *   <li>Hot-reload of providers, rules and policies without restart</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.llm.gateway.LlmGateway
 */
package fr.lapetina.llm.gateway;

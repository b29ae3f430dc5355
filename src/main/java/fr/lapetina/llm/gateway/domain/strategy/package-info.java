/**
 * Load balancing strategies picking one provider among routing candidates.
 *
 * <p>All implementations are thread-safe and skip providers whose circuit
 * breaker is open.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th></tr>
 *   <tr><td>{@code round-robin}</td><td>Cycles through providers, one cursor per candidate set</td></tr>
 *   <tr><td>{@code least-latency}</td><td>Lowest rolling latency, ties round-robin</td></tr>
 *   <tr><td>{@code least-connections}</td><td>Lowest in-flight utilization</td></tr>
 *   <tr><td>{@code cost-optimized}</td><td>Cheapest provider meeting the context and latency floor</td></tr>
 *   <tr><td>{@code weighted-random}</td><td>Random pick proportional to weight</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * LoadBalancingStrategy strategy = StrategyFactory.create("least-latency").orElseThrow();
 * Optional<ProviderRef> provider = strategy.select(candidates, SelectionContext.forModel("gpt-4o"));
 * }</pre>
 */
package fr.lapetina.llm.gateway.domain.strategy;

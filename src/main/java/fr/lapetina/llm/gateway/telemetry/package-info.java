/**
 * LMAX Disruptor-based bus for routing telemetry.
 *
 * <p>Routing threads publish attempt, breaker transition and request completion
 * events into a pre-allocated ring buffer and never block on it: a full buffer drops
 * the event and counts the drop. Handlers run in parallel on dedicated threads:
 * <pre>
 * publish → [Logging, Metrics] → Clear
 * </pre>
 *
 * @see fr.lapetina.llm.gateway.telemetry.TelemetryPipeline
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.llm.gateway.telemetry;

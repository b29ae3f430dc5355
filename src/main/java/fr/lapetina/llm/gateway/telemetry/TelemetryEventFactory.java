package fr.lapetina.llm.gateway.telemetry;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates telemetry slots in the ring buffer.
 */
public final class TelemetryEventFactory implements EventFactory<TelemetryEvent> {

    @Override
    public TelemetryEvent newInstance() {
        return new TelemetryEvent();
    }
}

package fr.lapetina.llm.gateway.telemetry;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.llm.gateway.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Asynchronous telemetry bus on an LMAX Disruptor ring buffer.
 *
 * Routing threads publish events without blocking: when the ring buffer is
 * full the event is dropped and counted. Handlers run in parallel on
 * dedicated consumer threads, then a final stage clears the slot.
 *
 * PRODUCER TYPE: MULTI, events come from caller threads, provider
 * completion threads and the scheduler concurrently.
 *
 * WAIT STRATEGY: configurable, "blocking" by default since telemetry is
 * not latency critical and should not burn a core.
 */
public final class TelemetryPipeline implements GatewayTelemetry, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TelemetryPipeline.class);

    private final Disruptor<TelemetryEvent> disruptor;
    private final RingBuffer<TelemetryEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();
    private final MetricsRegistry metricsRegistry;

    private TelemetryPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;

        this.disruptor = new Disruptor<>(
                new TelemetryEventFactory(),
                builder.ringBufferSize,
                new TelemetryThreadFactory("telemetry-handler"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        List<EventHandler<TelemetryEvent>> handlers = new ArrayList<>(builder.handlers);
        if (handlers.isEmpty()) {
            handlers.add((event, sequence, endOfBatch) -> { });
        }

        // Sinks in parallel, then release the slot's references
        @SuppressWarnings("unchecked")
        EventHandler<TelemetryEvent>[] sinks = handlers.toArray(new EventHandler[0]);
        disruptor.handleEventsWith(sinks)
                .then((event, sequence, endOfBatch) -> event.clear());

        disruptor.setDefaultExceptionHandler(new TelemetryExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        log.info("TelemetryPipeline created: ringBufferSize={}, waitStrategy={}, handlers={}",
                builder.ringBufferSize, builder.waitStrategy, builder.handlers.size());
    }

    /**
     * Starts the consumer threads.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("TelemetryPipeline started");
        }
    }

    @Override
    public void onAttempt(AttemptEvent event) {
        publish(slot -> slot.setAttempt(event));
    }

    @Override
    public void onBreakerTransition(BreakerTransitionEvent event) {
        publish(slot -> slot.setTransition(event));
    }

    @Override
    public void onRequestCompleted(RequestCompletedEvent event) {
        publish(slot -> slot.setCompleted(event));
    }

    private void publish(Consumer<TelemetryEvent> writer) {
        if (!running.get()) {
            drop("pipeline not running");
            return;
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            drop("ring buffer full");
            return;
        }

        try {
            writer.accept(ringBuffer.get(sequence));
        } finally {
            ringBuffer.publish(sequence);
        }

        if (metricsRegistry != null) {
            metricsRegistry.setRingBufferRemaining(ringBuffer.remainingCapacity());
        }
    }

    private void drop(String reason) {
        long total = dropped.incrementAndGet();
        if (metricsRegistry != null) {
            metricsRegistry.incrementDroppedEvents();
        }
        // Power-of-two sampling keeps a saturated buffer from flooding the log
        if (Long.bitCount(total) == 1) {
            log.warn("Telemetry event dropped: reason={}, totalDropped={}", reason, total);
        }
    }

    /**
     * Events dropped since creation.
     */
    public long getDroppedCount() {
        return dropped.get();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Drains pending events and stops the consumer threads.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down TelemetryPipeline...");
            try {
                disruptor.shutdown(10, TimeUnit.SECONDS);
                log.info("TelemetryPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("TelemetryPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Daemon threads: telemetry must never keep the JVM alive.
     */
    private static class TelemetryThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        TelemetryThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Logs handler failures; a failing sink must not stop the others.
     */
    private static class TelemetryExceptionHandler implements ExceptionHandler<TelemetryEvent> {

        private static final Logger log = LoggerFactory.getLogger(TelemetryExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, TelemetryEvent event) {
            log.error("Exception in telemetry handler: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during telemetry pipeline start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during telemetry pipeline shutdown", ex);
        }
    }

    /**
     * Builder for TelemetryPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 4096;
        private String waitStrategy = "blocking";
        private MetricsRegistry metricsRegistry;
        private final List<EventHandler<TelemetryEvent>> handlers = new ArrayList<>();

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder handler(EventHandler<TelemetryEvent> handler) {
            this.handlers.add(handler);
            return this;
        }

        public TelemetryPipeline build() {
            return new TelemetryPipeline(this);
        }
    }
}

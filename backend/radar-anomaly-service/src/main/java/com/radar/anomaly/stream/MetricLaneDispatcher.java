package com.radar.anomaly.stream;

import com.radar.anomaly.error.PersistenceUnavailableException;
import com.radar.anomaly.model.MetricEvent;
import com.radar.anomaly.model.MetricKey;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Ingestion queue -> partition lane -> result queue -> sink workers.
 *
 * <p>Each {@code (workspace, metric)} key hashes to one lane, a single thread with a bounded queue,
 * so events of a key are processed in order. Producers never block: above the high watermark every
 * Nth event is dropped, and a full queue drops the event. Lanes hand anomalies to a shared bounded
 * result queue drained by the sink workers.
 */
@Component
@ConditionalOnProperty(name = "radar.stream.enabled", havingValue = "true")
public class MetricLaneDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MetricLaneDispatcher.class);

    private final StreamProcessor processor;
    private final AnomalySink sink;
    private final MeterRegistry metrics;
    private final Lane[] lanes;
    private final int highWatermark;
    private final int sampleEvery;
    private final BlockingQueue<ScoredDetection> results;
    private final int sinkWorkers;
    private final long resultOfferTimeoutMs;
    private final Counter resultsDropped;
    private final List<Thread> sinkThreads = new ArrayList<>();
    private volatile boolean running;

    public MetricLaneDispatcher(StreamProcessor processor,
                                AnomalySink sink,
                                @Value("${radar.stream.lanes:8}") int laneCount,
                                @Value("${radar.stream.lane-capacity:10000}") int laneCapacity,
                                @Value("${radar.stream.high-watermark:0.8}") double highWatermarkRatio,
                                @Value("${radar.stream.sample-every:2}") int sampleEvery,
                                @Value("${radar.stream.result-capacity:10000}") int resultCapacity,
                                @Value("${radar.stream.sink-workers:2}") int sinkWorkers,
                                @Value("${radar.stream.result-offer-timeout-ms:1000}") long resultOfferTimeoutMs,
                                MeterRegistry metrics) {
        if (laneCount <= 0 || laneCapacity <= 0 || sampleEvery <= 0) {
            throw new IllegalArgumentException("lanes, lane capacity and sample-every must be positive");
        }
        this.processor = processor;
        this.sink = sink;
        this.metrics = metrics;
        this.highWatermark = Math.max(1, (int) Math.ceil(laneCapacity * highWatermarkRatio));
        this.sampleEvery = sampleEvery;
        this.results = new ArrayBlockingQueue<>(resultCapacity);
        this.sinkWorkers = sinkWorkers;
        this.resultOfferTimeoutMs = resultOfferTimeoutMs;
        this.resultsDropped = metrics.counter("radar_stream_results_dropped_total");
        this.lanes = new Lane[laneCount];
        for (int i = 0; i < laneCount; i++) {
            lanes[i] = new Lane(i, laneCapacity);
        }
    }

    @PostConstruct
    public void start() {
        running = true;
        for (Lane lane : lanes) {
            lane.thread.start();
        }
        for (int i = 0; i < sinkWorkers; i++) {
            Thread t = new Thread(this::sinkLoop, "radar-sink-" + i);
            t.setDaemon(true);
            sinkThreads.add(t);
            t.start();
        }
        log.info("Stream lanes started: lanes={} highWatermark={} sampleEvery={} sinkWorkers={}",
            lanes.length, highWatermark, sampleEvery, sinkWorkers);
    }

    @PreDestroy
    public void stop() {
        running = false;
        for (Lane lane : lanes) lane.thread.interrupt();
        sinkThreads.forEach(Thread::interrupt);
        for (Lane lane : lanes) join(lane.thread);
        sinkThreads.forEach(MetricLaneDispatcher::join);
        log.info("Stream lanes stopped; pending results dropped={}", results.size());
    }

    /** Routes an event to its lane. Returns false if backpressure dropped it. Never blocks. */
    public boolean submit(MetricEvent event) {
        return lanes[laneFor(event.key(), lanes.length)].offer(event);
    }

    /** Joins an asynchronously produced result (batch methods) into the sink path. */
    public boolean publishResult(ScoredDetection detection) {
        if (results.offer(detection)) return true;
        resultsDropped.increment();
        log.error("Result queue full, dropping detection fingerprint={}", detection.fingerprint());
        return false;
    }

    static int laneFor(MetricKey key, int laneCount) {
        return Math.floorMod(key.hashCode(), laneCount);
    }

    public int laneCount() {
        return lanes.length;
    }

    public long droppedEvents(int lane) {
        return lanes[lane].dropped.get();
    }

    public int queueDepth(int lane) {
        return lanes[lane].queue.size();
    }

    private void emit(ScoredDetection detection) {
        try {
            if (!results.offer(detection, resultOfferTimeoutMs, TimeUnit.MILLISECONDS)) {
                resultsDropped.increment();
                log.error("Result queue full for {}ms, dropping detection fingerprint={}", resultOfferTimeoutMs,
                    detection.fingerprint());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void sinkLoop() {
        while (running) {
            ScoredDetection detection;
            try {
                detection = results.poll(500, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (detection == null) continue;
            try {
                ProcessingStage stage = sink.record(detection);
                log.debug("fingerprint={} stage={} -> {}", detection.fingerprint(), stage, ProcessingStage.DONE);
            } catch (PersistenceUnavailableException e) {
                log.error("Dropping detection fingerprint={} ws={} metric={}: {}", detection.fingerprint(),
                    detection.key().workspaceId(), detection.key().metricType(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Sink failed for fingerprint={}", detection.fingerprint(), e);
            }
        }
    }

    private static void join(Thread t) {
        try {
            t.join(5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private final class Lane {
        final int index;
        final BlockingQueue<MetricEvent> queue;
        final AtomicLong dropped = new AtomicLong();
        final AtomicLong overWatermark = new AtomicLong();
        final Counter droppedCounter;
        final Thread thread;

        Lane(int index, int capacity) {
            this.index = index;
            this.queue = new ArrayBlockingQueue<>(capacity);
            this.droppedCounter = metrics.counter("radar_stream_events_dropped_total", "lane", String.valueOf(index));
            this.thread = new Thread(this::run, "radar-lane-" + index);
            this.thread.setDaemon(true);
        }

        boolean offer(MetricEvent event) {
            if (queue.size() >= highWatermark && overWatermark.incrementAndGet() % sampleEvery == 0) {
                return drop(event, "sampled");
            }
            if (!queue.offer(event)) {
                return drop(event, "full");
            }
            return true;
        }

        private boolean drop(MetricEvent event, String reason) {
            long total = dropped.incrementAndGet();
            droppedCounter.increment();
            if (total == 1 || total % 1000 == 0) {
                log.warn("Lane {} dropping events ({}): total dropped={} depth={} last key={}", index, reason, total,
                    queue.size(), event.key());
            }
            return false;
        }

        private void run() {
            while (running) {
                MetricEvent event;
                try {
                    event = queue.poll(500, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (event == null) continue;
                try {
                    processor.process(event, MetricLaneDispatcher.this::emit);
                } catch (RuntimeException e) {
                    log.error("Lane {} failed to process event for {}", index, event.key(), e);
                }
            }
        }
    }
}

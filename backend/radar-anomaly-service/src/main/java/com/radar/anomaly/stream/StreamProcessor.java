package com.radar.anomaly.stream;

import com.radar.anomaly.baseline.BaselineStore;
import com.radar.anomaly.model.MetricEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Per-event work done on a partition lane: evaluate, hand results downstream, then feed the
 * baseline and the recent-points window. Called by a single thread per key.
 */
@Component
public class StreamProcessor {

    private static final Logger log = LoggerFactory.getLogger(StreamProcessor.class);

    private final DetectionEngine engine;
    private final BaselineStore baselines;
    private final RecentPointsBuffer recent;
    private final boolean includeAnomalies;
    private final MeterRegistry metrics;
    private final Counter eventsProcessed;
    private final Counter detectionsEmitted;
    private final Timer processDuration;

    public StreamProcessor(DetectionEngine engine,
                           BaselineStore baselines,
                           RecentPointsBuffer recent,
                           @Value("${radar.baseline.include-anomalies:true}") boolean includeAnomalies,
                           MeterRegistry metrics) {
        this.engine = engine;
        this.baselines = baselines;
        this.recent = recent;
        this.includeAnomalies = includeAnomalies;
        this.metrics = metrics;
        this.eventsProcessed = metrics.counter("radar_stream_events_processed_total");
        this.detectionsEmitted = metrics.counter("radar_stream_detections_total");
        this.processDuration = metrics.timer("radar_stream_process_duration_seconds");
    }

    public EvaluationReport process(MetricEvent event, Consumer<ScoredDetection> results) {
        Timer.Sample sample = Timer.start(metrics);
        try {
            log.debug("Event {} stage={} value={}", event.key(), ProcessingStage.RECEIVED, event.value());
            EvaluationReport report = engine.evaluate(event);
            for (ScoredDetection detection : report.detections()) {
                log.debug("Event {} stage={} method={} severity={}", event.key(), ProcessingStage.SCORED,
                    detection.method().wireName(), detection.severity().wireName());
                results.accept(detection);
                detectionsEmitted.increment();
            }
            if (includeAnomalies || !report.hasDetections()) {
                baselines.updateIncremental(event.key(), event.value());
            }
            recent.append(event.key(), event.point());
            eventsProcessed.increment();
            return report;
        } finally {
            sample.stop(processDuration);
        }
    }
}

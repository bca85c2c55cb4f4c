package com.radar.anomaly.stream;

import com.radar.anomaly.baseline.BaselineSnapshot;
import com.radar.anomaly.baseline.BaselineStore;
import com.radar.anomaly.error.RulesUnavailableException;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.MetricKey;
import com.radar.anomaly.model.MetricPoint;
import com.radar.anomaly.rules.ResolvedRule;
import com.radar.anomaly.rules.RuleEngine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the window-based methods on their own cadence and joins their results into the sink path.
 * A per-(key, method) watermark on arrival order keeps a point from being reported twice by
 * overlapping windows; a point that arrives late, behind newer timestamps, is still reported once.
 */
@Component
@ConditionalOnProperty(name = "radar.stream.enabled", havingValue = "true")
public class BatchDetectionScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchDetectionScheduler.class);

    private final RuleEngine rules;
    private final RecentPointsBuffer recent;
    private final BaselineStore baselines;
    private final DetectionEngine engine;
    private final MetricLaneDispatcher dispatcher;
    private final MeterRegistry metrics;
    private final ConcurrentHashMap<Watermark, Long> watermarks = new ConcurrentHashMap<>();

    record Watermark(MetricKey key, DetectionMethod method) {}

    public BatchDetectionScheduler(RuleEngine rules,
                                   RecentPointsBuffer recent,
                                   BaselineStore baselines,
                                   DetectionEngine engine,
                                   MetricLaneDispatcher dispatcher,
                                   MeterRegistry metrics) {
        this.rules = rules;
        this.recent = recent;
        this.baselines = baselines;
        this.engine = engine;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${radar.batch.isolation-interval-ms:300000}",
               initialDelayString = "${radar.batch.isolation-interval-ms:300000}")
    public void runIsolationForest() {
        run(DetectionMethod.ISOLATION_FOREST);
    }

    @Scheduled(fixedDelayString = "${radar.batch.autoencoder-interval-ms:900000}",
               initialDelayString = "${radar.batch.autoencoder-interval-ms:900000}")
    public void runAutoencoder() {
        run(DetectionMethod.AUTOENCODER);
    }

    /** One pass of {@code method} over every key with buffered points. Returns detections published. */
    public int run(DetectionMethod method) {
        Timer.Sample sample = Timer.start(metrics);
        int keys = 0;
        int published = 0;
        try {
            for (MetricKey key : recent.keys()) {
                List<ResolvedRule> matching;
                try {
                    matching = rules.resolve(key).stream()
                        .filter(r -> r.method() == method)
                        .toList();
                } catch (RulesUnavailableException e) {
                    log.warn("[batch {}] pass skipped: {}", method.wireName(), e.getMessage());
                    return published;
                }
                if (matching.isEmpty()) continue;
                Long mark = watermarks.get(new Watermark(key, method));
                RecentPointsBuffer.Window window = recent.window(key, mark == null ? 0 : mark);
                if (window.isEmpty() || (mark != null && window.arrivedAfterMark().isEmpty())) continue;
                keys++;
                published += runKey(key, method, matching, window);
            }
            log.info("[batch {}] evaluated {} keys, published {} detections", method.wireName(), keys, published);
        } finally {
            sample.stop(metrics.timer("radar_batch_run_duration_seconds", "method", method.wireName()));
        }
        return published;
    }

    private int runKey(MetricKey key, DetectionMethod method, List<ResolvedRule> matching,
                       RecentPointsBuffer.Window window) {
        Watermark mark = new Watermark(key, method);
        Predicate<MetricPoint> reportable = watermarks.containsKey(mark) ? window.arrivedAfterMark()::contains : null;
        BaselineSnapshot baseline = null;
        try {
            baseline = baselines.get(key).orElse(null);
        } catch (RuntimeException e) {
            log.debug("No baseline for batch context {}: {}", key, e.getMessage());
        }
        int published = 0;
        for (ResolvedRule rule : matching) {
            try {
                EvaluationReport report = engine.evaluateWindow(key, rule, window.points(), baseline, reportable);
                for (MethodWarning w : report.warnings()) {
                    log.debug("[batch {}] {} rule={}: {}", method.wireName(), key, w.ruleId(), w.reason());
                }
                for (ScoredDetection d : report.detections()) {
                    if (dispatcher.publishResult(d)) published++;
                }
            } catch (RuntimeException e) {
                log.error("[batch {}] failed for {} rule={}", method.wireName(), key, rule.id(), e);
            }
        }
        watermarks.put(mark, window.lastArrival());
        return published;
    }
}

package com.radar.anomaly.stream;

import com.radar.anomaly.alert.AlertDispatcher;
import com.radar.anomaly.alert.AlertEvent;
import com.radar.anomaly.alert.AlertType;
import com.radar.anomaly.error.PersistenceUnavailableException;
import com.radar.anomaly.lifecycle.AnomalyLifecycleManager;
import com.radar.anomaly.lifecycle.UpsertResult;
import com.radar.anomaly.model.AnomalyDetection;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Persists a detection and decides whether it alerts. Alerts go out once per new incident and
 * once per severity increase; plain occurrence bumps never alert.
 */
@Component
public class AnomalySink {

    private static final Logger log = LoggerFactory.getLogger(AnomalySink.class);

    private final AnomalyLifecycleManager lifecycle;
    private final AlertDispatcher alerts;
    private final Clock clock;
    private final int maxAttempts;
    private final long backoffMs;
    private final Counter alertsSuppressed;

    public AnomalySink(AnomalyLifecycleManager lifecycle,
                       AlertDispatcher alerts,
                       Clock clock,
                       @Value("${radar.lifecycle.upsert-attempts:3}") int maxAttempts,
                       @Value("${radar.lifecycle.upsert-backoff-ms:100}") long backoffMs,
                       MeterRegistry metrics) {
        this.lifecycle = lifecycle;
        this.alerts = alerts;
        this.clock = clock;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = backoffMs;
        this.alertsSuppressed = metrics.counter("radar_alerts_suppressed_total");
    }

    /**
     * @return {@link ProcessingStage#ALERTED} or {@link ProcessingStage#SUPPRESSED}
     * @throws PersistenceUnavailableException when every upsert attempt failed
     */
    public ProcessingStage record(ScoredDetection detection) {
        UpsertResult result = upsertWithRetry(detection);
        ProcessingStage persisted = result.created() ? ProcessingStage.NEW_ANOMALY : ProcessingStage.DEDUPED;
        log.debug("fingerprint={} stage={}", detection.fingerprint(), persisted);

        AnomalyDetection anomaly = result.detection();
        boolean changed = result.created() || result.severityRaised();
        if (!detection.autoAlert() || !changed || !anomaly.getSeverity().isAtLeast(detection.alertMinSeverity())) {
            if (detection.autoAlert() && changed) alertsSuppressed.increment();
            return ProcessingStage.SUPPRESSED;
        }
        alerts.dispatch(new AlertEvent(
            result.created() ? AlertType.ANOMALY_DETECTED : AlertType.ANOMALY_ESCALATED,
            anomaly.getWorkspaceId(), anomaly.getId(), anomaly.getMetricType(), anomaly.getSeverity(),
            anomaly.getNormalizedScore(), detection.alertChannels(), clock.instant()));
        return ProcessingStage.ALERTED;
    }

    private UpsertResult upsertWithRetry(ScoredDetection detection) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return lifecycle.upsert(detection);
            } catch (DataIntegrityViolationException e) {
                throw new PersistenceUnavailableException("store rejected anomaly fingerprint="
                    + detection.fingerprint(), e);
            } catch (DataAccessException | TransactionException e) {
                last = e;
                log.warn("Upsert attempt {}/{} failed for fingerprint={}: {}", attempt, maxAttempts,
                    detection.fingerprint(), e.getMessage());
                if (attempt < maxAttempts) {
                    try {
                        Thread.sleep(backoffMs << (attempt - 1));
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new PersistenceUnavailableException("interrupted while retrying upsert", ie);
                    }
                }
            }
        }
        throw new PersistenceUnavailableException("upsert failed after " + maxAttempts + " attempts for fingerprint="
            + detection.fingerprint(), last);
    }
}

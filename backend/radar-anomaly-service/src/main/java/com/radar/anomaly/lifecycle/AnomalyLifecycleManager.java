package com.radar.anomaly.lifecycle;

import com.radar.anomaly.error.AnomalyNotFoundException;
import com.radar.anomaly.error.IllegalStatusTransitionException;
import com.radar.anomaly.model.AnomalyDetection;
import com.radar.anomaly.model.AnomalyStatus;
import com.radar.anomaly.repo.AnomalyDetectionRepository;
import com.radar.anomaly.stream.ScoredDetection;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Owns {@code anomaly_detections}: the fingerprint upsert and the status state machine.
 */
@Service
public class AnomalyLifecycleManager {

  private static final Logger log = LoggerFactory.getLogger(AnomalyLifecycleManager.class);
  private static final String UNIQUE_VIOLATION = "23505";

  private final AnomalyDetectionRepository repo;
  private final TransactionTemplate tx;
  private final Clock clock;
  private final int raceRetries;
  private final Counter created;
  private final Counter merged;
  private final Counter raceLost;
  private final Counter falsePositives;

  public AnomalyLifecycleManager(AnomalyDetectionRepository repo,
                                 PlatformTransactionManager transactionManager,
                                 Clock clock,
                                 @Value("${radar.lifecycle.race-retries:5}") int raceRetries,
                                 MeterRegistry metrics) {
    this.repo = repo;
    this.tx = new TransactionTemplate(transactionManager);
    this.clock = clock;
    this.raceRetries = raceRetries;
    this.created = metrics.counter("radar_anomalies_upserted_total", "result", "created");
    this.merged = metrics.counter("radar_anomalies_upserted_total", "result", "merged");
    this.raceLost = metrics.counter("radar_anomalies_upsert_conflicts_total");
    this.falsePositives = metrics.counter("radar_anomalies_false_positive_total");
  }

  /**
   * Inserts a new incident for the fingerprint or folds the detection into the existing one. An
   * insert that loses the race on the unique fingerprint is retried and lands as a merge. Any other
   * integrity violation is rethrown on the first attempt.
   *
   * @throws DataAccessException when the store fails for a reason other than a lost race
   */
  public UpsertResult upsert(ScoredDetection detection) {
    for (int attempt = 1; ; attempt++) {
      try {
        UpsertResult result = tx.execute(status -> upsertOnce(detection));
        (result.created() ? created : merged).increment();
        return result;
      } catch (DataIntegrityViolationException e) {
        if (!isUniqueViolation(e)) throw e;
        raceLost.increment();
        if (attempt >= raceRetries) throw e;
        log.debug("Upsert race on fingerprint={} (attempt {}), retrying as merge", detection.fingerprint(), attempt);
      } catch (ConcurrencyFailureException e) {
        raceLost.increment();
        if (attempt >= raceRetries) throw e;
        log.debug("Upsert race on fingerprint={} (attempt {}), retrying as merge", detection.fingerprint(), attempt);
      }
    }
  }

  static boolean isUniqueViolation(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) return true;
      if (t.getCause() == t) break;
    }
    return false;
  }

  private UpsertResult upsertOnce(ScoredDetection d) {
    Optional<AnomalyDetection> existing = repo.lockByFingerprint(d.fingerprint());
    if (existing.isEmpty()) {
      AnomalyDetection a = AnomalyDetection.open(d.fingerprint(), d.key().workspaceId(), d.key().metricType(),
          d.method(), d.ruleId(), d.detectedAt(), clock.instant());
      a.recordPeak(d.value(), d.rawScore(), d.normalizedScore(), d.confidence(), d.severity(),
          d.expectedRange(), d.context());
      AnomalyDetection saved = repo.saveAndFlush(a);
      log.info("New anomaly id={} ws={} metric={} method={} severity={} score={}", saved.getId(),
          saved.getWorkspaceId(), saved.getMetricType(), saved.getMethod().wireName(),
          saved.getSeverity().wireName(), String.format("%.3f", saved.getNormalizedScore()));
      return new UpsertResult(saved, true, false);
    }

    AnomalyDetection a = existing.get();
    a.recordOccurrence(d.detectedAt());
    boolean raised = false;
    // closed incidents only count occurrences
    if (a.getStatus().isOpen() && d.normalizedScore() > a.getNormalizedScore()) {
      raised = d.severity().compareTo(a.getSeverity()) > 0;
      a.recordPeak(d.value(), d.rawScore(), d.normalizedScore(), d.confidence(), d.severity(),
          d.expectedRange(), d.context());
    }
    if (raised) {
      log.info("Anomaly id={} escalated to {} (occurrences={})", a.getId(), a.getSeverity().wireName(),
          a.getOccurrenceCount());
    } else {
      log.debug("Anomaly id={} deduped (occurrences={})", a.getId(), a.getOccurrenceCount());
    }
    return new UpsertResult(a, false, raised);
  }

  public AnomalyDetection get(String workspaceId, String id) {
    return repo.findByIdAndWorkspaceId(id, workspaceId)
        .orElseThrow(() -> new AnomalyNotFoundException("anomaly not found: " + id));
  }

  /**
   * Applies a status action. Repeating an action, or asking for a state already passed, returns the
   * current state unchanged. Resolving an ignored anomaly or ignoring a resolved one is rejected.
   */
  public AnomalyDetection transition(String workspaceId, String id, StatusAction action, String actor,
                                     String notes, boolean falsePositive) {
    if (action.closes() && (notes == null || notes.isBlank())) {
      throw new IllegalArgumentException("notes are required to " + action.name().toLowerCase() + " an anomaly");
    }
    if (notes != null && notes.length() > AnomalyDetection.MAX_NOTES_LENGTH) {
      throw new IllegalArgumentException("notes must be at most " + AnomalyDetection.MAX_NOTES_LENGTH
          + " characters");
    }
    return tx.execute(status -> {
      AnomalyDetection a = repo.lockByIdAndWorkspace(id, workspaceId)
          .orElseThrow(() -> new AnomalyNotFoundException("anomaly not found: " + id));
      AnomalyStatus current = a.getStatus();
      AnomalyStatus target = action.target();
      if (current == target) {
        return a;
      }
      if (!current.isOpen()) {
        if (action.closes()) {
          throw new IllegalStatusTransitionException("anomaly " + id + " is already " + current.wireName()
              + ", cannot move to " + target.wireName());
        }
        return a;
      }
      Instant now = clock.instant();
      switch (action) {
        case ACKNOWLEDGE -> {
          if (current == AnomalyStatus.NEW) a.acknowledge(actor, notes, now);
        }
        case INVESTIGATE -> a.investigate(actor, notes, now);
        case RESOLVE, IGNORE -> {
          a.close(target, actor, notes, falsePositive, now);
          if (falsePositive) {
            falsePositives.increment();
            log.info("Anomaly id={} marked false positive by {} (rule={})", id, actor, a.getRuleId());
          }
        }
      }
      log.info("Anomaly id={} {} -> {} by {}", id, current.wireName(), a.getStatus().wireName(), actor);
      return a;
    });
  }
}

package com.radar.anomaly.baseline;

import com.radar.anomaly.alert.AlertDispatcher;
import com.radar.anomaly.alert.AlertEvent;
import com.radar.anomaly.alert.AlertType;
import com.radar.anomaly.error.DataUnavailableException;
import com.radar.anomaly.error.ModelTrainingException;
import com.radar.anomaly.model.BaselineModel;
import com.radar.anomaly.model.BaselineStatus;
import com.radar.anomaly.model.MetricKey;
import com.radar.anomaly.model.MetricPoint;
import com.radar.anomaly.model.Severity;
import com.radar.anomaly.repo.BaselineModelRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

/**
 * Per-(workspace, metric) baseline registry.
 *
 * <p>Each key owns a {@link BaselineSlot} with its own lock. Incremental updates go through the
 * slot's pending queue and are applied by whichever caller obtains the lock, so a running retrain
 * never blocks ingestion: values that arrive meanwhile stay queued and are replayed, in arrival
 * order, right after the retrained statistics are installed.
 *
 * <p>Readers get immutable {@link BaselineSnapshot}s and never take the lock.
 */
@Component
public class BaselineStore {

  private static final Logger log = LoggerFactory.getLogger(BaselineStore.class);

  private final ConcurrentHashMap<MetricKey, BaselineSlot> slots = new ConcurrentHashMap<>();

  private final BaselineModelRepository repo;
  private final MetricHistoryClient history;
  private final AlertDispatcher alerts;
  private final Clock clock;
  private final Duration maxAge;
  private final int failureThreshold;
  private final long backoffBaseMs;
  private final long backoffMaxMs;
  private final int trainingWindowDays;

  private final Counter retrainSucceeded;
  private final Counter retrainFailed;
  private final Counter baselinesDegraded;

  public BaselineStore(BaselineModelRepository repo,
                       MetricHistoryClient history,
                       AlertDispatcher alerts,
                       Clock clock,
                       @Value("${radar.baseline.max-age-days:7}") int maxAgeDays,
                       @Value("${radar.baseline.failure-threshold:3}") int failureThreshold,
                       @Value("${radar.baseline.retry-backoff-base-ms:60000}") long backoffBaseMs,
                       @Value("${radar.baseline.retry-backoff-max-ms:3600000}") long backoffMaxMs,
                       @Value("${radar.baseline.training-window-days:90}") int trainingWindowDays,
                       MeterRegistry metrics) {
    this.repo = repo;
    this.history = history;
    this.alerts = alerts;
    this.clock = clock;
    this.maxAge = Duration.ofDays(maxAgeDays);
    this.failureThreshold = failureThreshold;
    this.backoffBaseMs = backoffBaseMs;
    this.backoffMaxMs = backoffMaxMs;
    this.trainingWindowDays = trainingWindowDays;
    this.retrainSucceeded = metrics.counter("radar_baseline_retrain_total", "outcome", "success");
    this.retrainFailed = metrics.counter("radar_baseline_retrain_total", "outcome", "failure");
    this.baselinesDegraded = metrics.counter("radar_baseline_degraded_total");
  }

  /** Current baseline, or empty on cold start. */
  public Optional<BaselineSnapshot> get(MetricKey key) {
    return Optional.ofNullable(slot(key).snapshot);
  }

  public void updateIncremental(MetricKey key, double value) {
    if (!Double.isFinite(value)) {
      log.debug("Ignoring non-finite value for {}", key);
      return;
    }
    BaselineSlot slot;
    try {
      slot = slot(key);
    } catch (DataUnavailableException e) {
      log.warn("Baseline update skipped for {}: {}", key, e.getMessage());
      return;
    }
    slot.pending.add(value);
    drain(slot);
  }

  public BaselineSnapshot retrain(MetricKey key) {
    return retrain(key, trainingWindowDays);
  }

  /**
   * Recomputes statistics from the last {@code windowDays} of history and installs them atomically.
   *
   * @throws DataUnavailableException if the window holds no values (not counted as a failure)
   * @throws ModelTrainingException if history could not be read or summarized
   */
  public BaselineSnapshot retrain(MetricKey key, int windowDays) {
    if (windowDays <= 0) {
      throw new IllegalArgumentException("training window must be positive: " + windowDays);
    }
    BaselineSlot slot = slot(key);
    try {
      slot.lock.lockInterruptibly();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ModelTrainingException("retrain interrupted for " + key, e);
    }
    BaselineSnapshot installed;
    try {
      Instant end = clock.instant();
      Instant start = end.minus(Duration.ofDays(windowDays));
      List<MetricPoint> points;
      try {
        points = history.fetch(key, start, end);
      } catch (RuntimeException e) {
        recordFailure(slot, e);
        throw new ModelTrainingException("history fetch failed for " + key + ": " + e.getMessage(), e);
      }
      double[] values = points.stream().mapToDouble(MetricPoint::value).filter(Double::isFinite).toArray();
      if (values.length == 0) {
        throw new DataUnavailableException("no history for " + key + " in the last " + windowDays + " days");
      }
      BaselineStatistics.Summary summary;
      try {
        summary = BaselineStatistics.summarize(values);
      } catch (RuntimeException e) {
        recordFailure(slot, e);
        throw new ModelTrainingException("statistics failed for " + key + ": " + e.getMessage(), e);
      }

      slot.count = summary.count();
      slot.mean = summary.mean();
      slot.m2 = summary.m2();
      slot.min = summary.min();
      slot.max = summary.max();
      slot.percentiles = summary.percentiles();
      slot.trainingStart = start;
      slot.trainingEnd = end;
      slot.lastUpdated = end;
      slot.status = BaselineStatus.FRESH;
      slot.failures = 0;
      slot.nextRetryAt = Instant.EPOCH;
      int replayed = applyPending(slot);
      slot.publish();
      slot.dirty = true;
      installed = slot.snapshot;
      retrainSucceeded.increment();
      log.info("Retrained baseline {}: n={} mean={} std={} replayed={}", key, summary.count(),
          String.format("%.4f", installed.mean()), String.format("%.4f", installed.std()), replayed);
    } finally {
      slot.lock.unlock();
      drain(slot);
    }
    persistQuietly(slot);
    return installed;
  }

  /**
   * Keys whose model is past max age, or failing and out of backoff. Aged fresh models are marked
   * stale on the way.
   */
  public List<MetricKey> keysDueForRetrain() {
    Set<MetricKey> keys = new LinkedHashSet<>(slots.keySet());
    try {
      for (BaselineModel m : repo.findAll()) {
        keys.add(new MetricKey(m.getWorkspaceId(), m.getMetricType()));
      }
    } catch (DataAccessException e) {
      log.warn("Could not list persisted baselines, checking loaded ones only: {}", e.getMessage());
    }
    Instant now = clock.instant();
    Instant cutoff = now.minus(maxAge);
    List<MetricKey> due = new ArrayList<>();
    for (MetricKey key : keys) {
      BaselineSlot slot;
      try {
        slot = slot(key);
      } catch (DataUnavailableException e) {
        continue;
      }
      BaselineSnapshot s = slot.snapshot;
      if (s == null || now.isBefore(slot.nextRetryAt)) continue;
      boolean aged = s.lastUpdated().isBefore(cutoff);
      if (aged && s.status() == BaselineStatus.FRESH) {
        markStale(slot);
      }
      if (aged || s.status() == BaselineStatus.DEGRADED || s.consecutiveFailures() > 0) {
        due.add(key);
      }
    }
    return due;
  }

  /** Writes back every slot changed since its last write. Returns the number written. */
  public int flushDirty() {
    int written = 0;
    for (BaselineSlot slot : slots.values()) {
      if (slot.dirty && persistQuietly(slot)) written++;
    }
    if (written > 0) log.debug("Flushed {} baseline models", written);
    return written;
  }

  /** Baselines known for a workspace, live state preferred over the stored row. */
  public List<BaselineSnapshot> list(String workspaceId) {
    Map<MetricKey, BaselineSnapshot> out = new LinkedHashMap<>();
    for (BaselineModel m : repo.findByWorkspaceIdOrderByMetricTypeAsc(workspaceId)) {
      MetricKey key = new MetricKey(m.getWorkspaceId(), m.getMetricType());
      BaselineSlot live = slots.get(key);
      out.put(key, live != null && live.snapshot != null ? live.snapshot : BaselineSnapshot.fromEntity(m));
    }
    slots.forEach((key, slot) -> {
      if (key.workspaceId().equals(workspaceId) && slot.snapshot != null) {
        out.putIfAbsent(key, slot.snapshot);
      }
    });
    return new ArrayList<>(out.values());
  }

  BaselineSlot slot(MetricKey key) {
    BaselineSlot existing = slots.get(key);
    if (existing != null) return existing;
    BaselineSlot loaded = load(key);
    BaselineSlot prior = slots.putIfAbsent(key, loaded);
    return prior != null ? prior : loaded;
  }

  private BaselineSlot load(MetricKey key) {
    try {
      BaselineSlot slot = new BaselineSlot(key);
      repo.findByWorkspaceIdAndMetricType(key.workspaceId(), key.metricType()).ifPresent(slot::restore);
      return slot;
    } catch (DataAccessException e) {
      throw new DataUnavailableException("baseline lookup failed for " + key, e);
    }
  }

  private void drain(BaselineSlot slot) {
    while (!slot.pending.isEmpty() && slot.lock.tryLock()) {
      try {
        if (applyPending(slot) > 0) {
          slot.publish();
          slot.dirty = true;
        }
      } finally {
        slot.lock.unlock();
      }
    }
  }

  /** Welford update for every queued value. Caller holds the slot lock. */
  private int applyPending(BaselineSlot slot) {
    int applied = 0;
    Double v;
    while ((v = slot.pending.poll()) != null) {
      if (!slot.hasModel()) {
        slot.lastUpdated = clock.instant();
        slot.status = BaselineStatus.FRESH;
      }
      slot.count++;
      double delta = v - slot.mean;
      slot.mean += delta / slot.count;
      slot.m2 += delta * (v - slot.mean);
      if (slot.m2 < 0) slot.m2 = 0;
      slot.min = slot.min == null ? v : Math.min(slot.min, v);
      slot.max = slot.max == null ? v : Math.max(slot.max, v);
      applied++;
    }
    return applied;
  }

  /** Caller holds the slot lock. */
  private void recordFailure(BaselineSlot slot, Exception cause) {
    slot.failures++;
    retrainFailed.increment();
    long delay = Math.min(backoffMaxMs, backoffBaseMs << Math.min(slot.failures - 1, 20));
    slot.nextRetryAt = clock.instant().plusMillis(delay);
    log.warn("Retrain failed for {} (consecutive failures={}, next attempt after {}): {}",
        slot.key, slot.failures, slot.nextRetryAt, cause.getMessage());
    if (slot.failures >= failureThreshold && slot.status != BaselineStatus.DEGRADED) {
      slot.status = BaselineStatus.DEGRADED;
      baselinesDegraded.increment();
      log.error("Baseline {} degraded after {} consecutive retrain failures", slot.key, slot.failures);
      alerts.dispatch(new AlertEvent(AlertType.BASELINE_DEGRADED, slot.key.workspaceId(), null,
          slot.key.metricType(), Severity.HIGH, 0.0, List.of(), clock.instant()));
    }
    slot.publish();
    slot.dirty = true;
  }

  private void markStale(BaselineSlot slot) {
    slot.lock.lock();
    try {
      if (slot.status == BaselineStatus.FRESH) {
        slot.status = BaselineStatus.STALE;
        slot.publish();
        slot.dirty = true;
        log.info("Baseline {} is stale (last updated {})", slot.key, slot.lastUpdated);
      }
    } finally {
      slot.lock.unlock();
    }
    drain(slot);
  }

  private boolean persistQuietly(BaselineSlot slot) {
    try {
      persist(slot);
      return true;
    } catch (DataAccessException e) {
      log.warn("Could not persist baseline {}: {}", slot.key, e.getMessage());
      return false;
    }
  }

  private void persist(BaselineSlot slot) {
    synchronized (slot) {
      BaselineSnapshot s = slot.snapshot;
      slot.dirty = false;
      if (s == null) return;
      try {
        slot.entity = repo.save(copyInto(slot.entity != null ? slot.entity
            : new BaselineModel(s.key().workspaceId(), s.key().metricType(), s.modelType()), s));
      } catch (DataIntegrityViolationException | OptimisticLockingFailureException e) {
        // the row was written elsewhere since this slot last saw it
        BaselineModel current = repo.findByWorkspaceIdAndMetricType(s.key().workspaceId(), s.key().metricType())
            .orElseThrow(() -> e);
        if (adoptIfRetrained(slot, current)) return;
        slot.entity = repo.save(copyInto(current, slot.snapshot));
      } catch (DataAccessException e) {
        slot.dirty = true;
        throw e;
      }
    }
  }

  /**
   * Reloads every loaded slot whose stored row was retrained by another instance. Returns the number
   * of slots reloaded.
   */
  public int refreshFromStore() {
    List<BaselineModel> rows;
    try {
      rows = repo.findAll();
    } catch (DataAccessException e) {
      log.warn("Could not read stored baselines for refresh: {}", e.getMessage());
      return 0;
    }
    int reloaded = 0;
    for (BaselineModel m : rows) {
      BaselineSlot slot = slots.get(new MetricKey(m.getWorkspaceId(), m.getMetricType()));
      if (slot == null) continue;
      synchronized (slot) {
        if (adoptIfRetrained(slot, m)) reloaded++;
      }
    }
    return reloaded;
  }

  /**
   * Installs {@code stored} when it was trained later than the slot's model. Values queued on the
   * slot are replayed on top; increments applied since the last write are dropped. Caller holds the
   * slot monitor.
   */
  private boolean adoptIfRetrained(BaselineSlot slot, BaselineModel stored) {
    Instant storedEnd = stored.getTrainingEnd();
    if (storedEnd == null) return false;
    slot.lock.lock();
    try {
      if (slot.trainingEnd != null && !storedEnd.isAfter(slot.trainingEnd)) return false;
      slot.restore(stored);
      slot.nextRetryAt = Instant.EPOCH;
      slot.dirty = false;
    } finally {
      slot.lock.unlock();
    }
    drain(slot);
    log.info("Baseline {} was retrained elsewhere (training end {}), reloaded n={} mean={}", slot.key,
        storedEnd, stored.getSampleCount(), String.format("%.4f", stored.getMean()));
    return true;
  }

  private static BaselineModel copyInto(BaselineModel m, BaselineSnapshot s) {
    m.setMean(s.mean());
    m.setVariance(s.variance());
    m.setM2(s.variance() * s.sampleCount());
    m.setSampleCount(s.sampleCount());
    m.setMinValue(s.min());
    m.setMaxValue(s.max());
    m.setPercentiles(new LinkedHashMap<String, Object>(s.percentiles()));
    m.setTrainingStart(s.trainingStart());
    m.setTrainingEnd(s.trainingEnd());
    m.setLastUpdated(s.lastUpdated());
    m.setStatus(s.status());
    m.setConsecutiveFailures(s.consecutiveFailures());
    return m;
  }

  /** Mutable per-key state. Plain fields are guarded by {@link #lock}. */
  static final class BaselineSlot {
    final MetricKey key;
    final ReentrantLock lock = new ReentrantLock();
    final ConcurrentLinkedQueue<Double> pending = new ConcurrentLinkedQueue<>();

    long count;
    double mean;
    double m2;
    Double min;
    Double max;
    Map<String, Double> percentiles = Map.of();
    Instant trainingStart;
    Instant trainingEnd;
    Instant lastUpdated;
    BaselineStatus status = BaselineStatus.FRESH;
    int failures;

    BaselineModel entity;
    volatile BaselineSnapshot snapshot;
    volatile Instant nextRetryAt = Instant.EPOCH;
    volatile boolean dirty;

    BaselineSlot(MetricKey key) {
      this.key = key;
    }

    void restore(BaselineModel m) {
      BaselineSnapshot s = BaselineSnapshot.fromEntity(m);
      entity = m;
      count = s.sampleCount();
      mean = s.mean();
      m2 = m.getM2() > 0 ? m.getM2() : s.variance() * s.sampleCount();
      min = s.min();
      max = s.max();
      percentiles = s.percentiles();
      trainingStart = s.trainingStart();
      trainingEnd = s.trainingEnd();
      lastUpdated = s.lastUpdated();
      status = s.status();
      failures = s.consecutiveFailures();
      publish();
    }

    boolean hasModel() {
      return lastUpdated != null;
    }

    void publish() {
      snapshot = hasModel()
          ? new BaselineSnapshot(key, BaselineSnapshot.MODEL_TYPE, mean, count > 0 ? m2 / count : 0.0, count,
              percentiles, min, max, trainingStart, trainingEnd, lastUpdated, status, failures)
          : null;
    }
  }
}

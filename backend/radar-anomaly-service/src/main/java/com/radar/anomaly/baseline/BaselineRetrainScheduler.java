package com.radar.anomaly.baseline;

import com.radar.anomaly.config.ExecutorConfig;
import com.radar.anomaly.error.DataUnavailableException;
import com.radar.anomaly.error.ModelTrainingException;
import com.radar.anomaly.model.MetricKey;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background retrain of stale or failing baselines, one cancellable task per key, plus the
 * periodic write-back of incrementally updated models.
 */
@Component
@ConditionalOnProperty(name = "radar.stream.enabled", havingValue = "true")
public class BaselineRetrainScheduler {

  private static final Logger log = LoggerFactory.getLogger(BaselineRetrainScheduler.class);

  private final BaselineStore store;
  private final ExecutorService executor;
  private final ConcurrentHashMap<MetricKey, Future<?>> inFlight = new ConcurrentHashMap<>();

  public BaselineRetrainScheduler(BaselineStore store,
                                  @Qualifier(ExecutorConfig.RETRAIN_EXECUTOR) ExecutorService executor) {
    this.store = store;
    this.executor = executor;
  }

  @Scheduled(fixedDelayString = "${radar.baseline.staleness-check-interval-ms:300000}",
             initialDelayString = "${radar.baseline.staleness-check-initial-delay-ms:60000}")
  public void retrainStale() {
    Instant start = Instant.now();
    try {
      List<MetricKey> due = store.keysDueForRetrain();
      int submitted = 0;
      for (MetricKey key : due) {
        if (submit(key)) submitted++;
      }
      if (!due.isEmpty()) {
        log.info("[retrainStale] {} baselines due, {} retrains submitted", due.size(), submitted);
      }
    } catch (Exception e) {
      log.error("Error in retrainStale task: {}", e.getMessage());
    } finally {
      log.debug("[retrainStale] finished in {} ms", Duration.between(start, Instant.now()).toMillis());
    }
  }

  @Scheduled(fixedDelayString = "${radar.baseline.flush-interval-ms:60000}")
  public void flushBaselines() {
    try {
      int reloaded = store.refreshFromStore();
      if (reloaded > 0) log.info("[flushBaselines] reloaded {} baselines retrained elsewhere", reloaded);
      store.flushDirty();
    } catch (Exception e) {
      log.error("Error in flushBaselines task: {}", e.getMessage());
    }
  }

  /** Submits a retrain for {@code key} unless one is already running. */
  public boolean submit(MetricKey key) {
    boolean[] submitted = {false};
    inFlight.compute(key, (k, existing) -> {
      if (existing != null && !existing.isDone()) return existing;
      submitted[0] = true;
      return executor.submit(() -> retrain(k));
    });
    return submitted[0];
  }

  public boolean cancel(MetricKey key) {
    Future<?> f = inFlight.remove(key);
    return f != null && f.cancel(true);
  }

  private void retrain(MetricKey key) {
    try {
      store.retrain(key);
    } catch (DataUnavailableException e) {
      log.info("Retrain skipped for {}: {}", key, e.getMessage());
    } catch (ModelTrainingException e) {
      log.warn("Retrain failed for {}: {}", key, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected retrain error for {}", key, e);
    }
  }

  @PreDestroy
  public void shutdown() {
    inFlight.values().forEach(f -> f.cancel(true));
    store.flushDirty();
  }
}

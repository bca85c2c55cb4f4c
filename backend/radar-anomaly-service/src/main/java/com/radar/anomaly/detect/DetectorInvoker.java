package com.radar.anomaly.detect;

import com.radar.anomaly.config.ExecutorConfig;
import com.radar.anomaly.error.DataUnavailableException;
import com.radar.anomaly.error.DetectionMethodException;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.MetricPoint;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Runs detector calls on a pool under a per-call timeout. A timeout or exception becomes a
 * {@link DetectionMethodException} for that call only; {@link DataUnavailableException} passes
 * through unchanged so callers can tell cold start from failure.
 */
@Component
public class DetectorInvoker {

  private static final Logger log = LoggerFactory.getLogger(DetectorInvoker.class);

  private final ExecutorService realtimeExecutor;
  private final ExecutorService batchExecutor;
  private final long realtimeTimeoutMs;
  private final long batchTimeoutMs;
  private final MeterRegistry metrics;

  public DetectorInvoker(@Qualifier(ExecutorConfig.DETECTOR_EXECUTOR) ExecutorService realtimeExecutor,
                         @Qualifier(ExecutorConfig.BATCH_EXECUTOR) ExecutorService batchExecutor,
                         @Value("${radar.detect.realtime-timeout-ms:200}") long realtimeTimeoutMs,
                         @Value("${radar.detect.batch-timeout-ms:60000}") long batchTimeoutMs,
                         MeterRegistry metrics) {
    this.realtimeExecutor = realtimeExecutor;
    this.batchExecutor = batchExecutor;
    this.realtimeTimeoutMs = realtimeTimeoutMs;
    this.batchTimeoutMs = batchTimeoutMs;
    this.metrics = metrics;
  }

  public RawScore score(Detector detector, double value, DetectionContext context) {
    return invoke(detector.method(), () -> detector.score(value, context), realtimeTimeoutMs, realtimeExecutor);
  }

  public List<PointScore> scoreWindow(BatchDetector detector, DetectionContext context) {
    return invoke(detector.method(), () -> detector.scoreWindow(context), batchTimeoutMs, batchExecutor);
  }

  /**
   * Scores every point of the window one at a time with a realtime detector, under the batch
   * timeout for the whole run.
   */
  public List<PointScore> scorePoints(Detector detector, DetectionContext context) {
    return invoke(detector.method(), () -> {
      List<PointScore> out = new ArrayList<>(context.window().size());
      for (MetricPoint p : context.window()) {
        if (Thread.currentThread().isInterrupted()) break;
        DetectionContext pointContext =
            DetectionContext.realtime(context.baseline(), context.parameters(), p.timestamp());
        out.add(new PointScore(p, detector.score(p.value(), pointContext)));
      }
      return out;
    }, batchTimeoutMs, batchExecutor);
  }

  private <T> T invoke(DetectionMethod method, Callable<T> call, long timeoutMs, ExecutorService executor) {
    Future<T> future;
    try {
      future = executor.submit(call);
    } catch (RejectedExecutionException e) {
      failure(method, "rejected");
      throw new DetectionMethodException(method, "detector pool rejected the call", e);
    }
    try {
      return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      failure(method, "timeout");
      throw new DetectionMethodException(method, "timed out after " + timeoutMs + " ms", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof DataUnavailableException unavailable) {
        throw unavailable;
      }
      failure(method, "error");
      log.debug("Detector {} failed", method.wireName(), cause);
      throw new DetectionMethodException(method, String.valueOf(cause.getMessage()), cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new DetectionMethodException(method, "interrupted", e);
    }
  }

  private void failure(DetectionMethod method, String reason) {
    metrics.counter("radar_detector_failures_total", "method", method.wireName(), "reason", reason).increment();
  }
}

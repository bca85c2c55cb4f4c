package com.radar.anomaly.service;

import com.radar.anomaly.baseline.BaselineSnapshot;
import com.radar.anomaly.baseline.BaselineStore;
import com.radar.anomaly.baseline.MetricHistoryClient;
import com.radar.anomaly.error.DataUnavailableException;
import com.radar.anomaly.error.RulesUnavailableException;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.MetricKey;
import com.radar.anomaly.model.MetricPoint;
import com.radar.anomaly.rules.ResolvedRule;
import com.radar.anomaly.rules.RuleEngine;
import com.radar.anomaly.rules.RuleParameters;
import com.radar.anomaly.rules.RuleValidator;
import com.radar.anomaly.scoring.AnomalyScorer;
import com.radar.anomaly.stream.DetectionEngine;
import com.radar.anomaly.stream.EvaluationReport;
import com.radar.anomaly.stream.MethodWarning;
import com.radar.anomaly.stream.ScoredDetection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Runs detection over a historical window on request. Results are returned to the caller only:
 * nothing is persisted and no alert is sent. A failing method becomes a warning; the request
 * itself only fails when there is no data to evaluate.
 */
@Service
public class OnDemandDetectionService {

  private static final Logger log = LoggerFactory.getLogger(OnDemandDetectionService.class);

  public static final int DEFAULT_LOOKBACK_DAYS = 30;
  public static final int MAX_LOOKBACK_DAYS = 365;

  private final MetricHistoryClient history;
  private final BaselineStore baselines;
  private final RuleEngine rules;
  private final RuleValidator validator;
  private final DetectionEngine engine;
  private final Clock clock;

  public OnDemandDetectionService(MetricHistoryClient history,
                                  BaselineStore baselines,
                                  RuleEngine rules,
                                  RuleValidator validator,
                                  DetectionEngine engine,
                                  Clock clock) {
    this.history = history;
    this.baselines = baselines;
    this.rules = rules;
    this.validator = validator;
    this.engine = engine;
    this.clock = clock;
  }

  public OnDemandResult detect(String workspaceId, OnDemandRequest request) {
    if (workspaceId == null || workspaceId.isBlank()) {
      throw new IllegalArgumentException("workspace id must not be blank");
    }
    if (request == null) {
      throw new IllegalArgumentException("request body is required");
    }
    RuleValidator.requireSupportedMetric(request.metricType());
    int lookback = request.lookbackDays() == null ? DEFAULT_LOOKBACK_DAYS : request.lookbackDays();
    if (lookback < 1 || lookback > MAX_LOOKBACK_DAYS) {
      throw new IllegalArgumentException("lookback_days must be between 1 and " + MAX_LOOKBACK_DAYS);
    }

    MetricKey key = new MetricKey(workspaceId, request.metricType());
    Instant to = clock.instant();
    Instant from = to.minus(Duration.ofDays(lookback));

    List<MetricPoint> points;
    try {
      points = history.fetch(key, from, to);
    } catch (DataAccessException e) {
      throw new DataUnavailableException("metric history unavailable for " + key, e);
    }
    if (points.isEmpty()) {
      throw new DataUnavailableException("no data points for " + key + " in the last " + lookback + " days");
    }

    List<MethodWarning> warnings = new ArrayList<>();
    List<ResolvedRule> active = rulesFor(key, request, warnings);

    BaselineSnapshot baseline = null;
    if (active.stream().anyMatch(r -> r.method().needsBaseline())) {
      try {
        baseline = baselines.get(key).orElse(null);
      } catch (RuntimeException e) {
        log.warn("Baseline lookup failed for {}, using window statistics: {}", key, e.getMessage());
      }
      if (baseline == null) {
        double[] values = points.stream().mapToDouble(MetricPoint::value).toArray();
        baseline = BaselineSnapshot.fromValues(key, values, points.get(0).timestamp(),
            points.get(points.size() - 1).timestamp());
        warnings.add(new MethodWarning(null, null, "no trained baseline, using statistics of the requested window"));
      }
    }

    List<ScoredDetection> anomalies = new ArrayList<>();
    for (ResolvedRule rule : active) {
      EvaluationReport report = engine.evaluateWindow(key, rule, points, baseline, null);
      anomalies.addAll(report.detections());
      warnings.addAll(report.warnings());
    }
    anomalies.sort(Comparator.comparing(ScoredDetection::detectedAt)
        .thenComparing(ScoredDetection::method));

    log.info("On-demand detection {} over {} points: {} rule(s), {} anomalies, {} warnings",
        key, points.size(), active.size(), anomalies.size(), warnings.size());
    return new OnDemandResult(workspaceId, request.metricType(), from, to, points.size(), anomalies, warnings);
  }

  private List<ResolvedRule> rulesFor(MetricKey key, OnDemandRequest request, List<MethodWarning> warnings) {
    if (request.method() != null) {
      return List.of(adHoc(key, request.method(), request));
    }
    List<ResolvedRule> configured;
    try {
      configured = rules.resolve(key);
    } catch (RulesUnavailableException e) {
      log.warn("Rule index unavailable for on-demand {}, threshold rules only: {}", key, e.getMessage());
      warnings.add(new MethodWarning(null, null, "rule resolution failed: " + e.getMessage()));
      configured = rules.resolveThresholdRules(key.workspaceId(), key.metricType());
    }
    if (!configured.isEmpty()) {
      if (request.sensitivity() == null) return configured;
      List<ResolvedRule> tuned = new ArrayList<>(configured.size());
      for (ResolvedRule r : configured) {
        tuned.add(r.method() == DetectionMethod.ZSCORE ? withSensitivity(r, request.sensitivity()) : r);
      }
      return tuned;
    }
    return List.of(adHoc(key, DetectionMethod.ZSCORE, request));
  }

  private ResolvedRule adHoc(MetricKey key, DetectionMethod method, OnDemandRequest request) {
    RuleParameters params = RuleParameters.of(request.parameters() == null ? Map.of() : request.parameters());
    if (method == DetectionMethod.ZSCORE && !params.has(RuleParameters.SENSITIVITY)) {
      params = params.with(RuleParameters.SENSITIVITY,
          request.sensitivity() == null ? AnomalyScorer.DEFAULT_SENSITIVITY : request.sensitivity());
    }
    validator.validate("ad-hoc " + method.wireName(), key.metricType(), method, params, List.of());
    return ResolvedRule.adHoc(key.workspaceId(), key.metricType(), method, params);
  }

  private ResolvedRule withSensitivity(ResolvedRule rule, double sensitivity) {
    RuleParameters params = rule.parameters().with(RuleParameters.SENSITIVITY, sensitivity);
    validator.validate(rule.name() == null ? "rule" : rule.name(), rule.metricType(), rule.method(), params,
        List.of());
    return new ResolvedRule(rule.id(), rule.workspaceId(), rule.metricType(), rule.name(), rule.method(),
        params, false, rule.alertChannels());
  }
}

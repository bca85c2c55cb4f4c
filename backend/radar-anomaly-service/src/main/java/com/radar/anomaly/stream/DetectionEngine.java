package com.radar.anomaly.stream;

import com.radar.anomaly.baseline.BaselineSnapshot;
import com.radar.anomaly.baseline.BaselineStore;
import com.radar.anomaly.detect.DetectionContext;
import com.radar.anomaly.detect.Detector;
import com.radar.anomaly.detect.DetectorInvoker;
import com.radar.anomaly.detect.DetectorRegistry;
import com.radar.anomaly.detect.PointScore;
import com.radar.anomaly.detect.RawScore;
import com.radar.anomaly.error.DataUnavailableException;
import com.radar.anomaly.error.DetectionMethodException;
import com.radar.anomaly.lifecycle.Fingerprints;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.MetricEvent;
import com.radar.anomaly.model.MetricKey;
import com.radar.anomaly.model.MetricPoint;
import com.radar.anomaly.rules.ResolvedRule;
import com.radar.anomaly.rules.RuleEngine;
import com.radar.anomaly.scoring.AnomalyScorer;
import com.radar.anomaly.scoring.NormalizedScore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Evaluates rules against values: resolve rules, fetch the baseline, score, normalize and
 * fingerprint. Stateless apart from its collaborators; persistence and alerting happen downstream.
 */
@Component
public class DetectionEngine {

  private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

  private final RuleEngine rules;
  private final BaselineStore baselines;
  private final DetectorRegistry detectors;
  private final DetectorInvoker invoker;
  private final AnomalyScorer scorer;
  private final Duration debounce;

  public DetectionEngine(RuleEngine rules,
                         BaselineStore baselines,
                         DetectorRegistry detectors,
                         DetectorInvoker invoker,
                         AnomalyScorer scorer,
                         @Value("${radar.lifecycle.debounce-minutes:15}") long debounceMinutes) {
    this.rules = rules;
    this.baselines = baselines;
    this.detectors = detectors;
    this.invoker = invoker;
    this.scorer = scorer;
    this.debounce = Duration.ofMinutes(debounceMinutes);
  }

  public Duration debounce() {
    return debounce;
  }

  /**
   * Realtime pass for one event. Batch methods are skipped here. If rules or the baseline cannot
   * be read, only threshold rules run. Results sharing a fingerprint are merged, highest score wins.
   */
  public EvaluationReport evaluate(MetricEvent event) {
    MetricKey key = event.key();
    List<MethodWarning> warnings = new ArrayList<>();

    List<ResolvedRule> active;
    try {
      active = rules.resolve(key);
    } catch (RuntimeException e) {
      log.warn("Rule resolution failed for {}, threshold rules only: {}", key, e.getMessage());
      warnings.add(new MethodWarning(null, null, "rule resolution failed: " + e.getMessage()));
      active = rules.resolveThresholdRules(key.workspaceId(), key.metricType());
    }
    if (active.isEmpty()) {
      return new EvaluationReport(List.of(), warnings);
    }

    BaselineSnapshot baseline = null;
    boolean baselineFailed = false;
    if (active.stream().anyMatch(r -> r.method().needsBaseline())) {
      try {
        baseline = baselines.get(key).orElse(null);
      } catch (RuntimeException e) {
        baselineFailed = true;
        log.warn("Baseline lookup failed for {}, threshold rules only: {}", key, e.getMessage());
      }
    }

    Map<String, ScoredDetection> byFingerprint = new LinkedHashMap<>();
    for (ResolvedRule rule : active) {
      DetectionMethod method = rule.method();
      if (method.isBatch()) continue;
      if (baselineFailed && method != DetectionMethod.THRESHOLD) {
        warnings.add(new MethodWarning(rule.id(), method, "skipped: baseline unavailable"));
        continue;
      }
      RawScore raw;
      try {
        raw = invoker.score(detectors.get(method), event.value(),
            DetectionContext.realtime(baseline, rule.parameters(), event.timestamp()));
      } catch (DataUnavailableException e) {
        log.debug("{} skipped for {}: {}", method.wireName(), key, e.getMessage());
        warnings.add(new MethodWarning(rule.id(), method, "skipped: " + e.getMessage()));
        continue;
      } catch (DetectionMethodException e) {
        log.warn("Detection method failed rule={} key={}: {}", rule.id(), key, e.getMessage());
        warnings.add(new MethodWarning(rule.id(), method, "failed: " + e.getMessage()));
        continue;
      }
      if (!scorer.isAnomalous(method, raw.value(), rule.parameters())) continue;
      ScoredDetection d = toDetection(key, rule, event.point(), raw, event.tags());
      byFingerprint.merge(d.fingerprint(), d, ScoredDetection::mergeWith);
    }
    return new EvaluationReport(new ArrayList<>(byFingerprint.values()), warnings);
  }

  /**
   * Scores every point of a window with one rule. Batch methods score the window as a whole,
   * realtime methods point by point against {@code baseline}. Only points accepted by
   * {@code reportable} (null for all) are reported. Results are not merged.
   */
  public EvaluationReport evaluateWindow(MetricKey key, ResolvedRule rule, List<MetricPoint> window,
                                         BaselineSnapshot baseline, Predicate<MetricPoint> reportable) {
    DetectionMethod method = rule.method();
    List<MethodWarning> warnings = new ArrayList<>();
    if (window.isEmpty()) {
      warnings.add(new MethodWarning(rule.id(), method, "skipped: no data points"));
      return new EvaluationReport(List.of(), warnings);
    }
    Instant last = window.get(window.size() - 1).timestamp();
    DetectionContext context = new DetectionContext(baseline, rule.parameters(), window, last);
    List<PointScore> scores;
    try {
      Detector detector = detectors.get(method);
      scores = method.isBatch()
          ? invoker.scoreWindow(detectors.batch(method), context)
          : invoker.scorePoints(detector, context);
    } catch (DataUnavailableException e) {
      warnings.add(new MethodWarning(rule.id(), method, "skipped: " + e.getMessage()));
      return new EvaluationReport(List.of(), warnings);
    } catch (DetectionMethodException e) {
      log.warn("Window detection failed rule={} key={}: {}", rule.id(), key, e.getMessage());
      warnings.add(new MethodWarning(rule.id(), method, "failed: " + e.getMessage()));
      return new EvaluationReport(List.of(), warnings);
    }

    List<ScoredDetection> out = new ArrayList<>();
    for (PointScore ps : scores) {
      if (reportable != null && !reportable.test(ps.point())) continue;
      if (!scorer.isAnomalous(method, ps.score().value(), rule.parameters())) continue;
      out.add(toDetection(key, rule, ps.point(), ps.score(), Map.of()));
    }
    return new EvaluationReport(out, warnings);
  }

  private ScoredDetection toDetection(MetricKey key, ResolvedRule rule, MetricPoint point, RawScore raw,
                                      Map<String, String> tags) {
    NormalizedScore normalized = scorer.normalize(rule.method(), raw.value(), rule.parameters());
    String fingerprint = Fingerprints.of(key.workspaceId(), key.metricType(), rule.method(),
        point.timestamp(), debounce);
    Map<String, Object> context = new LinkedHashMap<>(raw.details());
    if (rule.name() != null) context.put("rule_name", rule.name());
    context.put("confidence", raw.confidence());
    if (!tags.isEmpty()) context.put("tags", tags);
    return new ScoredDetection(fingerprint, key, rule.method(), rule.id(), point.timestamp(), point.value(),
        raw.value(), raw.confidence(), normalized.score(), normalized.severity(), raw.expectedRange(), context,
        rule.autoAlert(), rule.alertChannels(), rule.alertMinSeverity());
  }
}

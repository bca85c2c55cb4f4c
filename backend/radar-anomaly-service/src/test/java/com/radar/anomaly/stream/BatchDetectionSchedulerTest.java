package com.radar.anomaly.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.radar.anomaly.baseline.BaselineStore;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.MetricKey;
import com.radar.anomaly.model.MetricPoint;
import com.radar.anomaly.model.Severity;
import com.radar.anomaly.rules.ResolvedRule;
import com.radar.anomaly.rules.RuleEngine;
import com.radar.anomaly.rules.RuleParameters;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class BatchDetectionSchedulerTest {

  private static final MetricKey KEY = new MetricKey("ws-1", "credits_consumed");
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private RuleEngine rules;
  private BaselineStore baselines;
  private DetectionEngine engine;
  private MetricLaneDispatcher dispatcher;
  private RecentPointsBuffer recent;
  private BatchDetectionScheduler scheduler;

  private final ResolvedRule forestRule = new ResolvedRule("r-if", "ws-1", KEY.metricType(), "forest",
      DetectionMethod.ISOLATION_FOREST, RuleParameters.EMPTY, true, List.of());

  @BeforeEach
  void setUp() {
    rules = mock(RuleEngine.class);
    baselines = mock(BaselineStore.class);
    engine = mock(DetectionEngine.class);
    dispatcher = mock(MetricLaneDispatcher.class);
    recent = new RecentPointsBuffer(64);
    scheduler = new BatchDetectionScheduler(rules, recent, baselines, engine, dispatcher, new SimpleMeterRegistry());
    when(baselines.get(any())).thenReturn(Optional.empty());
  }

  private ScoredDetection detection(Instant at) {
    return new ScoredDetection("fp-" + at.getEpochSecond(), KEY, DetectionMethod.ISOLATION_FOREST, "r-if", at,
        10, 3.5, 0.9, 1.0, Severity.CRITICAL, Map.of(), Map.of(), true, List.of(), Severity.LOW);
  }

  @Test
  void publishesDetectionsAndAdvancesWatermark() {
    for (int i = 0; i < 40; i++) recent.append(KEY, new MetricPoint(T0.plusSeconds(60L * i), i));
    Instant last = T0.plusSeconds(60L * 39);
    when(rules.resolve(KEY)).thenReturn(List.of(forestRule));
    when(engine.evaluateWindow(eq(KEY), eq(forestRule), any(), isNull(), isNull()))
        .thenReturn(new EvaluationReport(List.of(detection(last)), List.of()));
    when(dispatcher.publishResult(any())).thenReturn(true);

    assertThat(scheduler.run(DetectionMethod.ISOLATION_FOREST)).isEqualTo(1);
    assertThat(scheduler.run(DetectionMethod.ISOLATION_FOREST)).isZero();

    verify(engine, times(1)).evaluateWindow(any(), any(), any(), any(), any());
    verify(dispatcher).publishResult(detection(last));
  }

  @Test
  @SuppressWarnings("unchecked")
  void lateArrivalBehindTheWatermarkIsStillReported() {
    for (int i = 0; i < 40; i++) recent.append(KEY, new MetricPoint(T0.plusSeconds(60L * i), i));
    when(rules.resolve(KEY)).thenReturn(List.of(forestRule));
    when(engine.evaluateWindow(any(), any(), any(), any(), any()))
        .thenReturn(new EvaluationReport(List.of(), List.of()));
    scheduler.run(DetectionMethod.ISOLATION_FOREST);

    MetricPoint late = new MetricPoint(T0.plusSeconds(90), 500);
    recent.append(KEY, late);
    scheduler.run(DetectionMethod.ISOLATION_FOREST);

    ArgumentCaptor<Predicate<MetricPoint>> reportable = ArgumentCaptor.forClass(Predicate.class);
    ArgumentCaptor<List<MetricPoint>> window = ArgumentCaptor.forClass(List.class);
    verify(engine, times(2)).evaluateWindow(eq(KEY), eq(forestRule), window.capture(), isNull(),
        reportable.capture());
    assertThat(reportable.getAllValues().get(0)).isNull();
    Predicate<MetricPoint> second = reportable.getAllValues().get(1);
    assertThat(second.test(late)).isTrue();
    assertThat(second.test(new MetricPoint(T0.plusSeconds(60L * 39), 39))).isFalse();
    assertThat(window.getAllValues().get(1)).hasSize(41).contains(late);
  }

  @Test
  void keysWithoutRulesForTheMethodAreSkipped() {
    recent.append(KEY, new MetricPoint(T0, 1));
    when(rules.resolve(KEY)).thenReturn(List.of(forestRule));

    assertThat(scheduler.run(DetectionMethod.AUTOENCODER)).isZero();
    verify(engine, never()).evaluateWindow(any(), any(), any(), any(), any());
  }

  @Test
  void failingRuleDoesNotStopThePass() {
    MetricKey other = new MetricKey("ws-2", "credits_consumed");
    ResolvedRule otherRule = new ResolvedRule("r-2", "ws-2", other.metricType(), "forest 2",
        DetectionMethod.ISOLATION_FOREST, RuleParameters.EMPTY, false, List.of());
    recent.append(KEY, new MetricPoint(T0, 1));
    recent.append(other, new MetricPoint(T0, 1));
    when(rules.resolve(KEY)).thenReturn(List.of(forestRule));
    when(rules.resolve(other)).thenReturn(List.of(otherRule));
    when(engine.evaluateWindow(eq(KEY), any(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));
    when(engine.evaluateWindow(eq(other), any(), any(), any(), any()))
        .thenReturn(new EvaluationReport(List.of(detection(T0)), List.of()));
    when(dispatcher.publishResult(any())).thenReturn(true);

    assertThat(scheduler.run(DetectionMethod.ISOLATION_FOREST)).isEqualTo(1);
  }
}

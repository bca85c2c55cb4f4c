package com.radar.anomaly.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.radar.anomaly.MutableClock;
import com.radar.anomaly.detect.IsolationForestDetector;
import com.radar.anomaly.error.DataUnavailableException;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.MetricKey;
import com.radar.anomaly.model.Severity;
import com.radar.anomaly.scoring.AnomalyScorer;
import com.radar.anomaly.stream.ScoredDetection;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

class WorkloadPatternServiceTest {

  private static final Instant NOW = Instant.parse("2024-07-01T00:00:00Z");

  private ExecutionHistoryClient executions;
  private OnDemandDetectionService onDemand;
  private WorkloadPatternService service;

  @BeforeEach
  void setUp() {
    executions = mock(ExecutionHistoryClient.class);
    onDemand = mock(OnDemandDetectionService.class);
    service = new WorkloadPatternService(executions, onDemand, new IsolationForestDetector(42),
        AnomalyScorer.withDefaults(), new MutableClock(NOW));
  }

  private static List<ExecutionBucket> hourlyWithBurstAt(int burst) {
    List<ExecutionBucket> buckets = new ArrayList<>();
    for (int i = 0; i < 24; i++) {
      Instant start = NOW.minus(Duration.ofHours(24 - i));
      if (i == burst) {
        buckets.add(new ExecutionBucket(start, 100, 60, 120.0, 500.0));
      } else {
        buckets.add(new ExecutionBucket(start, 100, 2 + (i % 3), 30.0 + (i % 4), 500.0));
      }
    }
    return buckets;
  }

  @Test
  void errorBurstIsTheOnlyFlaggedHour() {
    List<ExecutionBucket> buckets = hourlyWithBurstAt(17);
    when(executions.hourly(eq("ws-1"), any(), any())).thenReturn(buckets);

    List<WorkloadAnomaly> anomalies = service.errorPatterns("ws-1", 24);

    verify(executions).hourly("ws-1", NOW.minus(Duration.ofHours(24)), NOW);
    assertThat(anomalies).extracting(WorkloadAnomaly::detectedAt).containsExactly(buckets.get(17).start());
    WorkloadAnomaly burst = anomalies.get(0);
    assertThat(burst.metricType()).isEqualTo("error_rate");
    assertThat(burst.detectionMethod()).isEqualTo(DetectionMethod.ISOLATION_FOREST);
    assertThat(burst.anomalyScore()).isGreaterThanOrEqualTo(WorkloadPatternService.MIN_FOREST_SCORE);
    assertThat(burst.userId()).isNull();
    assertThat(burst.context()).containsEntry("window_hours", 24);
    @SuppressWarnings("unchecked")
    Map<String, Object> features = (Map<String, Object>) burst.context().get("features");
    assertThat(features).containsEntry("error_rate", 0.6).containsEntry("failed_count", 60.0);
  }

  @Test
  void tooFewBucketsYieldNothing() {
    when(executions.hourly(any(), any(), any())).thenReturn(hourlyWithBurstAt(3).subList(0, 5));

    assertThat(service.errorPatterns("ws-1", null)).isEmpty();
  }

  @Test
  void missingAveragesDoNotBreakScoring() {
    List<ExecutionBucket> buckets = new ArrayList<>(hourlyWithBurstAt(17));
    ExecutionBucket quiet = buckets.get(5);
    buckets.set(5, new ExecutionBucket(quiet.start(), 3, 0, Double.NaN, Double.NaN));
    when(executions.hourly(any(), any(), any())).thenReturn(buckets);

    List<WorkloadAnomaly> anomalies = service.errorPatterns("ws-1", 24);

    assertThat(anomalies).isNotEmpty();
    assertThat(anomalies).allSatisfy(a -> assertThat(a.anomalyScore()).isFinite());
  }

  @Test
  void userBehaviorUsesDailyBucketsForTheUser() {
    List<ExecutionBucket> days = new ArrayList<>();
    for (int i = 0; i < 14; i++) {
      Instant start = NOW.minus(Duration.ofDays(14 - i));
      days.add(i == 11
          ? new ExecutionBucket(start, 400, 1, 95.0, 8000.0)
          : new ExecutionBucket(start, 20 + (i % 3), 0, 40.0 + (i % 5), 300.0 + 10 * (i % 4)));
    }
    when(executions.dailyForUser(eq("ws-1"), eq("u-7"), any(), any())).thenReturn(days);

    List<WorkloadAnomaly> anomalies = service.userBehavior("ws-1", "u-7", 14);

    verify(executions).dailyForUser("ws-1", "u-7", NOW.minus(Duration.ofDays(14)), NOW);
    assertThat(anomalies).extracting(WorkloadAnomaly::detectedAt).contains(days.get(11).start());
    assertThat(anomalies).hasSizeLessThanOrEqualTo(1);
    assertThat(anomalies.get(0).userId()).isEqualTo("u-7");
    assertThat(anomalies.get(0).metricType()).isEqualTo("user_behavior");
    assertThat(anomalies.get(0).context()).containsEntry("lookback_days", 14);
  }

  @Test
  void rejectsBadParameters() {
    assertThatThrownBy(() -> service.userBehavior("ws-1", " ", 30)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.userBehavior("ws-1", "u-7", 3)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.errorPatterns("ws-1", 169)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.usageSpikes("ws-1", 0.5, 24)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.usageSpikes("", null, null)).isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(executions, onDemand);
  }

  @Test
  void historyFailureIsUnavailable() {
    when(executions.hourly(any(), any(), any())).thenThrow(new DataAccessResourceFailureException("down"));

    assertThatThrownBy(() -> service.errorPatterns("ws-1", 24)).isInstanceOf(DataUnavailableException.class);
  }

  @Test
  void usageSpikesRunZScoreOverCreditsInWholeDays() {
    MetricKey key = new MetricKey("ws-1", "credits_consumed");
    ScoredDetection spike = new ScoredDetection("fp", key, DetectionMethod.ZSCORE, null, NOW.minusSeconds(600),
        900.0, 4.4, 1.0, 0.59, Severity.MEDIUM, Map.of("lower", 80.0, "upper", 220.0), Map.of(), false,
        List.of(), null);
    when(onDemand.detect(eq("ws-1"), any())).thenReturn(new OnDemandResult("ws-1", "credits_consumed",
        NOW.minus(Duration.ofDays(2)), NOW, 48, List.of(spike), List.of()));

    List<WorkloadAnomaly> anomalies = service.usageSpikes("ws-1", 3.0, 50);

    ArgumentCaptor<OnDemandRequest> request = ArgumentCaptor.forClass(OnDemandRequest.class);
    verify(onDemand).detect(eq("ws-1"), request.capture());
    assertThat(request.getValue().metricType()).isEqualTo("credits_consumed");
    assertThat(request.getValue().lookbackDays()).isEqualTo(2);
    assertThat(request.getValue().method()).isEqualTo(DetectionMethod.ZSCORE);
    assertThat(request.getValue().sensitivity()).isEqualTo(3.0);

    assertThat(anomalies).singleElement().satisfies(a -> {
      assertThat(a.anomalyScore()).isEqualTo(4.4);
      assertThat(a.severity()).isEqualTo(Severity.MEDIUM);
      assertThat(a.context()).containsEntry("value", 900.0).containsEntry("upper", 220.0)
          .containsEntry("sensitivity", 3.0);
    });
  }

  @Test
  void shortUsageWindowStillLooksBackOneDay() {
    when(onDemand.detect(eq("ws-1"), any())).thenReturn(new OnDemandResult("ws-1", "credits_consumed",
        NOW.minus(Duration.ofDays(1)), NOW, 10, List.of(), List.of()));

    service.usageSpikes("ws-1", null, 6);

    ArgumentCaptor<OnDemandRequest> request = ArgumentCaptor.forClass(OnDemandRequest.class);
    verify(onDemand).detect(eq("ws-1"), request.capture());
    assertThat(request.getValue().lookbackDays()).isEqualTo(1);
    assertThat(request.getValue().sensitivity()).isEqualTo(AnomalyScorer.DEFAULT_SENSITIVITY);
  }

  @Test
  void cutoffKeepsTheContaminationShareAboveTheFloor() {
    double[] scores = {0.4, 0.6, 0.5, 2.5, 0.7, 1.8, 0.3, 0.6, 0.5, 0.4};

    assertThat(WorkloadPatternService.cutoff(scores, 0.2)).isEqualTo(1.8);
    assertThat(WorkloadPatternService.cutoff(scores, 0.05)).isEqualTo(2.5);
    assertThat(WorkloadPatternService.cutoff(new double[] {0.4, 0.5, 0.6}, 0.5))
        .isEqualTo(WorkloadPatternService.MIN_FOREST_SCORE);
  }
}

package com.radar.api.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.radar.anomaly.error.AnomalyNotFoundException;
import com.radar.anomaly.error.DataUnavailableException;
import com.radar.anomaly.error.IllegalStatusTransitionException;
import com.radar.anomaly.lifecycle.AnomalyLifecycleManager;
import com.radar.anomaly.lifecycle.StatusAction;
import com.radar.anomaly.model.AnomalyDetection;
import com.radar.anomaly.model.AnomalyStatus;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.Severity;
import com.radar.anomaly.service.OnDemandDetectionService;
import com.radar.anomaly.service.OnDemandRequest;
import com.radar.anomaly.service.WorkloadAnomaly;
import com.radar.anomaly.service.WorkloadPatternService;
import com.radar.api.model.AnomaliesResponse;
import com.radar.api.model.HealthResponse;
import com.radar.api.service.AnomalyQueryService;
import com.radar.api.service.AnomalyQueryService.AnomalyFilter;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AnomaliesController.class)
class AnomaliesControllerTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  @Autowired
  private MockMvc mvc;

  @MockBean
  private AnomalyQueryService queries;

  @MockBean
  private AnomalyLifecycleManager lifecycle;

  @MockBean
  private OnDemandDetectionService onDemand;

  @MockBean
  private WorkloadPatternService workload;

  private static AnomalyDetection anomaly() {
    AnomalyDetection a = AnomalyDetection.open("fp", "ws-1", "latency_ms", DetectionMethod.ZSCORE, "r1", T0, T0);
    a.recordPeak(950, 6.1, 0.82, 1.0, Severity.HIGH, Map.of("lower", 100.0, "upper", 400.0), Map.of());
    return a;
  }

  @Test
  void unknownAnomalyIs404() throws Exception {
    when(lifecycle.get("ws-1", "missing")).thenThrow(new AnomalyNotFoundException("anomaly not found: missing"));

    mvc.perform(get("/api/v1/anomalies/ws-1/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("Not Found"))
        .andExpect(jsonPath("$.message").value("anomaly not found: missing"));
  }

  @Test
  void anomalyIsRenderedInSnakeCase() throws Exception {
    AnomalyDetection a = anomaly();
    when(lifecycle.get("ws-1", a.getId())).thenReturn(a);

    mvc.perform(get("/api/v1/anomalies/ws-1/" + a.getId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.workspace_id").value("ws-1"))
        .andExpect(jsonPath("$.metric_type").value("latency_ms"))
        .andExpect(jsonPath("$.method").value("zscore"))
        .andExpect(jsonPath("$.severity").value("high"))
        .andExpect(jsonPath("$.status").value("new"))
        .andExpect(jsonPath("$.occurrence_count").value(1))
        .andExpect(jsonPath("$.expected_range.upper").value(400.0))
        .andExpect(jsonPath("$.is_false_positive").value(false));
  }

  @Test
  void resolvePassesActorNotesAndFalsePositive() throws Exception {
    AnomalyDetection a = anomaly();
    a.close(AnomalyStatus.RESOLVED, "alice", "noisy deploy", true, T0);
    when(lifecycle.transition(eq("ws-1"), eq(a.getId()), eq(StatusAction.RESOLVE), eq("alice"), eq("noisy deploy"),
        eq(true))).thenReturn(a);

    mvc.perform(put("/api/v1/anomalies/ws-1/" + a.getId() + "/resolve")
            .header("X-User-Id", "alice")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"notes\":\"noisy deploy\",\"is_false_positive\":true}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("resolved"))
        .andExpect(jsonPath("$.resolved_by").value("alice"))
        .andExpect(jsonPath("$.is_false_positive").value(true));
  }

  @Test
  void acknowledgeWithoutHeaderOrBodyUsesSystemActor() throws Exception {
    AnomalyDetection a = anomaly();
    when(lifecycle.transition(any(), any(), any(), any(), any(), anyBoolean())).thenReturn(a);

    mvc.perform(put("/api/v1/anomalies/ws-1/" + a.getId() + "/acknowledge"))
        .andExpect(status().isOk());

    verify(lifecycle).transition(eq("ws-1"), eq(a.getId()), eq(StatusAction.ACKNOWLEDGE), eq("system"), isNull(),
        eq(false));
  }

  @Test
  void forbiddenTransitionIs409() throws Exception {
    when(lifecycle.transition(any(), any(), any(), any(), any(), anyBoolean()))
        .thenThrow(new IllegalStatusTransitionException("anomaly a-1 is already resolved, cannot move to ignored"));

    mvc.perform(put("/api/v1/anomalies/ws-1/a-1/ignore")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"notes\":\"dup\"}"))
        .andExpect(status().isConflict());
  }

  @Test
  void unknownActionIs400() throws Exception {
    mvc.perform(put("/api/v1/anomalies/ws-1/a-1/escalate"))
        .andExpect(status().isBadRequest());
    verifyNoInteractions(lifecycle);
  }

  @Test
  void oversizedPageIs400() throws Exception {
    mvc.perform(get("/api/v1/anomalies/ws-1").param("page_size", "500"))
        .andExpect(status().isBadRequest());
    verifyNoInteractions(queries);
  }

  @Test
  void listFiltersAreParsed() throws Exception {
    when(queries.list(eq("ws-1"), any(), eq(2), eq(25)))
        .thenReturn(new AnomaliesResponse(List.of(), new AnomaliesResponse.Meta(2, 25, 0)));

    mvc.perform(get("/api/v1/anomalies/ws-1")
            .param("date_from", "2024-01-01")
            .param("date_to", "2024-01-31")
            .param("severity", "high")
            .param("status", "acknowledged")
            .param("page", "2")
            .param("page_size", "25"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.meta.page_size").value(25))
        .andExpect(jsonPath("$.anomalies").isEmpty());

    ArgumentCaptor<AnomalyFilter> filter = ArgumentCaptor.forClass(AnomalyFilter.class);
    verify(queries).list(eq("ws-1"), filter.capture(), eq(2), eq(25));
    assertThat(filter.getValue().from()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    assertThat(filter.getValue().to()).isEqualTo(Instant.parse("2024-01-31T23:59:59.999Z"));
    assertThat(filter.getValue().severity()).isEqualTo(Severity.HIGH);
    assertThat(filter.getValue().status()).isEqualTo(AnomalyStatus.ACKNOWLEDGED);
    assertThat(filter.getValue().metricType()).isNull();
  }

  @Test
  void badDateIs400() throws Exception {
    mvc.perform(get("/api/v1/anomalies/ws-1").param("date_from", "last week"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void detectWithoutDataIs422() throws Exception {
    when(onDemand.detect(eq("ws-1"), any(OnDemandRequest.class)))
        .thenThrow(new DataUnavailableException("no data points"));

    mvc.perform(post("/api/v1/anomalies/ws-1/detect")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"metric_type\":\"latency_ms\",\"lookback_days\":7,\"method\":\"zscore\",\"sensitivity\":2.0}"))
        .andExpect(status().isUnprocessableEntity());

    ArgumentCaptor<OnDemandRequest> request = ArgumentCaptor.forClass(OnDemandRequest.class);
    verify(onDemand).detect(eq("ws-1"), request.capture());
    assertThat(request.getValue().method()).isEqualTo(DetectionMethod.ZSCORE);
    assertThat(request.getValue().lookbackDays()).isEqualTo(7);
    assertThat(request.getValue().sensitivity()).isEqualTo(2.0);
  }

  @Test
  void healthReportsCounts() throws Exception {
    when(queries.health()).thenReturn(new HealthResponse("healthy", 4, 12, 0, 3, T0));

    mvc.perform(get("/api/v1/anomalies/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("healthy"))
        .andExpect(jsonPath("$.active_rules").value(4))
        .andExpect(jsonPath("$.baseline_models").value(12));
  }

  @Test
  void usageSpikesReturnsAnomaliesWithCount() throws Exception {
    WorkloadAnomaly spike = new WorkloadAnomaly("credits_consumed", "ws-1", null, T0, 4.2, 0.56,
        Severity.MEDIUM, DetectionMethod.ZSCORE, Map.of("value", 900.0));
    when(workload.usageSpikes("ws-1", 3.0, 48)).thenReturn(List.of(spike));

    mvc.perform(post("/api/v1/anomalies/ws-1/detect/usage-spikes")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"sensitivity\":3.0,\"window_hours\":48}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.anomalies[0].metric_type").value("credits_consumed"))
        .andExpect(jsonPath("$.anomalies[0].anomaly_score").value(4.2))
        .andExpect(jsonPath("$.anomalies[0].detection_method").value("zscore"))
        .andExpect(jsonPath("$.anomalies[0].severity").value("medium"))
        .andExpect(jsonPath("$.anomalies[0].user_id").doesNotExist());
  }

  @Test
  void errorPatternsWithoutBodyUsesDefaults() throws Exception {
    when(workload.errorPatterns("ws-1", null)).thenReturn(List.of());

    mvc.perform(post("/api/v1/anomalies/ws-1/detect/error-patterns"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(0))
        .andExpect(jsonPath("$.anomalies").isEmpty());
  }

  @Test
  void userBehaviorPassesUserAndLookback() throws Exception {
    WorkloadAnomaly day = new WorkloadAnomaly("user_behavior", "ws-1", "u-7", T0, 2.4, 0.8,
        Severity.HIGH, DetectionMethod.ISOLATION_FOREST, Map.of("lookback_days", 14));
    when(workload.userBehavior("ws-1", "u-7", 14)).thenReturn(List.of(day));

    mvc.perform(post("/api/v1/anomalies/ws-1/detect/user-behavior")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"user_id\":\"u-7\",\"lookback_days\":14}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.anomalies[0].user_id").value("u-7"))
        .andExpect(jsonPath("$.anomalies[0].detection_method").value("isolation_forest"))
        .andExpect(jsonPath("$.anomalies[0].context.lookback_days").value(14));
  }

  @Test
  void invalidWorkloadWindowIs400() throws Exception {
    when(workload.errorPatterns("ws-1", 500))
        .thenThrow(new IllegalArgumentException("window_hours must be between 1 and 168"));

    mvc.perform(post("/api/v1/anomalies/ws-1/detect/error-patterns")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"window_hours\":500}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("window_hours must be between 1 and 168"));
  }
}

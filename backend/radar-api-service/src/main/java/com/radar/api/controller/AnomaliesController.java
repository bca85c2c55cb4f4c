package com.radar.api.controller;

import com.radar.anomaly.lifecycle.AnomalyLifecycleManager;
import com.radar.anomaly.lifecycle.StatusAction;
import com.radar.anomaly.model.AnomalyStatus;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.Severity;
import com.radar.anomaly.service.OnDemandDetectionService;
import com.radar.anomaly.service.OnDemandRequest;
import com.radar.anomaly.service.WorkloadPatternService;
import com.radar.api.model.AnomaliesResponse;
import com.radar.api.model.AnomalyView;
import com.radar.api.model.DetectRequest;
import com.radar.api.model.DetectResponse;
import com.radar.api.model.ErrorPatternsRequest;
import com.radar.api.model.HealthResponse;
import com.radar.api.model.StatusUpdateRequest;
import com.radar.api.model.SummaryResponse;
import com.radar.api.model.UsageSpikesRequest;
import com.radar.api.model.UserBehaviorRequest;
import com.radar.api.model.WorkloadAnomaliesResponse;
import com.radar.api.service.AnomalyQueryService;
import com.radar.api.service.AnomalyQueryService.AnomalyFilter;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/anomalies")
public class AnomaliesController {

  static final String DEFAULT_ACTOR = "system";

  private final AnomalyQueryService queries;
  private final AnomalyLifecycleManager lifecycle;
  private final OnDemandDetectionService onDemand;
  private final WorkloadPatternService workload;

  public AnomaliesController(AnomalyQueryService queries,
                             AnomalyLifecycleManager lifecycle,
                             OnDemandDetectionService onDemand,
                             WorkloadPatternService workload) {
    this.queries = queries;
    this.lifecycle = lifecycle;
    this.onDemand = onDemand;
    this.workload = workload;
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return queries.health();
  }

  @GetMapping("/{workspaceId}")
  public AnomaliesResponse list(
      @PathVariable("workspaceId") String workspaceId,
      @RequestParam(name = "date_from", required = false) String dateFrom,
      @RequestParam(name = "date_to", required = false) String dateTo,
      @RequestParam(name = "severity", required = false) String severity,
      @RequestParam(name = "metric_type", required = false) String metricType,
      @RequestParam(name = "status", required = false) String status,
      @RequestParam(name = "page", defaultValue = "0") int page,
      @RequestParam(name = "page_size", defaultValue = "50") int pageSize
  ) {
    if (pageSize < 1 || pageSize > AnomalyQueryService.MAX_PAGE_SIZE) {
      throw new IllegalArgumentException("page_size must be between 1 and " + AnomalyQueryService.MAX_PAGE_SIZE);
    }
    AnomalyFilter filter = new AnomalyFilter(
        parseInstant("date_from", dateFrom, false),
        parseInstant("date_to", dateTo, true),
        blank(severity) ? null : Severity.fromWire(severity),
        blank(metricType) ? null : metricType,
        blank(status) ? null : AnomalyStatus.fromWire(status));
    return queries.list(workspaceId, filter, page, pageSize);
  }

  @GetMapping("/{workspaceId}/summary")
  public SummaryResponse summary(@PathVariable("workspaceId") String workspaceId,
                                 @RequestParam(name = "days", defaultValue = "7") int days) {
    return queries.summary(workspaceId, days);
  }

  @GetMapping("/{workspaceId}/{anomalyId}")
  public AnomalyView get(@PathVariable("workspaceId") String workspaceId,
                         @PathVariable("anomalyId") String anomalyId) {
    return AnomalyView.from(lifecycle.get(workspaceId, anomalyId));
  }

  @PostMapping("/{workspaceId}/detect")
  public DetectResponse detect(@PathVariable("workspaceId") String workspaceId,
                               @RequestBody DetectRequest body) {
    DetectionMethod method = blank(body.method()) ? null : DetectionMethod.fromWire(body.method());
    OnDemandRequest request = new OnDemandRequest(body.metricType(), body.lookbackDays(), method,
        body.sensitivity(), body.parameters());
    return DetectResponse.from(onDemand.detect(workspaceId, request));
  }

  @PostMapping("/{workspaceId}/detect/usage-spikes")
  public WorkloadAnomaliesResponse usageSpikes(@PathVariable("workspaceId") String workspaceId,
                                               @RequestBody(required = false) UsageSpikesRequest body) {
    UsageSpikesRequest r = body == null ? new UsageSpikesRequest(null, null) : body;
    return WorkloadAnomaliesResponse.of(workload.usageSpikes(workspaceId, r.sensitivity(), r.windowHours()));
  }

  @PostMapping("/{workspaceId}/detect/error-patterns")
  public WorkloadAnomaliesResponse errorPatterns(@PathVariable("workspaceId") String workspaceId,
                                                 @RequestBody(required = false) ErrorPatternsRequest body) {
    Integer windowHours = body == null ? null : body.windowHours();
    return WorkloadAnomaliesResponse.of(workload.errorPatterns(workspaceId, windowHours));
  }

  @PostMapping("/{workspaceId}/detect/user-behavior")
  public WorkloadAnomaliesResponse userBehavior(@PathVariable("workspaceId") String workspaceId,
                                                @RequestBody UserBehaviorRequest body) {
    return WorkloadAnomaliesResponse.of(workload.userBehavior(workspaceId, body.userId(), body.lookbackDays()));
  }

  @PutMapping("/{workspaceId}/{anomalyId}/{action}")
  public AnomalyView updateStatus(@PathVariable("workspaceId") String workspaceId,
                                  @PathVariable("anomalyId") String anomalyId,
                                  @PathVariable("action") String action,
                                  @RequestHeader(name = "X-User-Id", required = false) String userId,
                                  @RequestBody(required = false) StatusUpdateRequest body) {
    StatusAction statusAction = parseAction(action);
    String actor = blank(userId) ? DEFAULT_ACTOR : userId;
    String notes = body == null ? null : body.notes();
    boolean falsePositive = body != null && Boolean.TRUE.equals(body.isFalsePositive());
    return AnomalyView.from(lifecycle.transition(workspaceId, anomalyId, statusAction, actor, notes, falsePositive));
  }

  private static StatusAction parseAction(String action) {
    try {
      return StatusAction.valueOf(action.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("unknown action: " + action
          + " (expected acknowledge, investigate, resolve or ignore)");
    }
  }

  // Accepts an ISO instant or a plain date; a plain date_to covers the whole day.
  static Instant parseInstant(String name, String raw, boolean endOfDay) {
    if (blank(raw)) return null;
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException notInstant) {
      try {
        LocalDate day = LocalDate.parse(raw);
        return endOfDay
            ? day.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC).minusMillis(1)
            : day.atStartOfDay().toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException(name + " is not an ISO date or instant: " + raw);
      }
    }
  }

  private static boolean blank(String s) {
    return s == null || s.isBlank();
  }
}

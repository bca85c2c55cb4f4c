package com.radar.api.service;

import com.radar.anomaly.model.AnomalyDetection;
import com.radar.anomaly.model.AnomalyStatus;
import com.radar.anomaly.model.BaselineStatus;
import com.radar.anomaly.model.DetectionMethod;
import com.radar.anomaly.model.Severity;
import com.radar.anomaly.repo.AnomalyDetectionRepository;
import com.radar.anomaly.repo.AnomalyRuleRepository;
import com.radar.anomaly.repo.BaselineModelRepository;
import com.radar.api.model.AnomaliesResponse;
import com.radar.api.model.AnomalyView;
import com.radar.api.model.HealthResponse;
import com.radar.api.model.SummaryResponse;
import jakarta.persistence.criteria.Predicate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AnomalyQueryService {

  private static final Logger log = LoggerFactory.getLogger(AnomalyQueryService.class);

  public static final int MAX_PAGE_SIZE = 200;

  private final AnomalyDetectionRepository detections;
  private final AnomalyRuleRepository rules;
  private final BaselineModelRepository baselines;
  private final Clock clock;

  public AnomalyQueryService(AnomalyDetectionRepository detections,
                             AnomalyRuleRepository rules,
                             BaselineModelRepository baselines,
                             Clock clock) {
    this.detections = detections;
    this.rules = rules;
    this.baselines = baselines;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public AnomaliesResponse list(String workspaceId, AnomalyFilter filter, int page, int pageSize) {
    int size = Math.max(1, Math.min(pageSize, MAX_PAGE_SIZE));
    var pageable = PageRequest.of(Math.max(0, page), size, Sort.by(Sort.Direction.DESC, "detectedAt"));
    Page<AnomalyDetection> rows = detections.findAll(buildSpec(workspaceId, filter), pageable);
    List<AnomalyView> views = rows.getContent().stream().map(AnomalyView::from).toList();
    return new AnomaliesResponse(views, new AnomaliesResponse.Meta(pageable.getPageNumber(), size,
        rows.getTotalElements()));
  }

  @Transactional(readOnly = true)
  public SummaryResponse summary(String workspaceId, int days) {
    if (days < 1 || days > 365) {
      throw new IllegalArgumentException("days must be between 1 and 365");
    }
    Instant since = clock.instant().minus(Duration.ofDays(days));
    long total = detections.countByWorkspaceIdAndDetectedAtGreaterThanEqual(workspaceId, since);
    long falsePositives =
        detections.countByWorkspaceIdAndDetectedAtGreaterThanEqualAndFalsePositiveTrue(workspaceId, since);
    List<AnomalyView> recent = detections
        .findTop10ByWorkspaceIdAndDetectedAtGreaterThanEqualOrderByDetectedAtDesc(workspaceId, since)
        .stream().map(AnomalyView::from).toList();
    return new SummaryResponse(workspaceId, days, total,
        grouped(detections.countBySeverity(workspaceId, since)),
        grouped(detections.countByMetricType(workspaceId, since)),
        grouped(detections.countByMethod(workspaceId, since)),
        grouped(detections.countByStatus(workspaceId, since)),
        falsePositives, recent);
  }

  public HealthResponse health() {
    Instant now = clock.instant();
    try {
      long activeRules = rules.countByActiveTrue();
      long models = baselines.count();
      long degraded = baselines.countByStatus(BaselineStatus.DEGRADED);
      long recent = detections.countByDetectedAtAfter(now.minus(Duration.ofHours(24)));
      String status = degraded > 0 ? "degraded" : "healthy";
      return new HealthResponse(status, activeRules, models, degraded, recent, now);
    } catch (DataAccessException e) {
      log.error("Anomaly health check failed: {}", e.getMessage());
      return new HealthResponse("unhealthy", 0, 0, 0, 0, now);
    }
  }

  // [group, count] rows keyed by wire name
  static Map<String, Long> grouped(List<Object[]> rows) {
    Map<String, Long> out = new TreeMap<>();
    for (Object[] row : rows) {
      out.put(wireName(row[0]), ((Number) row[1]).longValue());
    }
    return out;
  }

  private static String wireName(Object group) {
    if (group instanceof Severity s) return s.wireName();
    if (group instanceof DetectionMethod m) return m.wireName();
    if (group instanceof AnomalyStatus st) return st.wireName();
    return String.valueOf(group);
  }

  private Specification<AnomalyDetection> buildSpec(String workspaceId, AnomalyFilter filter) {
    return (root, query, cb) -> {
      var predicates = new ArrayList<Predicate>();
      predicates.add(cb.equal(root.get("workspaceId"), workspaceId));
      if (filter.from() != null) {
        predicates.add(cb.greaterThanOrEqualTo(root.get("detectedAt"), filter.from()));
      }
      if (filter.to() != null) {
        predicates.add(cb.lessThanOrEqualTo(root.get("detectedAt"), filter.to()));
      }
      if (filter.severity() != null) {
        predicates.add(cb.equal(root.get("severity"), filter.severity()));
      }
      if (filter.metricType() != null && !filter.metricType().isBlank()) {
        predicates.add(cb.equal(root.get("metricType"), filter.metricType()));
      }
      if (filter.status() != null) {
        predicates.add(cb.equal(root.get("status"), filter.status()));
      }
      return cb.and(predicates.toArray(new Predicate[0]));
    };
  }

  /** Optional list filters; null means unconstrained. */
  public record AnomalyFilter(Instant from, Instant to, Severity severity, String metricType, AnomalyStatus status) {
    public static final AnomalyFilter NONE = new AnomalyFilter(null, null, null, null, null);
  }
}

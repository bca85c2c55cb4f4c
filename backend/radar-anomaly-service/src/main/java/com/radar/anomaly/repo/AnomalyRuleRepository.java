package com.radar.anomaly.repo;

import com.radar.anomaly.model.AnomalyRule;
import com.radar.anomaly.model.DetectionMethod;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AnomalyRuleRepository extends JpaRepository<AnomalyRule, String> {

  List<AnomalyRule> findByActiveTrue();

  List<AnomalyRule> findByWorkspaceIdOrWorkspaceIdIsNullOrderByCreatedAtAsc(String workspaceId);

  List<AnomalyRule> findByWorkspaceIdAndMetricTypeAndMethodAndActiveTrue(
      String workspaceId, String metricType, DetectionMethod method);

  List<AnomalyRule> findByWorkspaceIdIsNullAndMetricTypeAndMethodAndActiveTrue(
      String metricType, DetectionMethod method);

  long countByActiveTrue();
}

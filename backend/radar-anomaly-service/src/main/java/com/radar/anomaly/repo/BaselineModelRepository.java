package com.radar.anomaly.repo;

import com.radar.anomaly.model.BaselineModel;
import com.radar.anomaly.model.BaselineStatus;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BaselineModelRepository extends JpaRepository<BaselineModel, String> {

  Optional<BaselineModel> findByWorkspaceIdAndMetricType(String workspaceId, String metricType);

  List<BaselineModel> findByWorkspaceIdOrderByMetricTypeAsc(String workspaceId);

  long countByStatus(BaselineStatus status);
}

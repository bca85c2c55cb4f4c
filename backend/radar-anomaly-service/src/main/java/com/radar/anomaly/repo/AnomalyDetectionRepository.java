package com.radar.anomaly.repo;

import com.radar.anomaly.model.AnomalyDetection;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AnomalyDetectionRepository
    extends JpaRepository<AnomalyDetection, String>, JpaSpecificationExecutor<AnomalyDetection> {

  Optional<AnomalyDetection> findByFingerprint(String fingerprint);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select a from AnomalyDetection a where a.fingerprint = :fingerprint")
  Optional<AnomalyDetection> lockByFingerprint(@Param("fingerprint") String fingerprint);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select a from AnomalyDetection a where a.id = :id and a.workspaceId = :workspaceId")
  Optional<AnomalyDetection> lockByIdAndWorkspace(@Param("id") String id, @Param("workspaceId") String workspaceId);

  Optional<AnomalyDetection> findByIdAndWorkspaceId(String id, String workspaceId);

  List<AnomalyDetection> findTop10ByWorkspaceIdAndDetectedAtGreaterThanEqualOrderByDetectedAtDesc(
      String workspaceId, Instant since);

  long countByWorkspaceIdAndDetectedAtGreaterThanEqual(String workspaceId, Instant since);

  long countByWorkspaceIdAndDetectedAtGreaterThanEqualAndFalsePositiveTrue(String workspaceId, Instant since);

  // rows are [severity, count]
  @Query("SELECT a.severity, COUNT(a) FROM AnomalyDetection a " +
      "WHERE a.workspaceId = :workspaceId AND a.detectedAt >= :since GROUP BY a.severity")
  List<Object[]> countBySeverity(@Param("workspaceId") String workspaceId, @Param("since") Instant since);

  @Query("SELECT a.metricType, COUNT(a) FROM AnomalyDetection a " +
      "WHERE a.workspaceId = :workspaceId AND a.detectedAt >= :since GROUP BY a.metricType")
  List<Object[]> countByMetricType(@Param("workspaceId") String workspaceId, @Param("since") Instant since);

  @Query("SELECT a.method, COUNT(a) FROM AnomalyDetection a " +
      "WHERE a.workspaceId = :workspaceId AND a.detectedAt >= :since GROUP BY a.method")
  List<Object[]> countByMethod(@Param("workspaceId") String workspaceId, @Param("since") Instant since);

  @Query("SELECT a.status, COUNT(a) FROM AnomalyDetection a " +
      "WHERE a.workspaceId = :workspaceId AND a.detectedAt >= :since GROUP BY a.status")
  List<Object[]> countByStatus(@Param("workspaceId") String workspaceId, @Param("since") Instant since);

  long countByDetectedAtAfter(Instant since);
}

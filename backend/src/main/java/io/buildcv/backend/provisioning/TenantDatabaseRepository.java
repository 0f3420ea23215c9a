package io.buildcv.backend.provisioning;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface TenantDatabaseRepository extends JpaRepository<TenantDatabase, UUID> {

  Optional<TenantDatabase> findByPrincipalId(String principalId);

  List<TenantDatabase> findByStatus(TenantDatabase.Status status);

  /**
   * Moves the stored row from {@code from} to {@code to} without going through a loaded entity.
   *
   * @return the number of rows changed, 0 when the row is not in {@code from}
   */
  @Modifying
  @Transactional
  @Query(
      """
      UPDATE TenantDatabase t SET t.status = :to, t.updatedAt = :updatedAt
      WHERE t.id = :id AND t.status = :from
      """)
  int updateStatus(
      @Param("id") UUID id,
      @Param("from") TenantDatabase.Status from,
      @Param("to") TenantDatabase.Status to,
      @Param("updatedAt") Instant updatedAt);
}

package com.flagship.fund_quarantine.quarantine;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface QuarantineRepository extends JpaRepository<QuarantineEntity, UUID> {

    /**
     * Loads a quarantine with SELECT ... FOR UPDATE so concurrent draw-downs,
     * updates and releases of the same quarantine cannot lose each other's writes.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT q FROM QuarantineEntity q WHERE q.id = :id")
    Optional<QuarantineEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<QuarantineEntity> findByIdempotencyKey(String idempotencyKey);

    boolean existsByBudgetLineIdAndProviderIdAndSupportItemCodeAndStatus(
        UUID budgetLineId, UUID providerId, String supportItemCode, QuarantineStatus status);
}

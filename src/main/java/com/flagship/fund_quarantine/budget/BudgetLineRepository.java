package com.flagship.fund_quarantine.budget;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface BudgetLineRepository extends JpaRepository<BudgetLineEntity, UUID> {

    /**
     * Loads a budget line with SELECT ... FOR UPDATE. Every reservation that
     * changes the reserved total of a line takes this lock first, so capacity
     * checks against one line run one at a time.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BudgetLineEntity b WHERE b.id = :id")
    Optional<BudgetLineEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<BudgetLineEntity> findByPlanIdAndCategoryCode(UUID planId, String categoryCode);
}

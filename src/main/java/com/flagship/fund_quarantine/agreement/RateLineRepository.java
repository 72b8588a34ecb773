package com.flagship.fund_quarantine.agreement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RateLineRepository extends JpaRepository<RateLineEntity, UUID> {

    /**
     * Rate lines in the order they were entered on the agreement.
     */
    List<RateLineEntity> findByAgreementIdOrderByCreatedAtAscIdAsc(UUID agreementId);
}

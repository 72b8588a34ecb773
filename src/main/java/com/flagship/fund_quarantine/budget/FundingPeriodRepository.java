package com.flagship.fund_quarantine.budget;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface FundingPeriodRepository extends JpaRepository<FundingPeriodEntity, UUID> {
}

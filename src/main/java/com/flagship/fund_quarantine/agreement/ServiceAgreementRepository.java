package com.flagship.fund_quarantine.agreement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ServiceAgreementRepository extends JpaRepository<ServiceAgreementEntity, UUID> {
}

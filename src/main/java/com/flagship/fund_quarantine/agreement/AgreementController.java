package com.flagship.fund_quarantine.agreement;

import com.flagship.fund_quarantine.agreement.dto.DerivationResponse;
import com.flagship.fund_quarantine.agreement.dto.DeriveQuarantinesRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/service-agreements")
@RequiredArgsConstructor
public class AgreementController {

    private final AgreementQuarantineDeriver deriver;

    /**
     * Creates one quarantine per rate line whose category has a budget line on the plan.
     * Rate lines that cannot be reserved are reported, not failed.
     */
    @PostMapping("/{id}/quarantines")
    public ResponseEntity<DerivationResponse> deriveQuarantines(
            @PathVariable("id") UUID serviceAgreementId,
            @Valid @RequestBody DeriveQuarantinesRequest request,
            @RequestHeader("X-User-Id") String actorId) {

        DerivationResult result = deriver.derive(serviceAgreementId, request.getPlanId(), actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(DerivationResponse.from(result));
    }
}
